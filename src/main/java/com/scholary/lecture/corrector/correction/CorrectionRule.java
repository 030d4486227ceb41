package com.scholary.lecture.corrector.correction;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single pattern rewrite.
 *
 * <p>Patterns are compiled with {@link Pattern#UNICODE_CHARACTER_CLASS} so that {@code \w},
 * {@code \s} and {@code \b} treat kana and kanji as word characters and ideographic spaces as
 * whitespace. Replacements use {@link Matcher#replaceAll(String)} syntax ({@code $1} for groups).
 */
public record CorrectionRule(Pattern pattern, String replacement, CorrectionCategory category) {

  public CorrectionRule {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(replacement, "replacement");
    Objects.requireNonNull(category, "category");
  }

  public static CorrectionRule of(String regex, String replacement, CorrectionCategory category) {
    return new CorrectionRule(
        Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS), replacement, category);
  }

  /**
   * Build a rule that rewrites a literal term.
   *
   * <p>When the replacement contains the source (for example {@code 松尾研} to {@code 松尾研究室}),
   * the pattern is guarded so the rule never fires on text it has already corrected.
   *
   * @param source the literal text to find
   * @param replacement the literal text to substitute
   * @param category the category to log
   * @return the rule
   */
  public static CorrectionRule literal(
      String source, String replacement, CorrectionCategory category) {
    StringBuilder regex = new StringBuilder();

    int at = replacement.indexOf(source);
    if (at >= 0) {
      String before = replacement.substring(0, at);
      String after = replacement.substring(at + source.length());
      if (!before.isEmpty()) {
        regex.append("(?<!").append(Pattern.quote(before)).append(')');
      }
      regex.append(Pattern.quote(source));
      if (!after.isEmpty()) {
        regex.append("(?!").append(Pattern.quote(after)).append(')');
      }
    } else {
      regex.append(Pattern.quote(source));
    }

    return of(regex.toString(), Matcher.quoteReplacement(replacement), category);
  }

  public boolean matches(String text) {
    return pattern.matcher(text).find();
  }

  public String apply(String text) {
    return pattern.matcher(text).replaceAll(replacement);
  }
}
