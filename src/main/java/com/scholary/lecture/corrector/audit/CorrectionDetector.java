package com.scholary.lecture.corrector.audit;

import static com.scholary.lecture.corrector.correction.CorrectionCategory.FILLER_REMOVAL;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.PUNCTUATION;
import static com.scholary.lecture.corrector.correction.CorrectionCategory.REPETITION_REMOVAL;

import com.scholary.lecture.corrector.config.CorrectionProperties;
import com.scholary.lecture.corrector.correction.CorrectionCategory;
import com.scholary.lecture.corrector.correction.CorrectionRule;
import com.scholary.lecture.corrector.correction.CorrectionRules;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Recognizes, from a before/after pair alone, which kinds of correction were made.
 *
 * <p>Reads the same dictionaries as the rule pipeline. A term, ending or naturalization rule
 * counts as applied when it matches the original and no longer matches the corrected text. Each
 * applied rule yields one entry, as in the pipeline's own log. Fillers and punctuation are
 * detected by comparing counts.
 */
@Component
public class CorrectionDetector {

  private static final Pattern COMMA_OR_STOP = Pattern.compile("[。、]");

  private final List<CorrectionRule> termRules;

  @Autowired
  public CorrectionDetector(CorrectionProperties properties) {
    this(CorrectionRules.customTermRules(properties.customTerms()));
  }

  public CorrectionDetector(List<CorrectionRule> customTermRules) {
    List<CorrectionRule> terms = new ArrayList<>(CorrectionRules.technicalTerms());
    terms.addAll(customTermRules);
    this.termRules = List.copyOf(terms);
  }

  public List<CorrectionCategory> detect(String original, String corrected) {
    List<CorrectionCategory> detected = new ArrayList<>();

    detected.addAll(resolvedRules(termRules, original, corrected));
    detected.addAll(resolvedRules(CorrectionRules.endingFixes(), original, corrected));

    if (CorrectionRules.DUPLICATED_PHRASE.matcher(original).find()
        && !CorrectionRules.DUPLICATED_PHRASE.matcher(corrected).find()) {
      detected.add(REPETITION_REMOVAL);
    }

    if (fillerCount(corrected) < fillerCount(original)) {
      detected.add(FILLER_REMOVAL);
    }

    detected.addAll(resolvedRules(CorrectionRules.naturalizations(), original, corrected));

    if (ReadabilityScorer.count(COMMA_OR_STOP, corrected)
        > ReadabilityScorer.count(COMMA_OR_STOP, original)) {
      detected.add(PUNCTUATION);
    }

    return detected;
  }

  /** Term rules that were resolved between the two texts, for naming substitutions. */
  List<CorrectionRule> resolvedTermRules(String original, String corrected) {
    return resolved(termRules, original, corrected);
  }

  private static List<CorrectionCategory> resolvedRules(
      List<CorrectionRule> rules, String original, String corrected) {
    List<CorrectionCategory> categories = new ArrayList<>();
    for (CorrectionRule rule : resolved(rules, original, corrected)) {
      categories.add(rule.category());
    }
    return categories;
  }

  private static List<CorrectionRule> resolved(
      List<CorrectionRule> rules, String original, String corrected) {
    List<CorrectionRule> resolved = new ArrayList<>();
    for (CorrectionRule rule : rules) {
      if (rule.matches(original) && !rule.matches(corrected)) {
        resolved.add(rule);
      }
    }
    return resolved;
  }

  private static int fillerCount(String text) {
    int count = 0;
    for (String filler : CorrectionRules.FILLER_WORDS) {
      count += ReadabilityScorer.occurrences(text, filler);
    }
    return count;
  }
}
