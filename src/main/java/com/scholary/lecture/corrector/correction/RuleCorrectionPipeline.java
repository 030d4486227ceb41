package com.scholary.lecture.corrector.correction;

import com.scholary.lecture.corrector.config.CorrectionProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Applies the ordered rule stages to the text of one segment.
 *
 * <p>Every stage is a list of {@link CorrectionRule}s run by the same loop: a rule that finds at
 * least one match rewrites all of its matches and adds one entry to the correction log. Disabled
 * stages are skipped; the order of the remaining stages never changes.
 *
 * <p>Rules are loaded once at construction and never modified afterwards, so one pipeline can be
 * shared across threads.
 */
@Component
public class RuleCorrectionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(RuleCorrectionPipeline.class);

  private final Map<CorrectionStage, List<CorrectionRule>> rules;
  private final Set<CorrectionStage> enabledStages;

  @Autowired
  public RuleCorrectionPipeline(CorrectionProperties properties) {
    this(
        CorrectionRules.defaults(),
        CorrectionRules.customTermRules(properties.customTerms()),
        properties.stages().enabledStages());
  }

  public RuleCorrectionPipeline(
      Map<CorrectionStage, List<CorrectionRule>> builtInRules,
      List<CorrectionRule> customTermRules,
      Set<CorrectionStage> enabledStages) {

    Map<CorrectionStage, List<CorrectionRule>> merged = new EnumMap<>(CorrectionStage.class);
    for (CorrectionStage stage : CorrectionStage.values()) {
      List<CorrectionRule> stageRules =
          new ArrayList<>(builtInRules.getOrDefault(stage, List.of()));
      if (stage == CorrectionStage.TECHNICAL_TERMS) {
        stageRules.addAll(customTermRules);
      }
      merged.put(stage, List.copyOf(stageRules));
    }

    this.rules = Collections.unmodifiableMap(merged);
    this.enabledStages =
        enabledStages.isEmpty()
            ? EnumSet.noneOf(CorrectionStage.class)
            : EnumSet.copyOf(enabledStages);

    LOGGER.info(
        "Initialized rule pipeline: stages={}, customTerms={}",
        this.enabledStages,
        customTermRules.size());
  }

  /**
   * Run all enabled stages over the text.
   *
   * @param text the segment text
   * @return the corrected text and the ordered correction log
   */
  public CorrectionResult correct(String text) {
    String corrected = text;
    List<CorrectionCategory> log = new ArrayList<>();

    for (CorrectionStage stage : CorrectionStage.values()) {
      if (enabledStages.contains(stage)) {
        corrected = runStage(stage, corrected, log);
      }
    }

    return new CorrectionResult(corrected, log);
  }

  /**
   * Run a single stage, regardless of whether it is enabled.
   *
   * @param stage the stage to run
   * @param text the input text
   * @return the stage output and the entries it logged
   */
  public CorrectionResult runStage(CorrectionStage stage, String text) {
    List<CorrectionCategory> log = new ArrayList<>();
    String corrected = runStage(stage, text, log);
    return new CorrectionResult(corrected, log);
  }

  private String runStage(CorrectionStage stage, String text, List<CorrectionCategory> log) {
    String current = text;
    for (CorrectionRule rule : rules.get(stage)) {
      if (!rule.matches(current)) {
        continue;
      }
      current = rule.apply(current);
      if (rule.category().isLogged()) {
        log.add(rule.category());
      }
      LOGGER.trace("Rule matched: stage={}, pattern={}", stage, rule.pattern().pattern());
    }
    return current;
  }
}
