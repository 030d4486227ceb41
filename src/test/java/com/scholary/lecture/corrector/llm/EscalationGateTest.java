package com.scholary.lecture.corrector.llm;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EscalationGateTest {

  private final EscalationGate gate = new EscalationGate();

  @Test
  void requiresEscalation_shouldFireOnKanaRunFollowedByMo() {
    assertThat(gate.requiresEscalation("あいうも")).isTrue();
  }

  @Test
  void requiresEscalation_shouldFireOnKnownConfusables() {
    assertThat(gate.requiresEscalation("帰漏らしがないように")).isTrue();
    assertThat(gate.requiresEscalation("バットケース")).isTrue();
    assertThat(gate.requiresEscalation("Googleコラボで実行")).isTrue();
  }

  @Test
  void requiresEscalation_shouldIgnoreCleanText() {
    assertThat(gate.requiresEscalation("GPTを使う")).isFalse();
    assertThat(gate.requiresEscalation("バッター")).isFalse();
    assertThat(gate.requiresEscalation("")).isFalse();
  }

  @Test
  void matchingDetectors_shouldListDetectorsInOrder() {
    assertThat(gate.matchingDetectors("帰漏らしのバットを")).containsExactly("帰漏らし", "バット[^ー]");
  }
}
