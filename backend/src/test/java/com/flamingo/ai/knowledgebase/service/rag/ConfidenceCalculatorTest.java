package com.flamingo.ai.knowledgebase.service.rag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgebase.service.retrieval.RetrievedChunk;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfidenceCalculatorTest {

  @Test
  void shouldBeZero_whenNoSources() {
    assertThat(ConfidenceCalculator.score(List.of(), "a long answer")).isZero();
  }

  @Test
  void shouldSaturateSourceCountAndLength() {
    List<RetrievedChunk> sources = List.of(chunk(0.2), chunk(0.2), chunk(0.2), chunk(0.2));

    double score = ConfidenceCalculator.score(sources, "x".repeat(500));

    assertThat(score).isEqualTo(0.88);
  }

  @Test
  void shouldWeighPartialFactors() {
    double score = ConfidenceCalculator.score(List.of(chunk(0.5)), "x".repeat(100));

    // 0.5 * 0.6 + (1/3) * 0.25 + 0.5 * 0.15
    assertThat(score).isEqualTo(0.458);
  }

  @Test
  void shouldClampToZero_whenSourcesAreOpposite() {
    assertThat(ConfidenceCalculator.score(List.of(chunk(2.0)), "")).isZero();
  }

  @Test
  void shouldReachOne_forPerfectMatches() {
    List<RetrievedChunk> sources = List.of(chunk(0.0), chunk(0.0), chunk(0.0));

    assertThat(ConfidenceCalculator.score(sources, "x".repeat(200))).isEqualTo(1.0);
  }

  private static RetrievedChunk chunk(double distance) {
    return new RetrievedChunk("id", "content", Map.of(), distance);
  }
}
