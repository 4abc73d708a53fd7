package dev.eureka.pagerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PageRankEngineTest {

  private static final double DAMPING = 0.85;

  @Test
  void threeCycleRanksMostLinkedDocumentHighest() {
    Map<Long, List<Long>> graph = new LinkedHashMap<>();
    graph.put(1L, List.of(2L, 3L));
    graph.put(2L, List.of(3L));
    graph.put(3L, List.of(1L));

    Map<Long, Double> scores =
        PageRankEngine.normalize(PageRankEngine.compute(graph, 20, DAMPING));

    assertThat(scores.get(3L)).isGreaterThan(scores.get(1L)).isGreaterThan(scores.get(2L));
    assertThat(sum(scores)).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void emptyGraphYieldsEmptyScores() {
    assertThat(PageRankEngine.compute(Map.of(), 20, DAMPING)).isEmpty();
    assertThat(PageRankEngine.normalize(Map.of())).isEmpty();
  }

  @Test
  void zeroIterationsKeepsInitialScores() {
    Map<Long, Double> scores = PageRankEngine.compute(Map.of(1L, List.of(2L)), 0, DAMPING);

    assertThat(scores).containsEntry(1L, 1.0).containsEntry(2L, 1.0);
  }

  @Test
  void targetOnlyDocumentsAreScored() {
    Map<Long, Double> scores = PageRankEngine.compute(Map.of(1L, List.of(2L)), 20, DAMPING);

    assertThat(scores).containsOnlyKeys(1L, 2L);
    assertThat(scores.get(2L)).isGreaterThan(scores.get(1L));
  }

  @Test
  void isolatedDocumentsGetBaseScoreAndAreNeverNegative() {
    Map<Long, List<Long>> graph = new LinkedHashMap<>();
    graph.put(1L, List.of());
    graph.put(2L, List.of());

    Map<Long, Double> scores = PageRankEngine.compute(graph, 20, DAMPING);

    // each dangling document receives half of the other's score through redistribution
    assertThat(scores.get(1L)).isEqualTo(scores.get(2L));
    assertThat(scores.get(1L)).isGreaterThanOrEqualTo(1.0 - DAMPING);
  }

  @Test
  void danglingDocumentDoesNotFeedItself() {
    Map<Long, Double> scores = PageRankEngine.compute(Map.of(1L, List.of()), 1, DAMPING);

    assertThat(scores.get(1L)).isCloseTo(1.0 - DAMPING, within(1e-12));
  }

  @Test
  void oneIterationMatchesHandComputedValues() {
    Map<Long, List<Long>> graph = new LinkedHashMap<>();
    graph.put(1L, List.of(2L));
    graph.put(2L, List.of());

    Map<Long, Double> scores = PageRankEngine.compute(graph, 1, DAMPING);

    // PR(1) = 0.15 + 0.85 * (dangling 2 spreads 1.0 / 2)
    assertThat(scores.get(1L)).isCloseTo(0.15 + 0.85 * 0.5, within(1e-12));
    // PR(2) = 0.15 + 0.85 * (1.0 from document 1)
    assertThat(scores.get(2L)).isCloseTo(0.15 + 0.85, within(1e-12));
  }

  @Test
  void normalizeLeavesAllZeroScoresUnchanged() {
    assertThat(PageRankEngine.normalize(Map.of(1L, 0.0, 2L, 0.0)))
        .containsEntry(1L, 0.0)
        .containsEntry(2L, 0.0);
  }

  @Test
  void rejectsInvalidParameters() {
    assertThatThrownBy(() -> PageRankEngine.compute(Map.of(), -1, DAMPING))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PageRankEngine.compute(Map.of(), 20, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static double sum(Map<Long, Double> scores) {
    return scores.values().stream().mapToDouble(Double::doubleValue).sum();
  }
}
