package dev.eureka.pagerank;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static PageRank over a document link graph.
 *
 * <p>For every document A, one iteration computes
 *
 * <pre>{@code
 * PR(A) = (1 - d) + d * ( sum over T linking to A of PR(T) / out(T)
 *                       + sum over dangling D != A of PR(D) / N )
 * }</pre>
 *
 * <p>where {@code d} is the damping factor, {@code N} the number of documents and dangling
 * documents are those without outbound links. Dangling documents spread their score evenly over
 * every other document. All scores start at 1.0 and each iteration reads only the previous
 * iteration's scores. A fixed number of iterations is run; there is no convergence test.
 *
 * <p>This class has no Spring dependencies and no state.
 */
public final class PageRankEngine {

  private PageRankEngine() {}

  /**
   * Computes raw (unnormalized) PageRank scores.
   *
   * @param graph adjacency map; documents that only appear as link targets are included too
   * @param iterations number of update rounds, at least 0
   * @param damping probability of following a link, in [0, 1]
   * @return score per document, graph keys first, then target-only documents in discovery order
   */
  public static Map<Long, Double> compute(
      Map<Long, List<Long>> graph, int iterations, double damping) {
    if (iterations < 0) {
      throw new IllegalArgumentException("iterations must not be negative, got: " + iterations);
    }
    if (damping < 0.0 || damping > 1.0) {
      throw new IllegalArgumentException("damping must be in [0.0, 1.0], got: " + damping);
    }

    Map<Long, Integer> indexById = new LinkedHashMap<>();
    graph.keySet().forEach(id -> indexById.putIfAbsent(id, indexById.size()));
    for (List<Long> targets : graph.values()) {
      targets.forEach(id -> indexById.putIfAbsent(id, indexById.size()));
    }
    int n = indexById.size();
    if (n == 0) {
      return Map.of();
    }

    int[][] outLinks = new int[n][];
    boolean[] dangling = new boolean[n];
    for (Map.Entry<Long, Integer> entry : indexById.entrySet()) {
      List<Long> targets = graph.getOrDefault(entry.getKey(), List.of());
      int[] indices = new int[targets.size()];
      for (int i = 0; i < indices.length; i++) {
        indices[i] = indexById.get(targets.get(i));
      }
      outLinks[entry.getValue()] = indices;
      dangling[entry.getValue()] = indices.length == 0;
    }

    double[] scores = new double[n];
    Arrays.fill(scores, 1.0);
    double base = 1.0 - damping;

    for (int round = 0; round < iterations; round++) {
      double[] incoming = new double[n];
      double danglingTotal = 0.0;
      for (int node = 0; node < n; node++) {
        if (dangling[node]) {
          danglingTotal += scores[node];
          continue;
        }
        double share = scores[node] / outLinks[node].length;
        for (int target : outLinks[node]) {
          incoming[target] += share;
        }
      }

      double[] next = new double[n];
      for (int node = 0; node < n; node++) {
        double danglingShare = (danglingTotal - (dangling[node] ? scores[node] : 0.0)) / n;
        next[node] = base + damping * (incoming[node] + danglingShare);
      }
      scores = next;
    }

    Map<Long, Double> result = new LinkedHashMap<>();
    for (Map.Entry<Long, Integer> entry : indexById.entrySet()) {
      result.put(entry.getKey(), scores[entry.getValue()]);
    }
    return result;
  }

  /**
   * Scales scores so they sum to 1.0.
   *
   * @return a new map with every score divided by the sum, or a copy of the input when the sum is
   *     zero
   */
  public static Map<Long, Double> normalize(Map<Long, Double> scores) {
    double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
    if (total == 0.0) {
      return new HashMap<>(scores);
    }
    Map<Long, Double> normalized = new LinkedHashMap<>();
    scores.forEach((id, score) -> normalized.put(id, score / total));
    return normalized;
  }
}
