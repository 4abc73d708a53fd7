package dev.eureka.ranking;

import org.jspecify.annotations.Nullable;

/**
 * A ranked document.
 *
 * @param url canonical document URL
 * @param title document title, null if the page had none
 * @param score combined relevance score, higher is better
 * @param importanceScore the document's stored PageRank score
 */
public record RankedResult(
    String url, @Nullable String title, double score, double importanceScore) {}
