package dev.eureka.search;

import org.jspecify.annotations.Nullable;

/**
 * A search result as presented to callers.
 *
 * @param url the document URL
 * @param title the document title, null if the page had none
 * @param snippet the title with query terms highlighted, empty without a title
 * @param score the relevance score
 * @param importanceScore the document's PageRank score
 */
public record SearchHit(
    String url, @Nullable String title, String snippet, double score, double importanceScore) {}
