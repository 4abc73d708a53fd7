package dev.eureka.store;

import org.jspecify.annotations.Nullable;

/**
 * A posting joined with the fields of its document, as read by the ranker.
 *
 * @param documentId the document identity
 * @param url the canonical document URL
 * @param title the document title, null when no title element was parsed
 * @param importanceScore the PageRank importance of the document
 * @param weight the emphasis weight of the term within the document
 */
public record PostingHit(
    Long documentId,
    String url,
    @Nullable String title,
    Double importanceScore,
    Integer weight) {}
