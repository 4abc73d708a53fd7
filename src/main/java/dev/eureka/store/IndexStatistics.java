package dev.eureka.store;

/**
 * Row counts of the four index tables.
 *
 * @param terms lexicon size
 * @param documents known documents (crawled or only linked to)
 * @param postings inverted index entries
 * @param links link graph edges
 */
public record IndexStatistics(long terms, long documents, long postings, long links) {}
