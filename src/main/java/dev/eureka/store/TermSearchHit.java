package dev.eureka.store;

import org.jspecify.annotations.Nullable;

/** One row of {@link IndexStore#searchTerm(String, int, int)}. */
public record TermSearchHit(String url, @Nullable String title, double importanceScore) {}
