package com.tierstore.model;

/**
 * @param abstractText short abstract (L0)
 * @param overview     navigable overview (L1)
 */
public record Summary(String abstractText, String overview, String model) {
}
