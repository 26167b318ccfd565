package com.tierstore.model;

public record RerankScore(int index, float score) {
}
