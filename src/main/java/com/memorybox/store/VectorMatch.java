package com.memorybox.store;

public record VectorMatch(String key, float distance) {
}
