package com.memorybox.retrieval;

public record Neighbor(long id, float distance) {
}
