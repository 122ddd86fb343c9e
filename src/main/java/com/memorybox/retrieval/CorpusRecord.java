package com.memorybox.retrieval;

public record CorpusRecord(long id, long timestamp, String sender, String content) {
}
