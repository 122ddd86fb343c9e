package com.memorybox.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MessageHistoryCorpusTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldImportOneMessagePerLineWithOptionalSender() throws Exception {
        Path export = tempDir.resolve("chat.txt");
        Files.writeString(export, "alice: see you at the lake\n\nno sender here\nbob: bring snacks\n");

        try (MessageHistoryCorpus corpus = MessageHistoryCorpus.open(tempDir, "family-chat", export)) {
            List<CorpusRecord> records = corpus.records();

            assertEquals(3, records.size());
            assertEquals(1L, records.get(0).id());
            assertEquals("alice", records.get(0).sender());
            assertEquals("see you at the lake", records.get(0).content());
            assertNull(records.get(1).sender());
            assertEquals("no sender here", records.get(1).content());
            assertEquals("bring snacks", corpus.find(3L).orElseThrow().content());
            assertTrue(corpus.find(42L).isEmpty());
        }
    }

    @Test
    void shouldReplaceContentOnReimportAndKeepItOtherwise() throws Exception {
        Path export = tempDir.resolve("chat.txt");
        Files.writeString(export, "one\ntwo\n");
        MessageHistoryCorpus.open(tempDir, "c1", export).close();

        try (MessageHistoryCorpus reopened = MessageHistoryCorpus.open(tempDir, "c1", null)) {
            assertEquals(2, reopened.records().size());
        }

        Files.writeString(export, "three\n");
        try (MessageHistoryCorpus reimported = MessageHistoryCorpus.open(tempDir, "c1", export)) {
            assertEquals(List.of("three"), reimported.records().stream().map(CorpusRecord::content).toList());
            assertEquals(1L, reimported.records().get(0).id());
        }

        try (MessageHistoryCorpus other = MessageHistoryCorpus.open(tempDir, "c2", null)) {
            assertTrue(other.records().isEmpty());
        }
    }
}
