package com.memorybox.library;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.memorybox.embed.Embedder;
import com.memorybox.embed.HashingTextEmbedder;
import com.memorybox.error.ConsistencyException;
import com.memorybox.error.LibraryUsageException;
import com.memorybox.error.LockContentionException;
import com.memorybox.runtime.AppConfig;
import com.memorybox.store.ItemRecord;
import com.memorybox.store.LocalVectorStore;
import com.memorybox.store.VectorStore;
import com.memorybox.store.VectorStoreFactory;

class LibraryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldEmbedEveryFileAndKeepBothStoresConsistent() throws Exception {
        Path root = libraryWith(Map.of(
                "notes/a.txt", "alpha beta gamma",
                "notes/b.txt", "delta epsilon",
                "c.txt", "zeta eta theta"));
        Library<String> library = documentLibrary(root, localStores(), 200);

        ScanReport report = library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanStatus.COMPLETED, report.status());
        assertEquals(3, report.embeddedFiles());
        assertTrue(library.isReady());
        assertConsistent(library, 3);
        assertTrue(library.uuidOf("notes/a.txt").isPresent());
        ItemRecord record = library.metadataStore().selectByUuid(library.uuidOf("notes/a.txt").get()).orElseThrow();
        assertEquals("notes", record.path());
        assertEquals("a.txt", record.filename());
    }

    @Test
    void shouldNotRescanAReadyLibraryUnlessForced() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        String uuidBefore = library.uuidOf("a.txt").orElseThrow();

        ScanReport second = library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        assertEquals(ScanReport.ScanStatus.UP_TO_DATE, second.status());
        assertEquals(uuidBefore, library.uuidOf("a.txt").orElseThrow());

        ScanReport forced = library.initialize(true, ProgressReporter.NONE, CancellationToken.none());
        assertEquals(ScanReport.ScanStatus.COMPLETED, forced.status());
        assertEquals(2, forced.embeddedFiles());
        assertFalse(uuidBefore.equals(library.uuidOf("a.txt").orElseThrow()));
        assertConsistent(library, 2);
    }

    @Test
    void shouldLoadExistingDataAfterRestartWithoutRescanning() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> first = documentLibrary(root, localStores(), 200);
        first.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        first.metadataStore().close();

        Library<String> reopened = documentLibrary(root, localStores(), 200);
        ScanReport report = reopened.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanStatus.UP_TO_DATE, report.status());
        assertTrue(reopened.isReady());
        assertConsistent(reopened, 2);
    }

    @Test
    void shouldEmbedNewFilesAndDropVanishedOnesIncrementally() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        String keptUuid = library.uuidOf("a.txt").orElseThrow();

        Files.delete(root.resolve("b.txt"));
        Files.writeString(root.resolve("c.txt"), "gamma");
        ScanReport report = library.incrementalInitialize(ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanMode.INCREMENTAL, report.mode());
        assertEquals(1, report.embeddedFiles());
        assertEquals(1, report.removedFiles());
        assertEquals(keptUuid, library.uuidOf("a.txt").orElseThrow());
        assertFalse(library.uuidOf("b.txt").isPresent());
        assertTrue(library.uuidOf("c.txt").isPresent());
        assertConsistent(library, 2);
    }

    @Test
    void shouldFallBackToFullScanWhenNothingWasEmbeddedYet() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha"));
        Library<String> library = documentLibrary(root, localStores(), 200);

        ScanReport report = library.incrementalInitialize(ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanMode.FULL, report.mode());
        assertEquals(1, report.embeddedFiles());
    }

    @Test
    void shouldRollBackFlushedAndStagedWritesWhenCancelled() throws Exception {
        Path root = libraryWith(Map.of(
                "1.txt", "one", "2.txt", "two", "3.txt", "three",
                "4.txt", "four", "5.txt", "five", "6.txt", "six"));
        InMemoryBatchingVectorStore store = new InMemoryBatchingVectorStore();
        CancellationToken token = new CancellationToken();
        AtomicInteger embedded = new AtomicInteger();
        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        Embedder<String> cancelAfterFive = text -> {
            if (embedded.incrementAndGet() == 5) {
                token.cancel();
            }
            return hashing.embed(text);
        };
        Library<String> library = new Library<>(root, "docs", "lib-1", Libraries.DOCUMENT, new TextContentReader(),
                (uuid, folder) -> store, settings(4));
        library.setEmbedder(cancelAfterFive);

        ScanReport report = library.initialize(false, ProgressReporter.NONE, token);

        assertEquals(ScanReport.ScanStatus.CANCELLED, report.status());
        assertTrue(report.cancelled());
        assertEquals(1, store.flushes);
        assertEquals(1, store.discarded.size());
        assertTrue(store.dbIsEmpty());
        assertEquals(0, library.metadataStore().rowCount());
        assertTrue(library.scanProfile().isEmpty());
        assertTrue(ScanProfile.load(library.dataFolder()).isEmpty());
        assertFalse(library.isScanning());
    }

    @Test
    void shouldKeepEarlierScansWhenAnIncrementalScanIsCancelled() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        Files.writeString(root.resolve("c.txt"), "gamma");
        Files.writeString(root.resolve("d.txt"), "delta");
        CancellationToken token = new CancellationToken();
        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        library.setEmbedder(text -> {
            token.cancel();
            return hashing.embed(text);
        });

        ScanReport report = library.incrementalInitialize(ProgressReporter.NONE, token);

        assertEquals(ScanReport.ScanStatus.CANCELLED, report.status());
        assertConsistent(library, 2);
        assertFalse(library.uuidOf("c.txt").isPresent());
        assertFalse(library.uuidOf("d.txt").isPresent());
    }

    @Test
    void shouldKeepPreviousItemsWhenAForcedRescanIsCancelled() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        Map<String, String> before = library.scanProfile().snapshot();

        CancellationToken token = new CancellationToken();
        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        library.setEmbedder(text -> {
            token.cancel();
            return hashing.embed(text);
        });
        ScanReport report = library.initialize(true, ProgressReporter.NONE, token);

        assertEquals(ScanReport.ScanStatus.CANCELLED, report.status());
        assertTrue(library.isReady());
        assertConsistent(library, 2);
        assertEquals(before, library.scanProfile().snapshot());
        assertEquals(before, ScanProfile.load(library.dataFolder()).snapshot());
        assertEquals("a.txt", library.searchByContent("alpha", 1).get(0).relativePath());
    }

    @Test
    void shouldKeepPreviousItemsWhenAForcedRescanFails() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        Map<String, String> before = library.scanProfile().snapshot();

        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        library.setEmbedder(text -> text.startsWith("beta") ? new float[0] : hashing.embed(text));
        assertThrows(ConsistencyException.class,
                () -> library.initialize(true, ProgressReporter.NONE, CancellationToken.none()));

        assertConsistent(library, 2);
        assertEquals(before, library.scanProfile().snapshot());
    }

    @Test
    void shouldDropVanishedFilesWhenAForcedRescanCommits() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());
        String oldUuid = library.uuidOf("b.txt").orElseThrow();

        Files.delete(root.resolve("b.txt"));
        ScanReport report = library.initialize(true, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanStatus.COMPLETED, report.status());
        assertFalse(library.uuidOf("b.txt").isPresent());
        assertFalse(library.metadataStore().selectByUuid(oldUuid).isPresent());
        assertConsistent(library, 1);
    }

    @Test
    void shouldStayUninitializedWhenTheFirstScanIsCancelled() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        CancellationToken token = new CancellationToken();
        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        library.setEmbedder(text -> {
            token.cancel();
            return hashing.embed(text);
        });

        ScanReport cancelled = library.initialize(false, ProgressReporter.NONE, token);
        assertEquals(ScanReport.ScanStatus.CANCELLED, cancelled.status());
        assertFalse(library.isReady());
        assertThrows(LibraryUsageException.class, () -> library.searchByContent("alpha", 1));

        library.setEmbedder(hashing);
        ScanReport retried = library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanStatus.COMPLETED, retried.status());
        assertEquals(2, retried.embeddedFiles());
        assertTrue(library.isReady());
        assertConsistent(library, 2);
    }

    @Test
    void shouldRejectEmptyEmbeddingAndLeaveNoPartialItem() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        library.setEmbedder(text -> text.startsWith("beta") ? new float[0] : hashing.embed(text));

        assertThrows(ConsistencyException.class,
                () -> library.initialize(false, ProgressReporter.NONE, CancellationToken.none()));

        assertEquals(0, library.metadataStore().rowCount());
        assertTrue(library.vectorStore().dbIsEmpty());
        assertTrue(library.scanProfile().isEmpty());
        assertFalse(library.isScanning());
    }

    @Test
    void shouldSkipInvalidItemsAndKeepScanning() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "c.txt", "gamma"));
        Files.write(root.resolve("broken.bin"), new byte[] { (byte) 0xC3, (byte) 0x28, 0x00 });
        Files.writeString(root.resolve("blank.txt"), "   \n", StandardCharsets.UTF_8);
        Library<String> library = documentLibrary(root, localStores(), 200);

        ScanReport report = library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(ScanReport.ScanStatus.COMPLETED, report.status());
        assertEquals(4, report.discoveredFiles());
        assertEquals(2, report.embeddedFiles());
        assertEquals(2, report.invalidFiles());
        assertFalse(library.uuidOf("broken.bin").isPresent());
        assertConsistent(library, 2);
    }

    @Test
    void shouldReportMonotonicProgressEndingAtOneHundred() throws Exception {
        Path root = libraryWith(Map.of(
                "1.txt", "one", "2.txt", "two", "3.txt", "three", "4.txt", "four", "5.txt", "five",
                "6.txt", "six", "7.txt", "seven"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        List<Integer> reported = new ArrayList<>();

        library.initialize(false, reported::add, CancellationToken.none());

        assertFalse(reported.isEmpty());
        for (int i = 1; i < reported.size(); i++) {
            assertTrue(reported.get(i) > reported.get(i - 1), "progress went from " + reported.get(i - 1) + " to " + reported.get(i));
        }
        assertEquals(100, reported.get(reported.size() - 1));
    }

    @Test
    void shouldRejectConcurrentScansWithoutWaiting() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta"));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HashingTextEmbedder hashing = new HashingTextEmbedder(16);
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.setEmbedder(text -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return hashing.embed(text);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ScanReport> running = executor.submit(
                    () -> library.initialize(false, ProgressReporter.NONE, CancellationToken.none()));
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            assertTrue(library.isScanning());

            assertThrows(LockContentionException.class,
                    () -> library.initialize(true, ProgressReporter.NONE, CancellationToken.none()));
            assertThrows(LockContentionException.class,
                    () -> library.incrementalInitialize(ProgressReporter.NONE, CancellationToken.none()));
            assertThrows(LockContentionException.class, library::demolish);

            release.countDown();
            assertEquals(ScanReport.ScanStatus.COMPLETED, running.get(10, TimeUnit.SECONDS).status());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertFalse(library.isScanning());
        assertConsistent(library, 2);
    }

    @Test
    void shouldFindTheClosestItemByContent() throws Exception {
        Path root = libraryWith(Map.of(
                "cats.txt", "cats purr and sleep in the sun",
                "rockets.txt", "rockets launch into orbit",
                "bread.txt", "bread needs flour water and yeast"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        List<ItemRecord> results = library.searchByContent("rockets launch into orbit", 2);

        assertEquals(2, results.size());
        assertEquals("rockets.txt", results.get(0).relativePath());
        assertTrue(library.searchByContent("anything", 0).isEmpty());
    }

    @Test
    void shouldRemoveEmbeddingsAndDeleteFiles() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha", "b.txt", "beta", "c.txt", "gamma"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(1, library.removeEmbeddings(List.of("a.txt", "missing.txt")));
        assertTrue(Files.exists(root.resolve("a.txt")));
        assertConsistent(library, 2);

        assertEquals(1, library.deleteFiles(List.of("b.txt")));
        assertFalse(Files.exists(root.resolve("b.txt")));
        assertConsistent(library, 1);

        assertThrows(LibraryUsageException.class, () -> library.deleteFiles(List.of("../outside.txt")));
        assertThrows(LibraryUsageException.class, () -> library.deleteFiles(List.of(".memorybox/metadata.json")));
    }

    @Test
    void shouldRequireAnEmbedderAndAReadyLibrary() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha"));
        Library<String> library = new Library<>(root, "docs", "lib-1", Libraries.DOCUMENT, new TextContentReader(),
                localStores(), settings(200));

        assertThrows(LibraryUsageException.class, () -> library.searchByContent("alpha", 3));
        assertThrows(LibraryUsageException.class,
                () -> library.initialize(false, ProgressReporter.NONE, CancellationToken.none()));
        assertFalse(library.isScanning());
    }

    @Test
    void shouldRefuseAFolderOwnedByAnotherLibrary() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha"));
        documentLibrary(root, localStores(), 200);

        assertThrows(LibraryUsageException.class, () -> new Library<>(root, "docs", "other-uuid", Libraries.DOCUMENT,
                new TextContentReader(), localStores(), settings(200)));
    }

    @Test
    void shouldDemolishEveryTraceOfTheLibrary() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha"));
        Library<String> library = documentLibrary(root, localStores(), 200);
        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        library.demolish();

        assertFalse(Files.exists(library.dataFolder()));
        assertTrue(Files.exists(root.resolve("a.txt")));
        assertFalse(library.isReady());
        assertThrows(LibraryUsageException.class,
                () -> library.initialize(true, ProgressReporter.NONE, CancellationToken.none()));
    }

    @Test
    void shouldRecordTheLastScanTime() throws Exception {
        Path root = libraryWith(Map.of("a.txt", "alpha"));
        Library<String> library = documentLibrary(root, localStores(), 200);

        library.initialize(false, ProgressReporter.NONE, CancellationToken.none());

        assertEquals(0, library.scanGapDays());
        assertTrue(LibraryMetadata.exists(library.dataFolder()));
        assertEquals("lib-1", LibraryMetadata.load(library.dataFolder()).uuid());
    }

    private Path libraryWith(Map<String, String> files) throws Exception {
        Path root = tempDir.resolve("library");
        for (Map.Entry<String, String> file : files.entrySet()) {
            Path path = root.resolve(file.getKey());
            Files.createDirectories(path.getParent());
            Files.writeString(path, file.getValue());
        }
        return root;
    }

    private static VectorStoreFactory localStores() {
        return (uuid, dataFolder) -> new LocalVectorStore(dataFolder);
    }

    private static AppConfig.LibraryConfig settings(int batchSize) {
        AppConfig.LibraryConfig settings = new AppConfig.LibraryConfig();
        settings.setBatchSize(batchSize);
        return settings;
    }

    private static Library<String> documentLibrary(Path root, VectorStoreFactory factory, int batchSize) throws Exception {
        Library<String> library = new Library<>(root, "docs", "lib-1", Libraries.DOCUMENT, new TextContentReader(),
                factory, settings(batchSize));
        library.setEmbedder(new HashingTextEmbedder(16));
        return library;
    }

    private static void assertConsistent(Library<?> library, int expectedItems) {
        VectorStore vectors = library.vectorStore();
        assertEquals(expectedItems, library.scanProfile().size());
        assertEquals(expectedItems, library.metadataStore().rowCount());
        assertEquals(expectedItems, vectors.size());
        for (Map.Entry<String, String> entry : library.scanProfile().snapshot().entrySet()) {
            ItemRecord record = library.metadataStore().selectByUuid(entry.getValue()).orElseThrow();
            assertEquals(entry.getKey(), record.relativePath());
        }
    }
}
