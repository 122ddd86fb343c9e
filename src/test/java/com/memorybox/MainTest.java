package com.memorybox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.memorybox.library.LibraryMetadata;
import com.memorybox.library.ScanProfile;
import com.memorybox.task.TaskHandle;
import com.memorybox.task.TaskRunner;
import com.memorybox.task.TaskState;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRejectMissingOrUnknownMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, new CommandLine(new Main()).execute());
        assertEquals(Main.EXIT_USAGE_ERROR, new CommandLine(new Main()).execute("--mode", "chat"));
    }

    @Test
    void shouldRequireTheOptionsOfEachMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "scan"));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "search", "--library-root", tempDir.toString()));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "remove", "--library-root", tempDir.toString()));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "build-index",
                "--index-path", tempDir.resolve("index.json").toString()));
        assertEquals(Main.EXIT_USAGE_ERROR, run("--mode", "query", "--query", "hello",
                "--index-path", tempDir.resolve("index.json").toString()));
    }

    @Test
    void shouldScanSearchRemoveAndDemolishALibrary() throws Exception {
        Path root = tempDir.resolve("docs");
        Files.createDirectories(root);
        Files.writeString(root.resolve("trip.txt"), "packing list for the mountain trip");
        Files.writeString(root.resolve("recipe.txt"), "sourdough bread recipe");
        String libraryRoot = root.toString();

        assertEquals(0, run("--mode", "scan", "--library-root", libraryRoot, "--library-name", "docs"));
        Path dataFolder = root.resolve(".memorybox");
        assertTrue(LibraryMetadata.exists(dataFolder));
        assertEquals(2, ScanProfile.load(dataFolder).size());

        Files.writeString(root.resolve("notes.txt"), "call the plumber");
        assertEquals(0, run("--mode", "incremental", "--library-root", libraryRoot));
        assertEquals(3, ScanProfile.load(dataFolder).size());

        assertEquals(0, run("--mode", "search", "--library-root", libraryRoot, "--query", "bread recipe"));
        assertEquals(0, run("--mode", "remove", "--library-root", libraryRoot, "recipe.txt"));
        assertEquals(2, ScanProfile.load(dataFolder).size());

        assertEquals(0, run("--mode", "demolish", "--library-root", libraryRoot));
        assertFalse(Files.exists(dataFolder));
        assertTrue(Files.exists(root.resolve("trip.txt")));
    }

    @Test
    void shouldBuildAnIndexAndQueryIt() throws Exception {
        Path export = tempDir.resolve("chat.txt");
        Files.writeString(export, "alice: the ferry leaves at noon\nbob: bring the tent\n");
        Path index = tempDir.resolve("retrieval/index.json");

        assertEquals(0, run("--mode", "build-index", "--corpus-id", "trip-chat",
                "--raw-source", export.toString(), "--index-path", index.toString()));
        assertTrue(Files.exists(index));

        assertEquals(0, run("--mode", "query", "--query", "when does the ferry leave",
                "--index-path", index.toString()));
    }

    @Test
    void shouldLetACancelledScanFinishItsRollbackOnShutdown() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean rolledBack = new AtomicBoolean();
        try (TaskRunner runner = new TaskRunner(1)) {
            TaskHandle<String> handle = runner.submit("scan", (reporter, token) -> {
                started.countDown();
                while (!token.isCancelled()) {
                    Thread.sleep(5);
                }
                Thread.sleep(200);
                rolledBack.set(true);
                return "rolled back";
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));

            Main.cancelAndWait(handle, Duration.ofSeconds(5)).run();

            assertTrue(rolledBack.get());
            assertTrue(handle.isDone());
            assertEquals(TaskState.SUCCEEDED, handle.state());
        }
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = tempDir.resolve("missing.yml").toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return new CommandLine(new Main()).execute(withConfig);
    }
}
