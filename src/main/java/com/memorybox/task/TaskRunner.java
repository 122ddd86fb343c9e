package com.memorybox.task;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.error.ScanCancelledException;
import com.memorybox.library.ScanReport;

/**
 * Runs long scans off the caller's thread. Each task gets a progress reporter and a
 * cancellation token; its handle exposes both to the outside.
 */
public class TaskRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final ExecutorService executor;
    private final Map<String, TaskHandle<?>> tasks = new ConcurrentHashMap<>();

    public TaskRunner(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "memorybox-task-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <R> TaskHandle<R> submit(String name, BackgroundTask<R> task) {
        TaskHandle<R> handle = new TaskHandle<>(UUID.randomUUID().toString(), name);
        tasks.put(handle.id(), handle);
        executor.execute(() -> run(handle, task));
        log.info("Task {} ({}) submitted", handle.id(), name);
        return handle;
    }

    public Optional<TaskHandle<?>> find(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public List<TaskHandle<?>> tasks() {
        return List.copyOf(tasks.values());
    }

    public boolean cancel(String id) {
        TaskHandle<?> handle = tasks.get(id);
        if (handle == null || handle.isDone()) {
            return false;
        }
        handle.cancel();
        return true;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Task executor did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <R> void run(TaskHandle<R> handle, BackgroundTask<R> task) {
        handle.markRunning();
        try {
            R result = task.run(handle::reportProgress, handle.cancelToken());
            TaskState finalState = isCancelledReport(result) ? TaskState.CANCELLED : TaskState.SUCCEEDED;
            handle.complete(result, finalState);
            log.info("Task {} ({}) finished: {}", handle.id(), handle.name(), finalState);
        } catch (ScanCancelledException e) {
            handle.complete(null, TaskState.CANCELLED);
            log.info("Task {} ({}) cancelled", handle.id(), handle.name());
        } catch (Exception e) {
            handle.fail(e);
            log.error("Task {} ({}) failed", handle.id(), handle.name(), e);
        }
    }

    private static boolean isCancelledReport(Object result) {
        return result instanceof ScanReport && ((ScanReport) result).cancelled();
    }
}
