package com.memorybox.task;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.memorybox.library.CancellationToken;

public class TaskHandle<R> {
    private final String id;
    private final String name;
    private final CancellationToken cancelToken = new CancellationToken();
    private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
    private final AtomicInteger progress = new AtomicInteger(0);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile R result;
    private volatile Throwable failure;

    TaskHandle(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public TaskState state() {
        return state.get();
    }

    public int progress() {
        return progress.get();
    }

    public Optional<R> result() {
        return Optional.ofNullable(result);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /** Asks the task to stop at its next cancellation check. */
    public void cancel() {
        cancelToken.cancel();
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    CancellationToken cancelToken() {
        return cancelToken;
    }

    void reportProgress(int percent) {
        progress.accumulateAndGet(percent, Math::max);
    }

    void markRunning() {
        state.compareAndSet(TaskState.PENDING, TaskState.RUNNING);
    }

    void complete(R value, TaskState finalState) {
        result = value;
        state.set(finalState);
        done.countDown();
    }

    void fail(Throwable cause) {
        failure = cause;
        state.set(TaskState.FAILED);
        done.countDown();
    }
}
