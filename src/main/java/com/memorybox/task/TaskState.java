package com.memorybox.task;

public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    CANCELLED,
    FAILED
}
