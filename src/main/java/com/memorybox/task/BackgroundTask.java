package com.memorybox.task;

import com.memorybox.library.CancellationToken;
import com.memorybox.library.ProgressReporter;

@FunctionalInterface
public interface BackgroundTask<R> {
    R run(ProgressReporter progressReporter, CancellationToken cancelToken) throws Exception;
}
