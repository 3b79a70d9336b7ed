/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.denstream.executor;

import static com.amazon.denstream.CommonUtils.checkNotNull;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * The single owned handle of a running maintenance task. {@link #stop()}
 * signals termination and blocks until the task has exited; once it returns no
 * thread touches the engine state on behalf of the task.
 */
public class MaintenanceHandle implements AutoCloseable {

    private final MaintenanceWorker<?> worker;

    private final Future<?> future;

    private final ExecutorService executor;

    private final Runnable onStop;

    private boolean stopped = false;

    /**
     * @param worker   the loop that was submitted
     * @param future   the future of the submission
     * @param executor the executor owning the thread, shut down on stop
     * @param onStop   tear-down run after the task has exited
     */
    public MaintenanceHandle(MaintenanceWorker<?> worker, Future<?> future, ExecutorService executor,
            Runnable onStop) {
        this.worker = checkNotNull(worker, "worker must not be null");
        this.future = checkNotNull(future, "future must not be null");
        this.executor = checkNotNull(executor, "executor must not be null");
        this.onStop = checkNotNull(onStop, "onStop must not be null");
    }

    /**
     * terminates the task and joins it; calling it again has no effect
     *
     * @throws IllegalStateException if the task failed, or if the calling thread
     *                               was interrupted while waiting
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        worker.terminate();
        try {
            future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("micro-cluster maintenance failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while stopping micro-cluster maintenance", e);
        } finally {
            executor.shutdown();
            onStop.run();
        }
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    @Override
    public void close() {
        stop();
    }
}
