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
import static com.amazon.denstream.CommonUtils.checkState;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A non-blocking FIFO buffer between the callers adding points and the
 * maintenance loop. Points offered by one thread are dequeued in the order they
 * were offered.
 *
 * @param <T> type of the stream element
 */
public class StreamIngestionQueue<T> {

    private final ConcurrentLinkedQueue<T> queue = new ConcurrentLinkedQueue<>();

    private volatile boolean discarded = false;

    public void enqueue(T point) {
        checkNotNull(point, "point must not be null");
        checkState(!discarded, "the ingestion queue has been torn down");
        queue.offer(point);
    }

    public void enqueueAll(Collection<? extends T> points) {
        checkNotNull(points, "points must not be null");
        for (T point : points) {
            enqueue(point);
        }
    }

    public Optional<T> tryDequeue() {
        return Optional.ofNullable(queue.poll());
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public void clear() {
        queue.clear();
    }

    /**
     * tears the queue down; pending points are dropped and further enqueues are
     * rejected
     */
    public void discard() {
        discarded = true;
        queue.clear();
    }

    public boolean isDiscarded() {
        return discarded;
    }
}
