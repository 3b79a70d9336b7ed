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

import static com.amazon.denstream.CommonUtils.checkArgument;
import static com.amazon.denstream.CommonUtils.checkNotNull;

import java.util.concurrent.locks.LockSupport;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;

/**
 * The background loop that absorbs queued points into the micro-cluster set.
 * The termination flag is checked between merges, so a point that has been
 * dequeued always completes its merge.
 *
 * @param <T> type of the stream element
 */
@Log4j2
public class MaintenanceWorker<T extends ITransformable<T> & IIdentifiable> implements Runnable {

    private final StreamIngestionQueue<T> queue;

    private final MicroClusterMaintainer<T> maintainer;

    private final long idleWaitNanos;

    private volatile boolean terminated = false;

    @Getter
    private volatile long mergedPoints = 0;

    public MaintenanceWorker(StreamIngestionQueue<T> queue, MicroClusterMaintainer<T> maintainer,
            long idleWaitNanos) {
        this.queue = checkNotNull(queue, "queue must not be null");
        this.maintainer = checkNotNull(maintainer, "maintainer must not be null");
        checkArgument(idleWaitNanos > 0, "idleWaitNanos must be greater than 0");
        this.idleWaitNanos = idleWaitNanos;
    }

    @Override
    public void run() {
        log.info("micro-cluster maintenance started");
        try {
            while (!terminated) {
                if (maintainer.mergeNext(queue)) {
                    ++mergedPoints;
                } else {
                    LockSupport.parkNanos(idleWaitNanos);
                }
            }
        } catch (RuntimeException e) {
            log.error("micro-cluster maintenance failed after {} points", mergedPoints, e);
            throw e;
        }
        log.info("micro-cluster maintenance stopped after {} points", mergedPoints);
    }

    public void terminate() {
        terminated = true;
    }

    public boolean isTerminated() {
        return terminated;
    }
}
