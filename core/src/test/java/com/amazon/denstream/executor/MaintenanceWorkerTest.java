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

import static com.amazon.denstream.TestUtils.AWAIT_MILLIS;
import static com.amazon.denstream.TestUtils.point;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.denstream.microcluster.TimelessMicroCluster;
import com.amazon.denstream.point.Distances;
import com.amazon.denstream.point.VectorPoint;

public class MaintenanceWorkerTest {

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testMergesUntilTerminated() throws Exception {
        StreamIngestionQueue<VectorPoint> queue = new StreamIngestionQueue<>();
        MicroClusterMaintainer<VectorPoint> maintainer = new MicroClusterMaintainer<>(
                p -> TimelessMicroCluster.initialize(p, Distances::L2distance), 15, 0, 1);
        MaintenanceWorker<VectorPoint> worker = new MaintenanceWorker<>(queue, maintainer, 1000);
        Future<?> future = executor.submit(worker);

        for (int i = 0; i < 100; i++) {
            queue.enqueue(point("p" + i, i, 0));
        }
        long deadline = System.currentTimeMillis() + AWAIT_MILLIS;
        while (maintainer.getTotalMerges() < 100 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertFalse(future.isDone());

        worker.terminate();
        future.get(AWAIT_MILLIS, TimeUnit.MILLISECONDS);
        assertTrue(worker.isTerminated());
        assertEquals(100, worker.getMergedPoints());
        assertEquals(100, maintainer.getTotalMerges());
        assertTrue(queue.isEmpty());
    }

    @SuppressWarnings("unchecked")
    @Test
    public void testFailureEndsLoop() {
        StreamIngestionQueue<VectorPoint> queue = new StreamIngestionQueue<>();
        MicroClusterMaintainer<VectorPoint> maintainer = mock(MicroClusterMaintainer.class);
        RuntimeException failure = new IllegalArgumentException("distance must be non-negative");
        when(maintainer.mergeNext(any())).thenThrow(failure);

        MaintenanceWorker<VectorPoint> worker = new MaintenanceWorker<>(queue, maintainer, 1000);
        Future<?> future = executor.submit(worker);
        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> future.get(AWAIT_MILLIS, TimeUnit.MILLISECONDS));
        assertSame(failure, exception.getCause());
    }

    @Test
    public void testInvalidArguments() {
        StreamIngestionQueue<VectorPoint> queue = new StreamIngestionQueue<>();
        MicroClusterMaintainer<VectorPoint> maintainer = new MicroClusterMaintainer<>(
                p -> TimelessMicroCluster.initialize(p, Distances::L2distance), 15, 0, 1);
        assertThrows(NullPointerException.class, () -> new MaintenanceWorker<>(null, maintainer, 1000));
        assertThrows(NullPointerException.class, () -> new MaintenanceWorker<>(queue, null, 1000));
        assertThrows(IllegalArgumentException.class, () -> new MaintenanceWorker<>(queue, maintainer, 0));
    }
}
