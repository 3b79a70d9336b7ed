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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.denstream.point.VectorPoint;

@ExtendWith(MockitoExtension.class)
public class MaintenanceHandleTest {

    @Mock
    private MaintenanceWorker<VectorPoint> worker;
    @Mock
    private Future<Object> future;
    @Mock
    private ExecutorService executor;
    @Mock
    private Runnable onStop;
    private MaintenanceHandle handle;

    @BeforeEach
    public void setUp() {
        handle = new MaintenanceHandle(worker, future, executor, onStop);
    }

    @Test
    public void testStop() throws Exception {
        assertFalse(handle.isStopped());
        handle.stop();
        assertTrue(handle.isStopped());

        InOrder order = inOrder(worker, future, executor, onStop);
        order.verify(worker).terminate();
        order.verify(future).get();
        order.verify(executor).shutdown();
        order.verify(onStop).run();
    }

    @Test
    public void testStopIsIdempotent() throws Exception {
        handle.stop();
        handle.stop();
        handle.close();

        verify(worker, times(1)).terminate();
        verify(future, times(1)).get();
        verify(executor, times(1)).shutdown();
        verify(onStop, times(1)).run();
    }

    @Test
    public void testFailureIsReported() throws Exception {
        RuntimeException failure = new RuntimeException("merge failed");
        when(future.get()).thenThrow(new ExecutionException(failure));

        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> handle.stop());
        assertSame(failure, exception.getCause());
        verify(executor).shutdown();
        verify(onStop).run();

        // reported once
        handle.stop();
        verify(future, times(1)).get();
    }

    @Test
    public void testInterruptedStop() throws Exception {
        when(future.get()).thenThrow(new InterruptedException());
        try {
            assertThrows(IllegalStateException.class, () -> handle.stop());
            assertTrue(Thread.currentThread().isInterrupted());
            verify(onStop).run();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testCloseStops() throws Exception {
        try (MaintenanceHandle closeable = new MaintenanceHandle(worker, future, executor, onStop)) {
            assertFalse(closeable.isStopped());
        }
        verify(worker).terminate();
        verify(onStop).run();
        assertFalse(handle.isStopped());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> new MaintenanceHandle(null, future, executor, onStop));
        assertThrows(NullPointerException.class, () -> new MaintenanceHandle(worker, null, executor, onStop));
        assertThrows(NullPointerException.class, () -> new MaintenanceHandle(worker, future, null, onStop));
        assertThrows(NullPointerException.class, () -> new MaintenanceHandle(worker, future, executor, null));
    }
}
