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

package com.amazon.denstream;

import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.denstream.config.ClusteringMode;
import com.amazon.denstream.point.Distances;
import com.amazon.denstream.point.VectorPoint;
import com.amazon.denstream.testutils.GaussianBlobTestData;
import com.amazon.denstream.testutils.LabeledStreamData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DenStreamBenchmark {

    public final static int DATA_SIZE = 5_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "TIMELESS", "TEMPORAL" })
        ClusteringMode mode;

        @Param({ "5", "15" })
        double maxRadius;

        VectorPoint[] points;
        DenStream<VectorPoint> engine;

        @Setup(Level.Trial)
        public void setUpData() {
            LabeledStreamData streamData = new GaussianBlobTestData(
                    new double[][] { { 0, 0 }, { 100, 0 }, { 0, 100 }, { 100, 100 } }, 10.0)
                    .generateTestData(DATA_SIZE, 0, 99);
            points = new VectorPoint[DATA_SIZE];
            for (int i = 0; i < DATA_SIZE; i++) {
                points[i] = VectorPoint.of("p" + i, streamData.data[i], streamData.timeStamps[i]);
            }
        }

        @Setup(Level.Invocation)
        public void setUpEngine() {
            engine = DenStream.<VectorPoint>builder().similarity(Distances::L2distance).mode(mode)
                    .maxRadius(maxRadius).minPoints(1).build();
        }
    }

    private DenStream<VectorPoint> engine;

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public DenStream<VectorPoint> addAndDrain(BenchmarkState state) {
        engine = state.engine;
        for (VectorPoint point : state.points) {
            engine.add(point);
        }
        engine.drain();
        return engine;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public DenStream<VectorPoint> addAndCluster(BenchmarkState state, Blackhole blackhole) {
        engine = state.engine;
        List<List<VectorPoint>> clusters = null;
        for (int i = 0; i < state.points.length; i++) {
            engine.add(state.points[i]);
            if (i % 100 == 99) {
                engine.drain();
                clusters = engine.cluster();
            }
        }
        blackhole.consume(clusters);
        return engine;
    }

    @Benchmark
    public List<List<VectorPoint>> drainClusterAndRefine(BenchmarkState state, Blackhole blackhole) {
        engine = state.engine;
        for (VectorPoint point : state.points) {
            engine.add(point);
        }
        engine.drain();
        List<List<VectorPoint>> clusters = engine.cluster();
        blackhole.consume(clusters);
        return clusters.isEmpty() ? clusters : engine.refine(clusters.get(0), 8, 10);
    }
}
