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

package com.amazon.denstream.microcluster;

import static com.amazon.denstream.CommonUtils.checkArgument;
import static com.amazon.denstream.CommonUtils.checkDistance;
import static com.amazon.denstream.CommonUtils.decayWeight;

import java.util.Collection;
import java.util.Collections;
import java.util.function.BiFunction;

import lombok.Getter;

import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;

/**
 * A time decayed micro-cluster in the sense of DenStream. A member that arrived
 * at time t0 contributes 2^(-decayRate * (t - t0)) at time t. The weight is the
 * sum of the contributions, the center is the weighted mean and the radius is
 * the weighted root mean square distance of the members from the center.
 *
 * The center and radius do not change if all contributions are multiplied by
 * the same factor, so they are computed relative to the most recent member;
 * this keeps old micro-clusters from underflowing to a zero total.
 */
public class TemporalMicroCluster<T extends ITransformable<T> & IIdentifiable> extends MicroCluster<T> {

    @Getter
    private final double decayRate;

    public TemporalMicroCluster(Collection<? extends T> points, BiFunction<T, T, Double> similarity,
            double decayRate) {
        super(points, similarity);
        checkArgument(decayRate >= 0, "decayRate must be greater than or equal to 0");
        this.decayRate = decayRate;
    }

    public static <T extends ITransformable<T> & IIdentifiable> TemporalMicroCluster<T> initialize(T point,
            BiFunction<T, T, Double> similarity, double decayRate) {
        return new TemporalMicroCluster<>(Collections.singletonList(point), similarity, decayRate);
    }

    @Override
    public MicroClusterKind getKind() {
        return MicroClusterKind.TEMPORAL;
    }

    @Override
    public double weight(long time) {
        double weight = 0;
        for (T point : points) {
            weight += decayWeight(decayRate, time - point.getTimeStamp());
        }
        return weight;
    }

    @Override
    public T center(long time) {
        checkNonEmpty();
        double[] weights = relativeWeights();
        double total = 0;
        T sum = null;
        for (int i = 0; i < points.size(); i++) {
            T term = points.get(i).scale(weights[i]);
            sum = (sum == null) ? term : sum.add(term);
            total += weights[i];
        }
        return sum.scale(1.0 / total);
    }

    @Override
    public double radius(long time) {
        checkNonEmpty();
        double[] weights = relativeWeights();
        T center = center(time);
        double total = 0;
        double sumOfSquares = 0;
        for (int i = 0; i < points.size(); i++) {
            double dist = checkDistance(similarity.apply(center, points.get(i)));
            sumOfSquares += weights[i] * dist * dist;
            total += weights[i];
        }
        return Math.sqrt(sumOfSquares / total);
    }

    @Override
    public int expire(long time, double floor) {
        int before = points.size();
        points.removeIf(p -> decayWeight(decayRate, time - p.getTimeStamp()) < floor);
        return before - points.size();
    }

    public long getLastArrival() {
        long last = Long.MIN_VALUE;
        for (T point : points) {
            last = Math.max(last, point.getTimeStamp());
        }
        return last;
    }

    @Override
    public TemporalMicroCluster<T> merge(MicroCluster<T> other) {
        return new TemporalMicroCluster<>(union(other), similarity, decayRate);
    }

    @Override
    public TemporalMicroCluster<T> copy() {
        return new TemporalMicroCluster<>(points, similarity, decayRate);
    }

    // contributions scaled so that the most recent member has weight 1
    private double[] relativeWeights() {
        long last = getLastArrival();
        double[] weights = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            weights[i] = decayWeight(decayRate, last - points.get(i).getTimeStamp());
        }
        return weights;
    }
}
