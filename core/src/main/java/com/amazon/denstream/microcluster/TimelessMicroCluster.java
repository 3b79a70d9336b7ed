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

import static com.amazon.denstream.CommonUtils.checkDistance;
import static java.lang.Math.max;

import java.util.Collection;
import java.util.Collections;
import java.util.function.BiFunction;

import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;

/**
 * a micro-cluster where every member has unit weight; the center is the
 * arithmetic mean and the radius is the largest distance of a member from the
 * center
 */
public class TimelessMicroCluster<T extends ITransformable<T> & IIdentifiable> extends MicroCluster<T> {

    public TimelessMicroCluster(Collection<? extends T> points, BiFunction<T, T, Double> similarity) {
        super(points, similarity);
    }

    public static <T extends ITransformable<T> & IIdentifiable> TimelessMicroCluster<T> initialize(T point,
            BiFunction<T, T, Double> similarity) {
        return new TimelessMicroCluster<>(Collections.singletonList(point), similarity);
    }

    @Override
    public MicroClusterKind getKind() {
        return MicroClusterKind.TIMELESS;
    }

    @Override
    public T center(long time) {
        checkNonEmpty();
        T sum = points.get(0);
        for (int i = 1; i < points.size(); i++) {
            sum = sum.add(points.get(i));
        }
        return sum.scale(1.0 / points.size());
    }

    @Override
    public double radius(long time) {
        checkNonEmpty();
        T center = center(time);
        double radius = 0;
        for (T point : points) {
            radius = max(radius, checkDistance(similarity.apply(center, point)));
        }
        return radius;
    }

    @Override
    public double weight(long time) {
        return points.size();
    }

    @Override
    public TimelessMicroCluster<T> merge(MicroCluster<T> other) {
        return new TimelessMicroCluster<>(union(other), similarity);
    }

    @Override
    public TimelessMicroCluster<T> copy() {
        return new TimelessMicroCluster<>(points, similarity);
    }
}
