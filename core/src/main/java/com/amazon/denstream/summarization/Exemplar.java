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

package com.amazon.denstream.summarization;

import static com.amazon.denstream.CommonUtils.checkDistance;
import static com.amazon.denstream.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

import com.amazon.denstream.point.ITransformable;

/**
 * a single centroid representation of a group of points that keeps the points
 * assigned to it, used for iterative reassignment
 *
 * @param <T> type of the point
 */
public class Exemplar<T extends ITransformable<T>> {

    T representative;
    ArrayList<T> assignedPoints;

    Exemplar(T representative) {
        this.representative = checkNotNull(representative, "representative must not be null");
        this.assignedPoints = new ArrayList<>();
    }

    public static <T extends ITransformable<T>> Exemplar<T> initialize(T representative) {
        return new Exemplar<>(representative);
    }

    public void addPoint(T point) {
        assignedPoints.add(point);
    }

    // the following sets up reassignment of the representative based on the
    // points assigned to it
    public void reset() {
        assignedPoints = new ArrayList<>();
    }

    public int getWeight() {
        return assignedPoints.size();
    }

    public T getRepresentative() {
        return representative;
    }

    public List<T> getAssignedPoints() {
        return Collections.unmodifiableList(assignedPoints);
    }

    /**
     * moves the representative to the centroid of the assigned points; an
     * exemplar without points keeps its representative
     */
    public void recompute() {
        if (assignedPoints.isEmpty()) {
            return;
        }
        T sum = assignedPoints.get(0);
        for (int i = 1; i < assignedPoints.size(); i++) {
            sum = sum.add(assignedPoints.get(i));
        }
        representative = sum.scale(1.0 / assignedPoints.size());
    }

    // takes over the points of another exemplar
    public void absorb(Exemplar<T> other) {
        assignedPoints.addAll(other.assignedPoints);
        other.assignedPoints = new ArrayList<>();
        recompute();
    }

    public double distance(T point, BiFunction<T, T, Double> distance) {
        return checkDistance(distance.apply(representative, point));
    }

    public double distance(Exemplar<T> other, BiFunction<T, T, Double> distance) {
        return checkDistance(distance.apply(representative, other.representative));
    }
}
