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
import static com.amazon.denstream.CommonUtils.checkNotNull;
import static com.amazon.denstream.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

import lombok.Getter;

import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;

/**
 * A compact stand-in for a group of nearby stream points. The summary keeps its
 * members (their order is irrelevant) and a reference to the similarity
 * function that is shared with the rest of the engine. The derived quantities
 * are computed from the members on every call and are never cached, since in
 * the temporal variant they change with the query time.
 *
 * The radius is the distance from the center to the members (the maximum for
 * the timeless variant, a weighted root mean square for the temporal variant)
 * and never a member to member distance; the insertion test of the maintenance
 * engine depends on this.
 *
 * Instances are not thread safe; the maintenance engine guards them.
 *
 * @param <T> type of the stream element
 */
public abstract class MicroCluster<T extends ITransformable<T> & IIdentifiable> {

    protected final ArrayList<T> points;

    @Getter
    protected final BiFunction<T, T, Double> similarity;

    protected MicroCluster(Collection<? extends T> points, BiFunction<T, T, Double> similarity) {
        checkNotNull(points, "points must not be null");
        this.similarity = checkNotNull(similarity, "similarity must not be null");
        this.points = new ArrayList<>(points);
    }

    public abstract MicroClusterKind getKind();

    /**
     * @param time query time, ignored by the timeless variant
     * @return the centroid of the members
     */
    public abstract T center(long time);

    /**
     * @param time query time, ignored by the timeless variant
     * @return the spread of the members around {@link #center(long)}
     */
    public abstract double radius(long time);

    /**
     * @param time query time, ignored by the timeless variant
     * @return the (decayed) mass of the members
     */
    public abstract double weight(long time);

    /**
     * @param other a micro-cluster of the same kind
     * @return a new micro-cluster of the same kind whose membership is the union
     */
    public abstract MicroCluster<T> merge(MicroCluster<T> other);

    /**
     * @return an independent micro-cluster with the same members
     */
    public abstract MicroCluster<T> copy();

    public void insert(T point) {
        points.add(checkNotNull(point, "point must not be null"));
    }

    /**
     * reverts the most recent {@link #insert}; removal by identity is not used
     * since other members may share the identifier
     */
    public void undoInsert(T point) {
        checkState(!points.isEmpty() && points.get(points.size() - 1) == point, "not the most recent insertion");
        points.remove(points.size() - 1);
    }

    /**
     * drops the members whose own decayed mass at the given time is below the
     * floor; summaries without decay keep all members
     *
     * @param time  the current time
     * @param floor the smallest mass a member may have
     * @return the number of members dropped
     */
    public int expire(long time, double floor) {
        return 0;
    }

    /**
     * removes all members with the given identity
     *
     * @param id identifier
     * @return the number of members removed
     */
    public int remove(String id) {
        int before = points.size();
        points.removeIf(p -> p.getId().equals(id));
        return before - points.size();
    }

    public boolean contains(String id) {
        for (T point : points) {
            if (point.getId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public List<T> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public boolean isPotentialCore(long time, double threshold) {
        return weight(time) >= threshold;
    }

    // distance of a point from the center, has to be non-negative
    public double distance(T point, long time) {
        return checkDistance(similarity.apply(center(time), point));
    }

    // distance between the centers of two micro-clusters
    public double distance(MicroCluster<T> other, long time) {
        return checkDistance(similarity.apply(center(time), other.center(time)));
    }

    protected void checkNonEmpty() {
        checkState(!points.isEmpty(), "micro-cluster has no members");
    }

    protected ArrayList<T> union(MicroCluster<T> other) {
        checkArgument(other.getKind() == getKind(), "cannot merge micro-clusters of different kinds");
        ArrayList<T> union = new ArrayList<>(points.size() + other.size());
        union.addAll(points);
        union.addAll(other.points);
        return union;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(size=" + points.size() + ")";
    }
}
