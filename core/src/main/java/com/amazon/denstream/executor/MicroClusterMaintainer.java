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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiFunction;
import java.util.function.Function;

import lombok.extern.log4j.Log4j2;

import com.amazon.denstream.microcluster.MicroCluster;
import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;

/**
 * Owns the live set of micro-clusters and the policy that absorbs stream points
 * into it. Every mutation (a merge including its dequeue, a removal, a prune)
 * holds the write lock for its whole duration, and readers run under the read
 * lock, so a reader never observes a point that is inserted but not yet
 * validated against the radius bound, nor a micro-cluster that is created but
 * not yet part of the set.
 *
 * The current time is the largest arrival time merged so far. Pruning is only
 * meaningful for decaying summaries and is disabled when the minimum weight is
 * not positive. When due, it runs before the next point is placed: members
 * whose own mass is below the minimum weight are forgotten, then micro-clusters
 * that are empty or lighter than the minimum weight are dropped.
 *
 * @param <T> type of the stream element
 */
@Log4j2
public class MicroClusterMaintainer<T extends ITransformable<T> & IIdentifiable> {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ArrayList<MicroCluster<T>> microClusters = new ArrayList<>();

    private final Function<T, MicroCluster<T>> clusterInitializer;

    private final double maxRadius;

    private final double minimumWeight;

    private final long pruneInterval;

    private long currentTime;

    private long lastPruneTime;

    private boolean timeInitialized;

    private long totalMerges;

    /**
     * @param clusterInitializer creates a singleton micro-cluster of the desired
     *                           kind
     * @param maxRadius          bound on the radius of a micro-cluster after an
     *                           insertion
     * @param minimumWeight      micro-clusters whose weight falls below this value
     *                           are pruned; a non-positive value disables pruning
     * @param pruneInterval      the minimum advance of the current time between
     *                           two prunes
     */
    public MicroClusterMaintainer(Function<T, MicroCluster<T>> clusterInitializer, double maxRadius,
            double minimumWeight, long pruneInterval) {
        this.clusterInitializer = checkNotNull(clusterInitializer, "clusterInitializer must not be null");
        checkArgument(maxRadius >= 0, "maxRadius must be greater than or equal to 0");
        checkArgument(pruneInterval > 0, "pruneInterval must be greater than 0");
        this.maxRadius = maxRadius;
        this.minimumWeight = minimumWeight;
        this.pruneInterval = pruneInterval;
    }

    /**
     * dequeues at most one point and merges it, as one critical section; a point
     * that leaves the queue is always merged
     *
     * @param queue the source of points
     * @return true if a point was merged, false if the queue was empty
     */
    public boolean mergeNext(StreamIngestionQueue<T> queue) {
        lock.writeLock().lock();
        try {
            Optional<T> point = queue.tryDequeue();
            if (!point.isPresent()) {
                return false;
            }
            mergeInternal(point.get());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void merge(T point) {
        checkNotNull(point, "point must not be null");
        lock.writeLock().lock();
        try {
            mergeInternal(point);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * removes every point with the given identity and drops the micro-clusters
     * that become empty; a micro-cluster whose radius exceeds the bound after
     * losing members is dissolved and its remaining members are placed again
     *
     * @param id identity of the point
     * @return the number of points removed
     */
    public int remove(String id) {
        checkNotNull(id, "id must not be null");
        lock.writeLock().lock();
        try {
            int removed = 0;
            List<MicroCluster<T>> dissolved = new ArrayList<>();
            Iterator<MicroCluster<T>> iterator = microClusters.iterator();
            while (iterator.hasNext()) {
                MicroCluster<T> microCluster = iterator.next();
                int count = microCluster.remove(id);
                removed += count;
                if (microCluster.isEmpty()) {
                    iterator.remove();
                } else if (count > 0 && microCluster.radius(currentTime) > maxRadius) {
                    iterator.remove();
                    dissolved.add(microCluster);
                }
            }
            for (MicroCluster<T> microCluster : dissolved) {
                for (T point : microCluster.getPoints()) {
                    place(point);
                }
            }
            if (!dissolved.isEmpty()) {
                log.debug("re-placed the members of {} micro-clusters after removing {}", dissolved.size(), id);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * prunes decayed micro-clusters at the current time regardless of the prune
     * interval
     *
     * @return number of micro-clusters removed
     */
    public int prune() {
        lock.writeLock().lock();
        try {
            return pruneInternal();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            microClusters.clear();
            timeInitialized = false;
            currentTime = 0;
            lastPruneTime = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * runs a computation over the live set under the read lock; the list handed
     * to the reader is an unmodifiable view that is only valid during the call
     *
     * @param reader a function of the micro-clusters and the current time, it
     *               must not mutate any micro-cluster
     * @param <R>    result type
     * @return the result of the reader
     */
    public <R> R read(BiFunction<List<MicroCluster<T>>, Long, R> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(Collections.unmodifiableList(microClusters), currentTime);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copies of the live micro-clusters, in enumeration order
     */
    public List<MicroCluster<T>> snapshot() {
        return read((list, time) -> {
            ArrayList<MicroCluster<T>> copies = new ArrayList<>(list.size());
            for (MicroCluster<T> microCluster : list) {
                copies.add(microCluster.copy());
            }
            return Collections.unmodifiableList(copies);
        });
    }

    public int size() {
        return read((list, time) -> list.size());
    }

    public long getCurrentTime() {
        return read((list, time) -> time);
    }

    public long getTotalMerges() {
        return read((list, time) -> totalMerges);
    }

    public double getMaxRadius() {
        return maxRadius;
    }

    public long getPruneInterval() {
        return pruneInterval;
    }

    private void mergeInternal(T point) {
        advanceTime(point.getTimeStamp());
        // decayed state goes before the point is placed, so that it cannot absorb
        // the point
        if (minimumWeight > 0 && currentTime - lastPruneTime >= pruneInterval) {
            pruneInternal();
        }
        place(point);
        ++totalMerges;
    }

    private void place(T point) {
        // the first closest micro-cluster in enumeration order wins ties
        MicroCluster<T> closest = null;
        double minDist = Double.MAX_VALUE;
        for (MicroCluster<T> microCluster : microClusters) {
            double dist = microCluster.distance(point, currentTime);
            if (closest == null || dist < minDist) {
                closest = microCluster;
                minDist = dist;
            }
        }

        if (closest == null || !tryInsert(point, closest)) {
            microClusters.add(clusterInitializer.apply(point));
        }
    }

    // keeps the insertion only if the radius bound still holds
    private boolean tryInsert(T point, MicroCluster<T> microCluster) {
        microCluster.insert(point);
        if (microCluster.radius(currentTime) <= maxRadius) {
            return true;
        }
        microCluster.undoInsert(point);
        return false;
    }

    // members whose own mass fell below the minimum weight are forgotten before
    // whole micro-clusters are judged; a micro-cluster that no longer fits the
    // radius bound after losing members is dissolved and its members placed again
    private int pruneInternal() {
        lastPruneTime = currentTime;
        if (minimumWeight <= 0) {
            return 0;
        }
        int expired = 0;
        List<MicroCluster<T>> dissolved = new ArrayList<>();
        Iterator<MicroCluster<T>> iterator = microClusters.iterator();
        while (iterator.hasNext()) {
            MicroCluster<T> microCluster = iterator.next();
            int count = microCluster.expire(currentTime, minimumWeight);
            expired += count;
            if (count > 0 && !microCluster.isEmpty() && microCluster.radius(currentTime) > maxRadius) {
                iterator.remove();
                dissolved.add(microCluster);
            }
        }
        int before = microClusters.size();
        microClusters.removeIf(e -> e.isEmpty() || e.weight(currentTime) < minimumWeight);
        int pruned = before - microClusters.size();
        for (MicroCluster<T> microCluster : dissolved) {
            for (T point : microCluster.getPoints()) {
                place(point);
            }
        }
        if (pruned > 0 || expired > 0) {
            log.debug("pruned {} micro-clusters and {} members at time {}, {} micro-clusters remain", pruned, expired,
                    currentTime, microClusters.size());
        }
        return pruned;
    }

    private void advanceTime(long timeStamp) {
        if (!timeInitialized) {
            currentTime = timeStamp;
            lastPruneTime = timeStamp;
            timeInitialized = true;
        } else if (timeStamp > currentTime) {
            currentTime = timeStamp;
        }
    }
}
