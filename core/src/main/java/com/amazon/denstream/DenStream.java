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

import static com.amazon.denstream.CommonUtils.checkArgument;
import static com.amazon.denstream.CommonUtils.checkNotNull;
import static com.amazon.denstream.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import java.util.function.Function;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.amazon.denstream.config.ClusteringMode;
import com.amazon.denstream.config.Config;
import com.amazon.denstream.config.IDynamicConfig;
import com.amazon.denstream.executor.MaintenanceHandle;
import com.amazon.denstream.executor.MaintenanceWorker;
import com.amazon.denstream.executor.MicroClusterMaintainer;
import com.amazon.denstream.executor.StreamIngestionQueue;
import com.amazon.denstream.macrocluster.DensityReachability;
import com.amazon.denstream.microcluster.MicroCluster;
import com.amazon.denstream.microcluster.TemporalMicroCluster;
import com.amazon.denstream.microcluster.TimelessMicroCluster;
import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;
import com.amazon.denstream.summarization.ShrinkageRefiner;

/**
 * An online density based clustering engine for unbounded streams of points,
 * after DenStream (Cao et al., "Density-Based Clustering over an Evolving Data
 * Stream with Noise", SDM 2006).
 *
 * Points added to the engine are buffered in a non-blocking queue and absorbed
 * into a set of micro-clusters, either by a background task started with
 * {@link #start()} or synchronously by {@link #drain()}. A point joins the
 * micro-cluster with the closest center if the radius of that micro-cluster
 * stays within {@code maxRadius}, and starts a new micro-cluster otherwise. In
 * {@link ClusteringMode#TEMPORAL} mode the mass of a point decays as
 * 2^(-decayRate * age), micro-clusters are potential-core micro-clusters while
 * their weight is at least {@code potentialCoreWeight}, and micro-clusters whose
 * weight falls below {@code minimumWeight} are pruned.
 *
 * {@link #cluster()} derives the macro-clusters on demand by density
 * reachability over the micro-cluster centers, and {@link #refine} splits a
 * group of points further by shrinkage refinement.
 *
 * The micro-cluster set is shared between the maintenance task and the callers;
 * merges, removals and prunes exclude readers, so a call to {@link #cluster()}
 * observes the result of a whole number of merges. An engine is terminated by
 * the handle returned from {@link #start()}; afterwards its state can still be
 * read but it no longer accepts points.
 *
 * @param <T> type of the stream element
 */
@Log4j2
public class DenStream<T extends ITransformable<T> & IIdentifiable> implements IDynamicConfig {

    /**
     * Default bound on the radius of a micro-cluster.
     */
    public static final double DEFAULT_MAX_RADIUS = 15;

    /**
     * Default connectivity threshold between micro-cluster centers.
     */
    public static final double DEFAULT_EPS = 250;

    /**
     * Default number of other connected micro-clusters of a core unit.
     */
    public static final int DEFAULT_MIN_POINTS = 2;

    /**
     * Default decay rate; the mass of a point halves every 1/decayRate time
     * units.
     */
    public static final double DEFAULT_DECAY_RATE = 0.01;

    /**
     * Default weight separating potential-core micro-clusters from outliers.
     */
    public static final double DEFAULT_POTENTIAL_CORE_WEIGHT = 2.0;

    /**
     * Default weight below which a temporal micro-cluster is pruned.
     */
    public static final double DEFAULT_MINIMUM_WEIGHT = 0.25;

    /**
     * Default time the maintenance task parks when the queue is empty.
     */
    public static final long DEFAULT_IDLE_WAIT_NANOS = 100_000L;

    public static final ClusteringMode DEFAULT_MODE = ClusteringMode.TIMELESS;

    @Getter
    private final ClusteringMode mode;

    @Getter
    private final double maxRadius;

    @Getter
    private final double decayRate;

    @Getter
    private final double potentialCoreWeight;

    @Getter
    private final double minimumWeight;

    @Getter
    private final long pruneInterval;

    @Getter
    private final long idleWaitNanos;

    @Getter
    private final BiFunction<T, T, Double> similarity;

    private final StreamIngestionQueue<T> queue;

    private final MicroClusterMaintainer<T> maintainer;

    private volatile DensityReachability<T> densityReachability;

    private MaintenanceHandle maintenanceHandle;

    private volatile boolean maintenanceActive = false;

    private volatile boolean terminated = false;

    public DenStream(Builder<T> builder) {
        checkNotNull(builder.similarity, "similarity must not be null");
        checkNotNull(builder.mode, "mode must not be null");
        checkArgument(builder.maxRadius >= 0, "maxRadius must be greater than or equal to 0");
        checkArgument(builder.eps >= 0, "eps must be greater than or equal to 0");
        checkArgument(builder.minPoints >= 0, "minPoints must be greater than or equal to 0");
        checkArgument(builder.decayRate >= 0, "decayRate must be greater than or equal to 0");
        checkArgument(builder.potentialCoreWeight > 0, "potentialCoreWeight must be greater than 0");
        checkArgument(builder.minimumWeight >= 0, "minimumWeight must be greater than or equal to 0");
        checkArgument(builder.minimumWeight <= builder.potentialCoreWeight,
                "minimumWeight cannot exceed potentialCoreWeight");
        checkArgument(builder.idleWaitNanos > 0, "idleWaitNanos must be greater than 0");
        builder.pruneInterval.ifPresent(n -> checkArgument(n > 0, "pruneInterval must be greater than 0"));

        mode = builder.mode;
        maxRadius = builder.maxRadius;
        decayRate = builder.decayRate;
        potentialCoreWeight = builder.potentialCoreWeight;
        minimumWeight = builder.minimumWeight;
        idleWaitNanos = builder.idleWaitNanos;
        similarity = builder.similarity;
        pruneInterval = builder.pruneInterval.orElse(defaultPruneInterval(decayRate, potentialCoreWeight));

        Function<T, MicroCluster<T>> clusterInitializer;
        if (mode == ClusteringMode.TEMPORAL) {
            clusterInitializer = p -> TemporalMicroCluster.initialize(p, similarity, decayRate);
        } else {
            clusterInitializer = p -> TimelessMicroCluster.initialize(p, similarity);
        }
        double pruneBelow = (mode == ClusteringMode.TEMPORAL) ? minimumWeight : 0;
        queue = new StreamIngestionQueue<>();
        maintainer = new MicroClusterMaintainer<>(clusterInitializer, maxRadius, pruneBelow, pruneInterval);
        densityReachability = new DensityReachability<>(builder.eps, builder.minPoints, similarity);
    }

    /**
     * the checking period of DenStream: the shortest time in which a
     * potential-core micro-cluster can decay into an outlier without receiving
     * points
     */
    static long defaultPruneInterval(double decayRate, double potentialCoreWeight) {
        if (decayRate <= 0 || potentialCoreWeight <= 1) {
            return 1;
        }
        double period = (1.0 / decayRate) * Math.log(potentialCoreWeight / (potentialCoreWeight - 1)) / Math.log(2);
        return Math.max(1, (long) Math.ceil(period));
    }

    public static <T extends ITransformable<T> & IIdentifiable> Builder<T> builder() {
        return new Builder<>();
    }

    public void add(T point) {
        checkState(!terminated, "the engine has been terminated");
        queue.enqueue(point);
    }

    public void add(Collection<? extends T> points) {
        checkState(!terminated, "the engine has been terminated");
        queue.enqueueAll(points);
    }

    /**
     * removes the point with the given identity from the micro-cluster holding
     * it; points still waiting in the queue are not affected
     *
     * @param id identity of the point
     * @return the number of points removed
     */
    public int remove(String id) {
        checkState(!terminated, "the engine has been terminated");
        return maintainer.remove(id);
    }

    /**
     * Launches the maintenance of the micro-clusters in a background thread.
     *
     * @return the handle that terminates the engine and joins the thread
     * @throws IllegalStateException if maintenance was started before or the
     *                               engine has been terminated
     */
    public synchronized MaintenanceHandle start() {
        checkState(!terminated && !queue.isDiscarded(), "the engine has been terminated");
        checkState(maintenanceHandle == null, "maintenance has already been started");

        MaintenanceWorker<T> worker = new MaintenanceWorker<>(queue, maintainer, idleWaitNanos);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "denstream-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        Future<?> future = executor.submit(worker);
        maintenanceActive = true;
        maintenanceHandle = new MaintenanceHandle(worker, future, executor, this::onMaintenanceStopped);
        return maintenanceHandle;
    }

    private void onMaintenanceStopped() {
        terminated = true;
        maintenanceActive = false;
        int dropped = queue.size();
        queue.discard();
        if (dropped > 0) {
            log.info("engine terminated with {} points left in the queue", dropped);
        }
    }

    /**
     * merges every queued point on the calling thread, under the same discipline
     * as the maintenance task (both can run at the same time)
     *
     * @return the number of points merged
     */
    public int drain() {
        checkState(!terminated, "the engine has been terminated");
        int merged = 0;
        while (maintainer.mergeNext(queue)) {
            ++merged;
        }
        return merged;
    }

    /**
     * drops all micro-clusters and all queued points
     */
    public void clear() {
        checkState(!terminated, "the engine has been terminated");
        queue.clear();
        maintainer.clear();
    }

    /**
     * @return the current macro-clusters, each given by the points of its
     *         micro-clusters; noise is omitted
     */
    public List<List<T>> cluster() {
        DensityReachability<T> macroClustering = densityReachability;
        return maintainer.read((list, time) -> macroClustering.cluster(units(list, time), time));
    }

    // outliers do not take part in macro-clustering
    private List<MicroCluster<T>> units(List<MicroCluster<T>> microClusters, long time) {
        if (mode == ClusteringMode.TIMELESS) {
            return microClusters;
        }
        List<MicroCluster<T>> answer = new ArrayList<>();
        for (MicroCluster<T> microCluster : microClusters) {
            if (microCluster.isPotentialCore(time, potentialCoreWeight)) {
                answer.add(microCluster);
            }
        }
        return answer;
    }

    /**
     * @return copies of the current micro-clusters
     */
    public List<MicroCluster<T>> getMicroClusters() {
        return maintainer.snapshot();
    }

    public List<MicroCluster<T>> getPotentialCoreMicroClusters() {
        return classified(true);
    }

    public List<MicroCluster<T>> getOutlierMicroClusters() {
        return classified(false);
    }

    private List<MicroCluster<T>> classified(boolean potentialCore) {
        checkState(mode == ClusteringMode.TEMPORAL, "classification is only defined in temporal mode");
        return maintainer.read((list, time) -> {
            List<MicroCluster<T>> answer = new ArrayList<>();
            for (MicroCluster<T> microCluster : list) {
                if (microCluster.isPotentialCore(time, potentialCoreWeight) == potentialCore) {
                    answer.add(microCluster.copy());
                }
            }
            return Collections.unmodifiableList(answer);
        });
    }

    /**
     * splits a group of points, for example one of the groups returned by
     * {@link #cluster()}, with the similarity function of the engine
     *
     * @param points           the points
     * @param subClusterBudget the maximum number of groups
     * @param iterationBudget  the maximum number of refinement rounds
     * @return at most min(subClusterBudget, points.size()) groups
     */
    public List<List<T>> refine(List<T> points, int subClusterBudget, int iterationBudget) {
        return new ShrinkageRefiner<T>(subClusterBudget, iterationBudget, similarity).cluster(points);
    }

    public long getCurrentTime() {
        return maintainer.getCurrentTime();
    }

    public int getPendingCount() {
        return queue.size();
    }

    public long getTotalMerges() {
        return maintainer.getTotalMerges();
    }

    public boolean isMaintenanceActive() {
        return maintenanceActive;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public double getEps() {
        return densityReachability.getEps();
    }

    public int getMinPoints() {
        return densityReachability.getMinPoints();
    }

    @Override
    public <V> void setConfig(String name, V value, Class<V> clazz) {
        checkNotNull(value, "value must not be null");
        if (Config.EPS.equals(name)) {
            checkArgument(Double.class.isAssignableFrom(clazz),
                    String.format("Setting '%s' must be a double value", name));
            synchronized (this) {
                densityReachability = densityReachability.withEps((Double) value);
            }
        } else if (Config.MIN_POINTS.equals(name)) {
            checkArgument(Integer.class.isAssignableFrom(clazz),
                    String.format("Setting '%s' must be an int value", name));
            synchronized (this) {
                densityReachability = densityReachability.withMinPoints((Integer) value);
            }
        } else {
            throw new IllegalArgumentException("Unsupported configuration setting: " + name);
        }
    }

    @Override
    public <V> V getConfig(String name, Class<V> clazz) {
        checkNotNull(clazz, "clazz must not be null");
        if (Config.EPS.equals(name)) {
            checkArgument(clazz.isAssignableFrom(Double.class),
                    String.format("Setting '%s' must be a double value", name));
            return clazz.cast(getEps());
        } else if (Config.MIN_POINTS.equals(name)) {
            checkArgument(clazz.isAssignableFrom(Integer.class),
                    String.format("Setting '%s' must be an int value", name));
            return clazz.cast(getMinPoints());
        } else {
            throw new IllegalArgumentException("Unsupported configuration setting: " + name);
        }
    }

    public static class Builder<T extends ITransformable<T> & IIdentifiable> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private ClusteringMode mode = DEFAULT_MODE;
        private double maxRadius = DEFAULT_MAX_RADIUS;
        private double eps = DEFAULT_EPS;
        private int minPoints = DEFAULT_MIN_POINTS;
        private double decayRate = DEFAULT_DECAY_RATE;
        private double potentialCoreWeight = DEFAULT_POTENTIAL_CORE_WEIGHT;
        private double minimumWeight = DEFAULT_MINIMUM_WEIGHT;
        private Optional<Long> pruneInterval = Optional.empty();
        private long idleWaitNanos = DEFAULT_IDLE_WAIT_NANOS;
        private BiFunction<T, T, Double> similarity;

        public Builder<T> mode(ClusteringMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder<T> maxRadius(double maxRadius) {
            this.maxRadius = maxRadius;
            return this;
        }

        public Builder<T> eps(double eps) {
            this.eps = eps;
            return this;
        }

        public Builder<T> minPoints(int minPoints) {
            this.minPoints = minPoints;
            return this;
        }

        public Builder<T> decayRate(double decayRate) {
            this.decayRate = decayRate;
            return this;
        }

        public Builder<T> potentialCoreWeight(double potentialCoreWeight) {
            this.potentialCoreWeight = potentialCoreWeight;
            return this;
        }

        public Builder<T> minimumWeight(double minimumWeight) {
            this.minimumWeight = minimumWeight;
            return this;
        }

        public Builder<T> pruneInterval(long pruneInterval) {
            this.pruneInterval = Optional.of(pruneInterval);
            return this;
        }

        public Builder<T> idleWaitNanos(long idleWaitNanos) {
            this.idleWaitNanos = idleWaitNanos;
            return this;
        }

        public Builder<T> similarity(BiFunction<T, T, Double> similarity) {
            this.similarity = similarity;
            return this;
        }

        public DenStream<T> build() {
            return new DenStream<>(this);
        }
    }
}
