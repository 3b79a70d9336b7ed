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

package com.amazon.denstream.macrocluster;

import static com.amazon.denstream.CommonUtils.checkArgument;
import static com.amazon.denstream.CommonUtils.checkDistance;
import static com.amazon.denstream.CommonUtils.checkNotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.amazon.denstream.microcluster.MicroCluster;
import com.amazon.denstream.point.IIdentifiable;
import com.amazon.denstream.point.ITransformable;

/**
 * DBSCAN over micro-clusters, see https://en.wikipedia.org/wiki/DBSCAN. The
 * unit of clustering is a micro-cluster and not a raw point: two micro-clusters
 * are directly connected if the similarity of their centers is at most eps.
 * Density is measured by weight, as in the offline phase of DenStream: a
 * micro-cluster is a core unit if its own weight plus the weights of the
 * micro-clusters directly connected to it is at least minPoints. Without decay
 * the weight of a micro-cluster is the number of its members, so a unit
 * holding two points is core for minPoints = 2 while a lone point is not.
 * Clusters are the transitive closure of the connections starting from core
 * units; a non-core unit joins the first cluster that reaches it and units that
 * no core unit reaches are noise, which is not part of the output.
 *
 * The computation only reads the micro-clusters it is given.
 *
 * @param <T> type of the stream element
 */
@Log4j2
@Getter
public class DensityReachability<T extends ITransformable<T> & IIdentifiable> {

    private static final int NOISE = -1;

    private final double eps;

    private final int minPoints;

    private final BiFunction<T, T, Double> similarity;

    public DensityReachability(double eps, int minPoints, BiFunction<T, T, Double> similarity) {
        checkArgument(eps >= 0, "eps must be greater than or equal to 0");
        checkArgument(minPoints >= 0, "minPoints must be greater than or equal to 0");
        this.eps = eps;
        this.minPoints = minPoints;
        this.similarity = checkNotNull(similarity, "similarity must not be null");
    }

    /**
     * @param microClusters the units, all non-empty and of the same kind
     * @param time          the time at which centers are evaluated
     * @return the flattened members of each macro-cluster, in order of discovery
     */
    public List<List<T>> cluster(List<MicroCluster<T>> microClusters, long time) {
        checkNotNull(microClusters, "microClusters must not be null");
        int[] labels = label(microClusters, time);
        int numberOfClusters = 0;
        for (int label : labels) {
            numberOfClusters = Math.max(numberOfClusters, label + 1);
        }

        List<List<T>> answer = new ArrayList<>(numberOfClusters);
        for (int i = 0; i < numberOfClusters; i++) {
            answer.add(new ArrayList<>());
        }
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != NOISE) {
                answer.get(labels[i]).addAll(microClusters.get(i).getPoints());
            }
        }
        log.debug("{} macro-clusters from {} micro-clusters", numberOfClusters, microClusters.size());
        return answer;
    }

    /**
     * assigns a cluster index to every unit
     *
     * @param microClusters the units
     * @param time          the time at which centers are evaluated
     * @return for each unit the index of its cluster, or -1 for noise
     */
    public int[] label(List<MicroCluster<T>> microClusters, long time) {
        int size = microClusters.size();
        List<T> centers = new ArrayList<>(size);
        double[] density = new double[size];
        for (int i = 0; i < size; i++) {
            centers.add(microClusters.get(i).center(time));
            density[i] = microClusters.get(i).weight(time);
        }

        List<List<Integer>> neighbors = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            neighbors.add(new ArrayList<>());
        }
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (checkDistance(similarity.apply(centers.get(i), centers.get(j))) <= eps) {
                    neighbors.get(i).add(j);
                    neighbors.get(j).add(i);
                }
            }
        }
        double[] neighborhoodWeight = new double[size];
        for (int i = 0; i < size; i++) {
            neighborhoodWeight[i] = density[i];
            for (int j : neighbors.get(i)) {
                neighborhoodWeight[i] += density[j];
            }
        }

        int[] labels = new int[size];
        Arrays.fill(labels, NOISE);
        int clusterIndex = 0;
        for (int i = 0; i < size; i++) {
            if (labels[i] != NOISE || neighborhoodWeight[i] < minPoints) {
                continue;
            }
            labels[i] = clusterIndex;
            ArrayDeque<Integer> toExplore = new ArrayDeque<>(neighbors.get(i));
            while (!toExplore.isEmpty()) {
                int q = toExplore.poll();
                if (labels[q] != NOISE) {
                    continue;
                }
                labels[q] = clusterIndex;
                if (neighborhoodWeight[q] >= minPoints) {
                    for (int next : neighbors.get(q)) {
                        if (labels[next] == NOISE) {
                            toExplore.add(next);
                        }
                    }
                }
            }
            ++clusterIndex;
        }
        return labels;
    }

    public DensityReachability<T> withEps(double newEps) {
        return new DensityReachability<>(newEps, minPoints, similarity);
    }

    public DensityReachability<T> withMinPoints(int newMinPoints) {
        return new DensityReachability<>(eps, newMinPoints, similarity);
    }
}
