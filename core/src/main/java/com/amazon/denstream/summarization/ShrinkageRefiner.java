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

import static com.amazon.denstream.CommonUtils.checkArgument;
import static com.amazon.denstream.CommonUtils.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.amazon.denstream.point.ITransformable;

/**
 * Splits a group of points, typically one macro-cluster, into finer groups. The
 * refinement alternates between assigning every point to its nearest exemplar
 * and moving each exemplar to the centroid of its points, as in k-means; in
 * addition exemplars that end up with too little support are shrunk away by
 * handing their points to the nearest surviving exemplar. The number of
 * exemplars therefore only decreases and never exceeds the smaller of the
 * budget and the number of points.
 *
 * Seeds are chosen by the farthest point method starting from the first input
 * point, which yields well scattered exemplars and a deterministic result for a
 * fixed input order.
 *
 * @param <T> type of the point
 */
@Log4j2
@Getter
public class ShrinkageRefiner<T extends ITransformable<T>> {

    /**
     * an exemplar is shrunk if it holds fewer points than this fraction of the
     * average number of points per exemplar
     */
    public static final double DEFAULT_MIN_SUPPORT_FRACTION = 0.1;

    private final int maxClusters;

    private final int maxIterations;

    private final double minSupportFraction;

    private final BiFunction<T, T, Double> similarity;

    public ShrinkageRefiner(int maxClusters, int maxIterations, BiFunction<T, T, Double> similarity) {
        this(maxClusters, maxIterations, similarity, DEFAULT_MIN_SUPPORT_FRACTION);
    }

    public ShrinkageRefiner(int maxClusters, int maxIterations, BiFunction<T, T, Double> similarity,
            double minSupportFraction) {
        checkArgument(maxClusters > 0, "maxClusters must be greater than 0");
        checkArgument(maxIterations > 0, "maxIterations must be greater than 0");
        checkArgument(minSupportFraction >= 0 && minSupportFraction <= 1, "minSupportFraction has to be in [0,1]");
        this.maxClusters = maxClusters;
        this.maxIterations = maxIterations;
        this.minSupportFraction = minSupportFraction;
        this.similarity = checkNotNull(similarity, "similarity must not be null");
    }

    public static <T extends ITransformable<T>> List<List<T>> refine(List<T> points, int maxClusters,
            int maxIterations, BiFunction<T, T, Double> similarity) {
        return new ShrinkageRefiner<>(maxClusters, maxIterations, similarity).cluster(points);
    }

    /**
     * @param points the points to split
     * @return at most min(maxClusters, points.size()) non-empty groups
     */
    public List<List<T>> cluster(List<T> points) {
        checkNotNull(points, "points must not be null");
        if (points.isEmpty()) {
            return new ArrayList<>();
        }

        List<Exemplar<T>> exemplars = seed(points, min(maxClusters, points.size()));
        List<Exemplar<T>> assignment = new ArrayList<>(Collections.nCopies(points.size(), null));

        boolean stale = true;
        int iteration = 0;
        while (iteration < maxIterations) {
            ++iteration;
            int changes = assign(points, exemplars, assignment);
            stale = false;
            if (changes == 0) {
                break;
            }
            for (Exemplar<T> exemplar : exemplars) {
                exemplar.recompute();
            }
            exemplars.removeIf(e -> e.getWeight() == 0);
            shrink(exemplars, points.size());
            stale = true;
        }
        if (stale) {
            assign(points, exemplars, assignment);
        }

        List<List<T>> answer = new ArrayList<>();
        for (Exemplar<T> exemplar : exemplars) {
            if (exemplar.getWeight() > 0) {
                answer.add(new ArrayList<>(exemplar.getAssignedPoints()));
            }
        }
        log.debug("refined {} points into {} groups in {} iterations", points.size(), answer.size(), iteration);
        return answer;
    }

    // farthest point traversal, stops early if the remaining points coincide
    // with the chosen seeds
    List<Exemplar<T>> seed(List<T> points, int count) {
        ArrayList<Exemplar<T>> exemplars = new ArrayList<>();
        exemplars.add(Exemplar.initialize(points.get(0)));
        double[] minDist = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            minDist[i] = exemplars.get(0).distance(points.get(i), similarity);
        }
        while (exemplars.size() < count) {
            int farthest = 0;
            for (int i = 1; i < points.size(); i++) {
                if (minDist[i] > minDist[farthest]) {
                    farthest = i;
                }
            }
            if (minDist[farthest] == 0) {
                break;
            }
            Exemplar<T> next = Exemplar.initialize(points.get(farthest));
            exemplars.add(next);
            for (int i = 0; i < points.size(); i++) {
                minDist[i] = min(minDist[i], next.distance(points.get(i), similarity));
            }
        }
        return exemplars;
    }

    // nearest exemplar, first on ties; returns the number of changed assignments
    int assign(List<T> points, List<Exemplar<T>> exemplars, List<Exemplar<T>> assignment) {
        for (Exemplar<T> exemplar : exemplars) {
            exemplar.reset();
        }
        int changes = 0;
        for (int i = 0; i < points.size(); i++) {
            T point = points.get(i);
            Exemplar<T> nearest = null;
            double minDist = Double.MAX_VALUE;
            for (Exemplar<T> exemplar : exemplars) {
                double dist = exemplar.distance(point, similarity);
                if (nearest == null || dist < minDist) {
                    nearest = exemplar;
                    minDist = dist;
                }
            }
            nearest.addPoint(point);
            if (assignment.get(i) != nearest) {
                assignment.set(i, nearest);
                ++changes;
            }
        }
        return changes;
    }

    // smallest first; the last exemplar standing is never shrunk
    void shrink(List<Exemplar<T>> exemplars, int numberOfPoints) {
        if (exemplars.size() < 2) {
            return;
        }
        int minSupport = max(1, (int) Math.ceil(minSupportFraction * numberOfPoints / exemplars.size()));
        List<Exemplar<T>> candidates = new ArrayList<>(exemplars);
        candidates.sort(Comparator.comparingInt(Exemplar::getWeight));
        for (Exemplar<T> candidate : candidates) {
            if (exemplars.size() < 2 || candidate.getWeight() >= minSupport) {
                break;
            }
            Exemplar<T> nearest = null;
            double minDist = Double.MAX_VALUE;
            for (Exemplar<T> other : exemplars) {
                if (other != candidate) {
                    double dist = candidate.distance(other, similarity);
                    if (nearest == null || dist < minDist) {
                        nearest = other;
                        minDist = dist;
                    }
                }
            }
            nearest.absorb(candidate);
            exemplars.remove(candidate);
        }
    }
}
