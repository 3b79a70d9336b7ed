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

import static com.amazon.denstream.TestUtils.labelOf;
import static com.amazon.denstream.TestUtils.point;
import static com.amazon.denstream.TestUtils.toPoints;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.denstream.point.Distances;
import com.amazon.denstream.point.VectorPoint;
import com.amazon.denstream.testutils.GaussianBlobTestData;
import com.amazon.denstream.testutils.LabeledStreamData;

public class ShrinkageRefinerTest {

    private static List<VectorPoint> groupWithOutlier() {
        List<VectorPoint> points = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            points.add(point("a" + i, i * 0.1f, 0));
        }
        points.add(point("outlier", 1000, 0));
        return points;
    }

    @Test
    public void testEmptyInput() {
        assertTrue(ShrinkageRefiner.refine(new ArrayList<VectorPoint>(), 3, 10, Distances::L2distance).isEmpty());
    }

    @Test
    public void testSeparatedGroups() {
        List<VectorPoint> points = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            points.add(point("left" + i, i, 0));
            points.add(point("right" + i, 500 + i, 0));
        }
        List<List<VectorPoint>> groups = ShrinkageRefiner.refine(points, 2, 10, Distances::L2distance);
        assertEquals(2, groups.size());
        for (List<VectorPoint> group : groups) {
            assertEquals(10, group.size());
            String side = group.get(0).getId().substring(0, 4);
            assertTrue(group.stream().allMatch(p -> p.getId().startsWith(side)));
        }
    }

    @Test
    public void testSmallExemplarIsShrunk() {
        List<List<VectorPoint>> groups = new ShrinkageRefiner<VectorPoint>(2, 10, Distances::L2distance)
                .cluster(groupWithOutlier());
        assertEquals(1, groups.size());
        assertEquals(21, groups.get(0).size());

        // without a support threshold the outlier keeps its own group
        groups = new ShrinkageRefiner<VectorPoint>(2, 10, Distances::L2distance, 0).cluster(groupWithOutlier());
        assertEquals(2, groups.size());
        assertEquals(20, groups.get(0).size());
        assertEquals("outlier", groups.get(1).get(0).getId());
    }

    @Test
    public void testDuplicatePoints() {
        List<VectorPoint> points = new ArrayList<>(Collections.nCopies(5, point("same", 3, 3)));
        List<List<VectorPoint>> groups = ShrinkageRefiner.refine(points, 3, 10, Distances::L2distance);
        assertEquals(1, groups.size());
        assertEquals(5, groups.get(0).size());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 3, 10 })
    public void testBudgetCapsGroups(int maxClusters) {
        List<VectorPoint> points = new ArrayList<>();
        points.add(point("a", 0, 0));
        points.add(point("b", 100, 0));
        points.add(point("c", 0, 100));
        List<List<VectorPoint>> groups = ShrinkageRefiner.refine(points, maxClusters, 5, Distances::L2distance);
        assertEquals(Math.min(maxClusters, points.size()), groups.size());
        assertEquals(3, groups.stream().mapToInt(List::size).sum());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 20 })
    public void testBlobsArePartitioned(int maxIterations) {
        LabeledStreamData streamData = new GaussianBlobTestData().generateTestData(600, 0, 11);
        List<VectorPoint> points = toPoints(streamData);
        List<List<VectorPoint>> groups = ShrinkageRefiner.refine(points, 3, maxIterations, Distances::L2distance);

        assertEquals(3, groups.size());
        Set<String> seen = new HashSet<>();
        Set<Integer> labels = new HashSet<>();
        for (List<VectorPoint> group : groups) {
            assertFalse(group.isEmpty());
            int label = labelOf(group.get(0), streamData);
            for (VectorPoint point : group) {
                assertEquals(label, labelOf(point, streamData));
                assertTrue(seen.add(point.getId()));
            }
            labels.add(label);
        }
        assertEquals(points.size(), seen.size());
        assertEquals(3, labels.size());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ShrinkageRefiner<VectorPoint>(0, 1, Distances::L2distance));
        assertThrows(IllegalArgumentException.class, () -> new ShrinkageRefiner<VectorPoint>(1, 0, Distances::L2distance));
        assertThrows(IllegalArgumentException.class,
                () -> new ShrinkageRefiner<VectorPoint>(1, 1, Distances::L2distance, 1.5));
        assertThrows(NullPointerException.class, () -> new ShrinkageRefiner<VectorPoint>(1, 1, null));
        assertThrows(NullPointerException.class,
                () -> new ShrinkageRefiner<VectorPoint>(1, 1, Distances::L2distance).cluster(null));
    }
}
