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

import static com.amazon.denstream.TestUtils.EPSILON;
import static com.amazon.denstream.TestUtils.point;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.denstream.point.Distances;
import com.amazon.denstream.point.VectorPoint;

public class TimelessMicroClusterTest {

    private TimelessMicroCluster<VectorPoint> microCluster;

    @BeforeEach
    public void setUp() {
        microCluster = new TimelessMicroCluster<>(Arrays.asList(point("a", 0, 0), point("b", 2, 0)),
                Distances::L2distance);
    }

    @Test
    public void testSummaries() {
        assertEquals(MicroClusterKind.TIMELESS, microCluster.getKind());
        VectorPoint center = microCluster.center(0);
        assertEquals(1.0, center.get(0), EPSILON);
        assertEquals(0.0, center.get(1), EPSILON);
        assertEquals(1.0, microCluster.radius(0), EPSILON);
        assertEquals(2.0, microCluster.weight(0), EPSILON);

        // no decay, the query time is irrelevant
        assertEquals(2.0, microCluster.weight(1_000_000), EPSILON);
        assertEquals(1.0, microCluster.radius(1_000_000), EPSILON);
    }

    @Test
    public void testInsertMovesCenter() {
        microCluster.insert(point("c", 10, 0));
        assertEquals(4.0, microCluster.center(0).get(0), EPSILON);
        assertEquals(6.0, microCluster.radius(0), EPSILON);
        assertEquals(5.0, microCluster.distance(point("d", 4, 5), 0), EPSILON);
    }

    @Test
    public void testUndoInsert() {
        VectorPoint far = point("b", 100, 0);
        microCluster.insert(far);
        microCluster.undoInsert(far);
        assertEquals(2, microCluster.size());
        assertEquals(1.0, microCluster.radius(0), EPSILON);

        // only the last insertion can be reverted, and only by reference
        assertThrows(IllegalStateException.class, () -> microCluster.undoInsert(point("b", 2, 0)));
    }

    @Test
    public void testMembersNeverExpire() {
        assertEquals(0, microCluster.expire(1_000_000, 0.25));
        assertEquals(2, microCluster.size());
    }

    @Test
    public void testRemove() {
        microCluster.insert(point("a", 1, 1));
        assertTrue(microCluster.contains("a"));
        assertEquals(2, microCluster.remove("a"));
        assertFalse(microCluster.contains("a"));
        assertEquals(0, microCluster.remove("a"));
        assertEquals(1, microCluster.size());
        assertEquals(1, microCluster.remove("b"));
        assertTrue(microCluster.isEmpty());
        assertThrows(IllegalStateException.class, () -> microCluster.center(0));
        assertThrows(IllegalStateException.class, () -> microCluster.radius(0));
    }

    @Test
    public void testMergeAndCopy() {
        TimelessMicroCluster<VectorPoint> other = TimelessMicroCluster.initialize(point("c", 4, 3),
                Distances::L2distance);
        TimelessMicroCluster<VectorPoint> merged = microCluster.merge(other);
        assertEquals(3, merged.size());
        assertEquals(2, microCluster.size());
        assertEquals(1, other.size());
        assertThat(merged.getPoints(), contains(microCluster.getPoints().get(0), microCluster.getPoints().get(1),
                other.getPoints().get(0)));

        TimelessMicroCluster<VectorPoint> copy = microCluster.copy();
        assertNotSame(microCluster, copy);
        copy.insert(point("z", 50, 50));
        assertEquals(2, microCluster.size());
        assertEquals(3, copy.size());

        TemporalMicroCluster<VectorPoint> temporal = TemporalMicroCluster.initialize(point("t", 0, 0),
                Distances::L2distance, 0.1);
        assertThrows(IllegalArgumentException.class, () -> microCluster.merge(temporal));
    }

    @Test
    public void testInvalidDistance() {
        TimelessMicroCluster<VectorPoint> broken = new TimelessMicroCluster<>(
                Collections.singletonList(point("a", 0, 0)), (x, y) -> -1.0);
        assertThrows(IllegalArgumentException.class, () -> broken.distance(point("b", 1, 1), 0));
        TimelessMicroCluster<VectorPoint> nullDistance = new TimelessMicroCluster<>(
                Collections.singletonList(point("a", 0, 0)), (x, y) -> null);
        assertThrows(NullPointerException.class, () -> nullDistance.radius(0));
        assertThrows(NullPointerException.class, () -> microCluster.insert(null));
    }

    @Test
    public void testPointsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> microCluster.getPoints().add(point("x", 0, 0)));
    }
}
