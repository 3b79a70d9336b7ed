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

import static com.amazon.denstream.TestUtils.EPSILON;
import static com.amazon.denstream.TestUtils.point;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.denstream.point.Distances;
import com.amazon.denstream.point.VectorPoint;

public class ExemplarTest {

    @Test
    public void testRecompute() {
        Exemplar<VectorPoint> exemplar = Exemplar.initialize(point("r", 0, 0));
        exemplar.addPoint(point("a", 2, 0));
        exemplar.addPoint(point("b", 4, 0));
        assertEquals(2, exemplar.getWeight());

        exemplar.recompute();
        assertEquals(3.0, exemplar.getRepresentative().get(0), EPSILON);
        assertEquals(1.0, exemplar.distance(point("a", 2, 0), Distances::L2distance), EPSILON);

        // without assigned points the representative stays where it is
        exemplar.reset();
        assertEquals(0, exemplar.getWeight());
        exemplar.recompute();
        assertEquals(3.0, exemplar.getRepresentative().get(0), EPSILON);
    }

    @Test
    public void testAbsorb() {
        Exemplar<VectorPoint> first = Exemplar.initialize(point("r1", 0, 0));
        first.addPoint(point("a", 0, 0));
        Exemplar<VectorPoint> second = Exemplar.initialize(point("r2", 10, 0));
        second.addPoint(point("b", 10, 0));
        assertEquals(10.0, first.distance(second, Distances::L2distance), EPSILON);

        first.absorb(second);
        assertEquals(2, first.getWeight());
        assertEquals(0, second.getWeight());
        assertEquals(5.0, first.getRepresentative().get(0), EPSILON);
        assertEquals(5.0, first.distance(point("c", 5, 5), Distances::L2distance), EPSILON);
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> Exemplar.initialize(null));
        Exemplar<VectorPoint> exemplar = Exemplar.initialize(point("r", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> exemplar.distance(point("a", 1, 1), (x, y) -> -1.0));
        assertThrows(UnsupportedOperationException.class, () -> exemplar.getAssignedPoints().add(point("a", 0, 0)));
    }
}
