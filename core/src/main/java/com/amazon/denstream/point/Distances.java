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

package com.amazon.denstream.point;

import static com.amazon.denstream.CommonUtils.checkArgument;
import static java.lang.Math.max;

/**
 * Similarity functions over {@link VectorPoint}, usable as
 * {@code BiFunction<VectorPoint, VectorPoint, Double>} through method
 * references.
 */
public class Distances {

    /**
     * mean radius of the earth in kilometers
     */
    public static final double EARTH_RADIUS = 6371.0;

    private Distances() {
    }

    public static Double L1distance(VectorPoint a, VectorPoint b) {
        checkArgument(a.getDimensions() == b.getDimensions(), "incorrect dimensions");
        double dist = 0;
        for (int i = 0; i < a.getDimensions(); i++) {
            dist += Math.abs(a.get(i) - b.get(i));
        }
        return dist;
    }

    public static Double L2distance(VectorPoint a, VectorPoint b) {
        checkArgument(a.getDimensions() == b.getDimensions(), "incorrect dimensions");
        double dist = 0;
        for (int i = 0; i < a.getDimensions(); i++) {
            double t = Math.abs(a.get(i) - b.get(i));
            dist += t * t;
        }
        return Math.sqrt(dist);
    }

    public static Double LInfinitydistance(VectorPoint a, VectorPoint b) {
        checkArgument(a.getDimensions() == b.getDimensions(), "incorrect dimensions");
        double dist = 0;
        for (int i = 0; i < a.getDimensions(); i++) {
            dist = max(Math.abs(a.get(i) - b.get(i)), dist);
        }
        return dist;
    }

    /**
     * great circle distance in kilometers; the first coordinate is the longitude
     * and the second the latitude, both in degrees
     */
    public static Double haversine(VectorPoint a, VectorPoint b) {
        checkArgument(a.getDimensions() >= 2 && b.getDimensions() >= 2, "need longitude and latitude");
        double lat1 = Math.toRadians(a.get(1));
        double lat2 = Math.toRadians(b.get(1));
        double deltaLat = lat2 - lat1;
        double deltaLon = Math.toRadians(b.get(0) - a.get(0));
        double h = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        // rounding can push h slightly above 1 for antipodal points
        return 2 * EARTH_RADIUS * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }
}
