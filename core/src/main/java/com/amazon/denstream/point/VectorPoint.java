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
import static com.amazon.denstream.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A feature vector arriving on a stream, for example the longitude and
 * latitude of a moving entity. Instances are immutable; the arithmetic returns
 * new vectors that keep the identity of the left operand.
 */
@Getter
public class VectorPoint implements ITransformable<VectorPoint>, IIdentifiable {

    private final String id;

    private final long timeStamp;

    @Getter(AccessLevel.NONE)
    private final float[] coordinates;

    public VectorPoint(String id, float[] coordinates, long timeStamp) {
        checkNotNull(id, "id must not be null");
        checkNotNull(coordinates, "coordinates must not be null");
        checkArgument(coordinates.length > 0, "coordinates cannot be empty");
        this.id = id;
        // explicitly copied because the caller may reuse the array
        this.coordinates = Arrays.copyOf(coordinates, coordinates.length);
        this.timeStamp = timeStamp;
    }

    public VectorPoint(String id, float x, float y, long timeStamp) {
        this(id, new float[] { x, y }, timeStamp);
    }

    public static VectorPoint of(String id, double[] values, long timeStamp) {
        float[] coordinates = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            coordinates[i] = (float) values[i];
        }
        return new VectorPoint(id, coordinates, timeStamp);
    }

    public int getDimensions() {
        return coordinates.length;
    }

    public float get(int index) {
        return coordinates[index];
    }

    public float[] getCoordinates() {
        return Arrays.copyOf(coordinates, coordinates.length);
    }

    @Override
    public VectorPoint add(VectorPoint other) {
        checkArgument(other.coordinates.length == coordinates.length, "incorrect dimensions");
        float[] sum = new float[coordinates.length];
        for (int i = 0; i < coordinates.length; i++) {
            sum[i] = coordinates[i] + other.coordinates[i];
        }
        return new VectorPoint(id, sum, Math.max(timeStamp, other.timeStamp));
    }

    @Override
    public VectorPoint scale(double factor) {
        float[] scaled = new float[coordinates.length];
        for (int i = 0; i < coordinates.length; i++) {
            scaled[i] = (float) (coordinates[i] * factor);
        }
        return new VectorPoint(id, scaled, timeStamp);
    }

    @Override
    public String toString() {
        return "VectorPoint(id=" + id + ", coordinates=" + Arrays.toString(coordinates) + ", timeStamp=" + timeStamp
                + ")";
    }
}
