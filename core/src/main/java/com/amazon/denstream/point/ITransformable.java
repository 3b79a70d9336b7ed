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

/**
 * The arithmetic a stream element has to support so that micro-clusters can
 * compute (weighted) centroids over it, together with the arrival time used by
 * time decayed summaries. Implementations must not mutate the receiver.
 *
 * @param <T> the element type
 */
public interface ITransformable<T> {

    /**
     * @param other another element of the same type
     * @return a new element that is the coordinate-wise sum
     */
    T add(T other);

    /**
     * @param factor a multiplier
     * @return a new element with every coordinate multiplied by factor
     */
    T scale(double factor);

    /**
     * @return the arrival time of the element; elements that are never used in
     *         a temporal summary can return 0
     */
    long getTimeStamp();
}
