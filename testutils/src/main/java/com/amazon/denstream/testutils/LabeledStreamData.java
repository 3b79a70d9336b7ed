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

package com.amazon.denstream.testutils;

/**
 * rows of a synthetic stream together with the index of the blob that produced
 * each row and its arrival time
 */
public class LabeledStreamData {

    public final double[][] data;

    public final int[] labels;

    public final long[] timeStamps;

    public LabeledStreamData(double[][] data, int[] labels, long[] timeStamps) {
        this.data = data;
        this.labels = labels;
        this.timeStamps = timeStamps;
    }

    public int size() {
        return data.length;
    }
}
