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

package com.amazon.denstream.config;

/**
 * Options for the summaries maintained by the engine
 */
public enum ClusteringMode {

    /**
     * every point keeps its mass forever; the micro-clusters only change through
     * insertions and removals, and all of them take part in macro-clustering
     */
    TIMELESS,
    /**
     * the mass of a point decays exponentially with the time since its arrival,
     * as in DenStream. Micro-clusters whose weight reaches the potential-core
     * threshold take part in macro-clustering, the others are outliers, and
     * micro-clusters that decay below the minimum weight are pruned.
     */
    TEMPORAL;
}
