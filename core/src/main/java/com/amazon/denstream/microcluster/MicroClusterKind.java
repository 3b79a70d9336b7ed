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

/**
 * The variants of a micro-cluster summary.
 */
public enum MicroClusterKind {

    /**
     * every member counts with weight 1 forever; center and radius do not depend
     * on the query time
     */
    TIMELESS,
    /**
     * members lose weight exponentially (base 2) with the time elapsed since
     * their arrival; center, radius and weight are functions of the query time
     */
    TEMPORAL;
}
