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
 * This interface is used by engine classes to configure parameters by name.
 * This is intended primarily for settings that a user may want to change while
 * the stream is running.
 */
public interface IDynamicConfig {

    <T> void setConfig(String name, T value, Class<T> clazz);

    default void setConfig(String name, int value) {
        setConfig(name, value, Integer.class);
    }

    default void setConfig(String name, double value) {
        setConfig(name, value, Double.class);
    }

    <T> T getConfig(String name, Class<T> clazz);

    default Object getConfig(String name) {
        return getConfig(name, Object.class);
    }
}
