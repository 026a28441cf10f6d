/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.trending.model;

/**
 * The declared type of the values in a mnemonic.
 *
 * @author Inscope Metrics
 */
public enum ValueType {

    /**
     * Continuous engineering values (voltages, temperatures, ratios).
     */
    NUMERIC,

    /**
     * Discrete status or position labels (e.g. {@code OFF}, {@code DETECTOR_READY}).
     */
    CATEGORICAL
}
