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

/**
 * Package containing the data models of the trending core.
 * <p>
 * Telemetry arrives as {@link com.arpnetworking.trending.model.MnemonicTable}
 * instances holding time ordered {@link com.arpnetworking.trending.model.Sample}
 * readings whose values are tagged as numeric or categorical. Conditions are
 * compiled into {@link com.arpnetworking.trending.model.Interval} lists and the
 * filtered values are condensed into
 * {@link com.arpnetworking.trending.model.TrendSummary} records.
 * </p>
 *
 * @author Inscope Metrics
 */
@ParametersAreNonnullByDefault
package com.arpnetworking.trending.model;

import javax.annotation.ParametersAreNonnullByDefault;
