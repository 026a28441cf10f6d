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
 * Package containing the correlation of actuator position reports with the
 * continuous position sensor feedback.
 * <p>
 * Each reported position is validated against its nominal sensor ratio with a
 * tolerance that starts strict and widens only as far as needed to find a
 * settled reading inside the window in which the position was valid.
 * </p>
 *
 * @author Inscope Metrics
 */
@ParametersAreNonnullByDefault
package com.arpnetworking.trending.correlation;

import javax.annotation.ParametersAreNonnullByDefault;
