/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.pipeline.exec;

/**
 * A transform applied to the time series at one spatial position by the {@link LineProcessingCapsule}.
 * <p>
 * Implementations are invoked concurrently from several worker threads and must not share mutable state.
 */
@FunctionalInterface
public interface LineFunction {

    /**
     * @param signal a private copy of the values at one position across all frames
     * @return the transformed signal; every position must yield the same length
     * @throws Exception any failure, reported to the caller as a {@link io.tileverse.pipeline.TransformException}
     */
    double[] apply(double[] signal) throws Exception;
}
