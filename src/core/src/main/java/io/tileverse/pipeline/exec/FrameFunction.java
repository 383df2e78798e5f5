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

import io.tileverse.pipeline.array.NdArray;

/**
 * A transform applied to one frame at a time by the {@link ChunkScheduler}.
 * <p>
 * Implementations must not retain state across invocations. Extra arguments are captured by the implementation,
 * e.g. {@code frame -> subtract(frame, dark)}.
 */
@FunctionalInterface
public interface FrameFunction {

    /**
     * @param frame a copy of one frame, which the function may modify
     * @return the transformed frame, not necessarily of the input shape
     * @throws Exception any failure, reported to the caller as a {@link io.tileverse.pipeline.TransformException}
     */
    NdArray apply(NdArray frame) throws Exception;

    static FrameFunction identity() {
        return frame -> frame;
    }
}
