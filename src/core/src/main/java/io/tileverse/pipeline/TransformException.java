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
package io.tileverse.pipeline;

import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Wraps a failure raised by a caller supplied transform function, recording where it happened.
 * <p>
 * For the chunked strategy the location is the index of the frame being transformed; for the line-parallel strategy
 * it is the spatial position of the time series.
 */
public class TransformException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final Integer frameIndex;
    private final int[] position;

    private TransformException(String message, Throwable cause, Integer frameIndex, int[] position) {
        super(message, cause);
        this.frameIndex = frameIndex;
        this.position = position;
    }

    /**
     * @param frameIndex the index of the frame whose transform failed
     * @param cause the failure raised by the transform
     * @return a new exception
     */
    public static TransformException atFrame(int frameIndex, Throwable cause) {
        return new TransformException(
                "Transform failed on frame " + frameIndex + ": " + cause.getMessage(), cause, frameIndex, null);
    }

    /**
     * @param y the row of the time series whose transform failed
     * @param x the column of the time series whose transform failed
     * @param cause the failure raised by the transform
     * @return a new exception
     */
    public static TransformException atPosition(int y, int x, Throwable cause) {
        return new TransformException(
                "Transform failed on line (" + y + ", " + x + "): " + cause.getMessage(),
                cause,
                null,
                new int[] {y, x});
    }

    public OptionalInt getFrameIndex() {
        return frameIndex == null ? OptionalInt.empty() : OptionalInt.of(frameIndex);
    }

    public Optional<int[]> getPosition() {
        return Optional.ofNullable(position).map(int[]::clone);
    }

    @Override
    public String toString() {
        return super.toString() + (position == null ? "" : " at " + Arrays.toString(position));
    }
}
