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

/**
 * Thrown when array shapes are incompatible with the requested write.
 * <p>
 * Typical causes are a transform that changes the frame shape while writing in place chunk by chunk, a line
 * transform that changes the signal length while input and output share a tag, or a partial write whose data does
 * not match the stored layout.
 */
public class ShapeConflictException extends PipelineException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message the detail message
     */
    public ShapeConflictException(String message) {
        super(message);
    }
}
