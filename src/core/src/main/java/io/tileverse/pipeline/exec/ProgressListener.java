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
 * Receives progress notifications from long-running strategies. Implementations keep no engine state.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param current the number of completed steps
     * @param total the total number of steps
     * @param label a human-readable label of the running stage
     */
    void report(int current, int total, String label);

    /**
     * Called once when the stage has completed successfully.
     *
     * @param label the label of the completed stage
     */
    default void done(String label) {
        // no-op
    }

    static ProgressListener noop() {
        return (current, total, label) -> {};
    }
}
