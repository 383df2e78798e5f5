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
 * Thrown when a {@link io.tileverse.pipeline.port.Port} is used before it has been bound to a store.
 */
public class UnboundPortException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String tag;

    /**
     * @param tag the tag of the unbound port
     */
    public UnboundPortException(String tag) {
        super("Port '" + tag + "' is not bound to an array store");
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
