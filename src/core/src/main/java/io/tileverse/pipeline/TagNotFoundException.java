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
 * Thrown when reading, or partially overwriting, a tag that holds no array.
 */
public class TagNotFoundException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String tag;

    /**
     * @param tag the missing tag
     * @param storeIdentifier the store that was queried
     */
    public TagNotFoundException(String tag, String storeIdentifier) {
        super("No array stored under tag '" + tag + "' in " + storeIdentifier);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
