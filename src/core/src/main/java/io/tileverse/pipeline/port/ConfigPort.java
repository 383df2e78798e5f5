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
package io.tileverse.pipeline.port;

/**
 * Read-only {@link Port} on the process-wide settings entry {@value #TAG}.
 * <p>
 * The settings are attributes of the entry, such as {@code MEMORY} and {@code CPU}; the entry holds no array.
 */
public class ConfigPort extends Port {

    /** The tag of the settings entry. */
    public static final String TAG = "config";

    public ConfigPort() {
        super(TAG);
    }
}
