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
package io.tileverse.pipeline.module;

import io.tileverse.pipeline.port.InputPort;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A module exporting data out of the store: it owns input ports only and never changes the store content.
 * <p>
 * A writing module may be given the directory it writes to; when it has none, the pipeline assigns its default output
 * directory when the module is added.
 */
public abstract class WritingModule extends PipelineModule {

    private Path outputDirectory;

    protected WritingModule(String name) {
        this(name, null);
    }

    /**
     * @param name the module name
     * @param outputDirectory an existing directory, or {@code null} for the pipeline default
     * @throws io.tileverse.pipeline.PipelineConfigurationException if {@code outputDirectory} is not an existing
     *     directory
     */
    protected WritingModule(String name, Path outputDirectory) {
        super(name);
        this.outputDirectory = ReadingModule.checkDirectory(name, outputDirectory);
    }

    public Optional<Path> getOutputDirectory() {
        return Optional.ofNullable(outputDirectory);
    }

    /**
     * Assigns {@code directory} unless this module already has one.
     *
     * @param directory the pipeline default
     */
    public void setDefaultOutputDirectory(Path directory) {
        if (outputDirectory == null) {
            outputDirectory = directory;
        }
    }

    protected final InputPort addInputPort(String tag) {
        return registerInputPort(tag);
    }

    public Optional<InputPort> getInputPort(String tag) {
        return inputPort(tag);
    }
}
