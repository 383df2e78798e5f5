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

import io.tileverse.pipeline.PipelineConfigurationException;
import io.tileverse.pipeline.port.OutputPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A module importing data into the store: it owns output ports only.
 * <p>
 * A reading module may be given the directory it reads from; when it has none, the pipeline assigns its default
 * input directory when the module is added.
 */
public abstract class ReadingModule extends PipelineModule {

    private Path inputDirectory;

    protected ReadingModule(String name) {
        this(name, null);
    }

    /**
     * @param name the module name
     * @param inputDirectory an existing directory, or {@code null} for the pipeline default
     * @throws PipelineConfigurationException if {@code inputDirectory} is not an existing directory
     */
    protected ReadingModule(String name, Path inputDirectory) {
        super(name);
        this.inputDirectory = checkDirectory(name, inputDirectory);
    }

    public Optional<Path> getInputDirectory() {
        return Optional.ofNullable(inputDirectory);
    }

    /**
     * Assigns {@code directory} unless this module already has one.
     *
     * @param directory the pipeline default
     */
    public void setDefaultInputDirectory(Path directory) {
        if (inputDirectory == null) {
            inputDirectory = directory;
        }
    }

    /**
     * Adds an active output port.
     *
     * @param tag the tag written by the port
     * @return the new port
     */
    protected final OutputPort addOutputPort(String tag) {
        return addOutputPort(tag, true);
    }

    protected final OutputPort addOutputPort(String tag, boolean active) {
        return registerOutputPort(tag, active);
    }

    public Optional<OutputPort> getOutputPort(String tag) {
        return outputPort(tag);
    }

    static Path checkDirectory(String module, Path directory) {
        if (directory != null && !Files.isDirectory(directory)) {
            throw new PipelineConfigurationException(
                    "Directory of module " + module + " does not exist: " + directory);
        }
        return directory;
    }
}
