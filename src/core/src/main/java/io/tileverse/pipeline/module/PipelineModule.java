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

import static java.util.Objects.requireNonNull;

import io.tileverse.pipeline.exec.ExecutionConfig;
import io.tileverse.pipeline.exec.LoggingProgressListener;
import io.tileverse.pipeline.exec.ProgressListener;
import io.tileverse.pipeline.port.ConfigPort;
import io.tileverse.pipeline.port.InputPort;
import io.tileverse.pipeline.port.OutputPort;
import io.tileverse.pipeline.port.Port;
import io.tileverse.pipeline.store.ArrayStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * A named pipeline stage owning a set of {@link Port ports}.
 * <p>
 * The set of module kinds is closed: a module is either a {@link ReadingModule} (outputs only), a
 * {@link WritingModule} (inputs only) or a {@link ProcessingModule} (both). Every module owns one {@link ConfigPort}.
 * <p>
 * All ports of a module are bound to the same store by {@link #bindStore(ArrayStore)}; ports added afterwards are
 * bound when they are added. Binding to another store is rejected.
 */
@Slf4j
public abstract class PipelineModule {

    private final String name;

    private final ConfigPort configPort = new ConfigPort();

    private final Map<String, InputPort> inputPorts = new LinkedHashMap<>();

    private final Map<String, OutputPort> outputPorts = new LinkedHashMap<>();

    // replaced output ports, still bound so that writes through them stay no-ops
    private final List<OutputPort> retiredPorts = new ArrayList<>();

    private ArrayStore store;

    private ProgressListener progressListener = new LoggingProgressListener();

    PipelineModule(String name) {
        requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("module name can't be blank");
        }
        this.name = name;
    }

    /**
     * @return the unique name of this module within a pipeline
     */
    public final String getName() {
        return name;
    }

    /**
     * Binds every port of this module, including the config port, to {@code store}.
     *
     * @param store the store connection
     * @throws NullPointerException if {@code store} is null
     * @throws IllegalStateException if this module is already bound to another store
     */
    public final synchronized void bindStore(ArrayStore store) {
        requireNonNull(store, "store");
        if (this.store != null && this.store != store) {
            throw new IllegalStateException("Module " + name + " is already bound to " + this.store.getStoreIdentifier());
        }
        this.store = store;
        configPort.bind(store);
        inputPorts.values().forEach(p -> p.bind(store));
        outputPorts.values().forEach(p -> p.bind(store));
        retiredPorts.forEach(p -> p.bind(store));
    }

    public final synchronized Optional<ArrayStore> getStore() {
        return Optional.ofNullable(store);
    }

    /**
     * Executes this module. The store is open and all ports are bound.
     *
     * @throws IOException If an I/O error occurs
     */
    public abstract void run() throws IOException;

    public Set<String> getInputTags() {
        return Collections.unmodifiableSet(inputPorts.keySet());
    }

    public Set<String> getOutputTags() {
        return Collections.unmodifiableSet(outputPorts.keySet());
    }

    /**
     * @return the tags of the output ports that are active
     */
    public List<String> getActiveOutputTags() {
        List<String> tags = new ArrayList<>();
        outputPorts.values().stream().filter(OutputPort::isActive).forEach(p -> tags.add(p.getTag()));
        return tags;
    }

    public ProgressListener getProgressListener() {
        return progressListener;
    }

    public void setProgressListener(ProgressListener progressListener) {
        this.progressListener = requireNonNull(progressListener, "progressListener");
    }

    protected final ConfigPort getConfigPort() {
        return configPort;
    }

    /**
     * Reads the execution settings from the config port.
     *
     * @return the current settings
     * @throws IOException If an I/O error occurs
     */
    protected final ExecutionConfig getExecutionConfig() throws IOException {
        return ExecutionConfig.fromConfigPort(configPort);
    }

    synchronized InputPort registerInputPort(String tag) {
        InputPort port = new InputPort(tag);
        if (store != null) {
            port.bind(store);
        }
        inputPorts.put(tag, port);
        return port;
    }

    /**
     * Adds an output port. A port already registered under the same tag is replaced and deactivated; it is still
     * bound with the other ports, so writes through a stale reference are ignored.
     */
    synchronized OutputPort registerOutputPort(String tag, boolean active) {
        OutputPort port = new OutputPort(tag, active);
        if (store != null) {
            port.bind(store);
        }
        OutputPort previous = outputPorts.put(tag, port);
        if (previous != null) {
            previous.deactivate();
            retiredPorts.add(previous);
            log.warn("Tag '{}' of module {} is already used by another output port, replacing it", tag, name);
        }
        return port;
    }

    synchronized Optional<InputPort> inputPort(String tag) {
        return Optional.ofNullable(inputPorts.get(tag));
    }

    synchronized Optional<OutputPort> outputPort(String tag) {
        return Optional.ofNullable(outputPorts.get(tag));
    }

    @Override
    public String toString() {
        return "%s[%s]".formatted(getClass().getSimpleName(), name);
    }
}
