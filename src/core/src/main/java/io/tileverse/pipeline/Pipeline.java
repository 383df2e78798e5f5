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

import static java.util.Objects.requireNonNull;

import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.exec.ExecutionConfig;
import io.tileverse.pipeline.exec.ProgressListener;
import io.tileverse.pipeline.module.PipelineModule;
import io.tileverse.pipeline.module.ReadingModule;
import io.tileverse.pipeline.module.WritingModule;
import io.tileverse.pipeline.port.ConfigPort;
import io.tileverse.pipeline.store.ArrayStore;
import io.tileverse.pipeline.store.ArrayStoreFactory;
import io.tileverse.pipeline.store.spi.ArrayStoreConfig;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * An ordered registry of {@link PipelineModule modules} sharing one {@link ArrayStore}.
 * <p>
 * {@link #run()} opens the store, writes the execution settings to the {@link ConfigPort#TAG config} entry, checks
 * that every module input is either stored already or produced by an earlier module, binds the modules to the store
 * and runs them in registration order. The store is closed when the run ends, successfully or not.
 *
 * <pre>{@code
 * Pipeline pipeline = Pipeline.builder()
 *     .storeUri(URI.create("file:/data/run42"))
 *     .memoryFrames(100)
 *     .workerCount(8)
 *     .build();
 * pipeline.addModule(new FitsReadingModule("read", "images"));
 * pipeline.addModule(new DarkSubtractionModule("dark", "images", "dark", "images_dark"));
 * pipeline.run();
 * NdArray result = pipeline.getData("images_dark");
 * }</pre>
 */
@Slf4j
public class Pipeline {

    private final ArrayStore store;
    private final Path inputDirectory;
    private final Path outputDirectory;
    private final ExecutionConfig executionConfig;
    private final ProgressListener progressListener;

    private final Map<String, PipelineModule> modules = new LinkedHashMap<>();

    private Pipeline(Builder builder, ArrayStore store, ExecutionConfig executionConfig) {
        this.store = store;
        this.inputDirectory = builder.inputDirectory;
        this.outputDirectory = builder.outputDirectory;
        this.executionConfig = executionConfig;
        this.progressListener = builder.progressListener;
    }

    public ArrayStore getStore() {
        return store;
    }

    public ExecutionConfig getExecutionConfig() {
        return executionConfig;
    }

    public Optional<Path> getInputDirectory() {
        return Optional.ofNullable(inputDirectory);
    }

    public Optional<Path> getOutputDirectory() {
        return Optional.ofNullable(outputDirectory);
    }

    /**
     * Appends a module. A module registered under the same name is replaced, keeping its position.
     *
     * @param module the module to add
     */
    public synchronized void addModule(PipelineModule module) {
        requireNonNull(module, "module");
        if (module instanceof ReadingModule reading && inputDirectory != null) {
            reading.setDefaultInputDirectory(inputDirectory);
        }
        if (module instanceof WritingModule writing && outputDirectory != null) {
            writing.setDefaultOutputDirectory(outputDirectory);
        }
        if (progressListener != null) {
            module.setProgressListener(progressListener);
        }
        if (modules.put(module.getName(), module) != null) {
            log.warn("Pipeline module names need to be unique. Overwriting module '{}'", module.getName());
        }
    }

    /**
     * @param name the module name
     * @return {@code true} if a module was removed
     */
    public synchronized boolean removeModule(String name) {
        PipelineModule removed = modules.remove(requireNonNull(name, "name"));
        if (removed == null) {
            log.warn("Module '{}' not found in the pipeline", name);
            return false;
        }
        log.debug("Removed module '{}'", name);
        return true;
    }

    public synchronized List<String> getModuleNames() {
        return List.copyOf(modules.keySet());
    }

    public synchronized Optional<PipelineModule> getModule(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * Runs every module in registration order. A closed store is opened for the run and closed afterwards; an open
     * store is left open.
     *
     * @throws PipelineConfigurationException if a module input is neither stored nor produced by an earlier module
     * @throws IOException If an I/O error occurs
     */
    public synchronized void run() throws IOException {
        List<PipelineModule> toRun = List.copyOf(modules.values());
        log.info("Start running pipeline with {} modules", toRun.size());
        withStore(s -> {
            writeExecutionConfig();
            validate(toRun);
            for (PipelineModule module : toRun) {
                runModule(module);
            }
            return null;
        });
        log.info("Finished running pipeline");
    }

    /**
     * Runs a single module; its inputs must be stored already.
     *
     * @param name the module name
     * @throws IllegalArgumentException if there is no module named {@code name}
     * @throws PipelineConfigurationException if an input of the module is not stored
     * @throws IOException If an I/O error occurs
     */
    public synchronized void runModule(String name) throws IOException {
        PipelineModule module = getModule(name)
                .orElseThrow(() -> new IllegalArgumentException("Module '" + name + "' not found in the pipeline"));
        withStore(s -> {
            writeExecutionConfig();
            validate(List.of(module));
            runModule(module);
            return null;
        });
    }

    private void runModule(PipelineModule module) throws IOException {
        module.bindStore(store);
        log.info("Running module {}...", module.getName());
        long start = System.nanoTime();
        module.run();
        log.info("Module {} finished in {} ms", module.getName(), (System.nanoTime() - start) / 1_000_000);
    }

    private void writeExecutionConfig() throws IOException {
        OptionalInt memory = executionConfig.memoryFrames();
        if (memory.isPresent()) {
            store.setAttribute(ConfigPort.TAG, ExecutionConfig.MEMORY, memory.getAsInt());
        } else {
            store.deleteAttribute(ConfigPort.TAG, ExecutionConfig.MEMORY);
        }
        store.setAttribute(ConfigPort.TAG, ExecutionConfig.CPU, executionConfig.workerCount());
    }

    private void validate(List<PipelineModule> toRun) throws IOException {
        Set<String> available = new HashSet<>(store.tags());
        for (PipelineModule module : toRun) {
            for (String tag : module.getInputTags()) {
                if (!available.contains(tag)) {
                    throw new PipelineConfigurationException("Input tag '" + tag + "' of module " + module.getName()
                            + " is neither stored nor produced by an earlier module");
                }
            }
            available.addAll(module.getActiveOutputTags());
        }
    }

    /**
     * Reads the array stored under {@code tag}, opening the store if needed.
     *
     * @param tag an entry tag
     * @return the stored array
     * @throws TagNotFoundException if there is no array under {@code tag}
     * @throws IOException If an I/O error occurs
     */
    public synchronized NdArray getData(String tag) throws IOException {
        return withStore(s -> s.get(tag));
    }

    public synchronized Optional<Object> getAttribute(String tag, String name) throws IOException {
        return withStore(s -> s.getAttribute(tag, name));
    }

    public synchronized void setAttribute(String tag, String name, Object value) throws IOException {
        withStore(s -> {
            s.setAttribute(tag, name, value);
            return null;
        });
    }

    public synchronized Set<String> getTags() throws IOException {
        return withStore(ArrayStore::tags);
    }

    @FunctionalInterface
    private interface StoreFunction<T> {
        T apply(ArrayStore store) throws IOException;
    }

    private <T> T withStore(StoreFunction<T> function) throws IOException {
        final boolean wasOpen = store.isOpen();
        store.open();
        try {
            return function.apply(store);
        } finally {
            if (!wasOpen) {
                store.close();
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link Pipeline}. Either a {@link #store(ArrayStore) store} or a store
     * {@link #storeConfig(ArrayStoreConfig) configuration} is required.
     */
    public static class Builder {
        private ArrayStore store;
        private ArrayStoreConfig storeConfig;
        private Path inputDirectory;
        private Path outputDirectory;
        private OptionalInt memoryFrames = OptionalInt.empty();
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private ProgressListener progressListener;

        private Builder() {}

        public Builder store(ArrayStore store) {
            this.store = requireNonNull(store, "store");
            return this;
        }

        public Builder storeConfig(ArrayStoreConfig storeConfig) {
            this.storeConfig = requireNonNull(storeConfig, "storeConfig");
            return this;
        }

        public Builder storeUri(URI uri) {
            return storeConfig(new ArrayStoreConfig().uri(uri));
        }

        /**
         * @param directory default directory of {@link ReadingModule reading modules}; must exist
         * @return this builder
         */
        public Builder inputDirectory(Path directory) {
            this.inputDirectory = requireExistingDirectory(directory);
            return this;
        }

        /**
         * @param directory default directory of {@link WritingModule writing modules}; must exist
         * @return this builder
         */
        public Builder outputDirectory(Path directory) {
            this.outputDirectory = requireExistingDirectory(directory);
            return this;
        }

        public Builder memoryFrames(int memoryFrames) {
            this.memoryFrames = OptionalInt.of(memoryFrames);
            return this;
        }

        public Builder unboundedMemory() {
            this.memoryFrames = OptionalInt.empty();
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * @param progressListener the progress sink assigned to every module added to the pipeline
         * @return this builder
         */
        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = requireNonNull(progressListener, "progressListener");
            return this;
        }

        /**
         * @return a new pipeline
         * @throws IllegalStateException if neither a store nor a store configuration is set
         * @throws PipelineConfigurationException if the memory budget or the worker count is invalid
         * @throws IOException If the store can't be created from its configuration
         */
        public Pipeline build() throws IOException {
            if (store == null && storeConfig == null) {
                throw new IllegalStateException("Either store or storeConfig must be set");
            }
            ExecutionConfig executionConfig = new ExecutionConfig(memoryFrames, workerCount);
            ArrayStore target = store != null ? store : ArrayStoreFactory.create(storeConfig);
            return new Pipeline(this, target, executionConfig);
        }

        private static Path requireExistingDirectory(Path directory) {
            requireNonNull(directory, "directory");
            if (!Files.isDirectory(directory)) {
                throw new PipelineConfigurationException("Directory does not exist: " + directory);
            }
            return directory;
        }
    }
}
