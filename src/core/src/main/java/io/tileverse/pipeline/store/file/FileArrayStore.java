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
package io.tileverse.pipeline.store.file;

import io.tileverse.pipeline.array.NdArray;
import io.tileverse.pipeline.array.Region;
import io.tileverse.pipeline.store.AbstractArrayStore;
import io.tileverse.pipeline.store.ArrayStore;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ArrayStore} persisting each entry as files in a local directory.
 * <p>
 * Every tag maps to two files named after the URL-encoded tag:
 * <ul>
 * <li>{@code <tag>.arr}: a header ({@code magic, version, ndim, shape[ndim]} as big-endian ints) followed by the
 * array values as big-endian doubles in row-major order</li>
 * <li>{@code <tag>.attrs}: the attribute map, written with {@link DataOutputStream}</li>
 * </ul>
 * <p>
 * Reads and partial writes use positioned {@link FileChannel} I/O so that only the requested region is transferred,
 * which is what allows the chunked strategy to stream frame stacks larger than the heap. Appends write the new
 * frames past the current tail and only then update the header, so an interrupted append leaves the previous content
 * readable. Full replacements and attribute updates are written to a temporary file and atomically moved in place.
 * <p>
 * All operations are serialized on the store instance.
 */
public class FileArrayStore extends AbstractArrayStore implements ArrayStore {

    private static final Logger logger = LoggerFactory.getLogger(FileArrayStore.class);

    static final int MAGIC = 0x54565041; // "TVPA"
    static final int VERSION = 1;

    static final String ARRAY_SUFFIX = ".arr";
    static final String ATTRIBUTES_SUFFIX = ".attrs";

    private final Path directory;

    /**
     * Creates a store rooted at {@code directory}. The directory is created on {@link #open()} if missing.
     *
     * @param directory the store directory
     */
    public FileArrayStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
    }

    /**
     * @return the directory holding the store files
     */
    public Path getDirectory() {
        return directory;
    }

    @Override
    protected synchronized void openInternal() throws IOException {
        Files.createDirectories(directory);
        if (logger.isDebugEnabled()) {
            logger.debug("Opened file array store at {} with {} arrays", directory, tagsInternal().size());
        }
    }

    @Override
    protected void closeInternal() {
        // channels are opened per operation, nothing to release
    }

    @Override
    protected synchronized boolean existsInternal(String tag) {
        return Files.isRegularFile(arrayFile(tag));
    }

    @Override
    protected synchronized Set<String> tagsInternal() throws IOException {
        Set<String> tags = new HashSet<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(ARRAY_SUFFIX))
                    .map(name -> name.substring(0, name.length() - ARRAY_SUFFIX.length()))
                    .map(encoded -> URLDecoder.decode(encoded, StandardCharsets.UTF_8))
                    .forEach(tags::add);
        }
        return tags;
    }

    @Override
    protected synchronized int[] shapeInternal(String tag) throws IOException {
        try (FileChannel channel = FileChannel.open(arrayFile(tag), StandardOpenOption.READ)) {
            return readHeader(channel, tag);
        }
    }

    @Override
    protected synchronized NdArray getSliceInternal(String tag, Region region, int[] shape) throws IOException {
        final double[] values = new double[Math.toIntExact(region.volume())];
        if (values.length == 0) {
            return NdArray.wrap(values, region.size());
        }
        try (FileChannel channel = FileChannel.open(arrayFile(tag), StandardOpenOption.READ)) {
            final long dataOffset = headerSize(shape.length);
            final RunLayout layout = RunLayout.of(region, shape);
            final ByteBuffer buffer = ByteBuffer.allocate(layout.runLength * Double.BYTES);
            int target = 0;
            for (long element : layout.runStarts()) {
                buffer.clear();
                readFully(channel, buffer, dataOffset + element * Double.BYTES, tag);
                buffer.flip();
                buffer.asDoubleBuffer().get(values, target, layout.runLength);
                target += layout.runLength;
            }
        }
        return NdArray.wrap(values, region.size());
    }

    @Override
    protected synchronized void setSliceInternal(String tag, Region region, int[] shape, NdArray data)
            throws IOException {
        if (data.size() == 0) {
            return;
        }
        try (FileChannel channel = FileChannel.open(arrayFile(tag), StandardOpenOption.WRITE)) {
            final long dataOffset = headerSize(shape.length);
            final RunLayout layout = RunLayout.of(region, shape);
            final ByteBuffer buffer = ByteBuffer.allocate(layout.runLength * Double.BYTES);
            int source = 0;
            for (long element : layout.runStarts()) {
                buffer.clear();
                DoubleBuffer doubles = buffer.asDoubleBuffer();
                for (int i = 0; i < layout.runLength; i++) {
                    doubles.put(data.getFlat(source++));
                }
                writeFully(channel, buffer, dataOffset + element * Double.BYTES);
            }
        }
    }

    @Override
    protected synchronized void appendInternal(String tag, int[] shape, NdArray data) throws IOException {
        long storedValues = 1;
        for (int s : shape) {
            storedValues *= s;
        }
        try (FileChannel channel =
                FileChannel.open(arrayFile(tag), StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            final long tail = headerSize(shape.length) + storedValues * Double.BYTES;
            writeFully(channel, encodeValues(data), tail);

            ByteBuffer frames = ByteBuffer.allocate(Integer.BYTES);
            frames.putInt(shape[0] + data.dim(0)).flip();
            writeFully(channel, frames, 3L * Integer.BYTES);
            channel.force(false);
        }
        logger.debug("Appended {} frames to '{}'", data.dim(0), tag);
    }

    @Override
    protected synchronized void replaceInternal(String tag, NdArray data) throws IOException {
        final int[] shape = data.shape();
        ByteBuffer header = ByteBuffer.allocate(headerSize(shape.length));
        header.putInt(MAGIC).putInt(VERSION).putInt(shape.length);
        for (int s : shape) {
            header.putInt(s);
        }
        header.flip();
        ByteBuffer values = encodeValues(data);
        atomicWrite(arrayFile(tag), channel -> {
            writeFully(channel, header, 0);
            writeFully(channel, values, header.limit());
        });
    }

    @Override
    protected synchronized void deleteAllInternal(String tag) throws IOException {
        boolean deleted = Files.deleteIfExists(arrayFile(tag));
        deleted |= Files.deleteIfExists(attributesFile(tag));
        if (deleted) {
            logger.debug("Deleted '{}' from {}", tag, directory);
        }
    }

    @Override
    protected synchronized Map<String, Object> getAttributesInternal(String tag) throws IOException {
        Path file = attributesFile(tag);
        if (!Files.isRegularFile(file)) {
            return Map.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return AttributeCodec.read(new DataInputStream(new BufferedInputStream(in)));
        } catch (NoSuchFileException alreadyRemoved) {
            return Map.of();
        }
    }

    @Override
    protected synchronized void setAttributeInternal(String tag, String name, Object value) throws IOException {
        Map<String, Object> attributes = new LinkedHashMap<>(getAttributesInternal(tag));
        attributes.put(name, value);
        writeAttributes(tag, attributes);
    }

    @Override
    protected synchronized void deleteAttributeInternal(String tag, String name) throws IOException {
        Map<String, Object> attributes = new LinkedHashMap<>(getAttributesInternal(tag));
        if (attributes.remove(name) != null) {
            writeAttributes(tag, attributes);
        }
    }

    @Override
    protected synchronized void deleteAttributesInternal(String tag) throws IOException {
        Files.deleteIfExists(attributesFile(tag));
    }

    @Override
    public String getStoreIdentifier() {
        return directory.toAbsolutePath().toUri().toString();
    }

    private void writeAttributes(String tag, Map<String, Object> attributes) throws IOException {
        Path file = attributesFile(tag);
        if (attributes.isEmpty()) {
            Files.deleteIfExists(file);
            return;
        }
        Path tmp = Files.createTempFile(directory, "attrs", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp);
                    DataOutputStream data = new DataOutputStream(new BufferedOutputStream(out))) {
                AttributeCodec.write(attributes, data);
            }
            move(tmp, file);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    private interface ChannelWriter {
        void write(FileChannel channel) throws IOException;
    }

    private void atomicWrite(Path target, ChannelWriter writer) throws IOException {
        Path tmp = Files.createTempFile(directory, "array", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                writer.write(channel);
                channel.force(false);
            }
            move(tmp, target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static ByteBuffer encodeValues(NdArray data) {
        ByteBuffer buffer = ByteBuffer.allocate(Math.multiplyExact(data.size(), Double.BYTES));
        buffer.asDoubleBuffer().put(data.toArray());
        return buffer;
    }

    private static int[] readHeader(FileChannel channel, String tag) throws IOException {
        ByteBuffer fixed = ByteBuffer.allocate(3 * Integer.BYTES);
        readFully(channel, fixed, 0, tag);
        fixed.flip();
        int magic = fixed.getInt();
        int version = fixed.getInt();
        int ndim = fixed.getInt();
        if (magic != MAGIC || version != VERSION || ndim < 1) {
            throw new IOException("Not a valid array file for tag '" + tag + "' (magic=" + Integer.toHexString(magic)
                    + ", version=" + version + ", ndim=" + ndim + ")");
        }
        ByteBuffer dims = ByteBuffer.allocate(ndim * Integer.BYTES);
        readFully(channel, dims, fixed.capacity(), tag);
        dims.flip();
        int[] shape = new int[ndim];
        for (int i = 0; i < ndim; i++) {
            shape[i] = dims.getInt();
        }
        return shape;
    }

    static int headerSize(int ndim) {
        return (3 + ndim) * Integer.BYTES;
    }

    private static void readFully(FileChannel channel, ByteBuffer target, long position, String tag)
            throws IOException {
        long current = position;
        while (target.hasRemaining()) {
            int read = channel.read(target, current);
            if (read == -1) {
                throw new EOFException("Unexpected end of array file for tag '" + tag + "' at " + current);
            }
            current += read;
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer source, long position) throws IOException {
        long current = position;
        while (source.hasRemaining()) {
            current += channel.write(source, current);
        }
    }

    Path arrayFile(String tag) {
        return directory.resolve(encode(tag) + ARRAY_SUFFIX);
    }

    Path attributesFile(String tag) {
        return directory.resolve(encode(tag) + ATTRIBUTES_SUFFIX);
    }

    private static String encode(String tag) {
        return URLEncoder.encode(tag, StandardCharsets.UTF_8);
    }

    /**
     * Splits a region of a row-major array into equally long runs of contiguous elements.
     * <p>
     * The run covers the innermost axes the region spans completely, plus the first partially covered axis, so a
     * frame range over a stack is read as a single run.
     */
    private record RunLayout(int runLength, long[] starts) {

        static RunLayout of(Region region, int[] shape) {
            final int[] offset = region.offset();
            final int[] size = region.size();
            final int rank = shape.length;
            int splitAxis = rank - 1;
            while (splitAxis > 0 && offset[splitAxis] == 0 && size[splitAxis] == shape[splitAxis]) {
                splitAxis--;
            }
            final int[] strides = NdArray.strides(shape);
            final int runLength = size[splitAxis] * strides[splitAxis];

            int runs = 1;
            for (int axis = 0; axis < splitAxis; axis++) {
                runs *= size[axis];
            }
            long[] starts = new long[runs];
            int[] cursor = new int[Math.max(1, splitAxis)];
            for (int r = 0; r < runs; r++) {
                long element = (long) offset[splitAxis] * strides[splitAxis];
                for (int axis = 0; axis < splitAxis; axis++) {
                    element += (long) (offset[axis] + cursor[axis]) * strides[axis];
                }
                starts[r] = element;
                for (int axis = splitAxis - 1; axis >= 0; axis--) {
                    if (++cursor[axis] < size[axis]) {
                        break;
                    }
                    cursor[axis] = 0;
                }
            }
            return new RunLayout(runLength, starts);
        }

        long[] runStarts() {
            return starts;
        }
    }

    /**
     * Creates a store from a {@code file:} URI or a plain path.
     *
     * @param uri the store directory
     * @return a new, closed store
     */
    public static FileArrayStore of(URI uri) {
        Objects.requireNonNull(uri, "URI cannot be null");
        if (null == uri.getScheme()) {
            return new FileArrayStore(Paths.get(uri.getPath()));
        }
        return new FileArrayStore(Paths.get(uri));
    }
}
