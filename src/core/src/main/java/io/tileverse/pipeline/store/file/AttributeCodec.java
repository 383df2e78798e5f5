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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binary encoding of attribute maps: an entry count followed by {@code (name, type code, value)} triples.
 * <p>
 * Strings are written as a byte count followed by their UTF-8 bytes, so their length is not bounded by
 * {@link DataOutput#writeUTF(String)}.
 */
final class AttributeCodec {

    private static final byte STRING = 'S';
    private static final byte INTEGER = 'I';
    private static final byte LONG = 'J';
    private static final byte DOUBLE = 'D';
    private static final byte BOOLEAN = 'Z';
    private static final byte DOUBLE_ARRAY = 'A';

    private AttributeCodec() {
        // utility class
    }

    static void write(Map<String, Object> attributes, DataOutput out) throws IOException {
        out.writeInt(attributes.size());
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            writeString(e.getKey(), out);
            Object value = e.getValue();
            if (value instanceof String s) {
                out.writeByte(STRING);
                writeString(s, out);
            } else if (value instanceof Integer i) {
                out.writeByte(INTEGER);
                out.writeInt(i);
            } else if (value instanceof Long l) {
                out.writeByte(LONG);
                out.writeLong(l);
            } else if (value instanceof Double d) {
                out.writeByte(DOUBLE);
                out.writeDouble(d);
            } else if (value instanceof Boolean b) {
                out.writeByte(BOOLEAN);
                out.writeBoolean(b);
            } else if (value instanceof double[] values) {
                out.writeByte(DOUBLE_ARRAY);
                out.writeInt(values.length);
                for (double v : values) {
                    out.writeDouble(v);
                }
            } else {
                throw new IllegalArgumentException("Unsupported attribute value for '" + e.getKey() + "': "
                        + (value == null ? "null" : value.getClass().getCanonicalName()));
            }
        }
    }

    static Map<String, Object> read(DataInput in) throws IOException {
        final int count = in.readInt();
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int n = 0; n < count; n++) {
            String name = readString(in);
            byte type = in.readByte();
            Object value =
                    switch (type) {
                        case STRING -> readString(in);
                        case INTEGER -> Integer.valueOf(in.readInt());
                        case LONG -> Long.valueOf(in.readLong());
                        case DOUBLE -> Double.valueOf(in.readDouble());
                        case BOOLEAN -> Boolean.valueOf(in.readBoolean());
                        case DOUBLE_ARRAY -> {
                            double[] values = new double[in.readInt()];
                            for (int i = 0; i < values.length; i++) {
                                values[i] = in.readDouble();
                            }
                            yield values;
                        }
                        default -> throw new IOException(
                                "Unknown attribute type code '" + (char) type + "' for " + name);
                    };
            attributes.put(name, value);
        }
        return attributes;
    }

    private static void writeString(String value, DataOutput out) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readString(DataInput in) throws IOException {
        final int length = in.readInt();
        if (length < 0) {
            throw new IOException("Corrupt attribute file: negative string length " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
