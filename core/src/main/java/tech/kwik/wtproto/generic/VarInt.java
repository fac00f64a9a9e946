/*
 * Copyright © 2025 Peter Doornbosch
 *
 * This file is part of Wtproto, a WebTransport protocol Java library
 *
 * Wtproto is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Wtproto is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.wtproto.generic;

import tech.kwik.core.generic.InvalidIntegerEncodingException;
import tech.kwik.core.generic.VariableLengthInteger;

import java.nio.ByteBuffer;

/**
 * A QUIC variable-length integer, as a value type.
 * https://www.rfc-editor.org/rfc/rfc9000.html#name-variable-length-integer-enc
 * Encoding and decoding is delegated to Kwik's {@link VariableLengthInteger}; this class only adds the operations
 * needed for incremental parsing (determining the encoded size from the first byte) and value semantics.
 */
public final class VarInt implements Comparable<VarInt> {

    /**
     * Largest value that can be encoded: 2^62 - 1.
     */
    public static final long MAX_VALUE = 4611686018427387903L;

    /**
     * Maximum number of bytes of an encoded variable-length integer.
     */
    public static final int MAX_SIZE = 8;

    public static final VarInt MAX = new VarInt(MAX_VALUE);

    private final long value;

    private VarInt(long value) {
        this.value = value;
    }

    /**
     * Creates a variable-length integer with the given value.
     * @param value  value in range [0, 2^62 - 1]
     * @return the variable-length integer
     * @throws IllegalArgumentException  when value is out of range
     */
    public static VarInt of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("value cannot be encoded in variable-length integer: " + value);
        }
        return new VarInt(value);
    }

    /**
     * Returns the number of bytes of the encoded integer that starts with the given byte.
     * https://www.rfc-editor.org/rfc/rfc9000.html#name-variable-length-integer-enc
     * "The QUIC variable-length integer encoding reserves the two most significant bits of the first byte to encode
     *  the base-2 logarithm of the integer encoding length in bytes."
     * @param firstByte  first byte of the encoded integer
     * @return 1, 2, 4 or 8
     */
    public static int parseSize(byte firstByte) {
        return 1 << ((firstByte & 0xc0) >> 6);
    }

    /**
     * Decodes a variable-length integer from the given buffer, advancing its position.
     * @param buffer  the buffer to read from
     * @return the decoded integer
     * @throws InvalidIntegerEncodingException  when the buffer does not contain the complete encoding; note that the
     * buffer's position might have been changed in that case
     */
    public static VarInt decode(ByteBuffer buffer) throws InvalidIntegerEncodingException {
        return new VarInt(VariableLengthInteger.parseLong(buffer));
    }

    /**
     * Writes the (shortest) encoding of this integer into the given buffer, advancing its position.
     * @param buffer  the buffer to write to, must have at least {@link #size()} bytes remaining
     * @return number of bytes written
     */
    public int encode(ByteBuffer buffer) {
        return VariableLengthInteger.encode(value, buffer);
    }

    /**
     * Returns the number of bytes needed to encode this integer.
     * @return 1, 2, 4 or 8
     */
    public int size() {
        return VariableLengthInteger.bytesNeeded(value);
    }

    public long longValue() {
        return value;
    }

    @Override
    public int compareTo(VarInt other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VarInt)) {
            return false;
        }
        return value == ((VarInt) other).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
