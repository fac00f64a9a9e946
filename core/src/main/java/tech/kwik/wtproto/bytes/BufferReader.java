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
package tech.kwik.wtproto.bytes;

import tech.kwik.core.generic.InvalidIntegerEncodingException;
import tech.kwik.wtproto.generic.VarInt;

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * A zero-copy reader on an immutable buffer. The reader maintains an offset that only increases, either by a
 * successful read or by an explicit {@link #skip(int)}; a read that fails never changes the offset.
 * Byte ranges returned by {@link #getBytes(int)} are read-only views on the underlying buffer.
 */
public class BufferReader implements BytesReader {

    private final ByteBuffer buffer;
    private int offset;

    public BufferReader(byte[] bytes) {
        this(ByteBuffer.wrap(bytes));
    }

    public BufferReader(byte[] bytes, int offset, int length) {
        this(ByteBuffer.wrap(bytes, offset, length));
    }

    /**
     * Creates a reader on the remaining bytes of the given buffer. The buffer's content is not copied and its position
     * is not changed by reading.
     * @param bytes  the buffer to read from
     */
    public BufferReader(ByteBuffer bytes) {
        buffer = bytes.slice().asReadOnlyBuffer();
        offset = 0;
    }

    /**
     * Returns the number of bytes that can still be read.
     * @return remaining capacity
     */
    public int capacity() {
        return buffer.limit() - offset;
    }

    /**
     * Returns the number of bytes read (or skipped) so far.
     * @return current offset
     */
    public int offset() {
        return offset;
    }

    /**
     * Advances the offset without reading.
     * @param length  number of bytes to skip
     * @throws EndOfBufferError  if less than <code>length</code> bytes remain; the offset is not changed in that case
     */
    public void skip(int length) throws EndOfBufferError {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative");
        }
        if (capacity() < length) {
            throw new EndOfBufferError(length, capacity());
        }
        offset += length;
    }

    /**
     * Returns a (read-only) view on the entire buffer, irrespective of the current offset.
     * @return the buffer
     */
    public ByteBuffer buffer() {
        return buffer.duplicate();
    }

    /**
     * Returns a (read-only) view on the part of the buffer that is not read yet.
     * @return the remaining bytes
     */
    public ByteBuffer bufferRemaining() {
        return buffer.slice(offset, capacity());
    }

    /**
     * Creates a child reader on the remaining bytes. Reading from the child does not affect this reader, until the
     * child is committed. Until the child is committed or discarded, this reader should not be read from.
     * @return a child reader
     */
    public BufferReaderChild child() {
        return new BufferReaderChild(this);
    }

    @Override
    public Optional<VarInt> getVarInt() {
        if (capacity() == 0) {
            return Optional.empty();
        }
        int varIntSize = VarInt.parseSize(buffer.get(offset));
        if (capacity() < varIntSize) {
            return Optional.empty();
        }
        try {
            VarInt value = VarInt.decode(buffer.slice(offset, varIntSize));
            offset += varIntSize;
            return Optional.of(value);
        }
        catch (InvalidIntegerEncodingException e) {
            // Impossible, size is checked above
            throw new IllegalStateException("variable-length integer not parsable", e);
        }
    }

    @Override
    public Optional<ByteBuffer> getBytes(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative");
        }
        if (capacity() < length) {
            return Optional.empty();
        }
        ByteBuffer bytes = buffer.slice(offset, length);
        offset += length;
        return Optional.of(bytes);
    }

    @Override
    public String toString() {
        return "BufferReader[offset=" + offset + ", capacity=" + capacity() + "]";
    }
}
