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

import tech.kwik.wtproto.generic.VarInt;

import java.nio.ByteBuffer;

/**
 * A zero-copy writer on a fixed size buffer. Writes that do not fit fail with {@link EndOfBufferError} and do not
 * write anything.
 */
public class BufferWriter implements BytesWriter {

    private final ByteBuffer buffer;
    private int offset;

    public BufferWriter(byte[] bytes) {
        this(ByteBuffer.wrap(bytes));
    }

    /**
     * Creates a writer on the remaining space of the given buffer. The position of the given buffer is not changed
     * by writing.
     * @param bytes  the buffer to write into
     * @throws IllegalArgumentException  if the buffer is read-only
     */
    public BufferWriter(ByteBuffer bytes) {
        if (bytes.isReadOnly()) {
            throw new IllegalArgumentException("cannot write into read-only buffer");
        }
        buffer = bytes.slice();
        offset = 0;
    }

    public int capacity() {
        return buffer.limit() - offset;
    }

    public int offset() {
        return offset;
    }

    /**
     * Returns a (read-only) view on the bytes written so far.
     * @return the written bytes
     */
    public ByteBuffer bufferWritten() {
        return buffer.slice(0, offset).asReadOnlyBuffer();
    }

    @Override
    public void putVarInt(VarInt varInt) throws EndOfBufferError {
        int size = varInt.size();
        if (capacity() < size) {
            throw new EndOfBufferError(size, capacity());
        }
        offset += varInt.encode(buffer.slice(offset, size));
    }

    @Override
    public void putBytes(byte[] bytes) throws EndOfBufferError {
        putBytes(ByteBuffer.wrap(bytes));
    }

    @Override
    public void putBytes(ByteBuffer bytes) throws EndOfBufferError {
        int length = bytes.remaining();
        if (capacity() < length) {
            throw new EndOfBufferError(length, capacity());
        }
        buffer.slice(offset, length).put(bytes);
        offset += length;
    }

    @Override
    public String toString() {
        return "BufferWriter[offset=" + offset + ", capacity=" + capacity() + "]";
    }
}
