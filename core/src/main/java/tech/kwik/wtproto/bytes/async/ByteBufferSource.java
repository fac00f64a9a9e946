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
package tech.kwik.wtproto.bytes.async;

import java.nio.ByteBuffer;

/**
 * Source that reads from an in-memory buffer. Never pending; when all bytes are consumed, it behaves as a closed
 * source.
 */
public class ByteBufferSource implements ByteSource {

    private final ByteBuffer data;

    public ByteBufferSource(byte[] bytes) {
        this(ByteBuffer.wrap(bytes));
    }

    /**
     * Creates a source on the remaining bytes of the given buffer; the position of the given buffer is not changed.
     * @param bytes  the data
     */
    public ByteBufferSource(ByteBuffer bytes) {
        data = bytes.slice();
    }

    @Override
    public Poll<Integer> pollRead(ByteBuffer destination) {
        int count = Integer.min(data.remaining(), destination.remaining());
        destination.put(data.slice(data.position(), count));
        data.position(data.position() + count);
        return Poll.ready(count);
    }

    public int remaining() {
        return data.remaining();
    }
}
