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

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * Source reading from a (blocking) input stream, e.g. the input stream of a QUIC stream. Never pending: each poll
 * blocks until at least one byte is available or the stream has ended.
 */
public class InputStreamByteSource implements ByteSource {

    private final InputStream input;

    public InputStreamByteSource(InputStream input) {
        this.input = input;
    }

    @Override
    public Poll<Integer> pollRead(ByteBuffer destination) throws IOException {
        if (!destination.hasRemaining()) {
            return Poll.ready(0);
        }
        int count;
        if (destination.hasArray()) {
            count = input.read(destination.array(), destination.arrayOffset() + destination.position(), destination.remaining());
            if (count > 0) {
                destination.position(destination.position() + count);
            }
        }
        else {
            byte[] chunk = new byte[destination.remaining()];
            count = input.read(chunk);
            if (count > 0) {
                destination.put(chunk, 0, count);
            }
        }
        return Poll.ready(Integer.max(count, 0));
    }
}
