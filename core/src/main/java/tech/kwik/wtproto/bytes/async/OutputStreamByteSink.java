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
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Sink writing to a (blocking) output stream, e.g. the output stream of a QUIC stream. Never pending; each write is
 * flushed.
 */
public class OutputStreamByteSink implements ByteSink {

    private final OutputStream output;

    public OutputStreamByteSink(OutputStream output) {
        this.output = output;
    }

    @Override
    public Poll<Integer> pollWrite(ByteBuffer source) throws IOException {
        int count = source.remaining();
        if (count == 0) {
            return Poll.ready(0);
        }
        byte[] bytes = new byte[count];
        source.get(bytes);
        output.write(bytes);
        output.flush();
        return Poll.ready(count);
    }
}
