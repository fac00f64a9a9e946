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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Sink that collects everything written in memory. Never pending.
 */
public class ByteArraySink implements ByteSink {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    @Override
    public Poll<Integer> pollWrite(ByteBuffer source) {
        int count = source.remaining();
        byte[] bytes = new byte[count];
        source.get(bytes);
        output.writeBytes(bytes);
        return Poll.ready(count);
    }

    public int size() {
        return output.size();
    }

    public byte[] toByteArray() {
        return output.toByteArray();
    }
}
