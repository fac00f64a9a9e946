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
package tech.kwik.wtproto.test;

import tech.kwik.wtproto.bytes.async.ByteSink;
import tech.kwik.wtproto.bytes.async.Poll;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Sink that alternates between being pending and accepting a single byte, starting with pending. Fails when more
 * than the maximum number of bytes is written.
 */
public class StepWriter implements ByteSink {

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final int maxLength;
    private boolean ready;

    public StepWriter(int maxLength) {
        this.maxLength = maxLength;
    }

    @Override
    public Poll<Integer> pollWrite(ByteBuffer source) throws IOException {
        if (!ready) {
            ready = true;
            return Poll.pending();
        }
        ready = false;
        if (!source.hasRemaining()) {
            return Poll.ready(0);
        }
        if (written.size() >= maxLength) {
            throw new IOException("sink is full");
        }
        written.write(source.get());
        return Poll.ready(1);
    }

    public byte[] getWritten() {
        return written.toByteArray();
    }
}
