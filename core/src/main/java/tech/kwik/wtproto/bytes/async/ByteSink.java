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

import tech.kwik.wtproto.generic.VarInt;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * A non-blocking sink for bytes, e.g. the sending side of a transport stream.
 */
public interface ByteSink {

    /**
     * Attempts to write the remaining bytes of the given buffer to the sink. The position of the buffer is advanced
     * by the number of bytes written.
     * A sink should never return ready with <code>0</code> for a non-empty buffer; when it does, it is considered
     * closed.
     * @param source  buffer with the bytes to write
     * @return the number of bytes written, or pending when the sink cannot accept bytes at the moment
     * @throws IOException  when the underlying transport fails
     */
    Poll<Integer> pollWrite(ByteBuffer source) throws IOException;

    /**
     * Creates a task that writes one variable-length integer to this sink.
     * @param varInt  the integer to write
     * @return the task, yielding the encoded size of the integer
     */
    default PutVarIntTask putVarInt(VarInt varInt) {
        return new PutVarIntTask(this, varInt);
    }

    /**
     * Creates a task that writes all remaining bytes of the given buffer to this sink.
     * @param source  the bytes to write
     * @return the task
     */
    default PutBufferTask putBuffer(ByteBuffer source) {
        return new PutBufferTask(this, source);
    }
}
