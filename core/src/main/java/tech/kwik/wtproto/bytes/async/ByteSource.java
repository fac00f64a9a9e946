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
import java.nio.ByteBuffer;

/**
 * A non-blocking source of bytes, e.g. the receiving side of a transport stream.
 */
public interface ByteSource {

    /**
     * Attempts to read bytes from the source, copying them into the given buffer (starting at its position, at most
     * its remaining bytes). The position of the buffer is advanced by the number of bytes read.
     * Returns ready with <code>0</code> if the buffer has no remaining bytes, or when the source has reached its end;
     * so a result of <code>0</code> for a non-empty buffer means the source is closed.
     * @param destination  buffer to copy bytes into
     * @return the number of bytes read, or pending when no bytes are available at the moment
     * @throws IOException  when the underlying transport fails
     */
    Poll<Integer> pollRead(ByteBuffer destination) throws IOException;

    /**
     * Creates a task that reads one variable-length integer from this source.
     * @return the task
     */
    default GetVarIntTask getVarInt() {
        return new GetVarIntTask(this);
    }

    /**
     * Creates a task that reads from this source until the remaining bytes of the given buffer are filled.
     * @param destination  buffer to fill
     * @return the task
     */
    default GetBufferTask getBuffer(ByteBuffer destination) {
        return new GetBufferTask(this, destination);
    }
}
