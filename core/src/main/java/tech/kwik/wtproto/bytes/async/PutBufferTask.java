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
 * Writes the remaining bytes of a buffer to a {@link ByteSink}. The position of the buffer is advanced when the task
 * completes. Yields the number of bytes written.
 */
public class PutBufferTask extends AbstractTask<Integer, IoError> {

    private final ByteSink sink;
    private final ByteBuffer source;
    private final int start;
    private final int length;
    private int offset;

    public PutBufferTask(ByteSink sink, ByteBuffer source) {
        this.sink = sink;
        this.source = source;
        this.start = source.position();
        this.length = source.remaining();
    }

    @Override
    protected Poll<Integer> resume() throws IoError {
        while (offset < length) {
            ByteBuffer window = source.duplicate();
            window.position(start + offset);
            window.limit(start + length);
            Poll<Integer> written = Transfer.write(sink, window);
            if (written.isPending()) {
                return Poll.pending();
            }
            if (written.get() == 0) {
                throw new IoError(IoError.Kind.CLOSED);
            }
            offset += written.get();
        }
        source.position(start + length);
        return Poll.ready(length);
    }
}
