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
 * Fills the remaining bytes of a buffer with bytes read from a {@link ByteSource}. The position of the buffer is
 * advanced when the task completes; on intermediate polls only the content changes.
 */
public class GetBufferTask extends AbstractTask<Integer, IoError> {

    private final ByteSource source;
    private final ByteBuffer destination;
    private final int start;
    private final int length;
    private int offset;

    public GetBufferTask(ByteSource source, ByteBuffer destination) {
        this.source = source;
        this.destination = destination;
        this.start = destination.position();
        this.length = destination.remaining();
    }

    @Override
    protected Poll<Integer> resume() throws IoError {
        while (offset < length) {
            ByteBuffer window = destination.duplicate();
            window.position(start + offset);
            window.limit(start + length);
            Poll<Integer> read = Transfer.read(source, window);
            if (read.isPending()) {
                return Poll.pending();
            }
            if (read.get() == 0) {
                throw new IoError(IoError.Kind.CLOSED);
            }
            offset += read.get();
        }
        destination.position(start + length);
        return Poll.ready(length);
    }
}
