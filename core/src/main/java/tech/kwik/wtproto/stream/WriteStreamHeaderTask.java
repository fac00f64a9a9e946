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
package tech.kwik.wtproto.stream;

import tech.kwik.wtproto.bytes.async.AbstractTask;
import tech.kwik.wtproto.bytes.async.ByteSink;
import tech.kwik.wtproto.bytes.async.IoError;
import tech.kwik.wtproto.bytes.async.Poll;
import tech.kwik.wtproto.bytes.async.PutVarIntTask;

/**
 * Writes a {@link StreamHeader} to a {@link ByteSink}. Yields the number of bytes written.
 */
public class WriteStreamHeaderTask extends AbstractTask<Integer, IoError> {

    private final ByteSink sink;
    private final StreamHeader header;
    private PutVarIntTask varIntTask;
    private boolean kindWritten;
    private int written;

    WriteStreamHeaderTask(ByteSink sink, StreamHeader header) {
        this.sink = sink;
        this.header = header;
        varIntTask = sink.putVarInt(header.kind().id());
    }

    @Override
    protected Poll<Integer> resume() throws IoError {
        if (!kindWritten) {
            Poll<Integer> size = varIntTask.poll();
            if (size.isPending()) {
                return Poll.pending();
            }
            written += size.get();
            kindWritten = true;
            if (header.sessionId().isEmpty()) {
                return Poll.ready(written);
            }
            varIntTask = sink.putVarInt(header.sessionId().get().toVarInt());
        }

        Poll<Integer> size = varIntTask.poll();
        if (size.isPending()) {
            return Poll.pending();
        }
        return Poll.ready(written + size.get());
    }
}
