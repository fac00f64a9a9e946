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
import tech.kwik.wtproto.bytes.async.ByteSource;
import tech.kwik.wtproto.bytes.async.GetVarIntTask;
import tech.kwik.wtproto.bytes.async.IoError;
import tech.kwik.wtproto.bytes.async.Poll;
import tech.kwik.wtproto.generic.VarInt;

/**
 * Reads a {@link StreamHeader} from a {@link ByteSource}, see {@link StreamHeader#readAsync(ByteSource)}.
 */
public class ReadStreamHeaderTask extends AbstractTask<StreamHeader, StreamHeaderReadAsyncError> {

    private enum State {
        READ_KIND,
        READ_SESSION_ID
    }

    private final ByteSource source;
    private State state;
    private GetVarIntTask varIntTask;
    private StreamKind kind;

    ReadStreamHeaderTask(ByteSource source) {
        this.source = source;
        state = State.READ_KIND;
        varIntTask = source.getVarInt();
    }

    @Override
    protected Poll<StreamHeader> resume() throws StreamHeaderReadAsyncError {
        try {
            if (state == State.READ_KIND) {
                Poll<VarInt> discriminant = varIntTask.poll();
                if (discriminant.isPending()) {
                    return Poll.pending();
                }
                kind = StreamHeader.parseKind(discriminant.get());
                if (kind.type() != StreamKind.Type.WEBTRANSPORT) {
                    return Poll.ready(StreamHeader.create(kind, null));
                }
                state = State.READ_SESSION_ID;
                varIntTask = source.getVarInt();
            }

            Poll<VarInt> sessionId = varIntTask.poll();
            if (sessionId.isPending()) {
                return Poll.pending();
            }
            return Poll.ready(StreamHeader.create(kind, StreamHeader.parseSessionId(sessionId.get())));
        }
        catch (IoError ioError) {
            throw new StreamHeaderReadAsyncError(ioError);
        }
        catch (StreamHeaderReadError contentError) {
            throw new StreamHeaderReadAsyncError(contentError);
        }
    }
}
