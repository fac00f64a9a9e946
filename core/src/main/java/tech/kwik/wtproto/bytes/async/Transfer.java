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
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.NotYetConnectedException;

/**
 * Single transfer attempts on a source or sink, with transport failures translated to {@link IoError}.
 */
final class Transfer {

    private Transfer() {
    }

    static Poll<Integer> read(ByteSource source, ByteBuffer destination) throws IoError {
        int requested = destination.remaining();
        Poll<Integer> result;
        try {
            result = source.pollRead(destination);
        }
        catch (IOException | UncheckedIOException | NotYetConnectedException e) {
            throw IoError.from(e);
        }
        if (result.isReady()) {
            checkCount(result.get(), requested);
        }
        return result;
    }

    static Poll<Integer> write(ByteSink sink, ByteBuffer source) throws IoError {
        int requested = source.remaining();
        Poll<Integer> result;
        try {
            result = sink.pollWrite(source);
        }
        catch (IOException | UncheckedIOException | NotYetConnectedException e) {
            throw IoError.from(e);
        }
        if (result.isReady()) {
            checkCount(result.get(), requested);
        }
        return result;
    }

    private static void checkCount(int count, int requested) {
        if (count < 0 || count > requested) {
            throw new IllegalStateException("invalid transfer count " + count + " (requested " + requested + ")");
        }
    }
}
