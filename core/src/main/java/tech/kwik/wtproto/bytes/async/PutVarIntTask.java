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

import tech.kwik.wtproto.bytes.BufferWriter;
import tech.kwik.wtproto.bytes.EndOfBufferError;
import tech.kwik.wtproto.generic.VarInt;

import java.nio.ByteBuffer;

/**
 * Writes one variable-length integer to a {@link ByteSink}. Yields the encoded size of the integer.
 */
public class PutVarIntTask extends AbstractTask<Integer, IoError> {

    private final ByteSink sink;
    private final byte[] scratch = new byte[VarInt.MAX_SIZE];
    private final int size;
    private int offset;

    public PutVarIntTask(ByteSink sink, VarInt varInt) {
        this.sink = sink;
        BufferWriter writer = new BufferWriter(scratch);
        try {
            writer.putVarInt(varInt);
        }
        catch (EndOfBufferError e) {
            // Impossible, scratch buffer can hold the largest encoding
            throw new IllegalStateException(e);
        }
        size = writer.offset();
    }

    @Override
    protected Poll<Integer> resume() throws IoError {
        while (offset < size) {
            Poll<Integer> written = Transfer.write(sink, ByteBuffer.wrap(scratch, offset, size - offset));
            if (written.isPending()) {
                return Poll.pending();
            }
            if (written.get() == 0) {
                throw new IoError(IoError.Kind.CLOSED);
            }
            offset += written.get();
        }
        return Poll.ready(size);
    }
}
