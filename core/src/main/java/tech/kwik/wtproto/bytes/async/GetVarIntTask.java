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

import tech.kwik.wtproto.bytes.BufferReader;
import tech.kwik.wtproto.generic.VarInt;

import java.nio.ByteBuffer;

/**
 * Reads one variable-length integer from a {@link ByteSource}. Reads the first byte to determine the encoded size,
 * and then exactly the remaining bytes of the encoding; never reads beyond the integer.
 */
public class GetVarIntTask extends AbstractTask<VarInt, IoError> {

    private final ByteSource source;
    private final byte[] scratch = new byte[VarInt.MAX_SIZE];
    private int offset;
    private int varIntSize;

    public GetVarIntTask(ByteSource source) {
        this.source = source;
    }

    @Override
    protected Poll<VarInt> resume() throws IoError {
        if (offset == 0) {
            Poll<Integer> read = Transfer.read(source, ByteBuffer.wrap(scratch, 0, 1));
            if (read.isPending()) {
                return Poll.pending();
            }
            if (read.get() == 0) {
                throw new IoError(IoError.Kind.CLOSED);
            }
            offset = 1;
            varIntSize = VarInt.parseSize(scratch[0]);
        }
        while (offset < varIntSize) {
            Poll<Integer> read = Transfer.read(source, ByteBuffer.wrap(scratch, offset, varIntSize - offset));
            if (read.isPending()) {
                return Poll.pending();
            }
            if (read.get() == 0) {
                throw new IoError(IoError.Kind.CLOSED);
            }
            offset += read.get();
        }

        return Poll.ready(new BufferReader(scratch, 0, varIntSize).getVarInt()
                .orElseThrow(() -> new IllegalStateException("incomplete variable-length integer")));
    }
}
