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
package tech.kwik.wtproto.bytes;

import tech.kwik.wtproto.generic.VarInt;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Writer that grows as needed; writing never fails.
 */
public class ByteArrayWriter implements BytesWriter {

    private final ByteArrayOutputStream output;

    public ByteArrayWriter() {
        this(32);
    }

    public ByteArrayWriter(int initialCapacity) {
        output = new ByteArrayOutputStream(initialCapacity);
    }

    @Override
    public void putVarInt(VarInt varInt) {
        ByteBuffer encoded = ByteBuffer.allocate(varInt.size());
        varInt.encode(encoded);
        output.write(encoded.array(), 0, encoded.position());
    }

    @Override
    public void putBytes(byte[] bytes) {
        output.writeBytes(bytes);
    }

    @Override
    public void putBytes(ByteBuffer bytes) {
        byte[] data = new byte[bytes.remaining()];
        bytes.get(data);
        output.writeBytes(data);
    }

    public int size() {
        return output.size();
    }

    public byte[] toByteArray() {
        return output.toByteArray();
    }
}
