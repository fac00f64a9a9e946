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

import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * Reads bytes or variable-length integers from a source of bytes that is available in memory.
 */
public interface BytesReader {

    /**
     * Reads a variable-length integer (in network byte order) at the current position and advances the position.
     * @return the integer, or empty when there are not enough bytes available, in which case nothing is consumed
     */
    Optional<VarInt> getVarInt();

    /**
     * Reads <code>length</code> bytes at the current position, without copying, and advances the position.
     * @param length  number of bytes to read
     * @return a read-only view on the bytes, or empty when there are not enough bytes available, in which case
     * nothing is consumed
     */
    Optional<ByteBuffer> getBytes(int length);
}
