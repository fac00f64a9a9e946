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

/**
 * Writes bytes or variable-length integers to a destination in memory.
 */
public interface BytesWriter {

    /**
     * Writes a variable-length integer (in network byte order) at the current position and advances the position.
     * @param varInt  the integer to write
     * @throws EndOfBufferError  if there is not enough space; nothing is written in that case
     */
    void putVarInt(VarInt varInt) throws EndOfBufferError;

    /**
     * Writes (copies) all bytes at the current position and advances the position.
     * @param bytes  the bytes to write
     * @throws EndOfBufferError  if there is not enough space; nothing is written in that case
     */
    void putBytes(byte[] bytes) throws EndOfBufferError;

    /**
     * Writes (copies) the remaining bytes of the given buffer at the current position and advances the position.
     * On success, the position of <code>bytes</code> is advanced to its limit.
     * @param bytes  the bytes to write
     * @throws EndOfBufferError  if there is not enough space; nothing is written in that case
     */
    void putBytes(ByteBuffer bytes) throws EndOfBufferError;
}
