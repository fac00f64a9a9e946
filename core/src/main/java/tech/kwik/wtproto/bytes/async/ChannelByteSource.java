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
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

/**
 * Source reading from a (non-blocking) channel: a read that transfers no bytes is pending, end-of-stream means closed.
 */
public class ChannelByteSource implements ByteSource {

    private final ReadableByteChannel channel;

    public ChannelByteSource(ReadableByteChannel channel) {
        this.channel = channel;
    }

    @Override
    public Poll<Integer> pollRead(ByteBuffer destination) throws IOException {
        if (!destination.hasRemaining()) {
            return Poll.ready(0);
        }
        int count = channel.read(destination);
        if (count < 0) {
            return Poll.ready(0);
        }
        if (count == 0) {
            return Poll.pending();
        }
        return Poll.ready(count);
    }
}
