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
import java.nio.channels.WritableByteChannel;

/**
 * Sink writing to a (non-blocking) channel: a write that transfers no bytes is pending.
 */
public class ChannelByteSink implements ByteSink {

    private final WritableByteChannel channel;

    public ChannelByteSink(WritableByteChannel channel) {
        this.channel = channel;
    }

    @Override
    public Poll<Integer> pollWrite(ByteBuffer source) throws IOException {
        if (!source.hasRemaining()) {
            return Poll.ready(0);
        }
        int count = channel.write(source);
        if (count == 0) {
            return Poll.pending();
        }
        return Poll.ready(count);
    }
}
