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

/**
 * A reader on the remaining bytes of a parent {@link BufferReader}, that can be used to read ahead without changing
 * the parent. The number of bytes read on the child is made permanent on the parent by {@link #commit()}; when the
 * child is discarded without committing, the parent is not changed at all.
 * Created by {@link BufferReader#child()}.
 */
public class BufferReaderChild extends BufferReader {

    private final BufferReader parent;
    private final int parentOffset;
    private boolean committed;

    BufferReaderChild(BufferReader parent) {
        super(parent.bufferRemaining());
        this.parent = parent;
        this.parentOffset = parent.offset();
    }

    /**
     * Advances the parent reader with the number of bytes read from this child. Can only be called once.
     */
    public void commit() {
        if (committed) {
            throw new IllegalStateException("child reader already committed");
        }
        if (parent.offset() != parentOffset) {
            throw new IllegalStateException("parent reader has been advanced while child was in use");
        }
        try {
            parent.skip(offset());
        }
        catch (EndOfBufferError e) {
            // Impossible, capacity of child is bounded by remaining bytes of parent.
            throw new IllegalStateException(e);
        }
        committed = true;
    }
}
