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

import org.junit.jupiter.api.Test;
import tech.kwik.wtproto.generic.VarInt;

import java.nio.ByteBuffer;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferReaderTest {

    @Test
    void canonicalVarIntsShouldBeDecoded() {
        // Given
        BufferReader reader = new BufferReader(new byte[] {
                0x25,
                0x7b, (byte) 0xbd,
                (byte) 0x9d, 0x7f, 0x3e, 0x7d,
                (byte) 0xc2, 0x19, 0x7c, 0x5e, (byte) 0xff, 0x14, (byte) 0xe8, (byte) 0x8c });

        // Then
        assertThat(reader.getVarInt()).contains(VarInt.of(37));
        assertThat(reader.offset()).isEqualTo(1);
        assertThat(reader.getVarInt()).contains(VarInt.of(15293));
        assertThat(reader.offset()).isEqualTo(3);
        assertThat(reader.getVarInt()).contains(VarInt.of(494878333));
        assertThat(reader.offset()).isEqualTo(7);
        assertThat(reader.getVarInt()).contains(VarInt.of(151288809941952652L));
        assertThat(reader.capacity()).isEqualTo(0);
    }

    @Test
    void readingVarIntFromEmptyBufferFails() {
        BufferReader reader = new BufferReader(new byte[0]);

        assertThat(reader.getVarInt()).isEmpty();
        assertThat(reader.getBytes(1)).isEmpty();
    }

    @Test
    void incompleteVarIntIsNotConsumed() {
        // Given
        BufferReader reader = new BufferReader(new byte[] { (byte) 0x9d, 0x7f, 0x3e });

        // When
        Optional<VarInt> result = reader.getVarInt();

        // Then
        assertThat(result).isEmpty();
        assertThat(reader.offset()).isEqualTo(0);
        assertThat(reader.capacity()).isEqualTo(3);
    }

    @Test
    void getBytesShouldReturnViewOnUnderlyingBuffer() {
        // Given
        byte[] data = { 0x01, 0x02, 0x03, 0x04, 0x05 };
        BufferReader reader = new BufferReader(data, 1, 4);

        // When
        ByteBuffer bytes = reader.getBytes(3).get();
        data[2] = 0x42;

        // Then
        assertThat(bytes.remaining()).isEqualTo(3);
        assertThat(bytes.get(0)).isEqualTo((byte) 0x02);
        assertThat(bytes.get(1)).isEqualTo((byte) 0x42);
        assertThat(bytes.isReadOnly()).isTrue();
        assertThat(reader.capacity()).isEqualTo(1);
    }

    @Test
    void getBytesWithInsufficientCapacityDoesNotConsume() {
        BufferReader reader = new BufferReader(new byte[] { 0x01, 0x02 });

        assertThat(reader.getBytes(3)).isEmpty();
        assertThat(reader.offset()).isEqualTo(0);
        assertThat(reader.getBytes(0)).hasValueSatisfying(b -> assertThat(b.remaining()).isEqualTo(0));
    }

    @Test
    void skipBeyondEndFailsWithoutChangingOffset() throws Exception {
        // Given
        BufferReader reader = new BufferReader(new byte[4]);
        reader.skip(3);

        // Then
        assertThatThrownBy(() -> reader.skip(2))
                .isInstanceOf(EndOfBufferError.class)
                .hasMessage("End of buffer: 2 bytes required, but only 1 available");
        assertThat(reader.offset()).isEqualTo(3);
    }

    @Test
    void readerShouldNotChangePositionOfGivenBuffer() {
        // Given
        ByteBuffer buffer = ByteBuffer.wrap(new byte[] { 0x00, 0x25, 0x26 });
        buffer.position(1);

        // When
        BufferReader reader = new BufferReader(buffer);
        reader.getVarInt();

        // Then
        assertThat(buffer.position()).isEqualTo(1);
        assertThat(reader.bufferRemaining().get(0)).isEqualTo((byte) 0x26);
        assertThat(reader.buffer().remaining()).isEqualTo(2);
    }
}
