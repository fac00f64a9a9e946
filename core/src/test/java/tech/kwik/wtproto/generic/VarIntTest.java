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
package tech.kwik.wtproto.generic;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VarIntTest {

    @Test
    void sizeIsDeterminedByTwoMostSignificantBits() {
        assertThat(VarInt.parseSize((byte) 0x25)).isEqualTo(1);
        assertThat(VarInt.parseSize((byte) 0x7b)).isEqualTo(2);
        assertThat(VarInt.parseSize((byte) 0x9d)).isEqualTo(4);
        assertThat(VarInt.parseSize((byte) 0xc2)).isEqualTo(8);
    }

    @Test
    void encodedSizeDependsOnValue() {
        assertThat(VarInt.of(63).size()).isEqualTo(1);
        assertThat(VarInt.of(64).size()).isEqualTo(2);
        assertThat(VarInt.of(16383).size()).isEqualTo(2);
        assertThat(VarInt.of(16384).size()).isEqualTo(4);
        assertThat(VarInt.of(1073741824).size()).isEqualTo(8);
        assertThat(VarInt.MAX.size()).isEqualTo(VarInt.MAX_SIZE);
    }

    @Test
    void valueOutOfRangeIsRejected() {
        assertThatThrownBy(() -> VarInt.of(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VarInt.of(VarInt.MAX_VALUE + 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eightByteIntegerShouldDecodeAndEncodeIdentically() throws Exception {
        byte[] encoded = { (byte) 0xc2, 0x19, 0x7c, 0x5e, (byte) 0xff, 0x14, (byte) 0xe8, (byte) 0x8c };

        VarInt value = VarInt.decode(ByteBuffer.wrap(encoded));
        ByteBuffer buffer = ByteBuffer.allocate(8);
        int written = value.encode(buffer);

        assertThat(value.longValue()).isEqualTo(151288809941952652L);
        assertThat(written).isEqualTo(8);
        assertThat(buffer.array()).isEqualTo(encoded);
    }

    @Test
    void integersAreOrderedByValue() {
        assertThat(VarInt.of(3)).isLessThan(VarInt.of(0x54));
        assertThat(VarInt.of(0x54)).isEqualTo(VarInt.of(0x54));
    }
}
