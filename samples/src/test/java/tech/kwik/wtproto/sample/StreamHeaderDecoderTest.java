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
package tech.kwik.wtproto.sample;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.kwik.core.log.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class StreamHeaderDecoderTest {

    private Logger log;
    private StreamHeaderDecoder decoder;

    @BeforeEach
    void initObjectUnderTest() {
        log = mock(Logger.class);
        decoder = new StreamHeaderDecoder(log);
    }

    @Test
    void webTransportHeaderIsDecoded() {
        // When
        boolean valid = decoder.decode("4054 04");

        // Then
        assertThat(valid).isTrue();
        verify(log).info(contains("WEBTRANSPORT, session 4 (3 bytes)"));
    }

    @Test
    void trailingBytesAreReported() {
        // When
        boolean valid = decoder.decode("00ff");

        // Then
        assertThat(valid).isTrue();
        verify(log).info(contains("CONTROL (1 bytes, 1 trailing)"));
    }

    @Test
    void incompleteHeaderIsReported() {
        // When
        boolean valid = decoder.decode("4054");

        // Then
        assertThat(valid).isFalse();
        verify(log).warn(contains("incomplete"));
    }

    @Test
    void unknownStreamTypeIsReported() {
        // When
        boolean valid = decoder.decode("4042");

        // Then
        assertThat(valid).isFalse();
        verify(log).warn(contains("UNKNOWN_STREAM"));
    }

    @Test
    void invalidHexIsReported() {
        // When
        boolean valid = decoder.decode("5g");

        // Then
        assertThat(valid).isFalse();
        verify(log).warn(contains("not a hex string"));
    }
}
