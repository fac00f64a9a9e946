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

import tech.kwik.core.log.Logger;
import tech.kwik.core.log.SysOutLogger;
import tech.kwik.wtproto.bytes.BufferReader;
import tech.kwik.wtproto.stream.StreamHeader;
import tech.kwik.wtproto.stream.StreamHeaderReadError;

import java.util.HexFormat;
import java.util.Optional;

/**
 * Decodes hex-encoded unidirectional stream headers, e.g. <code>4054 04</code> (a WebTransport stream for session 4).
 */
public class StreamHeaderDecoder {

    private final Logger log;

    public StreamHeaderDecoder(Logger log) {
        this.log = log;
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: java " + StreamHeaderDecoder.class.getName() + " <hex> [<hex> ...]");
            System.exit(1);
        }
        SysOutLogger log = new SysOutLogger();
        log.logInfo(true);
        log.logWarning(true);

        StreamHeaderDecoder decoder = new StreamHeaderDecoder(log);
        boolean allValid = true;
        for (String arg : args) {
            allValid &= decoder.decode(arg);
        }
        if (!allValid) {
            System.exit(2);
        }
    }

    /**
     * Decodes one header and logs the outcome.
     * @param hex  the header bytes, hex encoded; whitespace is ignored
     * @return whether the input holds a complete and valid header
     */
    public boolean decode(String hex) {
        byte[] bytes;
        try {
            bytes = HexFormat.of().parseHex(hex.replaceAll("\\s", ""));
        }
        catch (IllegalArgumentException invalidHex) {
            log.warn("'" + hex + "': not a hex string (" + invalidHex.getMessage() + ")");
            return false;
        }

        BufferReader reader = new BufferReader(bytes);
        try {
            Optional<StreamHeader> header = StreamHeader.readFromBuffer(reader);
            if (header.isEmpty()) {
                log.warn("'" + hex + "': incomplete stream header (" + bytes.length + " bytes)");
                return false;
            }
            log.info("'" + hex + "': kind " + header.get().kind()
                    + header.get().sessionId().map(id -> ", session " + id.getValue()).orElse("")
                    + " (" + reader.offset() + " bytes" + (reader.capacity() > 0? ", " + reader.capacity() + " trailing": "") + ")");
            return true;
        }
        catch (StreamHeaderReadError error) {
            log.warn("'" + hex + "': " + error.getKind() + ": " + error.getMessage());
            return false;
        }
    }
}
