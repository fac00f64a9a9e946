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
package tech.kwik.wtproto.stream;

import tech.kwik.wtproto.generic.VarInt;
import tech.kwik.wtproto.ids.InvalidSessionIdError;

/**
 * The stream header was read completely, but its content is not valid.
 */
public class StreamHeaderReadError extends Exception {

    public enum Kind {
        UNKNOWN_STREAM,
        INVALID_SESSION_ID
    }

    private final Kind kind;

    private StreamHeaderReadError(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    static StreamHeaderReadError unknownStream(VarInt discriminant) {
        return new StreamHeaderReadError(Kind.UNKNOWN_STREAM, "Unknown stream type " + discriminant, null);
    }

    static StreamHeaderReadError invalidSessionId(InvalidSessionIdError cause) {
        return new StreamHeaderReadError(Kind.INVALID_SESSION_ID, "Invalid session id " + cause.getValue(), cause);
    }

    public Kind getKind() {
        return kind;
    }
}
