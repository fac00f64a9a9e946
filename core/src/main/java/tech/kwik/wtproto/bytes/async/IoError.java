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

import java.nio.channels.NotYetConnectedException;

/**
 * Error during an asynchronous I/O operation. Terminal for the operation that raised it.
 */
public class IoError extends Exception {

    public enum Kind {
        /**
         * The operation failed because the transport was not connected (yet).
         */
        NOT_CONNECTED,
        /**
         * The operation did not complete because the transport was closed.
         */
        CLOSED
    }

    private final Kind kind;

    public IoError(Kind kind) {
        super(message(kind));
        this.kind = kind;
    }

    public IoError(Kind kind, Throwable cause) {
        super(message(kind), cause);
        this.kind = kind;
    }

    /**
     * Classifies a transport failure: a {@link NotYetConnectedException} (anywhere in the cause chain) means the
     * transport was not connected, anything else is treated as closed.
     * @param error  the transport failure
     * @return the classified error, with the given error as cause
     */
    public static IoError from(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof NotYetConnectedException) {
                return new IoError(Kind.NOT_CONNECTED, error);
            }
        }
        return new IoError(Kind.CLOSED, error);
    }

    public Kind getKind() {
        return kind;
    }

    private static String message(Kind kind) {
        switch (kind) {
            case NOT_CONNECTED:
                return "Transport not connected";
            case CLOSED:
                return "Transport closed";
            default:
                throw new IllegalArgumentException();
        }
    }
}
