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

import tech.kwik.wtproto.bytes.async.IoError;

import java.util.Optional;

/**
 * Failure of an asynchronous stream header read: either the header content is invalid, or the transport failed.
 * Exactly one of {@link #streamHeaderError()} and {@link #ioError()} is present; it is also the cause of this error.
 */
public class StreamHeaderReadAsyncError extends Exception {

    private final StreamHeaderReadError streamHeaderError;
    private final IoError ioError;

    public StreamHeaderReadAsyncError(StreamHeaderReadError cause) {
        super(cause.getMessage(), cause);
        streamHeaderError = cause;
        ioError = null;
    }

    public StreamHeaderReadAsyncError(IoError cause) {
        super(cause.getMessage(), cause);
        streamHeaderError = null;
        ioError = cause;
    }

    public Optional<StreamHeaderReadError> streamHeaderError() {
        return Optional.ofNullable(streamHeaderError);
    }

    public Optional<IoError> ioError() {
        return Optional.ofNullable(ioError);
    }
}
