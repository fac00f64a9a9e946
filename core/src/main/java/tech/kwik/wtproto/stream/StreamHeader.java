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

import tech.kwik.wtproto.bytes.BufferReader;
import tech.kwik.wtproto.bytes.BufferReaderChild;
import tech.kwik.wtproto.bytes.BufferWriter;
import tech.kwik.wtproto.bytes.BytesReader;
import tech.kwik.wtproto.bytes.BytesWriter;
import tech.kwik.wtproto.bytes.EndOfBufferError;
import tech.kwik.wtproto.bytes.async.ByteSink;
import tech.kwik.wtproto.bytes.async.ByteSource;
import tech.kwik.wtproto.generic.VarInt;
import tech.kwik.wtproto.ids.InvalidSessionIdError;
import tech.kwik.wtproto.ids.SessionId;

import java.util.Objects;
import java.util.Optional;

/**
 * Header of a unidirectional stream: the stream type and, for WebTransport streams, the session id.
 * https://www.ietf.org/archive/id/draft-ietf-webtrans-http3-13.html#name-unidirectional-streams
 * <pre>
 * Unidirectional Stream Header {
 *   Stream Type (i),
 *   [Session ID (i)],
 * }
 * </pre>
 * A header has a session id if, and only if, it is of type WebTransport.
 */
public final class StreamHeader {

    /**
     * Maximum encoded size: two variable-length integers.
     */
    public static final int MAX_SIZE = 2 * VarInt.MAX_SIZE;

    private final StreamKind kind;
    private final SessionId sessionId;

    private StreamHeader(StreamKind kind, SessionId sessionId) {
        assert (kind.type() == StreamKind.Type.WEBTRANSPORT) == (sessionId != null);
        this.kind = kind;
        this.sessionId = sessionId;
    }

    static StreamHeader create(StreamKind kind, SessionId sessionId) {
        if ((kind.type() == StreamKind.Type.WEBTRANSPORT) != (sessionId != null)) {
            throw new IllegalArgumentException("session id must be present for, and only for, webtransport streams");
        }
        return new StreamHeader(kind, sessionId);
    }

    public static StreamHeader newControl() {
        return new StreamHeader(StreamKind.CONTROL, null);
    }

    public static StreamHeader newQPackEncoder() {
        return new StreamHeader(StreamKind.QPACK_ENCODER, null);
    }

    public static StreamHeader newQPackDecoder() {
        return new StreamHeader(StreamKind.QPACK_DECODER, null);
    }

    public static StreamHeader newWebTransport(SessionId sessionId) {
        return new StreamHeader(StreamKind.WEBTRANSPORT, Objects.requireNonNull(sessionId));
    }

    /**
     * @param id  the reserved stream type
     * @return a header for a reserved stream type
     * @throws IllegalArgumentException  if the id is not a reserved stream type
     */
    public static StreamHeader newExercise(VarInt id) {
        return new StreamHeader(StreamKind.exercise(id), null);
    }

    /**
     * Reads a stream header. Not atomic: when the header is incomplete or invalid, the reader may have been advanced
     * past the stream type; use {@link #readFromBuffer(BufferReader)} when this matters.
     * @param reader  the reader to read from
     * @return the header, or empty when not all bytes of the header are available
     * @throws StreamHeaderReadError  when the stream type is unknown or the session id is invalid
     */
    public static Optional<StreamHeader> read(BytesReader reader) throws StreamHeaderReadError {
        Optional<VarInt> discriminant = reader.getVarInt();
        if (discriminant.isEmpty()) {
            return Optional.empty();
        }
        StreamKind kind = parseKind(discriminant.get());
        if (kind.type() != StreamKind.Type.WEBTRANSPORT) {
            return Optional.of(new StreamHeader(kind, null));
        }
        Optional<VarInt> sessionId = reader.getVarInt();
        if (sessionId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StreamHeader(kind, parseSessionId(sessionId.get())));
    }

    /**
     * Reads a stream header atomically: the buffer is only advanced when a complete and valid header is read.
     * @param buffer  the buffer to read from
     * @return the header, or empty when not all bytes of the header are available
     * @throws StreamHeaderReadError  when the stream type is unknown or the session id is invalid
     */
    public static Optional<StreamHeader> readFromBuffer(BufferReader buffer) throws StreamHeaderReadError {
        BufferReaderChild child = buffer.child();
        Optional<StreamHeader> header = read(child);
        if (header.isPresent()) {
            child.commit();
        }
        return header;
    }

    /**
     * Creates a task that reads a stream header from the given source. The task never reads beyond the header.
     * @param source  the source to read from
     * @return the task
     */
    public static ReadStreamHeaderTask readAsync(ByteSource source) {
        return new ReadStreamHeaderTask(source);
    }

    static StreamKind parseKind(VarInt discriminant) throws StreamHeaderReadError {
        return StreamKind.parse(discriminant)
                .orElseThrow(() -> StreamHeaderReadError.unknownStream(discriminant));
    }

    static SessionId parseSessionId(VarInt value) throws StreamHeaderReadError {
        try {
            return SessionId.fromVarInt(value);
        }
        catch (InvalidSessionIdError e) {
            throw StreamHeaderReadError.invalidSessionId(e);
        }
    }

    public void write(BytesWriter writer) throws EndOfBufferError {
        writer.putVarInt(kind.id());
        if (sessionId != null) {
            writer.putVarInt(sessionId.toVarInt());
        }
    }

    /**
     * Writes the header to the buffer, either completely or not at all.
     * @param buffer  the buffer to write into
     * @throws EndOfBufferError  when the buffer cannot hold {@link #writeSize()} bytes
     */
    public void writeToBuffer(BufferWriter buffer) throws EndOfBufferError {
        int size = writeSize();
        if (buffer.capacity() < size) {
            throw new EndOfBufferError(size, buffer.capacity());
        }
        write(buffer);
    }

    public WriteStreamHeaderTask writeAsync(ByteSink sink) {
        return new WriteStreamHeaderTask(sink, this);
    }

    /**
     * @return the number of bytes needed to encode this header
     */
    public int writeSize() {
        return kind.id().size() + (sessionId != null? sessionId.toVarInt().size(): 0);
    }

    public StreamKind kind() {
        return kind;
    }

    public Optional<SessionId> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StreamHeader)) {
            return false;
        }
        StreamHeader that = (StreamHeader) other;
        return kind.equals(that.kind) && Objects.equals(sessionId, that.sessionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, sessionId);
    }

    @Override
    public String toString() {
        return "StreamHeader[" + kind + (sessionId != null? ", " + sessionId: "") + "]";
    }
}
