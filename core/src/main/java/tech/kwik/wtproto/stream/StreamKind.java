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

import java.util.Objects;
import java.util.Optional;

/**
 * The type of a unidirectional stream, as indicated by the discriminant at the start of the stream.
 * https://www.rfc-editor.org/rfc/rfc9114.html#name-unidirectional-streams
 */
public final class StreamKind {

    public enum Type {
        CONTROL,
        QPACK_ENCODER,
        QPACK_DECODER,
        WEBTRANSPORT,
        EXERCISE
    }

    public static final long STREAM_TYPE_CONTROL = 0x00;
    public static final long STREAM_TYPE_QPACK_ENCODER = 0x02;
    public static final long STREAM_TYPE_QPACK_DECODER = 0x03;
    // https://www.ietf.org/archive/id/draft-ietf-webtrans-http3-13.html#name-unidirectional-streams
    public static final long STREAM_TYPE_WEBTRANSPORT = 0x54;

    public static final StreamKind CONTROL = new StreamKind(Type.CONTROL, VarInt.of(STREAM_TYPE_CONTROL));
    public static final StreamKind QPACK_ENCODER = new StreamKind(Type.QPACK_ENCODER, VarInt.of(STREAM_TYPE_QPACK_ENCODER));
    public static final StreamKind QPACK_DECODER = new StreamKind(Type.QPACK_DECODER, VarInt.of(STREAM_TYPE_QPACK_DECODER));
    public static final StreamKind WEBTRANSPORT = new StreamKind(Type.WEBTRANSPORT, VarInt.of(STREAM_TYPE_WEBTRANSPORT));

    private final Type type;
    private final VarInt id;

    private StreamKind(Type type, VarInt id) {
        this.type = type;
        this.id = id;
    }

    /**
     * Creates an exercise (reserved) stream kind.
     * @param id  the discriminant, which must be of the form <code>0x1f * N + 0x21</code>
     * @return the stream kind
     * @throws IllegalArgumentException  if the id is not a reserved stream type
     */
    public static StreamKind exercise(VarInt id) {
        if (!isIdExercise(id)) {
            throw new IllegalArgumentException("Not a reserved stream type: " + id);
        }
        return new StreamKind(Type.EXERCISE, id);
    }

    /**
     * Maps a discriminant to a stream kind.
     * @param id  the discriminant
     * @return the stream kind, or empty if the discriminant is not a known (or reserved) stream type
     */
    public static Optional<StreamKind> parse(VarInt id) {
        long value = id.longValue();
        if (value == STREAM_TYPE_CONTROL) {
            return Optional.of(CONTROL);
        }
        else if (value == STREAM_TYPE_QPACK_ENCODER) {
            return Optional.of(QPACK_ENCODER);
        }
        else if (value == STREAM_TYPE_QPACK_DECODER) {
            return Optional.of(QPACK_DECODER);
        }
        else if (value == STREAM_TYPE_WEBTRANSPORT) {
            return Optional.of(WEBTRANSPORT);
        }
        else if (isIdExercise(id)) {
            return Optional.of(new StreamKind(Type.EXERCISE, id));
        }
        return Optional.empty();
    }

    /**
     * https://www.rfc-editor.org/rfc/rfc9114.html#name-reserved-stream-types
     * "Stream types of the format 0x1f * N + 0x21 for non-negative integer values of N are reserved to exercise the
     *  requirement that unknown types be ignored."
     * @param id  the discriminant
     * @return whether the discriminant is a reserved stream type
     */
    public static boolean isIdExercise(VarInt id) {
        long value = id.longValue();
        return value >= 0x21 && (value - 0x21) % 0x1f == 0;
    }

    public Type type() {
        return type;
    }

    public VarInt id() {
        return id;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StreamKind)) {
            return false;
        }
        StreamKind that = (StreamKind) other;
        return type == that.type && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return type == Type.EXERCISE? "EXERCISE(" + id + ")": type.name();
    }
}
