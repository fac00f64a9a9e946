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
package tech.kwik.wtproto.ids;

import tech.kwik.wtproto.generic.VarInt;

/**
 * Identifier of a WebTransport session.
 * https://www.ietf.org/archive/id/draft-ietf-webtrans-http3-09.html#name-unidirectional-streams
 * "The session ID is the stream ID of the CONNECT request that established the session."
 * Hence, a session id is always the id of a client-initiated bidirectional stream.
 */
public final class SessionId {

    private final VarInt value;

    private SessionId(VarInt value) {
        this.value = value;
    }

    /**
     * Converts a (decoded) variable-length integer to a session id.
     * @param varInt  the value
     * @return the session id
     * @throws InvalidSessionIdError  when the value is not the id of a client-initiated bidirectional stream
     */
    public static SessionId fromVarInt(VarInt varInt) throws InvalidSessionIdError {
        if (!isClientInitiatedBidirectional(varInt.longValue())) {
            throw new InvalidSessionIdError(varInt.longValue());
        }
        return new SessionId(varInt);
    }

    /**
     * Returns the session id for the session established on the given QUIC stream.
     * @param streamId  id of the stream that carried the CONNECT request
     * @return the session id
     * @throws InvalidSessionIdError  when the stream id is not the id of a client-initiated bidirectional stream
     */
    public static SessionId fromStreamId(long streamId) throws InvalidSessionIdError {
        if (streamId < 0 || streamId > VarInt.MAX_VALUE) {
            throw new InvalidSessionIdError(streamId);
        }
        return fromVarInt(VarInt.of(streamId));
    }

    private static boolean isClientInitiatedBidirectional(long streamId) {
        // https://www.rfc-editor.org/rfc/rfc9000.html#name-stream-types-and-identifier
        // "The least significant bit (0x01) of the stream ID identifies the initiator of the stream. Client-initiated
        //  streams have even-numbered stream IDs"
        // "The second least significant bit (0x02) of the stream ID distinguishes between bidirectional streams (with
        //  the bit set to 0) and unidirectional streams"
        return (streamId & 0x03) == 0;
    }

    public VarInt toVarInt() {
        return value;
    }

    public long getValue() {
        return value.longValue();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SessionId)) {
            return false;
        }
        return value.equals(((SessionId) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SessionId[" + value + "]";
    }
}
