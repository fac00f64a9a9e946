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

import tech.kwik.core.QuicStream;
import tech.kwik.core.log.Logger;
import tech.kwik.core.log.NullLogger;
import tech.kwik.wtproto.bytes.async.InputStreamByteSource;
import tech.kwik.wtproto.bytes.async.TaskRunner;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.LongConsumer;

/**
 * Reads the header of incoming unidirectional QUIC streams and passes each stream to the handler registered for its
 * stream type. The stream is passed positioned directly after the header.
 */
public class UnidirectionalStreamDispatcher {

    // https://www.rfc-editor.org/rfc/rfc9114.html#name-http-3-error-codes
    public static final int H3_STREAM_CREATION_ERROR = 0x0103;
    public static final int H3_ID_ERROR = 0x0108;

    private final Map<StreamKind.Type, BiConsumer<StreamHeader, QuicStream>> handlers;
    private final LongConsumer connectionErrorHandler;
    private final TaskRunner taskRunner;
    private final Logger log;

    public UnidirectionalStreamDispatcher(LongConsumer connectionErrorHandler) {
        this(connectionErrorHandler, new NullLogger());
    }

    /**
     * @param connectionErrorHandler  called with the HTTP/3 error code when a stream header is an error of the
     *                                connection (rather than of the stream)
     * @param log  logger
     */
    public UnidirectionalStreamDispatcher(LongConsumer connectionErrorHandler, Logger log) {
        this.connectionErrorHandler = connectionErrorHandler;
        this.log = log;
        handlers = new ConcurrentHashMap<>();
        taskRunner = TaskRunner.newBuilder().logger(log).build();
    }

    public void registerHandler(StreamKind.Type type, BiConsumer<StreamHeader, QuicStream> handler) {
        // https://www.rfc-editor.org/rfc/rfc9114.html#name-reserved-stream-types
        // "These streams have no semantics, and they can be sent when application-layer padding is desired."
        if (type == StreamKind.Type.EXERCISE) {
            throw new IllegalArgumentException("reserved stream types cannot be handled");
        }
        handlers.put(type, handler);
    }

    public void dispatch(QuicStream quicStream) {
        StreamHeader header;
        try {
            header = taskRunner.run(StreamHeader.readAsync(new InputStreamByteSource(quicStream.getInputStream())));
        }
        catch (StreamHeaderReadAsyncError error) {
            if (error.ioError().isPresent()) {
                // https://www.rfc-editor.org/rfc/rfc9114.html#name-unidirectional-streams
                // "A receiver MUST tolerate unidirectional streams being closed or reset prior to the reception of the
                //  unidirectional stream header."
                log.debug("Stream " + quicStream.getStreamId() + " closed before stream header was received");
                return;
            }
            handleInvalidHeader(quicStream, error.streamHeaderError().get());
            return;
        }

        BiConsumer<StreamHeader, QuicStream> handler = handlers.get(header.kind().type());
        if (handler != null) {
            handler.accept(header, quicStream);
        }
        else {
            // https://www.rfc-editor.org/rfc/rfc9114.html#name-unidirectional-streams
            // "Recipients of unknown stream types MUST either abort reading of the stream or discard incoming data
            //  without further processing. If reading is aborted, the recipient SHOULD use the
            //  H3_STREAM_CREATION_ERROR error code"
            log.debug("No handler for stream " + quicStream.getStreamId() + " of type " + header.kind());
            quicStream.abortReading(H3_STREAM_CREATION_ERROR);
        }
    }

    private void handleInvalidHeader(QuicStream quicStream, StreamHeaderReadError error) {
        switch (error.getKind()) {
            case UNKNOWN_STREAM:
                log.debug("Stream " + quicStream.getStreamId() + ": " + error.getMessage());
                quicStream.abortReading(H3_STREAM_CREATION_ERROR);
                break;
            case INVALID_SESSION_ID:
                log.warn("Stream " + quicStream.getStreamId() + ": " + error.getMessage());
                quicStream.abortReading(H3_ID_ERROR);
                connectionErrorHandler.accept(H3_ID_ERROR);
                break;
            default:
                throw new IllegalStateException("unexpected error kind " + error.getKind());
        }
    }
}
