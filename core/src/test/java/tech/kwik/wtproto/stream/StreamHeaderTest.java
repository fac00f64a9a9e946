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

import org.junit.jupiter.api.Test;
import tech.kwik.wtproto.bytes.BufferReader;
import tech.kwik.wtproto.bytes.BufferWriter;
import tech.kwik.wtproto.bytes.ByteArrayWriter;
import tech.kwik.wtproto.bytes.EndOfBufferError;
import tech.kwik.wtproto.bytes.async.ByteBufferSource;
import tech.kwik.wtproto.bytes.async.TaskRunner;
import tech.kwik.wtproto.generic.VarInt;
import tech.kwik.wtproto.ids.InvalidSessionIdError;
import tech.kwik.wtproto.ids.SessionId;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamHeaderTest {

    private static final byte[] WEBTRANSPORT_SESSION_4 = { 0x40, 0x54, 0x04 };
    private static final byte[] UNKNOWN_STREAM = { 0x40, 0x42 };
    private static final byte[] INVALID_SESSION_ID = { 0x40, 0x54, 0x01 };

    @Test
    void controlHeaderIsSingleByte() throws Exception {
        Optional<StreamHeader> header = StreamHeader.read(new BufferReader(new byte[] { 0x00 }));

        assertThat(header).contains(StreamHeader.newControl());
        assertThat(header.get().sessionId()).isEmpty();
    }

    @Test
    void webTransportHeaderContainsSessionId() throws Exception {
        // Given
        BufferReader reader = new BufferReader(WEBTRANSPORT_SESSION_4);

        // When
        StreamHeader header = StreamHeader.readFromBuffer(reader).get();

        // Then
        assertThat(header.kind()).isEqualTo(StreamKind.WEBTRANSPORT);
        assertThat(header.sessionId()).contains(SessionId.fromStreamId(4));
        assertThat(reader.capacity()).isEqualTo(0);
    }

    @Test
    void everyKindOfHeaderShouldBeReadBackAsWritten() throws Exception {
        List<StreamHeader> headers = List.of(
                StreamHeader.newControl(),
                StreamHeader.newQPackEncoder(),
                StreamHeader.newQPackDecoder(),
                StreamHeader.newWebTransport(SessionId.fromStreamId(0)),
                StreamHeader.newWebTransport(SessionId.fromVarInt(VarInt.of(VarInt.MAX_VALUE - 3))),
                StreamHeader.newExercise(VarInt.of(0x21 + 0x1f * 0x1f)));

        for (StreamHeader header : headers) {
            BufferWriter writer = new BufferWriter(new byte[StreamHeader.MAX_SIZE]);
            header.writeToBuffer(writer);
            assertThat(writer.offset()).isEqualTo(header.writeSize());

            BufferReader reader = new BufferReader(writer.bufferWritten());
            assertThat(StreamHeader.readFromBuffer(reader)).contains(header);
            assertThat(reader.offset()).isEqualTo(header.writeSize());
        }
    }

    @Test
    void largestHeaderFitsMaxSize() throws Exception {
        StreamHeader header = StreamHeader.newWebTransport(SessionId.fromVarInt(VarInt.of(VarInt.MAX_VALUE - 3)));

        assertThat(header.writeSize()).isEqualTo(10);
        assertThat(StreamHeader.newExercise(VarInt.of(0x21 + 0x1f * 0x1f_ffff_ffffL)).writeSize()).isEqualTo(8);
    }

    @Test
    void headerIsWrittenToGrowableWriter() throws Exception {
        ByteArrayWriter writer = new ByteArrayWriter();

        StreamHeader.newWebTransport(SessionId.fromStreamId(4)).write(writer);

        assertThat(writer.toByteArray()).isEqualTo(WEBTRANSPORT_SESSION_4);
    }

    @Test
    void writingToBufferThatIsTooSmallWritesNothing() throws Exception {
        // Given
        byte[] data = new byte[2];
        BufferWriter writer = new BufferWriter(data);
        StreamHeader header = StreamHeader.newWebTransport(SessionId.fromStreamId(4));

        // Then
        assertThatThrownBy(() -> header.writeToBuffer(writer)).isInstanceOf(EndOfBufferError.class);
        assertThat(writer.offset()).isEqualTo(0);
        assertThat(data).containsOnly(0);
    }

    @Test
    void incompleteHeaderIsNotConsumedFromBuffer() throws Exception {
        // Given
        BufferReader reader = new BufferReader(new byte[] { 0x40, 0x54 });

        // When
        Optional<StreamHeader> header = StreamHeader.readFromBuffer(reader);

        // Then
        assertThat(header).isEmpty();
        assertThat(reader.offset()).isEqualTo(0);
    }

    @Test
    void incompleteHeaderIsPartiallyConsumedByNonAtomicRead() throws Exception {
        // Given
        BufferReader reader = new BufferReader(new byte[] { 0x40, 0x54 });

        // When
        Optional<StreamHeader> header = StreamHeader.read(reader);

        // Then
        assertThat(header).isEmpty();
        assertThat(reader.offset()).isEqualTo(2);
    }

    @Test
    void truncatedDiscriminantIsNotConsumed() throws Exception {
        BufferReader reader = new BufferReader(new byte[] { 0x40 });

        assertThat(StreamHeader.read(reader)).isEmpty();
        assertThat(reader.offset()).isEqualTo(0);
    }

    @Test
    void emptyBufferHoldsNoHeader() throws Exception {
        assertThat(StreamHeader.read(new BufferReader(new byte[0]))).isEmpty();
    }

    @Test
    void unknownStreamTypeIsRejectedWithoutConsumingBuffer() {
        // Given
        BufferReader reader = new BufferReader(UNKNOWN_STREAM);

        // Then
        assertThatThrownBy(() -> StreamHeader.readFromBuffer(reader))
                .isInstanceOf(StreamHeaderReadError.class)
                .extracting(e -> ((StreamHeaderReadError) e).getKind())
                .isEqualTo(StreamHeaderReadError.Kind.UNKNOWN_STREAM);
        assertThat(reader.offset()).isEqualTo(0);
    }

    @Test
    void invalidSessionIdIsRejectedWithoutConsumingBuffer() {
        // Given
        BufferReader reader = new BufferReader(INVALID_SESSION_ID);

        // Then
        assertThatThrownBy(() -> StreamHeader.readFromBuffer(reader))
                .isInstanceOf(StreamHeaderReadError.class)
                .hasCauseInstanceOf(InvalidSessionIdError.class)
                .extracting(e -> ((StreamHeaderReadError) e).getKind())
                .isEqualTo(StreamHeaderReadError.Kind.INVALID_SESSION_ID);
        assertThat(reader.offset()).isEqualTo(0);
    }

    @Test
    void headerIsReadFromStartOfBufferOnly() throws Exception {
        // Given
        ByteBuffer data = ByteBuffer.wrap(new byte[] { 0x03, 0x00, 0x01 });
        BufferReader reader = new BufferReader(data);

        // When
        Optional<StreamHeader> header = StreamHeader.readFromBuffer(reader);

        // Then
        assertThat(header).contains(StreamHeader.newQPackDecoder());
        assertThat(reader.capacity()).isEqualTo(2);
    }

    @Test
    void headerMustHaveSessionIdIfAndOnlyIfWebTransport() throws Exception {
        SessionId sessionId = SessionId.fromStreamId(4);

        assertThatThrownBy(() -> StreamHeader.create(StreamKind.CONTROL, sessionId)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamHeader.create(StreamKind.WEBTRANSPORT, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamHeader.newExercise(VarInt.of(0x54))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void allReadPathsAgreeOnValidity() throws Exception {
        TaskRunner runner = TaskRunner.newBuilder().build();
        List<byte[]> inputs = List.of(
                new byte[] { 0x00 }, new byte[] { 0x02 }, new byte[] { 0x03 }, new byte[] { 0x21 }, new byte[] { 0x01 },
                new byte[] { 0x04 }, WEBTRANSPORT_SESSION_4, UNKNOWN_STREAM, INVALID_SESSION_ID);

        for (byte[] input : inputs) {
            Optional<StreamHeaderReadError.Kind> syncResult = syncError(input);
            Optional<StreamHeaderReadError.Kind> asyncResult;
            try {
                runner.run(StreamHeader.readAsync(new ByteBufferSource(input)));
                asyncResult = Optional.empty();
            }
            catch (StreamHeaderReadAsyncError error) {
                asyncResult = error.streamHeaderError().map(StreamHeaderReadError::getKind);
            }
            assertThat(asyncResult).isEqualTo(syncResult);
        }
    }

    private static Optional<StreamHeaderReadError.Kind> syncError(byte[] input) {
        try {
            StreamHeader.read(new BufferReader(input));
            try {
                StreamHeader.readFromBuffer(new BufferReader(input));
            }
            catch (StreamHeaderReadError error) {
                throw new AssertionError("atomic read rejects what plain read accepts", error);
            }
            return Optional.empty();
        }
        catch (StreamHeaderReadError error) {
            return Optional.of(error.getKind());
        }
    }
}
