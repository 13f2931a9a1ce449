package com.chatter.chatbackend.msg;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;

/**
 * One framed entry of {@code messages.log}.
 * <pre>
 * int   bodyLength
 * long  mid
 * byte  kind
 * long  keyA
 * long  keyB
 * int   participantCount
 * long  participants[participantCount]
 * int   payloadLength
 * byte  payload[payloadLength]
 * int   crc32(mid .. payload)
 * </pre>
 */
record LogRecord(long mid, ConversationKey key, long[] participants, byte[] payload) {

    static final int LENGTH_PREFIX = Integer.BYTES;
    static final int CRC_SUFFIX = Integer.BYTES;
    // mid + kind + keyA + keyB + participantCount + payloadLength
    static final int MIN_BODY = Long.BYTES + 1 + Long.BYTES + Long.BYTES + Integer.BYTES + Integer.BYTES;

    int bodyLength() {
        return MIN_BODY + participants.length * Long.BYTES + payload.length;
    }

    int frameLength() {
        return LENGTH_PREFIX + bodyLength() + CRC_SUFFIX;
    }

    ByteBuffer encode() {
        int bodyLength = bodyLength();
        ByteBuffer buf = ByteBuffer.allocate(LENGTH_PREFIX + bodyLength + CRC_SUFFIX);
        buf.putInt(bodyLength);
        buf.putLong(mid);
        buf.put(key.kind().code());
        buf.putLong(key.first());
        buf.putLong(key.second());
        buf.putInt(participants.length);
        for (long p : participants) {
            buf.putLong(p);
        }
        buf.putInt(payload.length);
        buf.put(payload);

        CRC32 crc = new CRC32();
        crc.update(buf.array(), LENGTH_PREFIX, bodyLength);
        buf.putInt((int) crc.getValue());
        buf.flip();
        return buf;
    }

    /**
     * Decodes a body (without the length prefix) followed by its checksum.
     *
     * @return the record, or {@code null} when the checksum or the inner lengths do not add up
     */
    static LogRecord decode(ByteBuffer bodyAndCrc) {
        int bodyLength = bodyAndCrc.remaining() - CRC_SUFFIX;
        if (bodyLength < MIN_BODY) return null;

        int start = bodyAndCrc.position();
        CRC32 crc = new CRC32();
        ByteBuffer body = bodyAndCrc.duplicate();
        body.limit(start + bodyLength);
        crc.update(body);
        int expected = bodyAndCrc.getInt(start + bodyLength);
        if ((int) crc.getValue() != expected) return null;

        try {
            long mid = bodyAndCrc.getLong();
            ConversationKey.Kind kind = ConversationKey.Kind.fromCode(bodyAndCrc.get());
            long keyA = bodyAndCrc.getLong();
            long keyB = bodyAndCrc.getLong();
            int count = bodyAndCrc.getInt();
            if (count < 0 || count > (bodyLength - MIN_BODY) / Long.BYTES) return null;
            long[] participants = new long[count];
            for (int i = 0; i < count; i++) {
                participants[i] = bodyAndCrc.getLong();
            }
            int payloadLength = bodyAndCrc.getInt();
            if (payloadLength != bodyLength - MIN_BODY - count * Long.BYTES) return null;
            byte[] payload = new byte[payloadLength];
            bodyAndCrc.get(payload);
            return new LogRecord(mid, new ConversationKey(kind, keyA, keyB), participants, payload);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            return null;
        }
    }
}
