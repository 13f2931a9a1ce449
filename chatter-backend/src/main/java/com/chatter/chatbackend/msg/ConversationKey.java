package com.chatter.chatbackend.msg;

/**
 * Partition key of the message log. A DM pair is stored with the smaller id first so that
 * {@code dm(a, b)} and {@code dm(b, a)} address the same partition.
 */
public record ConversationKey(Kind kind, long first, long second) {

    public enum Kind {
        DM((byte) 1),
        GROUP((byte) 2);

        private final byte code;

        Kind(byte code) {
            this.code = code;
        }

        public byte code() {
            return code;
        }

        public static Kind fromCode(byte code) {
            for (Kind k : values()) {
                if (k.code == code) return k;
            }
            throw new IllegalArgumentException("Unknown conversation kind: " + code);
        }
    }

    public static ConversationKey dm(long userA, long userB) {
        return new ConversationKey(Kind.DM, Math.min(userA, userB), Math.max(userA, userB));
    }

    public static ConversationKey group(long groupId) {
        return new ConversationKey(Kind.GROUP, groupId, 0L);
    }

    public boolean isDm() {
        return kind == Kind.DM;
    }

    @Override
    public String toString() {
        return isDm() ? "dm:" + first + "-" + second : "group:" + first;
    }
}
