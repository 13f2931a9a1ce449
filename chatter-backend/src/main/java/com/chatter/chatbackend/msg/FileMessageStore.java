package com.chatter.chatbackend.msg;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link MessageStore} backed by a single append-only {@code messages.log}.
 * <p>
 * Only offsets live in memory; payloads are read back from the file on demand. Indexes are
 * rebuilt from the log every time the store is opened.
 */
@Service
@Slf4j
public class FileMessageStore implements MessageStore, Closeable {

    static final String LOG_FILE = "messages.log";

    private final Path rootDir;
    private final boolean fsync;
    private final FileChannel channel;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<Long, Long> offsets = new HashMap<>();
    private final Map<ConversationKey, List<Long>> partitions = new HashMap<>();
    private final Map<Long, List<Long>> userFeeds = new HashMap<>();

    private long lastMid;
    private long writePosition;

    public FileMessageStore(
            @Value("${app.msg.root:data/msgdb}") String root,
            @Value("${app.msg.fsync:true}") boolean fsync
    ) throws IOException {
        this.rootDir = Path.of(root).toAbsolutePath().normalize();
        this.fsync = fsync;
        Files.createDirectories(rootDir);
        this.channel = FileChannel.open(rootDir.resolve(LOG_FILE),
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        recover();
    }

    private void recover() throws IOException {
        long size = channel.size();
        long pos = 0;
        int skipped = 0;
        long frames = 0;
        ByteBuffer lenBuf = ByteBuffer.allocate(LogRecord.LENGTH_PREFIX);

        while (pos < size) {
            if (size - pos < LogRecord.LENGTH_PREFIX) break;
            lenBuf.clear();
            readFully(lenBuf, pos);
            lenBuf.flip();
            int bodyLength = lenBuf.getInt();
            long frameEnd = pos + LogRecord.LENGTH_PREFIX + (long) bodyLength + LogRecord.CRC_SUFFIX;
            if (bodyLength < LogRecord.MIN_BODY || frameEnd > size) break;

            ByteBuffer body = ByteBuffer.allocate(bodyLength + LogRecord.CRC_SUFFIX);
            readFully(body, pos + LogRecord.LENGTH_PREFIX);
            body.flip();
            LogRecord record = LogRecord.decode(body);
            if (record == null) {
                log.warn("Skipping corrupt message record at offset {} in {}", pos, rootDir);
                skipped++;
            } else {
                index(record, pos);
            }
            frames++;
            pos = frameEnd;
        }
        // every complete frame consumed one id, readable or not
        if (frames > lastMid) {
            log.warn("Raising last message id from {} to {} past unreadable records", lastMid, frames);
            lastMid = frames;
        }

        if (pos < size) {
            log.warn("Truncating torn tail of {}: {} trailing bytes at offset {}", LOG_FILE, size - pos, pos);
            channel.truncate(pos);
            channel.force(true);
        }
        writePosition = pos;
        log.info("Message store opened at {}: {} messages, last id {}, {} skipped",
                rootDir, offsets.size(), lastMid, skipped);
    }

    private void index(LogRecord record, long offset) {
        long mid = record.mid();
        offsets.put(mid, offset);
        partitions.computeIfAbsent(record.key(), k -> new ArrayList<>()).add(mid);
        Set<Long> seen = new LinkedHashSet<>();
        for (long uid : record.participants()) {
            if (seen.add(uid)) {
                userFeeds.computeIfAbsent(uid, k -> new ArrayList<>()).add(mid);
            }
        }
        if (mid > lastMid) lastMid = mid;
    }

    @Override
    public long sendToDm(long from, long to, byte[] payload) {
        ConversationKey key = ConversationKey.dm(from, to);
        long[] participants = from == to ? new long[]{from} : new long[]{key.first(), key.second()};
        return append(key, participants, payload);
    }

    @Override
    public long sendToGroup(long groupId, Collection<Long> memberIds, byte[] payload) {
        long[] participants = memberIds.stream().distinct().mapToLong(Long::longValue).toArray();
        return append(ConversationKey.group(groupId), participants, payload);
    }

    private long append(ConversationKey key, long[] participants, byte[] payload) {
        lock.lock();
        try {
            long mid = lastMid + 1;
            LogRecord record = new LogRecord(mid, key, participants, payload);
            ByteBuffer buf = record.encode();
            long offset = writePosition;
            try {
                long pos = offset;
                while (buf.hasRemaining()) {
                    pos += channel.write(buf, pos);
                }
                if (fsync) channel.force(false);
            } catch (IOException e) {
                rollback(offset);
                throw new StoreIoException("Failed to append message to " + key, e);
            }
            writePosition = offset + record.frameLength();
            index(record, offset);
            log.debug("Appended message {} to {}", mid, key);
            return mid;
        } finally {
            lock.unlock();
        }
    }

    private void rollback(long offset) {
        try {
            channel.truncate(offset);
        } catch (IOException e) {
            log.error("Could not roll back partial record at offset {}", offset, e);
        }
    }

    @Override
    public List<StoredMessage> fetchDmMessagesBefore(long userA, long userB, Long beforeId, int limit) {
        return fetchBefore(ConversationKey.dm(userA, userB), beforeId, limit);
    }

    @Override
    public List<StoredMessage> fetchGroupMessagesBefore(long groupId, Long beforeId, int limit) {
        return fetchBefore(ConversationKey.group(groupId), beforeId, limit);
    }

    private List<StoredMessage> fetchBefore(ConversationKey key, Long beforeId, int limit) {
        if (limit <= 0) return List.of();
        lock.lock();
        try {
            List<Long> mids = partitions.getOrDefault(key, List.of());
            int end = beforeId == null ? mids.size() : lowerBound(mids, beforeId);
            List<StoredMessage> out = new ArrayList<>(Math.min(limit, end));
            for (int i = end - 1; i >= 0 && out.size() < limit; i--) {
                readPayload(mids.get(i)).ifPresent(p -> out.add(p));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredMessage> fetchUserMessagesAfter(long userId, Long afterId, int limit) {
        if (limit <= 0) return List.of();
        lock.lock();
        try {
            List<Long> mids = userFeeds.getOrDefault(userId, List.of());
            int start = afterId == null ? 0 : upperBound(mids, afterId);
            List<StoredMessage> out = new ArrayList<>(Math.min(limit, mids.size() - start));
            for (int i = start; i < mids.size() && out.size() < limit; i++) {
                readPayload(mids.get(i)).ifPresent(out::add);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<byte[]> get(long mid) {
        lock.lock();
        try {
            return readPayload(mid).map(StoredMessage::payload);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long countDmMessagesAfter(long userA, long userB, long afterId) {
        return countAfter(ConversationKey.dm(userA, userB), afterId);
    }

    @Override
    public long countGroupMessagesAfter(long groupId, long afterId) {
        return countAfter(ConversationKey.group(groupId), afterId);
    }

    private long countAfter(ConversationKey key, long afterId) {
        lock.lock();
        try {
            List<Long> mids = partitions.get(key);
            if (mids == null) return 0;
            return mids.size() - upperBound(mids, afterId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean containsDmMessage(long userA, long userB, long mid) {
        return contains(ConversationKey.dm(userA, userB), mid);
    }

    @Override
    public boolean containsGroupMessage(long groupId, long mid) {
        return contains(ConversationKey.group(groupId), mid);
    }

    private boolean contains(ConversationKey key, long mid) {
        lock.lock();
        try {
            List<Long> mids = partitions.get(key);
            return mids != null && Collections.binarySearch(mids, mid) >= 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long lastMessageId() {
        lock.lock();
        try {
            return lastMid;
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private Optional<StoredMessage> readPayload(long mid) {
        Long offset = offsets.get(mid);
        if (offset == null) return Optional.empty();
        try {
            ByteBuffer lenBuf = ByteBuffer.allocate(LogRecord.LENGTH_PREFIX);
            readFully(lenBuf, offset);
            lenBuf.flip();
            ByteBuffer body = ByteBuffer.allocate(lenBuf.getInt() + LogRecord.CRC_SUFFIX);
            readFully(body, offset + LogRecord.LENGTH_PREFIX);
            body.flip();
            LogRecord record = LogRecord.decode(body);
            if (record == null || record.mid() != mid) {
                log.warn("Message {} failed verification on read, leaving it out", mid);
                return Optional.empty();
            }
            return Optional.of(new StoredMessage(mid, record.payload()));
        } catch (IOException e) {
            throw new StoreIoException("Failed to read message " + mid, e);
        }
    }

    private void readFully(ByteBuffer dst, long position) throws IOException {
        long pos = position;
        while (dst.hasRemaining()) {
            int n = channel.read(dst, pos);
            if (n < 0) throw new IOException("Unexpected end of " + LOG_FILE + " at offset " + pos);
            pos += n;
        }
    }

    /** First index whose id is &gt;= {@code id}. */
    private static int lowerBound(List<Long> mids, long id) {
        int i = Collections.binarySearch(mids, id);
        return i >= 0 ? i : -i - 1;
    }

    /** First index whose id is &gt; {@code id}. */
    private static int upperBound(List<Long> mids, long id) {
        int i = Collections.binarySearch(mids, id);
        return i >= 0 ? i + 1 : -i - 1;
    }

    @Override
    @PreDestroy
    public void close() throws IOException {
        lock.lock();
        try {
            if (channel.isOpen()) {
                channel.close();
                log.info("Message store at {} closed", rootDir);
            }
        } finally {
            lock.unlock();
        }
    }
}
