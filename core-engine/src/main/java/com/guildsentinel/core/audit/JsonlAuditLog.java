package com.guildsentinel.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.guildsentinel.core.model.AuditLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * {@link AuditLog} backed by a JSON-lines file.
 *
 * <p>
 * Each entry is serialized with Jackson as one line, written and forced to
 * disk before {@link #append} returns. An in-memory index per guild serves
 * queries and holds at most {@code maxEntriesPerGuild} recent entries; the
 * file itself is never truncated.
 * </p>
 *
 * <p>
 * {@link #load()} replays an existing file. Lines that fail to parse are
 * logged and skipped, so a torn final write after a crash does not block
 * startup.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonlAuditLog implements AuditLog, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(JsonlAuditLog.class);

    private static final Comparator<AuditLogEntry> NEWEST_FIRST = Comparator
            .comparing(AuditLogEntry::getTimestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Path path;
    private final int maxEntriesPerGuild;
    private final ObjectMapper mapper;
    private final Map<String, Deque<AuditLogEntry>> index = new ConcurrentHashMap<>();
    private FileChannel channel;

    /**
     * @param path               file to append to; parent directories are created
     * @param maxEntriesPerGuild entries kept queryable per guild
     */
    public JsonlAuditLog(Path path, int maxEntriesPerGuild) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        if (maxEntriesPerGuild < 1) {
            throw new IllegalArgumentException("maxEntriesPerGuild must be >= 1, got: " + maxEntriesPerGuild);
        }
        this.maxEntriesPerGuild = maxEntriesPerGuild;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Replay the file into the query index.
     *
     * @return number of entries loaded
     * @throws AuditWriteException if the file exists but cannot be read
     */
    public int load() {
        if (!Files.exists(path)) {
            return 0;
        }
        int loaded = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    AuditLogEntry entry = mapper.readValue(line, AuditLogEntry.class);
                    if (entry.getGuildId() == null) {
                        skipped++;
                        continue;
                    }
                    index(entry);
                    loaded++;
                } catch (JsonProcessingException e) {
                    skipped++;
                    LOG.warn("Skipping malformed audit line in {}: {}", path, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new AuditWriteException("Failed to read audit log " + path, e);
        }
        LOG.info("Loaded {} audit entries from {} ({} skipped)", loaded, path, skipped);
        return loaded;
    }

    @Override
    public synchronized void append(AuditLogEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (entry.getGuildId() == null) {
            throw new IllegalArgumentException("Audit entry must carry a guildId");
        }
        try {
            byte[] line = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            FileChannel ch = channel();
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                ch.write(buffer);
            }
            ch.force(false);
        } catch (IOException e) {
            throw new AuditWriteException("Failed to append audit entry " + entry.getId(), e);
        }
        index(entry);
        LOG.debug("Audit entry {} appended for guild {}", entry.getId(), entry.getGuildId());
    }

    @Override
    public List<AuditLogEntry> query(String guildId, AuditQuery filters, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        Deque<AuditLogEntry> entries = index.get(guildId);
        if (entries == null) {
            return List.of();
        }
        AuditQuery query = filters != null ? filters : AuditQuery.all();
        List<AuditLogEntry> matched = new ArrayList<>();
        for (AuditLogEntry entry : entries) {
            if (query.matches(entry)) {
                matched.add(entry);
            }
        }
        matched.sort(NEWEST_FIRST);
        return matched.size() > limit ? List.copyOf(matched.subList(0, limit)) : List.copyOf(matched);
    }

    /** Number of entries currently queryable for a guild. */
    public int size(String guildId) {
        Deque<AuditLogEntry> entries = index.get(guildId);
        return entries == null ? 0 : entries.size();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private FileChannel channel() throws IOException {
        if (channel == null || !channel.isOpen()) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND);
        }
        return channel;
    }

    private void index(AuditLogEntry entry) {
        Deque<AuditLogEntry> entries = index.computeIfAbsent(entry.getGuildId(), g -> new ConcurrentLinkedDeque<>());
        entries.addLast(entry);
        while (entries.size() > maxEntriesPerGuild) {
            entries.pollFirst();
        }
    }
}
