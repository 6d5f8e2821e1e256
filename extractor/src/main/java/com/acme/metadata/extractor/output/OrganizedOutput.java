package com.acme.metadata.extractor.output;

import com.acme.metadata.extractor.extract.ExtractionRecord;
import com.acme.metadata.extractor.extract.RoutingKey;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One CSV file per routing key under {@code <base>/<providerId>/<clientId>.csv}.
 *
 * <p>At most {@code maxOpenFiles} handles are open at once. On a miss at capacity the least
 * recently used handles are flushed and closed in a group. A destination is truncated and given
 * a header the first time it is opened in this process; later reopens append without a header.
 * The header-written set is never pruned.</p>
 *
 * <p>Not thread-safe: only the writer thread may call it.</p>
 */
public final class OrganizedOutput implements OutputStrategy {
    private static final Logger LOG = Logger.getLogger(OrganizedOutput.class.getName());
    private static final int EVICTION_DIVISOR = 10;

    private final Path baseDir;
    private final int maxOpenFiles;
    private final int evictionBatch;
    // access-ordered: iteration starts at the least recently used key
    private final LinkedHashMap<RoutingKey, OutputHandle> open = new LinkedHashMap<>(16, 0.75f, true);
    private final Set<Path> headerWritten = new HashSet<>();
    private long evictions;
    private long reopens;
    private boolean closed;

    public OrganizedOutput(Path baseDir, int maxOpenFiles) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.maxOpenFiles = Math.max(1, maxOpenFiles);
        this.evictionBatch = Math.max(1, this.maxOpenFiles / EVICTION_DIVISOR);
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new OutputException(baseDir, "Failed to create output directory", e);
        }
        LOG.info(() -> "Created output directory " + baseDir
            + " maxOpenFiles=" + this.maxOpenFiles
            + " evictionBatch=" + evictionBatch);
    }

    @Override
    public void writeBatch(List<ExtractionRecord> batch) {
        ensureOpen();
        Map<RoutingKey, List<ExtractionRecord>> grouped = new LinkedHashMap<>();
        for (ExtractionRecord record : batch) {
            grouped.computeIfAbsent(record.routingKey(), ignored -> new ArrayList<>()).add(record);
        }
        for (Map.Entry<RoutingKey, List<ExtractionRecord>> e : grouped.entrySet()) {
            OutputHandle handle = getOrOpen(e.getKey());
            for (ExtractionRecord record : e.getValue()) {
                handle.write(record);
            }
        }
    }

    public OutputHandle getOrOpen(RoutingKey key) {
        ensureOpen();
        OutputHandle handle = open.get(key);
        if (handle != null) {
            return handle;
        }
        if (open.size() >= maxOpenFiles) {
            evictLeastRecentlyUsed();
        }
        Path destination = destinationOf(key);
        boolean firstOpen = headerWritten.add(destination);
        if (!firstOpen) {
            reopens++;
        }
        handle = OutputHandle.open(destination, !firstOpen, firstOpen);
        open.put(key, handle);
        return handle;
    }

    public Path destinationOf(RoutingKey key) {
        return baseDir.resolve(safeName(key.providerId())).resolve(safeName(key.clientId()) + ".csv");
    }

    /**
     * File-name form of an id. One-to-one, so distinct routing keys never share a file:
     * {@code %}, {@code /} and {@code \} are percent-encoded and the names {@code ""}, {@code "."}
     * and {@code ".."} are replaced by encoded forms that no other id produces.
     */
    static String safeName(String id) {
        if (id.isEmpty()) {
            return "%00";
        }
        if (id.equals(".") || id.equals("..")) {
            return id.replace(".", "%2E");
        }
        StringBuilder sb = new StringBuilder(id.length() + 8);
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            switch (c) {
                case '%' -> sb.append("%25");
                case '/' -> sb.append("%2F");
                case '\\' -> sb.append("%5C");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private void evictLeastRecentlyUsed() {
        int toEvict = Math.min(evictionBatch, open.size());
        Iterator<Map.Entry<RoutingKey, OutputHandle>> it = open.entrySet().iterator();
        for (int i = 0; i < toEvict && it.hasNext(); i++) {
            OutputHandle victim = it.next().getValue();
            it.remove();
            victim.close();
            evictions++;
        }
        LOG.fine(() -> "Evicted " + toEvict + " output handles, open=" + open.size());
    }

    @Override
    public void flush() {
        ensureOpen();
        for (OutputHandle handle : open.values()) {
            handle.flush();
        }
    }

    /**
     * Closes every handle. A failure on one handle does not stop the others from being closed;
     * the first failure is rethrown afterwards.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        OutputException first = null;
        for (OutputHandle handle : open.values()) {
            try {
                handle.close();
            } catch (OutputException e) {
                LOG.log(Level.WARNING, "Failed to close " + handle.path(), e);
                if (first == null) {
                    first = e;
                }
            }
        }
        open.clear();
        if (first != null) {
            throw first;
        }
    }

    @Override
    public int openHandleCount() {
        return open.size();
    }

    public int destinationCount() {
        return headerWritten.size();
    }

    public long evictions() {
        return evictions;
    }

    public long reopens() {
        return reopens;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("organized output already closed");
        }
    }
}
