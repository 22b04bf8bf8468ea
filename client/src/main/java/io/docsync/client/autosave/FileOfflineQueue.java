package io.docsync.client.autosave;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docsync.client.ClientJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Offline queue kept as one JSON file per document.
 * <p>
 * Layout: {@code <dir>/<url-encoded documentId>.queue.json} holding the
 * entries in FIFO order. Each mutation rewrites the file through a temp
 * file and an atomic move, so readers see either the old or the new list.
 */
public final class FileOfflineQueue implements OfflineQueue {
    private static final Logger log = Logger.getLogger(FileOfflineQueue.class.getName());
    private static final TypeReference<List<OfflineQueueEntry>> ENTRIES = new TypeReference<>() {};

    private final ObjectMapper json = ClientJson.mapper();
    private final Path file;
    private final List<OfflineQueueEntry> entries;

    public FileOfflineQueue(Path dir, String documentId) {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(documentId, "documentId");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create offline queue dir " + dir, e);
        }
        this.file = dir.resolve(URLEncoder.encode(documentId, StandardCharsets.UTF_8) + ".queue.json");
        this.entries = new ArrayList<>(load());
        if (!entries.isEmpty()) {
            log.info(() -> "Loaded " + entries.size() + " queued write(s) for " + documentId);
        }
    }

    @Override
    public synchronized void append(OfflineQueueEntry entry) {
        Objects.requireNonNull(entry, "entry");
        List<OfflineQueueEntry> next = new ArrayList<>(entries);
        next.add(entry);
        commit(next);
    }

    @Override
    public synchronized Optional<OfflineQueueEntry> peek() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    @Override
    public synchronized void replaceHead(OfflineQueueEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (entries.isEmpty()) {
            throw new IllegalStateException("queue is empty");
        }
        List<OfflineQueueEntry> next = new ArrayList<>(entries);
        next.set(0, entry);
        commit(next);
    }

    @Override
    public synchronized void removeHead() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("queue is empty");
        }
        commit(new ArrayList<>(entries.subList(1, entries.size())));
    }

    @Override
    public synchronized void rebaseAll(long version) {
        List<OfflineQueueEntry> next = new ArrayList<>(entries);
        next.replaceAll(e -> e.rebase(version));
        commit(next);
    }

    @Override
    public synchronized void clear() {
        commit(new ArrayList<>());
    }

    @Override
    public synchronized List<OfflineQueueEntry> entries() {
        return List.copyOf(entries);
    }

    private List<OfflineQueueEntry> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return json.readValue(file.toFile(), ENTRIES);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable offline queue " + file, e);
        }
    }

    /** Write {@code next} to disk, then make it the in-memory list. */
    private void commit(List<OfflineQueueEntry> next) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            json.writeValue(tmp.toFile(), next);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot persist offline queue " + file, e);
        }
        entries.clear();
        entries.addAll(next);
    }
}
