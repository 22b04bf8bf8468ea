package io.docsync.client.autosave;

import io.docsync.core.ContentBlock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileOfflineQueueSpec {

    @TempDir Path dir;

    private static OfflineQueueEntry entry(String opId, String text, long base) {
        return new OfflineQueueEntry(opId, "notes/today", List.of(new ContentBlock("action", text)),
                base, Instant.parse("2024-05-01T10:00:00Z"), 0);
    }

    private static List<String> ops(OfflineQueue q) {
        return q.entries().stream().map(OfflineQueueEntry::opId).toList();
    }

    @Test
    void entries_come_back_in_order_after_reopening() {
        var q = new FileOfflineQueue(dir, "notes/today");
        q.append(entry("op-1", "a", 3));
        q.append(entry("op-2", "b", 3));

        var reopened = new FileOfflineQueue(dir, "notes/today");

        assertEquals(List.of("op-1", "op-2"), ops(reopened));
        assertEquals(entry("op-1", "a", 3), reopened.peek().orElseThrow());
        assertTrue(Files.exists(dir.resolve("notes%2Ftoday.queue.json")));
    }

    @Test
    void queues_of_different_documents_are_separate() {
        new FileOfflineQueue(dir, "a").append(entry("op-1", "x", 0));

        assertTrue(new FileOfflineQueue(dir, "b").isEmpty());
        assertEquals(1, new FileOfflineQueue(dir, "a").size());
    }

    @Test
    void rebase_all_moves_every_base_and_keeps_op_ids() {
        var q = new FileOfflineQueue(dir, "notes/today");
        q.append(entry("op-1", "a", 3));
        q.append(entry("op-2", "b", 3));

        q.rebaseAll(7);

        var reopened = new FileOfflineQueue(dir, "notes/today");
        assertEquals(List.of("op-1", "op-2"), ops(reopened));
        assertTrue(reopened.entries().stream().allMatch(e -> e.baseVersionAtEnqueue() == 7));
    }

    @Test
    void head_can_be_replaced_and_removed() {
        var q = new FileOfflineQueue(dir, "notes/today");
        q.append(entry("op-1", "a", 3));
        q.append(entry("op-2", "b", 3));

        q.replaceHead(entry("op-1", "a", 3).failedOnce());
        assertEquals(1, new FileOfflineQueue(dir, "notes/today").peek().orElseThrow().retryCount());

        q.removeHead();
        assertEquals(List.of("op-2"), ops(new FileOfflineQueue(dir, "notes/today")));
    }

    @Test
    void empty_queue_has_no_head() {
        var q = new FileOfflineQueue(dir, "notes/today");

        assertTrue(q.peek().isEmpty());
        assertThrows(IllegalStateException.class, q::removeHead);
        assertThrows(IllegalStateException.class, () -> q.replaceHead(entry("op-1", "a", 0)));
    }

    @Test
    void clear_empties_the_file_too() {
        var q = new FileOfflineQueue(dir, "notes/today");
        q.append(entry("op-1", "a", 3));

        q.clear();

        assertTrue(q.isEmpty());
        assertTrue(new FileOfflineQueue(dir, "notes/today").isEmpty());
    }
}
