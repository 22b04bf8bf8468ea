package io.docsync.client.autosave;

import io.docsync.client.RemoteCallException;
import io.docsync.core.ContentBlock;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;
import io.docsync.core.error.PermanentWriteFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for the client save loop, run in virtual time against an in-memory server.
 */
class AutosaveCoordinatorSpec {

    @TempDir Path dir;

    private final ManualScheduler scheduler = new ManualScheduler();
    private final AtomicReference<List<ContentBlock>> editor = new AtomicReference<>(text("v0"));
    private final FakeDocumentServer server = new FakeDocumentServer(0, text("v0"));
    private final DrainGuard guard = new DrainGuard();
    private final Recording listener = new Recording();
    private FileOfflineQueue queue;
    private AutosaveCoordinator autosave;

    static final class Recording implements AutosaveListener {
        final List<SaveState> states = new ArrayList<>();
        final List<WriteResult.Conflict> conflicts = new ArrayList<>();
        final List<PermanentWriteFailureException> failures = new ArrayList<>();

        @Override
        public void stateChanged(SaveState state) {
            states.add(state);
        }

        @Override
        public void conflict(WriteResult.Conflict conflict) {
            conflicts.add(conflict);
        }

        @Override
        public void failed(PermanentWriteFailureException failure) {
            failures.add(failure);
        }
    }

    @BeforeEach
    void setUp() {
        queue = new FileOfflineQueue(dir, "doc");
        autosave = newCoordinator(queue);
    }

    private AutosaveCoordinator newCoordinator(OfflineQueue q) {
        return new AutosaveCoordinator("doc", 0, editor::get, server, q, guard,
                AutosaveOptions.defaults(), listener, scheduler, scheduler.clock());
    }

    private static List<ContentBlock> text(String s) {
        return List.of(new ContentBlock("action", s));
    }

    private void edit(String s) {
        editor.set(text(s));
        autosave.markChanged();
        scheduler.runPending();
    }

    private WriteRequest request(int i) {
        return server.requests.get(i);
    }

    // ---------- debounce ----------

    @Test
    void bursts_of_edits_collapse_into_one_save_after_the_quiet_period() {
        edit("a");
        scheduler.advanceMillis(1000);
        edit("b");
        scheduler.advanceMillis(1000);
        edit("c");
        scheduler.advanceMillis(1499);
        assertTrue(server.requests.isEmpty());
        assertEquals(SaveState.PENDING, autosave.state());

        scheduler.advanceMillis(1);

        assertEquals(1, server.requests.size());
        assertEquals(text("c"), request(0).content());
        assertEquals(0L, request(0).baseVersion());
        assertEquals(SaveState.SAVED, autosave.state());
        assertEquals(1L, autosave.baseVersion());
    }

    @Test
    void max_wait_forces_a_save_while_typing_continues() {
        for (int i = 0; i < 5; i++) {
            edit("e" + i);
            scheduler.advanceMillis(1000);
        }

        assertEquals(1, server.requests.size());
        assertEquals(text("e4"), request(0).content());
    }

    @Test
    void unchanged_content_is_not_saved() {
        autosave.markChanged();
        scheduler.advanceMillis(10_000);

        assertTrue(server.requests.isEmpty());
        assertEquals(SaveState.IDLE, autosave.state());
    }

    @Test
    void next_save_builds_on_the_accepted_version() {
        edit("a");
        scheduler.advanceMillis(1500);
        edit("b");
        scheduler.advanceMillis(1500);

        assertEquals(1L, request(1).baseVersion());
        assertNotEquals(request(0).opId(), request(1).opId());
        assertEquals(2L, autosave.baseVersion());
        assertEquals(text("b"), server.content);
    }

    @Test
    void save_now_skips_the_timers() {
        editor.set(text("now"));
        autosave.saveNow();
        scheduler.runPending();

        assertEquals(1, server.requests.size());
        scheduler.advanceMillis(10_000);
        assertEquals(1, server.requests.size(), "disarmed timers do not save again");
    }

    // ---------- conflicts ----------

    @Test
    void conflict_fast_forwards_once_with_a_fresh_op_id() {
        server.externalWrite(text("theirs"));

        edit("mine");
        scheduler.advanceMillis(1500);

        assertEquals(2, server.requests.size());
        assertEquals(0L, request(0).baseVersion());
        assertEquals(1L, request(1).baseVersion());
        assertEquals(text("mine"), request(1).content());
        assertNotEquals(request(0).opId(), request(1).opId());
        assertEquals(SaveState.SAVED, autosave.state());
        assertEquals(2L, autosave.baseVersion());
        assertTrue(listener.conflicts.isEmpty());
    }

    @Test
    void second_conflict_parks_until_the_user_accepts_the_server_copy() throws Exception {
        server.beforeWrite = () -> server.externalWrite(text("theirs"));

        edit("mine");
        scheduler.advanceMillis(1500);

        assertEquals(2, server.requests.size(), "exactly one automatic fast-forward");
        assertEquals(SaveState.CONFLICT, autosave.state());
        assertEquals(1, listener.conflicts.size());
        assertEquals(2L, listener.conflicts.get(0).latestVersion());

        edit("more typing");
        scheduler.advanceMillis(10_000);
        assertEquals(2, server.requests.size(), "no saves while the conflict is open");

        CompletableFuture<List<ContentBlock>> serverCopy = autosave.acceptServerVersion();
        scheduler.runPending();

        assertEquals(text("theirs"), serverCopy.get());
        assertEquals(SaveState.IDLE, autosave.state());
        assertEquals(2L, autosave.baseVersion());
    }

    @Test
    void forcing_the_local_version_writes_over_the_latest_server_version() {
        server.beforeWrite = () -> server.externalWrite(text("theirs"));
        edit("mine");
        scheduler.advanceMillis(1500);
        assertEquals(SaveState.CONFLICT, autosave.state());
        server.beforeWrite = () -> { };

        autosave.forceLocalVersion();
        scheduler.runPending();

        WriteRequest forced = request(2);
        assertEquals(2L, forced.baseVersion());
        assertEquals(text("mine"), forced.content());
        assertEquals(SaveState.SAVED, autosave.state());
        assertEquals(text("mine"), server.content);
    }

    @Test
    void accepting_without_a_conflict_fails() {
        CompletableFuture<List<ContentBlock>> f = autosave.acceptServerVersion();
        scheduler.runPending();

        assertTrue(f.isCompletedExceptionally());
    }

    // ---------- rate limits and server errors ----------

    @Test
    void rate_limited_save_is_retried_once_after_the_delay() {
        server.injected.add(new WriteResult.RateLimited(Duration.ofSeconds(3)));

        edit("a");
        scheduler.advanceMillis(1500);
        assertEquals(SaveState.RATE_LIMITED, autosave.state());
        scheduler.advanceMillis(2999);
        assertEquals(1, server.requests.size());

        scheduler.advanceMillis(1);

        assertEquals(2, server.requests.size());
        assertEquals(request(0).opId(), request(1).opId());
        assertEquals(SaveState.SAVED, autosave.state());
    }

    @Test
    void edits_during_a_rate_limit_wait_are_saved_after_the_retry() {
        server.injected.add(new WriteResult.RateLimited(Duration.ofSeconds(3)));
        edit("a");
        scheduler.advanceMillis(1500);

        edit("b");
        scheduler.advanceMillis(3000);
        assertEquals(2, server.requests.size());
        assertEquals(text("a"), request(1).content());

        scheduler.advanceMillis(1500);
        assertEquals(3, server.requests.size());
        assertEquals(text("b"), request(2).content());
        assertEquals(1L, request(2).baseVersion());
    }

    @Test
    void server_errors_back_off_exponentially_then_fail_permanently() {
        for (int i = 0; i < 4; i++) {
            server.injected.add(new RemoteCallException(503, "storage unavailable"));
        }

        edit("a");
        scheduler.advanceMillis(1500);
        assertEquals(1, server.requests.size());
        scheduler.advanceMillis(1999);
        assertEquals(1, server.requests.size());
        scheduler.advanceMillis(1);
        assertEquals(2, server.requests.size(), "first retry after 2s");
        scheduler.advanceMillis(4000);
        assertEquals(3, server.requests.size(), "second retry after 4s");
        scheduler.advanceMillis(8000);
        assertEquals(4, server.requests.size(), "third retry after 8s");

        assertEquals(SaveState.ERROR, autosave.state());
        assertEquals(1, listener.failures.size());
        assertEquals(4, listener.failures.get(0).attempts());
        assertEquals(request(0).opId(), listener.failures.get(0).opId());

        autosave.retry();
        scheduler.runPending();
        assertEquals(SaveState.SAVED, autosave.state());
        assertEquals(text("a"), server.content);
    }

    @Test
    void client_errors_are_not_retried() {
        server.injected.add(new RemoteCallException(400, "content must not contain null blocks"));

        edit("a");
        scheduler.advanceMillis(60_000);

        assertEquals(1, server.requests.size());
        assertEquals(SaveState.ERROR, autosave.state());
        assertEquals(1, listener.failures.get(0).attempts());
    }

    // ---------- offline queue ----------

    @Test
    void transport_failure_parks_the_write_and_later_edits_queue_behind_it() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        assertEquals(SaveState.OFFLINE, autosave.state());
        assertEquals(1, autosave.queuedWrites());

        server.offline = false;
        edit("b");
        scheduler.advanceMillis(1500);

        assertEquals(1, server.requests.size(), "queued behind the parked write, not sent");
        assertEquals(2, autosave.queuedWrites());
        assertEquals(SaveState.OFFLINE, autosave.state());
    }

    @Test
    void reconnect_drains_in_order_rebasing_each_entry_under_the_drain_flag() {
        List<Boolean> guardDuringWrites = new ArrayList<>();
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        edit("b");
        scheduler.advanceMillis(1500);
        edit("c");
        scheduler.advanceMillis(1500);
        List<String> queuedOps = queue.entries().stream().map(OfflineQueueEntry::opId).toList();
        server.requests.clear();
        server.offline = false;
        server.beforeWrite = () -> guardDuringWrites.add(guard.isDraining());

        autosave.onReconnect();
        scheduler.runPending();

        assertEquals(3, server.requests.size());
        assertEquals(List.of(text("a"), text("b"), text("c")),
                server.requests.stream().map(WriteRequest::content).toList());
        assertEquals(List.of(0L, 1L, 2L),
                server.requests.stream().map(WriteRequest::baseVersion).toList());
        assertEquals(queuedOps, server.requests.stream().map(WriteRequest::opId).toList());
        assertEquals(List.of(true, true, true), guardDuringWrites);
        assertFalse(guard.isDraining());
        assertEquals(0, autosave.queuedWrites());
        assertEquals(SaveState.SAVED, autosave.state());
        assertEquals(3L, autosave.baseVersion());
    }

    @Test
    void a_write_that_landed_before_the_disconnect_is_not_applied_twice() {
        server.loseNextResponse = true;
        edit("a");
        scheduler.advanceMillis(1500);
        assertEquals(SaveState.OFFLINE, autosave.state());
        assertEquals(1L, server.version, "the write reached the server");

        autosave.onReconnect();
        scheduler.runPending();

        assertEquals(request(0).opId(), request(1).opId());
        assertEquals(1L, server.version);
        assertEquals(1L, autosave.baseVersion());
        assertEquals(SaveState.SAVED, autosave.state());
    }

    @Test
    void drain_conflict_fast_forwards_once_then_keeps_the_entry_for_the_user() throws Exception {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        server.offline = false;
        server.beforeWrite = () -> server.externalWrite(text("theirs"));

        autosave.onReconnect();
        scheduler.runPending();

        assertEquals(SaveState.CONFLICT, autosave.state());
        assertEquals(1, autosave.queuedWrites(), "entry kept, never dropped silently");
        assertEquals(1, listener.conflicts.size());
        assertFalse(guard.isDraining());

        autosave.acceptServerVersion();
        scheduler.runPending();
        assertEquals(0, autosave.queuedWrites());
        assertEquals(SaveState.IDLE, autosave.state());
    }

    @Test
    void drain_waits_out_a_rate_limit_and_retries_the_same_entry() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        edit("b");
        scheduler.advanceMillis(1500);
        server.requests.clear();
        server.offline = false;
        server.injected.add(new WriteResult.RateLimited(Duration.ofSeconds(2)));

        autosave.onReconnect();
        scheduler.runPending();
        assertEquals(SaveState.RATE_LIMITED, autosave.state());
        assertTrue(guard.isDraining(), "still draining while waiting");

        scheduler.advanceMillis(2000);

        assertEquals(3, server.requests.size());
        assertEquals(request(0).opId(), request(1).opId());
        assertEquals(text("b"), request(2).content());
        assertEquals(0, autosave.queuedWrites());
    }

    @Test
    void drain_entry_that_keeps_failing_is_surfaced_and_kept() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        server.offline = false;
        for (int i = 0; i < 3; i++) {
            server.injected.add(new RemoteCallException(503, "down"));
        }

        autosave.onReconnect();
        scheduler.runPending();
        scheduler.advanceMillis(2000);
        scheduler.advanceMillis(4000);

        assertEquals(SaveState.ERROR, autosave.state());
        assertEquals(1, listener.failures.size());
        assertEquals(3, queue.peek().orElseThrow().retryCount());

        autosave.retry();
        scheduler.runPending();
        assertEquals(0, autosave.queuedWrites());
        assertEquals(SaveState.SAVED, autosave.state());
    }

    @Test
    void still_offline_on_reconnect_keeps_everything_queued() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);

        autosave.onReconnect();
        scheduler.runPending();

        assertEquals(SaveState.OFFLINE, autosave.state());
        assertEquals(1, autosave.queuedWrites());
        assertFalse(guard.isDraining());
    }

    @Test
    void queued_writes_survive_a_restart() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        autosave.close();
        scheduler.runPending();
        server.offline = false;

        var reopened = newCoordinator(new FileOfflineQueue(dir, "doc"));
        assertEquals(SaveState.OFFLINE, reopened.state());
        reopened.onReconnect();
        scheduler.runPending();

        assertEquals(0, reopened.queuedWrites());
        assertEquals(text("a"), server.content);
        assertTrue(new FileOfflineQueue(dir, "doc").isEmpty());
    }

    @Test
    void queue_entries_carry_enqueue_metadata() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);

        OfflineQueueEntry e = queue.peek().orElseThrow();
        assertEquals("doc", e.documentId());
        assertEquals(0L, e.baseVersionAtEnqueue());
        assertEquals(0, e.retryCount());
        assertEquals(Instant.parse("2024-05-01T10:00:01.500Z"), e.enqueueTime());
    }

    @Test
    void fast_forward_carries_the_latest_local_content() {
        server.externalWrite(text("theirs"));
        boolean[] typed = {false};
        server.beforeWrite = () -> {
            if (!typed[0]) {
                typed[0] = true;
                editor.set(text("mine, kept typing"));
            }
        };

        edit("mine");
        scheduler.advanceMillis(1500);

        assertEquals(2, server.requests.size());
        assertEquals(text("mine"), request(0).content());
        assertEquals(text("mine, kept typing"), request(1).content());
        assertEquals(text("mine, kept typing"), server.content);
        scheduler.advanceMillis(10_000);
        assertEquals(2, server.requests.size(), "nothing left over to save");
    }

    @Test
    void a_limiter_that_never_admits_ends_in_error() {
        for (int i = 0; i < 4; i++) {
            server.injected.add(new WriteResult.RateLimited(Duration.ofSeconds(1)));
        }

        edit("a");
        scheduler.advanceMillis(1500);
        scheduler.advanceMillis(1000);
        scheduler.advanceMillis(1000);
        scheduler.advanceMillis(1000);

        assertEquals(4, server.requests.size());
        assertEquals(SaveState.ERROR, autosave.state());
        assertEquals(1, listener.failures.size());
        assertEquals(4, listener.failures.get(0).attempts());

        scheduler.advanceMillis(60_000);
        assertEquals(4, server.requests.size(), "no retries after giving up");

        autosave.retry();
        scheduler.runPending();
        assertEquals(SaveState.SAVED, autosave.state());
    }

    @Test
    void drain_gives_up_on_an_entry_the_limiter_keeps_refusing() {
        server.offline = true;
        edit("a");
        scheduler.advanceMillis(1500);
        server.offline = false;
        for (int i = 0; i < 4; i++) {
            server.injected.add(new WriteResult.RateLimited(Duration.ofSeconds(1)));
        }

        autosave.onReconnect();
        scheduler.runPending();
        scheduler.advanceMillis(3000);

        assertEquals(SaveState.ERROR, autosave.state());
        assertEquals(1, autosave.queuedWrites(), "entry kept for a later retry");
        assertFalse(guard.isDraining());
        assertEquals(4, listener.failures.get(0).attempts());
    }
}
