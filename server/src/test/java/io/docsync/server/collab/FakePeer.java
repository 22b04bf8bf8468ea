package io.docsync.server.collab;

import io.docsync.core.frame.Frame;
import io.docsync.core.frame.FrameType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Peer that records what the session sends it. */
final class FakePeer implements Peer {
    private final String id;
    private final String userId;
    final List<Frame> received = new CopyOnWriteArrayList<>();
    volatile String closedWith;

    FakePeer(String id, String userId) {
        this.id = id;
        this.userId = userId;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public void send(Frame frame) {
        received.add(frame);
    }

    @Override
    public void close(String reason) {
        closedWith = reason;
    }

    List<Frame> ofType(FrameType type) {
        return received.stream().filter(f -> f.type() == type).toList();
    }

    Frame last() {
        return received.get(received.size() - 1);
    }
}
