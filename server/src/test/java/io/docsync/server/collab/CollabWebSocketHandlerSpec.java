package io.docsync.server.collab;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollabWebSocketHandlerSpec {

    @Test
    void document_id_is_the_last_path_segment() {
        assertEquals("doc-1", CollabWebSocketHandler.documentIdFrom("/collab/doc-1"));
        assertEquals("doc-1", CollabWebSocketHandler.documentIdFrom("/collab/doc-1?token=x"));
        assertEquals("doc-1", CollabWebSocketHandler.documentIdFrom("ws://host:8080/collab/doc-1"));
    }

    @Test
    void malformed_paths_have_no_document_id() {
        assertNull(CollabWebSocketHandler.documentIdFrom(null));
        assertNull(CollabWebSocketHandler.documentIdFrom("/collab/"));
        assertNull(CollabWebSocketHandler.documentIdFrom("/collab/a/b"));
        assertNull(CollabWebSocketHandler.documentIdFrom("/documents/doc-1"));
    }

    @Test
    void escaped_ids_decode_like_rest_paths() {
        assertEquals("my doc", CollabWebSocketHandler.documentIdFrom("/collab/my%20doc"));
        assertEquals("a+b", CollabWebSocketHandler.documentIdFrom("/collab/a+b"));
        assertEquals("caf\u00e9", CollabWebSocketHandler.documentIdFrom("/collab/caf%C3%A9"));
        assertNull(CollabWebSocketHandler.documentIdFrom("/collab/bad%2"));
        assertNull(CollabWebSocketHandler.documentIdFrom("/collab/%20"));
    }
}
