package io.docsync.client.live;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollabSocketSpec {

    @Test
    void document_id_is_one_percent_encoded_segment() {
        assertEquals("/collab/my%20doc", CollabSocket.collabUri("ws://localhost:8080/", "my doc").getRawPath());
        assertEquals("/collab/a%2Bb", CollabSocket.collabUri("ws://localhost:8080", "a+b").getRawPath());
        assertEquals("/collab/notes%2Ftoday", CollabSocket.collabUri("ws://localhost:8080", "notes/today").getRawPath());
    }
}
