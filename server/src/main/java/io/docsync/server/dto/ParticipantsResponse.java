package io.docsync.server.dto;

import io.docsync.server.collab.Participant;

import java.util.List;

/** JSON response for GET /documents/{id}/participants. */
public class ParticipantsResponse {
    public String documentId;
    public List<Participant> participants;
}
