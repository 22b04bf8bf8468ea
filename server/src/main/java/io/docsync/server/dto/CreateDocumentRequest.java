package io.docsync.server.dto;

import io.docsync.core.ContentBlock;

import java.util.List;

/** JSON body for PUT /documents/{id}. */
public class CreateDocumentRequest {
    public List<ContentBlock> content;
}
