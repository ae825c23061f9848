package com.purchasingpower.forge.model.retrieval;

/**
 * A parent section reached through one of its leaves.
 */
public record RetrievedDocument(String sourceId, String contextHeader, String parentId, String parentText, double score) {
}
