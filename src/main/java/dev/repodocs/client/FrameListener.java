package dev.repodocs.client;

import tools.jackson.databind.JsonNode;

/**
 * Receives decoded frames in arrival order.
 */
public interface FrameListener {

    void onProgress(int progress, String message);

    /** The generated docs are ready. More frames (a "saved") may still follow. */
    void onDone(JsonNode docs);

    void onError(String message);

    void onSaved(String slug, String repoName);
}
