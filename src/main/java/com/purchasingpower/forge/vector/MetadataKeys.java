package com.purchasingpower.forge.vector;

/**
 * Metadata keys written to the vector collections.
 */
public final class MetadataKeys {

    public static final String SOURCE_ID = "source_filename";
    public static final String HEADER_PATH = "header_path";
    public static final String CONTEXT_HEADER = "context_header";
    public static final String PARENT_TEXT = "parent_text";
    public static final String PARENT_ID = "parent_id";
    public static final String LEAF_INDEX = "leaf_index";

    public static final String TURN_NUMBER = "turn_number";
    public static final String ACTIVE_PROBE = "active_probe";
    public static final String ACTIVE_MODE = "active_mode";
    public static final String USER_MESSAGE = "user_message";
    public static final String ASSISTANT_RESPONSE = "assistant_response";

    private MetadataKeys() {
    }
}
