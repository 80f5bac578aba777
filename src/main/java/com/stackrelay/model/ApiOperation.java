package com.stackrelay.model;

/**
 * Stack Exchange API operations issued through the dispatcher.
 *
 * Paths are relative to the configured base URL. {@code {ids}} is filled from the
 * request parameter of the same name.
 */
public enum ApiOperation {
    SEARCH_QUESTIONS("search/advanced"),
    SEARCH_BY_TAGS("search/advanced"),
    QUESTION_DETAILS("questions/{ids}"),
    QUESTION_ANSWERS("questions/{ids}/answers"),
    API_INFO("info");

    public static final String IDS_PARAM = "ids";

    private final String path;

    ApiOperation(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public boolean hasIdsVariable() {
        return path.contains("{" + IDS_PARAM + "}");
    }
}
