package com.tenex.sync.core.parse;

/**
 * Tag-key vocabulary shared by parsers and builders. Both sides reference these constants so the
 * two directions cannot drift apart.
 */
public final class TagKeys {

    private TagKeys() {}

    public static final String SLUG = "d";
    public static final String ADDRESS = "a";
    public static final String EVENT = "e";
    public static final String ROOT = "E";
    public static final String PUBKEY = "p";
    public static final String LABEL = "t";

    public static final String TITLE = "title";
    public static final String REPO = "repo";
    public static final String PICTURE = "picture";
    public static final String HASHTAGS = "hashtags";
    public static final String AGENT = "agent";
    public static final String TOOL = "mcp";
    public static final String STATUS = "status";
    public static final String BRANCH = "branch";
    public static final String DESCRIPTION = "description";
    public static final String ROLE = "role";
    public static final String USE_CRITERIA = "use-criteria";
    public static final String VERSION = "ver";
    public static final String PHASE = "phase";
    public static final String AGENT_NAME = "agent-name";
    public static final String LESSON_TYPE = "lesson-type";

    /** Marker of an {@code e} tag that points at the task a record updates or aborts. */
    public static final String MARKER_TASK = "task";
    /** Marker of an {@code e} tag that points at the conversation a record updates. */
    public static final String MARKER_CONVERSATION = "conversation";
    public static final String MARKER_ROOT = "root";
    public static final String MARKER_REPLY = "reply";
}
