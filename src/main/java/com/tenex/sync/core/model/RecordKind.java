package com.tenex.sync.core.model;

/**
 * =====================================================================
 * RecordKind
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Canonical vocabulary of record kinds understood by the synchronization core.
 *
 * These values are written by other clients and agents, so they are a wire
 * contract, not a convenience:
 *  - Values MUST NOT change
 *  - New kinds are added, never renumbered
 *
 * RANGES
 * ------
 *  - below 10000      regular records, stored by relays
 *  - 20000 .. 29999   ephemeral records (presence, signals), not stored
 *  - 30000 .. 39999   addressable records, unique per kind + creator + "d" tag
 */
public final class RecordKind {

    private RecordKind() {}

    /** Root of a conversation (chat thread). */
    public static final int CONVERSATION = 11;

    /** Reply inside a thread (conversation replies, lesson comments). */
    public static final int THREAD_REPLY = 1111;

    /** Task, and updates referencing an existing task. */
    public static final int TASK = 1934;

    /** Lesson learned by an agent. */
    public static final int AGENT_LESSON = 4129;

    /** Agent definition / profile. */
    public static final int AGENT_PROFILE = 4199;

    /** Project start/stop request. Ephemeral. */
    public static final int PROJECT_CONTROL = 24001;

    /** Project status snapshot (available agents). Ephemeral. */
    public static final int PROJECT_STATUS = 24010;

    /** LLM configuration change for a project. Ephemeral. */
    public static final int LLM_CONFIG_CHANGE = 24020;

    /** An agent started typing in a conversation. Ephemeral. */
    public static final int TYPING_START = 24111;

    /** An agent stopped typing in a conversation. Ephemeral. */
    public static final int TYPING_STOP = 24112;

    /** Abort instruction for a running task. Ephemeral. */
    public static final int TASK_ABORT = 24133;

    /** Project definition. Addressable. */
    public static final int PROJECT = 31933;

    public static boolean isEphemeral(int kind) {
        return kind >= 20000 && kind < 30000;
    }

    public static boolean isAddressable(int kind) {
        return kind >= 30000 && kind < 40000;
    }
}
