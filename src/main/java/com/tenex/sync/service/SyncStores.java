package com.tenex.sync.service;

import com.tenex.sync.core.entity.AgentProfile;
import com.tenex.sync.core.entity.Conversation;
import com.tenex.sync.core.entity.Lesson;
import com.tenex.sync.core.entity.LlmConfigChange;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.ProjectStatus;
import com.tenex.sync.core.entity.Task;
import com.tenex.sync.core.entity.ThreadReply;
import com.tenex.sync.core.entity.TypingSignal;
import com.tenex.sync.core.merge.MergeStore;
import com.tenex.sync.core.reduce.ProjectStatusReducer;
import com.tenex.sync.core.reduce.TaskAbortInbox;
import com.tenex.sync.core.reduce.ThreadReplyReducer;
import com.tenex.sync.core.reduce.TypingSignalReducer;

import java.time.Duration;

/**
 * The live entity state of one process: one merge store per entity type, plus the presence
 * reducers layered on top of theirs.
 *
 * <p>These stores are the only shared mutable structures of the synchronization core.</p>
 */
public class SyncStores {

    private final MergeStore<Project> projects = new MergeStore<>("projects");
    private final MergeStore<Conversation> conversations = new MergeStore<>("conversations");
    private final MergeStore<Task> tasks = new MergeStore<>("tasks");
    private final MergeStore<AgentProfile> agents = new MergeStore<>("agents");
    private final MergeStore<Lesson> lessons = new MergeStore<>("lessons");
    private final MergeStore<LlmConfigChange> llmConfigs = new MergeStore<>("llm-configs");
    private final MergeStore<ProjectStatus> statusStore = new MergeStore<>("project-status");
    private final MergeStore<TypingSignal> typingStore = new MergeStore<>("typing");
    private final MergeStore<ThreadReply> replyStore = new MergeStore<>("replies");

    private final ProjectStatusReducer statuses;
    private final TypingSignalReducer typing;
    private final ThreadReplyReducer replies;
    private final TaskAbortInbox aborts;

    public SyncStores(Duration statusFreshness, Duration typingValidity, int abortDedupWindow) {
        this.statuses = new ProjectStatusReducer(statusStore, statusFreshness);
        this.typing = new TypingSignalReducer(typingStore, typingValidity);
        this.replies = new ThreadReplyReducer(replyStore);
        this.aborts = new TaskAbortInbox(abortDedupWindow);
    }

    public MergeStore<Project> projects() { return projects; }

    public MergeStore<Conversation> conversations() { return conversations; }

    public MergeStore<Task> tasks() { return tasks; }

    public MergeStore<AgentProfile> agents() { return agents; }

    public MergeStore<Lesson> lessons() { return lessons; }

    public MergeStore<LlmConfigChange> llmConfigs() { return llmConfigs; }

    public MergeStore<ProjectStatus> statusStore() { return statusStore; }

    public MergeStore<TypingSignal> typingStore() { return typingStore; }

    public MergeStore<ThreadReply> replyStore() { return replyStore; }

    public ProjectStatusReducer statuses() { return statuses; }

    public TypingSignalReducer typing() { return typing; }

    public ThreadReplyReducer replies() { return replies; }

    public TaskAbortInbox aborts() { return aborts; }
}
