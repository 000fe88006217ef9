package com.tenex.sync.core.build;

import com.tenex.sync.core.entity.ProjectStatus.AgentAvailability;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.parse.JsonContent;
import com.tenex.sync.core.parse.TagKeys;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * =====================================================================
 * EntityBuilders
 * =====================================================================
 *
 * PURPOSE ------- Inverse of {@link com.tenex.sync.core.parse.EntityParsers}:
 * turns a local mutation intent into an unsigned outgoing record.
 *
 * GUARANTEES ---------- - Pure and deterministic: same intent, same record -
 * No side effects: signing and transmission belong to the transport - Symmetric:
 * parsing a built record yields the entity the intent describes, because both
 * sides share {@link TagKeys}
 */
public final class EntityBuilders {

	/** Content of a task abort record. */
	public static final String ABORT_CONTENT = "abort";

	private EntityBuilders() {
	}

	public static SyncRecord project(ProjectIntent i) {
		RecordDraft d = RecordDraft.kind(RecordKind.PROJECT)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.description())
				.tag(TagKeys.SLUG, i.slug())
				.tag(TagKeys.TITLE, i.title())
				.tag(TagKeys.REPO, i.repoUrl())
				.tag(TagKeys.PICTURE, i.picture());
		if (i.hashtags() != null && !i.hashtags().isEmpty()) {
			d.group(TagKeys.HASHTAGS, i.hashtags().toArray(String[]::new));
		}
		return d.each(TagKeys.AGENT, i.agentIds())
				.each(TagKeys.TOOL, i.toolIds())
				.build();
	}

	public static SyncRecord conversation(ConversationIntent i) {
		return RecordDraft.kind(RecordKind.CONVERSATION)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.content())
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.tag(TagKeys.TITLE, i.title())
				.each(TagKeys.PUBKEY, i.mentionedAgentIds())
				.build();
	}

	public static SyncRecord conversationTitle(ConversationTitleIntent i) {
		return RecordDraft.kind(RecordKind.CONVERSATION)
				.author(i.author())
				.createdAt(i.createdAt())
				.group(TagKeys.EVENT, i.conversationId(), "", TagKeys.MARKER_CONVERSATION)
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.tag(TagKeys.TITLE, i.title())
				.build();
	}

	public static SyncRecord task(TaskIntent i) {
		return RecordDraft.kind(RecordKind.TASK)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.content())
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.tag(TagKeys.TITLE, i.title())
				.tag(TagKeys.STATUS, i.status())
				.each(TagKeys.PUBKEY, i.assignees())
				.tag(TagKeys.BRANCH, i.branch())
				.tag(TagKeys.EVENT, i.conversationId())
				.build();
	}

	public static SyncRecord taskUpdate(TaskUpdateIntent i) {
		return RecordDraft.kind(RecordKind.TASK)
				.author(i.author())
				.createdAt(i.createdAt())
				.group(TagKeys.EVENT, i.taskId(), "", TagKeys.MARKER_TASK)
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.tag(TagKeys.STATUS, i.status())
				.each(TagKeys.PUBKEY, i.assignees())
				.tag(TagKeys.BRANCH, i.branch())
				.build();
	}

	public static SyncRecord agentProfile(AgentProfileIntent i) {
		return RecordDraft.kind(RecordKind.AGENT_PROFILE)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.instructionsMarkdown())
				.tag(TagKeys.SLUG, i.agentId())
				.tag(TagKeys.TITLE, i.displayName())
				.tag(TagKeys.DESCRIPTION, i.description())
				.tag(TagKeys.ROLE, i.role())
				.tag(TagKeys.USE_CRITERIA, i.usageCriteria())
				.tag(TagKeys.VERSION, i.version())
				.each(TagKeys.LABEL, i.labels())
				.build();
	}

	public static SyncRecord projectStatus(ProjectStatusIntent i) {
		RecordDraft d = RecordDraft.kind(RecordKind.PROJECT_STATUS)
				.author(i.author())
				.createdAt(i.createdAt())
				.tag(TagKeys.ADDRESS, i.projectIdentity());
		for (AgentAvailability a : i.agents()) {
			d.group(TagKeys.AGENT, a.agentId(), a.slug());
		}
		return d.build();
	}

	public static SyncRecord typing(TypingIntent i) {
		return RecordDraft.kind(i.typing() ? RecordKind.TYPING_START : RecordKind.TYPING_STOP)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.message())
				.tag(TagKeys.EVENT, i.conversationId())
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.tag(TagKeys.PHASE, i.phase())
				.build();
	}

	public static SyncRecord taskAbort(TaskAbortIntent i) {
		return RecordDraft.kind(RecordKind.TASK_ABORT)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(ABORT_CONTENT)
				.group(TagKeys.EVENT, i.taskId(), "", TagKeys.MARKER_TASK)
				.build();
	}

	/**
	 * The title travels both in the JSON content and as a {@code title} tag, so
	 * clients that do not decode the content still show it.
	 */
	public static SyncRecord lesson(LessonIntent i) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("title", i.title());
		body.put("content", i.content());
		return RecordDraft.kind(RecordKind.AGENT_LESSON)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(JsonContent.write(body))
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.tag(TagKeys.TITLE, i.title())
				.tag(TagKeys.AGENT_NAME, i.agentName())
				.tag(TagKeys.LESSON_TYPE, i.lessonType())
				.build();
	}

	public static SyncRecord threadReply(ThreadReplyIntent i) {
		String parent = i.parentId() == null || i.parentId().isBlank() ? i.rootId() : i.parentId();
		return RecordDraft.kind(RecordKind.THREAD_REPLY)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.content())
				.tag(TagKeys.ROOT, i.rootId())
				.group(TagKeys.EVENT, parent, "", TagKeys.MARKER_REPLY)
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.build();
	}

	public static SyncRecord llmConfig(LlmConfigIntent i) {
		Map<String, Object> body = new LinkedHashMap<>();
		putIfPresent(body, "model", i.model());
		putIfPresent(body, "temperature", i.temperature());
		putIfPresent(body, "maxTokens", i.maxTokens());
		putIfPresent(body, "provider", i.provider());
		return RecordDraft.kind(RecordKind.LLM_CONFIG_CHANGE)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(JsonContent.write(body))
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.build();
	}

	public static SyncRecord projectControl(ProjectControlIntent i) {
		return RecordDraft.kind(RecordKind.PROJECT_CONTROL)
				.author(i.author())
				.createdAt(i.createdAt())
				.content(i.command().name())
				.tag(TagKeys.ADDRESS, i.projectIdentity())
				.build();
	}

	private static void putIfPresent(Map<String, Object> body, String key, Object value) {
		if (value != null) {
			body.put(key, value);
		}
	}
}
