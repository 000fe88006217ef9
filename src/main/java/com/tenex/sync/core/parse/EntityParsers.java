package com.tenex.sync.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenex.sync.core.entity.AgentProfile;
import com.tenex.sync.core.entity.Conversation;
import com.tenex.sync.core.entity.Lesson;
import com.tenex.sync.core.entity.LlmConfigChange;
import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.ProjectStatus;
import com.tenex.sync.core.entity.ProjectStatus.AgentAvailability;
import com.tenex.sync.core.entity.Task;
import com.tenex.sync.core.entity.TaskAbortSignal;
import com.tenex.sync.core.entity.ThreadReply;
import com.tenex.sync.core.entity.TypingSignal;
import com.tenex.sync.core.identity.AddressableId;
import com.tenex.sync.core.model.RecordKind;
import com.tenex.sync.core.model.SyncRecord;
import com.tenex.sync.core.model.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * =====================================================================
 * EntityParsers
 * =====================================================================
 *
 * PURPOSE ------- One total parse function per entity type. Each is usable
 * as a {@code Function<SyncRecord, T>} via method reference, e.g.
 * {@code EntityParsers::project}.
 *
 * EXTRACTION RULES ---------------- - Scalar field: first tag group with the
 * designated key, second element, else the documented default - List field:
 * second element of every matching group, tag order kept - Project references
 * ({@code a} tags): normalized to {@code kind:creator:slug}, relay hints
 * dropped
 *
 * The tag keys used here are a wire contract shared with
 * {@link com.tenex.sync.core.build.EntityBuilders}; see {@link TagKeys}.
 */
public final class EntityParsers {

	private EntityParsers() {
	}

	/**
	 * Defaults: slug {@code ""}, title = slug, description absent when content is
	 * empty.
	 */
	public static Project project(SyncRecord r) {
		List<List<String>> tags = r.tags();
		String slug = Tags.value(tags, TagKeys.SLUG).orElse("");
		return new Project(
				AddressableId.of(r.kind(), r.creator(), slug).toString(),
				r.creator(),
				slug,
				Tags.value(tags, TagKeys.TITLE).orElse(slug),
				r.content().isEmpty() ? null : r.content(),
				Tags.value(tags, TagKeys.REPO).orElse(null),
				Tags.value(tags, TagKeys.PICTURE).orElse(null),
				nonBlank(Tags.tail(tags, TagKeys.HASHTAGS)),
				Tags.values(tags, TagKeys.AGENT),
				Tags.values(tags, TagKeys.TOOL),
				r.createdAt());
	}

	/**
	 * A record carrying {@code ["e", <id>, "", "conversation"]} is an update of that
	 * conversation (title backfill); otherwise the record itself is the
	 * conversation. Title defaults to the first content line, then
	 * {@link Conversation#UNTITLED}.
	 */
	public static Conversation conversation(SyncRecord r) {
		List<List<String>> tags = r.tags();
		String id = Tags.marked(tags, TagKeys.EVENT, TagKeys.MARKER_CONVERSATION).orElse(r.id());
		String title = Tags.value(tags, TagKeys.TITLE).orElseGet(() -> firstLine(r.content()));
		return new Conversation(
				id,
				projectRef(tags),
				r.creator(),
				title.isBlank() ? Conversation.UNTITLED : title,
				r.content(),
				Tags.values(tags, TagKeys.PUBKEY),
				r.createdAt(),
				r.createdAt());
	}

	/**
	 * A record carrying {@code ["e", <taskId>, "", "task"]} is an update of that
	 * task. An unmarked {@code e} tag is the related conversation.
	 */
	public static Task task(SyncRecord r) {
		List<List<String>> tags = r.tags();
		return new Task(
				Tags.marked(tags, TagKeys.EVENT, TagKeys.MARKER_TASK).orElse(r.id()),
				projectRef(tags),
				r.creator(),
				Tags.value(tags, TagKeys.TITLE).orElse(Task.UNTITLED),
				r.content(),
				Tags.value(tags, TagKeys.STATUS).orElse(null),
				Tags.values(tags, TagKeys.PUBKEY),
				Tags.value(tags, TagKeys.BRANCH).orElse(null),
				Tags.unmarked(tags, TagKeys.EVENT).orElse(null),
				r.createdAt());
	}

	public static AgentProfile agentProfile(SyncRecord r) {
		List<List<String>> tags = r.tags();
		String id = Tags.value(tags, TagKeys.SLUG).orElse(r.id());
		return new AgentProfile(
				AddressableId.of(r.kind(), r.creator(), id).toString(),
				id,
				r.creator(),
				Tags.value(tags, TagKeys.TITLE).orElse(AgentProfile.UNTITLED),
				r.content(),
				Tags.value(tags, TagKeys.DESCRIPTION).orElse(null),
				Tags.value(tags, TagKeys.ROLE).orElse(null),
				Tags.value(tags, TagKeys.USE_CRITERIA).orElse(null),
				Tags.value(tags, TagKeys.VERSION).orElse(null),
				Tags.values(tags, TagKeys.LABEL),
				r.createdAt());
	}

	/**
	 * Agents are {@code ["agent", <pubkey>, <slug>]}; groups shorter than that are
	 * skipped. The slug doubles as display name. An empty project identity means
	 * the record cannot be attributed and callers drop it.
	 */
	public static ProjectStatus projectStatus(SyncRecord r) {
		List<AgentAvailability> agents = new ArrayList<>();
		for (List<String> g : Tags.groups(r.tags(), TagKeys.AGENT)) {
			if (g.size() >= 3 && !g.get(1).isBlank()) {
				agents.add(new AgentAvailability(g.get(1), g.get(2), g.get(2)));
			}
		}
		return new ProjectStatus(projectRef(r.tags()), r.createdAt(), agents);
	}

	/**
	 * Stop records ({@link RecordKind#TYPING_STOP}) parse to an inactive signal.
	 */
	public static TypingSignal typingSignal(SyncRecord r) {
		List<List<String>> tags = r.tags();
		return new TypingSignal(
				Tags.value(tags, TagKeys.EVENT).orElse(""),
				projectRef(tags),
				r.creator(),
				r.content(),
				Tags.value(tags, TagKeys.PHASE).orElse(null),
				r.kind() != RecordKind.TYPING_STOP,
				r.createdAt());
	}

	public static TaskAbortSignal taskAbort(SyncRecord r) {
		return new TaskAbortSignal(r.id(), Tags.value(r.tags(), TagKeys.EVENT).orElse(""), r.creator(),
				r.createdAt());
	}

	/**
	 * Content is JSON {@code {title, content}}. Missing JSON fields fall back to the
	 * {@code title} tag and the raw content; non-JSON content is used as-is.
	 */
	public static Lesson lesson(SyncRecord r) {
		List<List<String>> tags = r.tags();
		Optional<JsonNode> json = JsonContent.object(r.content());
		String fallbackTitle = Tags.value(tags, TagKeys.TITLE).orElse(Lesson.UNTITLED);
		String title = json.flatMap(j -> JsonContent.text(j, "title")).orElse(fallbackTitle);
		String content = json.flatMap(j -> JsonContent.text(j, "content")).orElse(r.content());
		return new Lesson(
				r.id(),
				r.creator(),
				projectRef(tags),
				title,
				content,
				Tags.value(tags, TagKeys.AGENT_NAME).orElse(null),
				Tags.value(tags, TagKeys.LESSON_TYPE).orElse(null),
				r.createdAt());
	}

	/**
	 * Root: {@code E} tag, else {@code e} marked "root", else the first {@code e}.
	 * Parent: {@code e} marked "reply", else the first {@code e}, else the root.
	 */
	public static ThreadReply threadReply(SyncRecord r) {
		List<List<String>> tags = r.tags();
		String root = Tags.value(tags, TagKeys.ROOT)
				.or(() -> Tags.marked(tags, TagKeys.EVENT, TagKeys.MARKER_ROOT))
				.or(() -> Tags.value(tags, TagKeys.EVENT))
				.orElse("");
		String parent = Tags.marked(tags, TagKeys.EVENT, TagKeys.MARKER_REPLY)
				.or(() -> Tags.value(tags, TagKeys.EVENT))
				.orElse(root);
		return new ThreadReply(r.id(), root, parent, projectRef(tags), r.creator(), r.content(), r.createdAt());
	}

	/**
	 * Content is JSON {@code {model, temperature, maxTokens, provider}}; anything
	 * else leaves every setting absent.
	 */
	public static LlmConfigChange llmConfigChange(SyncRecord r) {
		Optional<JsonNode> json = JsonContent.object(r.content());
		return new LlmConfigChange(
				projectRef(r.tags()),
				json.flatMap(j -> JsonContent.text(j, "model")).orElse(null),
				json.flatMap(j -> JsonContent.decimal(j, "temperature")).orElse(null),
				json.flatMap(j -> JsonContent.integer(j, "maxTokens")).orElse(null),
				json.flatMap(j -> JsonContent.text(j, "provider")).orElse(null),
				r.createdAt());
	}

	private static String projectRef(List<List<String>> tags) {
		return AddressableId.normalize(Tags.value(tags, TagKeys.ADDRESS).orElse(""));
	}

	private static String firstLine(String content) {
		int nl = content.indexOf('\n');
		return (nl < 0 ? content : content.substring(0, nl)).strip();
	}

	private static List<String> nonBlank(List<String> values) {
		return values.stream().map(String::strip).filter(v -> !v.isEmpty()).toList();
	}
}
