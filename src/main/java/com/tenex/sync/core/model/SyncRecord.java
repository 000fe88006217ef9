package com.tenex.sync.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * =====================================================================
 * SyncRecord
 * =====================================================================
 *
 * PURPOSE ------- Represents one **immutable, externally produced record**
 * as delivered by the transport. It is the atomic unit of input for the
 * synchronization core: every entity is derived from one or more of these.
 *
 * This model is: - Transport-neutral (no NATS classes) - Immutable (safe to
 * share between subscription tasks) - Total (null inputs are normalized, never
 * rejected)
 *
 * DELIVERY ASSUMPTIONS -------------------- Records may arrive: - more than
 * once - out of order - from several independent sources
 *
 * Correctness therefore never depends on arrival order, only on
 * {@link #createdAt()} and the identity rules of each entity.
 *
 * TAGS ---- Tags are ordered string arrays looked up by their first element
 * (the tag key). A group {@code [key, v1, v2, ...]} yields {@code v1} as its
 * value. See {@link Tags} for the lookup rules.
 */
public record SyncRecord(

		/**
		 * Record identifier assigned by the signer. Empty for a record that has been
		 * built locally but not signed yet.
		 */
		String id,

		/** Identity (public key) of the creator. */
		String creator,

		/** Record type tag, see {@link RecordKind}. */
		int kind,

		/**
		 * Declared creation timestamp (second precision on the wire). The only
		 * ordering input used by merge.
		 */
		Instant createdAt,

		/** Free-form content, JSON for some kinds. Never null. */
		String content,

		/** Ordered tag groups. Never null, never containing null strings. */
		List<List<String>> tags) {

	public SyncRecord {
		id = id == null ? "" : id;
		creator = creator == null ? "" : creator;
		createdAt = createdAt == null ? Instant.EPOCH : createdAt;
		content = content == null ? "" : content;
		tags = copyTags(tags);
	}

	/**
	 * @return true when the record carries a signer-assigned id
	 */
	public boolean isSigned() {
		return !id.isBlank();
	}

	/**
	 * Returns a copy of this record with the given id and creator, as produced by
	 * a signer.
	 */
	public SyncRecord withSignature(String signedId, String signedCreator) {
		return new SyncRecord(signedId, signedCreator, kind, createdAt, content, tags);
	}

	private static List<List<String>> copyTags(List<List<String>> raw) {
		if (raw == null || raw.isEmpty()) {
			return List.of();
		}
		List<List<String>> out = new ArrayList<>(raw.size());
		for (List<String> group : raw) {
			if (group == null) {
				out.add(List.of());
				continue;
			}
			List<String> copy = new ArrayList<>(group.size());
			for (String v : group) {
				copy.add(v == null ? "" : v);
			}
			out.add(List.copyOf(copy));
		}
		return List.copyOf(out);
	}
}
