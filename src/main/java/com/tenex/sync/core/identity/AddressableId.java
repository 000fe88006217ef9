package com.tenex.sync.core.identity;

import java.util.Objects;

/**
 * =====================================================================
 * AddressableId
 * =====================================================================
 *
 * PURPOSE ------- Stable identity of a mutable logical entity that is unique
 * per creator and slug, e.g. a project. Several records may carry the same
 * addressable identity; the one with the largest creation timestamp wins.
 *
 * CANONICAL FORMAT (LOCKED) ------------------------
 *
 * <kind>:<creator>:<slug>
 *
 * Token Count: EXACTLY 3 in canonical form. References found in {@code a}
 * tags may carry a trailing relay hint ({@code kind:creator:slug:wss://...});
 * the hint is discarded when the reference is resolved, so the same entity
 * always maps to one identity string.
 *
 * IMMUTABILITY ------------ Java record, safe to use as a map key.
 */
public record AddressableId(int kind, String creator, String slug) {

	public AddressableId {
		Objects.requireNonNull(creator, "creator");
		Objects.requireNonNull(slug, "slug");
	}

	public static AddressableId of(int kind, String creator, String slug) {
		return new AddressableId(kind, creator, slug);
	}

	/**
	 * Attempts to parse a reference into an identity.
	 *
	 * BEHAVIOR -------- - Returns null if the reference is null, has fewer than 3
	 * segments, or its kind is not numeric - Ignores everything after the third
	 * segment
	 *
	 * NOTE ---- NON-THROWING so parsers can use it on untrusted tags.
	 */
	public static AddressableId tryParse(String reference) {
		if (reference == null) {
			return null;
		}
		String[] t = reference.trim().split(":", 4);
		if (t.length < 3) {
			return null;
		}
		try {
			return new AddressableId(Integer.parseInt(t[0]), t[1], t[2]);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * Reduces a reference to its canonical {@code kind:creator:slug} form.
	 *
	 * References with fewer than three segments are returned trimmed and otherwise
	 * untouched; null becomes the empty string.
	 */
	public static String normalize(String reference) {
		if (reference == null) {
			return "";
		}
		String trimmed = reference.trim();
		String[] t = trimmed.split(":", 4);
		if (t.length < 3) {
			return trimmed;
		}
		return t[0] + ":" + t[1] + ":" + t[2];
	}

	/**
	 * @return canonical identity string
	 */
	@Override
	public String toString() {
		return kind + ":" + creator + ":" + slug;
	}
}
