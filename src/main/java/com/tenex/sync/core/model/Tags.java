package com.tenex.sync.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tag lookup rules shared by every parser.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A tag group is matched by its first element (the key).</li>
 *   <li>A scalar lookup takes the <b>first</b> matching group and returns its second element.
 *       A matching group without a second element, or with a blank one, resolves to empty.
 *       Later groups with the same key are not consulted.</li>
 *   <li>A list lookup collects the second element of <b>every</b> matching group, in tag order,
 *       skipping groups with fewer than two elements.</li>
 *   <li>Nothing here throws. Absent or malformed tags resolve to empty.</li>
 * </ul>
 */
public final class Tags {

    /** Position of the marker element in reference tags: {@code ["e", id, relay, marker]}. */
    private static final int MARKER_INDEX = 3;

    private Tags() {}

    /**
     * First value of {@code key}, if present and non-blank.
     */
    public static Optional<String> value(List<List<String>> tags, String key) {
        for (List<String> group : tags) {
            if (matches(group, key)) {
                if (group.size() < 2 || group.get(1).isBlank()) {
                    return Optional.empty();
                }
                return Optional.of(group.get(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Second element of every group keyed {@code key}, in tag order.
     */
    public static List<String> values(List<List<String>> tags, String key) {
        List<String> out = new ArrayList<>();
        for (List<String> group : tags) {
            if (matches(group, key) && group.size() >= 2) {
                out.add(group.get(1));
            }
        }
        return List.copyOf(out);
    }

    /**
     * All groups keyed {@code key}, whole, in tag order.
     */
    public static List<List<String>> groups(List<List<String>> tags, String key) {
        List<List<String>> out = new ArrayList<>();
        for (List<String> group : tags) {
            if (matches(group, key)) {
                out.add(group);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Every element after the key of the first group keyed {@code key}
     * (for multi-valued groups such as {@code ["hashtags", "a", "b"]}).
     */
    public static List<String> tail(List<List<String>> tags, String key) {
        for (List<String> group : tags) {
            if (matches(group, key)) {
                return List.copyOf(group.subList(1, group.size()));
            }
        }
        return List.of();
    }

    /**
     * Value of the first {@code key} group whose marker element equals {@code marker}.
     */
    public static Optional<String> marked(List<List<String>> tags, String key, String marker) {
        for (List<String> group : tags) {
            if (matches(group, key) && group.size() > MARKER_INDEX
                    && marker.equals(group.get(MARKER_INDEX)) && !group.get(1).isBlank()) {
                return Optional.of(group.get(1));
            }
        }
        return Optional.empty();
    }

    /**
     * Value of the first {@code key} group that carries no marker.
     */
    public static Optional<String> unmarked(List<List<String>> tags, String key) {
        for (List<String> group : tags) {
            if (!matches(group, key) || group.size() < 2 || group.get(1).isBlank()) {
                continue;
            }
            if (group.size() <= MARKER_INDEX || group.get(MARKER_INDEX).isBlank()) {
                return Optional.of(group.get(1));
            }
        }
        return Optional.empty();
    }

    private static boolean matches(List<String> group, String key) {
        return !group.isEmpty() && key.equals(group.get(0));
    }
}
