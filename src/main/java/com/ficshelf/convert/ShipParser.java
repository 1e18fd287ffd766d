package com.ficshelf.convert;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the free-text character and pairing fields.
 *
 * <p>Pairings are {@code /}-separated, but character names may contain
 * {@code /} themselves ("Max/Jax"). Known slash-containing names are masked
 * with {@link #SLASH_SENTINEL} before the split and unmasked afterwards.</p>
 */
public final class ShipParser {

    /**
     * Stand-in for a slash inside a character name. Contains NUL, which no name can.
     */
    static final String SLASH_SENTINEL = "\u0000SLASH\u0000";

    private ShipParser() {
    }

    /**
     * Comma-separated names to a set of trimmed, non-empty, distinct names (first occurrence order).
     */
    public static Set<String> parseCharacters(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return names;
        }
        for (String part : text.split(",")) {
            String name = part.strip();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Parse a comma-separated list of {@code /}-separated pairings.
     *
     * @param text       the raw ships field, may be null
     * @param characters known character names, used to keep names containing {@code /} whole
     * @return one sorted member list per non-empty pairing, in input order
     */
    public static List<List<String>> parseShips(String text, Collection<String> characters) {
        List<List<String>> ships = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return ships;
        }

        List<String> slashNames = new ArrayList<>();
        if (characters != null) {
            for (String name : characters) {
                if (name != null && name.contains("/")) {
                    slashNames.add(name);
                }
            }
        }
        // longest first, so "A/B/C" is masked before "A/B" can break it up
        slashNames.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));

        for (String entry : text.split(",")) {
            String ship = entry.strip();
            if (ship.isEmpty()) {
                continue;
            }
            for (String name : slashNames) {
                if (ship.contains(name)) {
                    ship = ship.replace(name, name.replace("/", SLASH_SENTINEL));
                }
            }
            List<String> members = new ArrayList<>();
            for (String member : ship.split("/")) {
                String restored = member.replace(SLASH_SENTINEL, "/").strip();
                if (!restored.isEmpty()) {
                    members.add(restored);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            Collections.sort(members);
            ships.add(members);
        }
        return ships;
    }
}
