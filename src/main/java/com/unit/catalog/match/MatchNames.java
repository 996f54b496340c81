package com.unit.catalog.match;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic name rewrites used by the matching tiers.
 */
public final class MatchNames {

    private MatchNames() {
    }

    /**
     * Alternatives for dual-named units. {@code "Dasher (Fire Moth) A"} yields
     * {@code ["Dasher A", "Fire Moth A"]}; names without a parenthetical yield nothing.
     */
    public static List<String> dualNameAlternatives(String name) {
        Parenthetical p = Parenthetical.of(name);
        if (p == null || p.before.isEmpty() || p.inside.isEmpty()) {
            return List.of();
        }
        if (p.after.isEmpty()) {
            return List.of(p.before, p.inside);
        }
        return List.of(p.before + " " + p.after, p.inside + " " + p.after);
    }

    /**
     * The alternate (Clan) name of a dual-named unit. Only extracted when a variant suffix
     * follows the parenthetical: {@code "Dasher (Fire Moth) A"} gives {@code "Fire Moth A"},
     * while {@code "Awesome AWS-8Q (Smith)"} names a pilot and gives nothing.
     */
    public static Optional<String> alternateName(String name) {
        Parenthetical p = Parenthetical.of(name);
        if (p == null || p.inside.isEmpty() || p.after.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(p.inside + " " + p.after);
    }

    /**
     * Drops a trailing parenthetical and collapses whitespace.
     */
    public static String normalizeName(String name) {
        String trimmed = name.trim();
        int open = trimmed.lastIndexOf('(');
        String base = open >= 0 ? trimmed.substring(0, open).trim() : trimmed;
        return String.join(" ", base.split("\\s+"));
    }

    /**
     * Lowercase letters and digits only; punctuation and whitespace removed.
     */
    public static String compact(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
            }
        }
        return out.toString();
    }

    public static String lower(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Parenthetical {
        final String before;
        final String inside;
        final String after;

        private Parenthetical(String before, String inside, String after) {
            this.before = before;
            this.inside = inside;
            this.after = after;
        }

        static Parenthetical of(String name) {
            String trimmed = name.trim();
            int open = trimmed.indexOf('(');
            if (open < 0) {
                return null;
            }
            int close = trimmed.indexOf(')', open);
            if (close < 0) {
                return null;
            }
            return new Parenthetical(trimmed.substring(0, open).trim(),
                    trimmed.substring(open + 1, close).trim(),
                    trimmed.substring(close + 1).trim());
        }
    }
}
