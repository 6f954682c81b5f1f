package domain.id;

import domain.change.RenumberDirectiveParser;

import java.util.Locale;

/**
 * Classification of the text found in an id column or a {@code parent} attribute.
 */
public enum IdentifierToken {

    /** All digits: already a final article id. */
    NUMERIC_LITERAL,

    /** {@code ID...} / {@code TEMP...}: stands for an id allocated during the run. */
    TEMPORARY,

    /** A bulk reordering instruction, not an identifier at all. */
    RENUMBER_DIRECTIVE,

    /** Blank or any other shape. */
    UNRESOLVED;

    private static final String[] TEMPORARY_PREFIXES = {"ID", "TEMP"};

    public static IdentifierToken classify(String raw) {
        if (raw == null || raw.isBlank()) return UNRESOLVED;
        String t = raw.trim();
        if (isAllDigits(t)) return NUMERIC_LITERAL;
        if (isTemporary(t)) return TEMPORARY;
        if (RenumberDirectiveParser.isDirective(t)) return RENUMBER_DIRECTIVE;
        return UNRESOLVED;
    }

    /**
     * Registry key of a temporary token: trimmed and upper-cased.
     */
    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }

    static boolean isAllDigits(String t) {
        if (t.isEmpty()) return false;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    static boolean isTemporary(String t) {
        String u = t.toUpperCase(Locale.ROOT);
        for (String p : TEMPORARY_PREFIXES) {
            if (u.startsWith(p)) return true;
        }
        return false;
    }
}
