package domain.change;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Closed set of phrases recognized in the action and id columns.
 *
 * <p>Change logs are written in Russian; the English phrasing of the same markers is
 * accepted as well. Matching is substring containment on lower-cased text.</p>
 */
public final class ChangePhrases {

    private ChangePhrases() {
    }

    public static final List<String> RENAME = List.of(
            "сменила название на",
            "changed name to"
    );

    public static final List<String> ADD_ARTICLE = List.of(
            "добавление статьи",
            "add article"
    );

    public static final List<String> LOGICAL_DELETE = List.of(
            "логически удаляем из документа",
            "logically deletes from the document"
    );

    public static final List<String> LEVEL_AND_PARENT = List.of(
            "меняет уровень и родителя",
            "меняет уровень, родителя",
            "changes level and parent",
            "changes level, parent"
    );

    /** Generic "changes X, Y" marker; the changed aspects follow it. */
    public static final List<String> CHANGES = List.of(
            "меняет ",
            "changes "
    );

    public static final List<String> ASPECT_NAME = List.of("имя", "название", "name", "title");
    public static final List<String> ASPECT_ORDER = List.of("ord", "позицию", "order", "position");
    public static final List<String> ASPECT_LEVEL_OR_PARENT = List.of("уровень", "родителя", "level", "parent");

    /** "(родитель=123 остается)" / "(parent=123 unchanged)" */
    public static final Pattern PARENT_UNCHANGED = Pattern.compile(
            "\\((?:родитель|parent)\\s*=\\s*([\\w-]+)\\s+(?:остается|остаётся|unchanged)\\)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final String NUM = "(\\d+)";
    private static final String SHIFT = "\\s*\\+?" + NUM;

    /** order &gt; N, shift down by M */
    public static final List<Pattern> RENUMBER_GREATER = List.of(
            directive("статьи с порядком\\s*>\\s*" + NUM + "\\s+вниз на" + SHIFT),
            directive("(?:articles with\\s+)?order\\s*>\\s*" + NUM + "\\s+shift down by" + SHIFT)
    );

    /** order &gt;= N, shift down by M */
    public static final List<Pattern> RENUMBER_GREATER_OR_EQUAL = List.of(
            directive("статьи с порядком\\s*>=\\s*" + NUM + "\\s+вниз на" + SHIFT),
            directive("(?:articles with\\s+)?order\\s*>=\\s*" + NUM + "\\s+shift down by" + SHIFT)
    );

    /** order &gt;= N and order &lt;= K, shift down by M */
    public static final List<Pattern> RENUMBER_RANGE = List.of(
            directive("статьи с порядком\\s*>=\\s*" + NUM + "\\s+и\\s+порядком\\s*<=\\s*" + NUM + "\\s+вниз на" + SHIFT),
            directive("(?:articles with\\s+)?order\\s*>=\\s*" + NUM + "\\s+and\\s+order\\s*<=\\s*" + NUM + "\\s+shift down by" + SHIFT)
    );

    private static Pattern directive(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean containsAny(String normalizedText, List<String> phrases) {
        if (normalizedText == null || normalizedText.isEmpty()) return false;
        for (String p : phrases) {
            if (normalizedText.contains(p)) return true;
        }
        return false;
    }

    /**
     * Index just past the first marker found, or -1.
     */
    public static int endOfFirst(String normalizedText, List<String> phrases) {
        if (normalizedText == null) return -1;
        int best = -1;
        int bestEnd = -1;
        for (String p : phrases) {
            int i = normalizedText.indexOf(p);
            if (i >= 0 && (best < 0 || i < best)) {
                best = i;
                bestEnd = i + p.length();
            }
        }
        return bestEnd;
    }
}
