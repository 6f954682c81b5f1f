package domain.change;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes bulk reordering instructions written into the article id column.
 *
 * <ul>
 *   <li>{@code статьи с порядком > 50 вниз на 3} - begin 51, open end</li>
 *   <li>{@code статьи с порядком >= 50 вниз на 3} - begin 50, open end</li>
 *   <li>{@code статьи с порядком >= 10 и порядком <= 20 вниз на +5} - begin 10, end 20</li>
 * </ul>
 * First match wins. Open ends are closed later by the driver.
 */
public final class RenumberDirectiveParser {

    private RenumberDirectiveParser() {
    }

    /**
     * @return the directive, or empty when the text is not one or a bound does not fit an int
     */
    public static Optional<RenumberDirective> parse(String idColumnText) {
        if (idColumnText == null || idColumnText.isBlank()) return Optional.empty();
        try {
            return match(idColumnText.trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<RenumberDirective> match(String text) {
        Matcher m = find(ChangePhrases.RENUMBER_GREATER, text);
        if (m != null) {
            return Optional.of(RenumberDirective.openEnded(toInt(m.group(1)) + 1, toInt(m.group(2))));
        }
        m = find(ChangePhrases.RENUMBER_GREATER_OR_EQUAL, text);
        if (m != null) {
            return Optional.of(RenumberDirective.openEnded(toInt(m.group(1)), toInt(m.group(2))));
        }
        m = find(ChangePhrases.RENUMBER_RANGE, text);
        if (m != null) {
            return Optional.of(new RenumberDirective(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3))));
        }
        return Optional.empty();
    }

    public static boolean isDirective(String idColumnText) {
        return parse(idColumnText).isPresent();
    }

    private static Matcher find(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) return m;
        }
        return null;
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }
}
