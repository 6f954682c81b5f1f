package domain.change;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the multi-line {@code key=value} blob of the attribute column.
 *
 * <pre>
 * name=Товарный газ
 * ord=24
 * lvl=2&lt;br/&gt;parent=ID
 * </pre>
 *
 * Lines without {@code =} are dropped; the split happens at the first {@code =}.
 */
public final class AttributeParser {

    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>|\\r\\n|\\n|\\r", Pattern.CASE_INSENSITIVE);

    private AttributeParser() {
    }

    public static AttributeMap parse(String attributeText) {
        if (attributeText == null || attributeText.isBlank()) return AttributeMap.empty();

        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : LINE_BREAK.split(attributeText)) {
            String line = raw.trim();
            int eq = line.indexOf('=');
            if (eq < 0) continue;
            String key = line.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(eq + 1).trim();
            out.put(key, value);
        }
        return new AttributeMap(out);
    }
}
