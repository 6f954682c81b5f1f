package domain.change;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Attributes of one row: lower-cased key to trimmed value, in input order.
 */
public final class AttributeMap {

    private static final AttributeMap EMPTY = new AttributeMap(Collections.emptyMap());

    private final Map<String, String> values;

    AttributeMap(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static AttributeMap empty() {
        return EMPTY;
    }

    public String get(String key) {
        return key == null ? null : values.get(key.toLowerCase(Locale.ROOT));
    }

    public String getOrDefault(String key, String def) {
        String v = get(key);
        return v == null ? def : v;
    }

    /**
     * True when the key is present with a non-blank value; {@code ord=} counts as absent.
     */
    public boolean has(String key) {
        String v = get(key);
        return v != null && !v.isBlank();
    }

    public boolean hasAll(String... keys) {
        for (String k : keys) {
            if (!has(k)) return false;
        }
        return true;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
