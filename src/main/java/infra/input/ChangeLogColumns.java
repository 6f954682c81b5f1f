package infra.input;

import domain.input.ChangeLogReadException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header row → column index.
 *
 * <p>Headers are trimmed and lower-cased before lookup; Russian and English names are
 * accepted. Date and article id columns are required, the rest are optional.</p>
 */
final class ChangeLogColumns {

    static final List<String> CHANGE_DATE = List.of("дата изменения", "change date", "change_date", "date");
    static final List<String> ARTICLE_ID = List.of("id статьи", "article id", "article_id", "id");
    static final List<String> ARTICLE_NAME = List.of("имя статьи", "article name", "article_name", "name");
    static final List<String> ACTION = List.of("действие", "action");
    static final List<String> ATTRIBUTE_VALUE = List.of("значение атрибута", "attribute value", "attribute_value", "attributes");

    final int changeDate;
    final int articleId;
    final int articleName;
    final int action;
    final int attributeValue;

    private ChangeLogColumns(int changeDate, int articleId, int articleName, int action, int attributeValue) {
        this.changeDate = changeDate;
        this.articleId = articleId;
        this.articleName = articleName;
        this.action = action;
        this.attributeValue = attributeValue;
    }

    static ChangeLogColumns resolve(List<String> headers, String source) {
        // normalized header -> index (first wins)
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            index.putIfAbsent(norm(headers.get(i)), i);
        }

        int date = find(index, CHANGE_DATE);
        int id = find(index, ARTICLE_ID);
        if (date < 0 || id < 0) {
            throw new ChangeLogReadException("Required column missing in " + source
                    + " (need '" + CHANGE_DATE.get(0) + "' and '" + ARTICLE_ID.get(0) + "'), headers=" + index.keySet());
        }
        return new ChangeLogColumns(date, id, find(index, ARTICLE_NAME), find(index, ACTION), find(index, ATTRIBUTE_VALUE));
    }

    static String norm(String header) {
        if (header == null) return "";
        String h = header;
        if (!h.isEmpty() && h.charAt(0) == '\uFEFF') h = h.substring(1);
        return h.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static int find(Map<String, Integer> index, List<String> aliases) {
        for (String a : aliases) {
            Integer i = index.get(a);
            if (i != null) return i;
        }
        return -1;
    }
}
