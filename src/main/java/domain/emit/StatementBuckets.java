package domain.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects statements per category and concatenates them in category order,
 * keeping row order inside each category.
 */
public final class StatementBuckets {

    private final Map<StatementCategory, List<EmittedStatement>> buckets = new EnumMap<>(StatementCategory.class);

    public StatementBuckets() {
        for (StatementCategory c : StatementCategory.values()) {
            buckets.put(c, new ArrayList<>());
        }
    }

    public void add(EmittedStatement statement) {
        if (statement == null) return;
        buckets.get(statement.getCategory()).add(statement);
    }

    public void addAll(List<EmittedStatement> statements) {
        if (statements == null) return;
        for (EmittedStatement s : statements) add(s);
    }

    public List<EmittedStatement> get(StatementCategory category) {
        return Collections.unmodifiableList(buckets.get(category));
    }

    public int count(StatementCategory category) {
        return buckets.get(category).size();
    }

    public int size() {
        int n = 0;
        for (List<EmittedStatement> l : buckets.values()) n += l.size();
        return n;
    }

    public List<EmittedStatement> toOrderedList() {
        List<EmittedStatement> out = new ArrayList<>(size());
        for (StatementCategory c : StatementCategory.values()) {
            out.addAll(buckets.get(c));
        }
        return out;
    }
}
