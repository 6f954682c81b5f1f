package domain.classify;

import domain.change.ChangeRow;
import domain.operation.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decides which structural operation a row stands for.
 *
 * <p>Rules are evaluated top to bottom and the first match wins. A row that no rule
 * matches (no action text, no create attributes) yields no operation.</p>
 */
public final class ActionClassifier {

    private final List<ClassificationRule> rules;

    public ActionClassifier() {
        this(defaultRules());
    }

    public ActionClassifier(List<ClassificationRule> rules) {
        if (rules == null || rules.isEmpty()) throw new IllegalArgumentException("rules is empty");
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static List<ClassificationRule> defaultRules() {
        List<ClassificationRule> r = new ArrayList<>();
        r.add(new RenumberRule());
        r.add(new RenameRule());
        r.add(new AddArticleRule());
        r.add(new LogicalDeleteRule());
        r.add(new LevelAndParentRule());
        r.add(new CompositeRule());
        r.add(new UnrecognizedRule());
        return r;
    }

    public Optional<Operation> classify(ChangeRow row) {
        return classify(RowInput.of(row));
    }

    public Optional<Operation> classify(RowInput input) {
        for (ClassificationRule rule : rules) {
            if (rule.matches(input)) {
                return Optional.of(rule.build(input));
            }
        }
        return Optional.empty();
    }

    /**
     * Rule that fired for the row, or null.
     */
    public ClassificationRule matchingRule(ChangeRow row) {
        RowInput input = RowInput.of(row);
        for (ClassificationRule rule : rules) {
            if (rule.matches(input)) return rule;
        }
        return null;
    }

    /**
     * True when the row describes a new article, whatever its id column holds.
     * Used by id pre-allocation to decide whether a blank id needs a placeholder.
     */
    public boolean hasCreateShape(ChangeRow row) {
        return matchingRule(row) instanceof AddArticleRule;
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }
}
