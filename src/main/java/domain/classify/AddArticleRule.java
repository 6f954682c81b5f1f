package domain.classify;

import domain.change.AttributeMap;
import domain.change.ChangePhrases;
import domain.operation.AddArticleOperation;
import domain.operation.Operation;
import domain.operation.OperationKind;
import domain.operation.SkippedOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * "добавление статьи", or a row with no action text that carries all create attributes.
 */
public final class AddArticleRule implements ClassificationRule {

    static final String[] REQUIRED = {"name", "ord", "lvl", "parent"};

    @Override
    public String name() {
        return "add-article";
    }

    @Override
    public boolean matches(RowInput input) {
        if (ChangePhrases.containsAny(input.getAction(), ChangePhrases.ADD_ARTICLE)) return true;
        return !input.hasAction() && input.getAttributes().hasAll(REQUIRED);
    }

    @Override
    public Operation build(RowInput input) {
        AttributeMap attrs = input.getAttributes();
        List<String> missing = new ArrayList<>();
        for (String k : REQUIRED) {
            if (!attrs.has(k)) missing.add(k);
        }
        if (!missing.isEmpty()) {
            return new SkippedOperation(OperationKind.ADD_ARTICLE, "missing attributes " + missing);
        }
        return new AddArticleOperation(
                input.getArticleToken(),
                attrs.get("name"),
                attrs.get("ord"),
                attrs.get("lvl"),
                attrs.get("parent")
        );
    }
}
