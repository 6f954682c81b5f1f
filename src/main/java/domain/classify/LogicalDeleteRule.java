package domain.classify;

import domain.change.ChangePhrases;
import domain.operation.LogicalDeleteOperation;
import domain.operation.Operation;

public final class LogicalDeleteRule implements ClassificationRule {

    @Override
    public String name() {
        return "logical-delete";
    }

    @Override
    public boolean matches(RowInput input) {
        return ChangePhrases.containsAny(input.getAction(), ChangePhrases.LOGICAL_DELETE);
    }

    @Override
    public Operation build(RowInput input) {
        return new LogicalDeleteOperation(input.getArticleToken());
    }
}
