package domain.classify;

import domain.change.RenumberDirectiveParser;
import domain.operation.Operation;
import domain.operation.RenumberOperation;

/** The id column holds a renumber directive; the action column is not consulted. */
public final class RenumberRule implements ClassificationRule {

    @Override
    public String name() {
        return "renumber";
    }

    @Override
    public boolean matches(RowInput input) {
        return RenumberDirectiveParser.isDirective(input.getArticleToken());
    }

    @Override
    public Operation build(RowInput input) {
        return new RenumberOperation(RenumberDirectiveParser.parse(input.getArticleToken()).orElseThrow());
    }
}
