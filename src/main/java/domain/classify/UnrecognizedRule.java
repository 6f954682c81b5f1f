package domain.classify;

import domain.operation.Operation;
import domain.operation.UnrecognizedOperation;

/** Catch-all for action text no other rule understood. */
public final class UnrecognizedRule implements ClassificationRule {

    @Override
    public String name() {
        return "unrecognized";
    }

    @Override
    public boolean matches(RowInput input) {
        return input.hasAction();
    }

    @Override
    public Operation build(RowInput input) {
        return new UnrecognizedOperation(input.getRow().getActionText());
    }
}
