package domain.classify;

import domain.change.ChangePhrases;
import domain.operation.Operation;
import domain.operation.OperationKind;
import domain.operation.RenameOperation;
import domain.operation.SkippedOperation;

/**
 * "сменила название на": the whole attribute cell is the new name.
 */
public final class RenameRule implements ClassificationRule {

    @Override
    public String name() {
        return "rename";
    }

    @Override
    public boolean matches(RowInput input) {
        return ChangePhrases.containsAny(input.getAction(), ChangePhrases.RENAME);
    }

    @Override
    public Operation build(RowInput input) {
        String newName = input.getRow().getAttributeText();
        if (newName == null || newName.isBlank()) {
            return new SkippedOperation(OperationKind.RENAME, "attribute value (new name) is empty");
        }
        return new RenameOperation(input.getArticleToken(), newName);
    }
}
