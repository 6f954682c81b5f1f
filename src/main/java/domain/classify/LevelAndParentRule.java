package domain.classify;

import domain.change.ChangePhrases;
import domain.operation.Operation;
import domain.operation.SetLevelAndParentOperation;

/**
 * "меняет уровень и родителя". Level and parent are both optional here; the emitter
 * drops the row when neither is usable.
 */
public final class LevelAndParentRule implements ClassificationRule {

    @Override
    public String name() {
        return "level-and-parent";
    }

    @Override
    public boolean matches(RowInput input) {
        return ChangePhrases.containsAny(input.getAction(), ChangePhrases.LEVEL_AND_PARENT);
    }

    @Override
    public Operation build(RowInput input) {
        return new SetLevelAndParentOperation(
                input.getArticleToken(),
                input.getAttributes().get("lvl"),
                input.getAttributes().get("parent")
        );
    }
}
