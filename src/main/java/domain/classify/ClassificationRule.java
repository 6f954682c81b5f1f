package domain.classify;

import domain.operation.Operation;

/**
 * One entry of the classifier's ordered rule list.
 */
public interface ClassificationRule {

    String name();

    boolean matches(RowInput input);

    /**
     * Called only when {@link #matches(RowInput)} returned true.
     */
    Operation build(RowInput input);
}
