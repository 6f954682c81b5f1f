package domain.operation;

import domain.change.RenumberDirective;

public final class RenumberOperation extends Operation {

    private final RenumberDirective directive;

    public RenumberOperation(RenumberDirective directive) {
        super(OperationKind.RENUMBER);
        if (directive == null) throw new IllegalArgumentException("directive is null");
        this.directive = directive;
    }

    public RenumberDirective getDirective() {
        return directive;
    }

    @Override
    public String toString() {
        return "RenumberOperation{" + directive + "}";
    }
}
