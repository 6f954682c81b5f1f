package domain.classify;

import domain.change.AttributeMap;
import domain.change.AttributeParser;
import domain.change.ChangePhrases;
import domain.change.ChangeRow;

/**
 * What the rules look at for one row: the row, its parsed attributes and the
 * normalized action text.
 */
public final class RowInput {

    private final ChangeRow row;
    private final AttributeMap attributes;
    private final String action;

    private RowInput(ChangeRow row, AttributeMap attributes, String action) {
        this.row = row;
        this.attributes = attributes;
        this.action = action;
    }

    public static RowInput of(ChangeRow row) {
        if (row == null) throw new IllegalArgumentException("row is null");
        return new RowInput(row, AttributeParser.parse(row.getAttributeText()), ChangePhrases.normalize(row.getActionText()));
    }

    public ChangeRow getRow() {
        return row;
    }

    public AttributeMap getAttributes() {
        return attributes;
    }

    /**
     * Trimmed, lower-cased action text; empty when the column is blank.
     */
    public String getAction() {
        return action;
    }

    public boolean hasAction() {
        return !action.isEmpty();
    }

    public String getArticleToken() {
        return row.getArticleToken();
    }
}
