package domain.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * "changes name, position, level" - several independent sub-operations on one article.
 * Each part is emitted on its own.
 */
public final class CompositeOperation extends ArticleOperation {

    private final List<String> aspects;
    private final List<ArticleOperation> parts;

    public CompositeOperation(String articleToken, List<String> aspects, List<ArticleOperation> parts) {
        super(OperationKind.COMPOSITE, articleToken);
        this.aspects = aspects == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(aspects));
        this.parts = parts == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public List<String> getAspects() {
        return aspects;
    }

    public List<ArticleOperation> getParts() {
        return parts;
    }

    @Override
    public String toString() {
        return "CompositeOperation{article=" + getArticleToken() + ", aspects=" + aspects + ", parts=" + parts + "}";
    }
}
