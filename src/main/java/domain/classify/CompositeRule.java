package domain.classify;

import domain.change.AttributeMap;
import domain.change.ChangePhrases;
import domain.operation.ArticleOperation;
import domain.operation.CompositeOperation;
import domain.operation.Operation;
import domain.operation.OperationKind;
import domain.operation.RenameOperation;
import domain.operation.SetLevelAndParentOperation;
import domain.operation.SetOrderOperation;
import domain.operation.SkippedOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "меняет позицию, уровень, родителя, название (родитель=123 остается)".
 *
 * <p>Up to three parts, in this order: rename, order, level/parent. Each part is
 * built only when its aspect is named and its attribute is present.</p>
 */
public final class CompositeRule implements ClassificationRule {

    private static final Pattern ASPECT_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+и\\s+|\\s+and\\s+");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\(.*?(\\)|$)");

    @Override
    public String name() {
        return "composite";
    }

    @Override
    public boolean matches(RowInput input) {
        return ChangePhrases.containsAny(input.getAction(), ChangePhrases.CHANGES);
    }

    @Override
    public Operation build(RowInput input) {
        String action = input.getAction();
        List<String> aspects = aspects(action);
        AttributeMap attrs = input.getAttributes();
        String token = input.getArticleToken();

        List<ArticleOperation> parts = new ArrayList<>(3);

        if (namesAny(aspects, ChangePhrases.ASPECT_NAME) && attrs.has("name")) {
            parts.add(new RenameOperation(token, attrs.get("name")));
        }
        if (namesAny(aspects, ChangePhrases.ASPECT_ORDER) && attrs.has("ord")) {
            parts.add(new SetOrderOperation(token, attrs.get("ord")));
        }
        if (namesAny(aspects, ChangePhrases.ASPECT_LEVEL_OR_PARENT)) {
            String parent = attrs.get("parent");
            if (parent == null || parent.isBlank()) {
                parent = parentUnchanged(action);
            }
            parts.add(new SetLevelAndParentOperation(token, attrs.get("lvl"), parent));
        }

        if (parts.isEmpty()) {
            return new SkippedOperation(OperationKind.COMPOSITE,
                    "no changed aspect with its attribute present: aspects=" + aspects + ", attributes=" + attrs.asMap().keySet());
        }
        return new CompositeOperation(token, aspects, parts);
    }

    /**
     * Changed aspects named after the marker, lower-cased, parentheticals removed.
     */
    static List<String> aspects(String normalizedAction) {
        List<String> out = new ArrayList<>();
        int from = ChangePhrases.endOfFirst(normalizedAction, ChangePhrases.CHANGES);
        if (from < 0) return out;

        String tail = PARENTHETICAL.matcher(normalizedAction.substring(from)).replaceAll(" ");
        for (String item : ASPECT_SEPARATOR.split(tail)) {
            String a = item.trim();
            if (!a.isEmpty()) out.add(a);
        }
        return out;
    }

    static String parentUnchanged(String normalizedAction) {
        Matcher m = ChangePhrases.PARENT_UNCHANGED.matcher(normalizedAction);
        return m.find() ? m.group(1) : null;
    }

    private static boolean namesAny(List<String> aspects, List<String> words) {
        for (String a : aspects) {
            if (words.contains(a)) return true;
        }
        return false;
    }
}
