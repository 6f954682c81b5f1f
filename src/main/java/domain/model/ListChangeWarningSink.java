package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|source|row|token|message|detail) so that a token referenced
 * several times in one row yields a single warning.</p>
 */
public final class ListChangeWarningSink implements ChangeWarningSink {

    private final List<ChangeWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListChangeWarningSink(List<ChangeWarning> target) {
        this.target = target;
    }

    private static String key(ChangeWarning w) {
        return w.getCode().name() + "|"
                + w.getSource() + "|"
                + w.getRowNumber() + "|"
                + w.getArticleToken() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(ChangeWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
