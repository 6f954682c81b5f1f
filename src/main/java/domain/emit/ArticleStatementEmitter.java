package domain.emit;

import domain.change.RenumberDirective;
import domain.id.IdentifierToken;
import domain.id.TemporaryIdRegistry;
import domain.model.ChangeWarning;
import domain.model.ChangeWarningSink;
import domain.model.ProcessingContext;
import domain.model.WarningCode;
import domain.operation.AddArticleOperation;
import domain.operation.ArticleOperation;
import domain.operation.CompositeOperation;
import domain.operation.LogicalDeleteOperation;
import domain.operation.Operation;
import domain.operation.RenameOperation;
import domain.operation.RenumberOperation;
import domain.operation.SetLevelAndParentOperation;
import domain.operation.SetOrderOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns classified operations into {@code balance_api} calls.
 *
 * <p>One instance per file: it holds the file's report id and id registry. Operations
 * whose article cannot be resolved, or whose {@code ID}/{@code TEMP} parent failed to
 * allocate, produce no statement and a warning. A parent of any other shape is
 * emitted as {@code NULL} with a warning.</p>
 */
public final class ArticleStatementEmitter {

    private static final Logger log = LoggerFactory.getLogger(ArticleStatementEmitter.class);

    static final String FN_RENUM = "fn_balance_article_renum_up_down";
    static final String FN_ADD = "fn_balance_article_add_1";
    static final String FN_RENAME = "fn_balance_article_rename";
    static final String FN_ORD_SET = "fn_balance_article_ord_set";
    static final String FN_LEVEL_SET = "fn_balance_article_level_set";
    static final String FN_END_DATE_SET = "fn_balance_article_end_date_set";

    private static final String NULL = "NULL";

    private final BalanceApiSettings settings;
    private final String reportId;
    private final TemporaryIdRegistry registry;
    private final ChangeWarningSink warningSink;

    public ArticleStatementEmitter(BalanceApiSettings settings,
                                   String reportId,
                                   TemporaryIdRegistry registry,
                                   ChangeWarningSink warningSink) {
        if (registry == null) throw new IllegalArgumentException("registry is null");
        if (reportId == null || reportId.isBlank()) throw new IllegalArgumentException("reportId is blank");
        this.settings = settings == null ? BalanceApiSettings.defaults() : settings;
        this.reportId = reportId.trim();
        this.registry = registry;
        this.warningSink = warningSink == null ? ChangeWarningSink.none() : warningSink;
    }

    /**
     * @return statements for the operation; empty when it was skipped
     */
    public List<EmittedStatement> emit(Operation op, LocalDate changeDate, ProcessingContext ctx) {
        if (op == null) return Collections.emptyList();
        if (changeDate == null) throw new IllegalArgumentException("changeDate is null");

        String date = settings.getDateFormat().format(changeDate);
        int row = ctx == null ? 0 : ctx.getRowNumber();

        switch (op.getKind()) {
            case RENUMBER:
                return one(StatementCategory.RENUMBER, row, renumber(((RenumberOperation) op).getDirective(), date));
            case ADD_ARTICLE:
                return one(StatementCategory.ADD, row, add((AddArticleOperation) op, date, ctx));
            case COMPOSITE: {
                List<EmittedStatement> out = new ArrayList<>(3);
                for (ArticleOperation part : ((CompositeOperation) op).getParts()) {
                    out.addAll(one(StatementCategory.CHANGE, row, change(part, date, ctx)));
                }
                return out;
            }
            case RENAME:
            case SET_ORDER:
            case SET_LEVEL_AND_PARENT:
            case LOGICAL_DELETE:
                return one(StatementCategory.CHANGE, row, change((ArticleOperation) op, date, ctx));
            default:
                // UNRECOGNIZED / SKIPPED are reported by the driver
                return Collections.emptyList();
        }
    }

    private static List<EmittedStatement> one(StatementCategory category, int row, String text) {
        if (text == null) return Collections.emptyList();
        List<EmittedStatement> out = new ArrayList<>(1);
        out.add(new EmittedStatement(category, row, text));
        return out;
    }

    String renumber(RenumberDirective d, String date) {
        return ProcedureCall.of(settings.function(FN_RENUM))
                .named("p_report_id", reportId)
                .named("p_begin_ord", String.valueOf(d.getBeginOrd()))
                .named("p_end_ord", String.valueOf(d.getEndOrd()))
                .named("p_shift_ord", String.valueOf(d.getShiftOrd()))
                .named("p_old_valid_date", quote(date))
                .named("p_new_valid_date", quote(settings.getNewValidDate()))
                .render();
    }

    private String add(AddArticleOperation op, String date, ProcessingContext ctx) {
        Long articleId = resolveArticle(op, ctx);
        if (articleId == null) return null;

        ParentRef parent = resolveParent(op.getParentToken(), ctx);
        if (parent.unresolved) return null;

        return ProcedureCall.of(settings.function(FN_ADD))
                .named("p_report_id", reportId)
                .named("p_article_name", quote(op.getName()))
                .named("p_article_ord", op.getOrd())
                .named("p_begin_date", quote(date))
                .named("p_end_date", quote(settings.getNewValidDate()))
                .named("p_parent_id", parent.sql())
                .named("p_level", op.getLevel())
                .named("p_article_id", String.valueOf(articleId))
                .render();
    }

    private String change(ArticleOperation op, String date, ProcessingContext ctx) {
        Long articleId = resolveArticle(op, ctx);
        if (articleId == null) return null;

        if (op instanceof RenameOperation) {
            return ProcedureCall.of(settings.function(FN_RENAME))
                    .named("p_article_id", String.valueOf(articleId))
                    .named("p_article_name", quote(((RenameOperation) op).getNewName()))
                    .named("p_old_date", quote(date))
                    .named("p_new_valid_date", quote(settings.getNewValidDate()))
                    .render();
        }
        if (op instanceof SetOrderOperation) {
            return ProcedureCall.of(settings.function(FN_ORD_SET))
                    .named("p_article_id", String.valueOf(articleId))
                    .named("p_article_ord", ((SetOrderOperation) op).getOrd())
                    .named("p_valid_date", quote(date))
                    .render();
        }
        if (op instanceof SetLevelAndParentOperation) {
            return levelSet((SetLevelAndParentOperation) op, articleId, date, ctx);
        }
        if (op instanceof LogicalDeleteOperation) {
            return ProcedureCall.of(settings.function(FN_END_DATE_SET))
                    .positional(String.valueOf(articleId))
                    .positional(quote(date))
                    .positional("true")
                    .render();
        }
        throw new IllegalStateException("Unsupported change operation: " + op);
    }

    private String levelSet(SetLevelAndParentOperation op, long articleId, String date, ProcessingContext ctx) {
        ParentRef parent = resolveParent(op.getParentToken(), ctx);
        if (parent.unresolved) return null;

        if (parent.id == null && !op.isLevelChanged()) {
            log.warn("Row {}: neither parent nor lvl given for level/parent change of '{}'",
                    rowOf(ctx), op.getArticleToken());
            warningSink.warn(ChangeWarning.of(WarningCode.MISSING_PRECONDITION, ctx,
                    "level/parent change without parent or lvl"));
            return null;
        }

        return ProcedureCall.of(settings.function(FN_LEVEL_SET))
                .named("p_article_id", String.valueOf(articleId))
                .named("p_begin_date", quote(date))
                .named("p_end_date", quote(settings.getNewValidDate()))
                .named("p_parent_id", parent.sql())
                .named("p_level", op.getLevel())
                .render();
    }

    private Long resolveArticle(ArticleOperation op, ProcessingContext ctx) {
        String token = op.getArticleToken();
        Long id = registry.resolve(token, ctx);
        if (id == null) {
            log.warn("Row {}: article '{}' could not be resolved, {} skipped", rowOf(ctx), token, op.getKind());
            warningSink.warn(ChangeWarning.of(WarningCode.UNRESOLVED_REFERENCE, ctx,
                    "article id not resolved", op.getKind().name()));
        }
        return id;
    }

    private ParentRef resolveParent(String parentToken, ProcessingContext ctx) {
        if (parentToken == null || parentToken.isBlank()) return ParentRef.NONE;

        Long id = registry.resolve(parentToken, ctx);
        if (id == null) {
            // only a failed allocation drops the statement; any other shape means no parent
            boolean allocationFailed = IdentifierToken.classify(parentToken) == IdentifierToken.TEMPORARY;
            log.warn("Row {}: parent '{}' could not be resolved{}", rowOf(ctx), parentToken,
                    allocationFailed ? "" : ", emitted as NULL");
            warningSink.warn(ChangeWarning.of(WarningCode.UNRESOLVED_REFERENCE, ctx,
                    allocationFailed ? "parent id not resolved" : "parent id not resolved, emitted as NULL",
                    parentToken));
            return allocationFailed ? ParentRef.UNRESOLVED : ParentRef.NONE;
        }
        // parent=0 means "top level"
        return id == 0L ? ParentRef.NONE : new ParentRef(id, false);
    }

    private String quote(String value) {
        String v = value == null ? "" : value;
        if (settings.isEscapeLiterals()) v = v.replace("'", "''");
        return "'" + v + "'";
    }

    private static int rowOf(ProcessingContext ctx) {
        return ctx == null ? 0 : ctx.getRowNumber();
    }

    private static final class ParentRef {
        static final ParentRef NONE = new ParentRef(null, false);
        static final ParentRef UNRESOLVED = new ParentRef(null, true);

        final Long id;
        final boolean unresolved;

        ParentRef(Long id, boolean unresolved) {
            this.id = id;
            this.unresolved = unresolved;
        }

        String sql() {
            return id == null ? NULL : String.valueOf(id);
        }
    }
}
