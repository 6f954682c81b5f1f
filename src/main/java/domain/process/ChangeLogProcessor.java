package domain.process;

import domain.change.AttributeParser;
import domain.change.ChangeLog;
import domain.change.ChangeRow;
import domain.change.RenumberDirective;
import domain.change.RenumberDirectiveParser;
import domain.classify.ActionClassifier;
import domain.emit.ArticleStatementEmitter;
import domain.emit.BalanceApiSettings;
import domain.emit.StatementBuckets;
import domain.id.IdAllocator;
import domain.id.IdentifierToken;
import domain.id.TemporaryIdRegistry;
import domain.model.ChangeWarning;
import domain.model.ChangeWarningSink;
import domain.model.ListChangeWarningSink;
import domain.model.ProcessingContext;
import domain.model.WarningCode;
import domain.operation.Operation;
import domain.operation.RenumberOperation;
import domain.operation.SkippedOperation;
import domain.operation.UnrecognizedOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Two passes over one change log.
 *
 * <ol>
 *   <li>id pre-allocation: every token and {@code parent} reference is resolved, and
 *   create rows with a blank id column get a {@code TEMP_n} placeholder. All ids exist
 *   before any statement is built, so rows may reference articles created further down
 *   the file, or the placeholder of their own row.</li>
 *   <li>classify + emit, in file order. A failing row becomes a comment marker and the
 *   next row is processed.</li>
 * </ol>
 *
 * A fresh {@link TemporaryIdRegistry} is created for every call.
 */
public final class ChangeLogProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChangeLogProcessor.class);

    public static final String PLACEHOLDER_PREFIX = "TEMP_";

    private final ActionClassifier classifier;
    private final BalanceApiSettings settings;

    public ChangeLogProcessor() {
        this(new ActionClassifier(), BalanceApiSettings.defaults());
    }

    public ChangeLogProcessor(ActionClassifier classifier, BalanceApiSettings settings) {
        this.classifier = classifier == null ? new ActionClassifier() : classifier;
        this.settings = settings == null ? BalanceApiSettings.defaults() : settings;
    }

    public ChangeScript process(ChangeLog changeLog, IdAllocator allocator) {
        if (changeLog == null) throw new IllegalArgumentException("changeLog is null");

        List<ChangeWarning> warnings = new ArrayList<>();
        ChangeWarningSink sink = new ListChangeWarningSink(warnings);
        TemporaryIdRegistry registry = new TemporaryIdRegistry(allocator, sink);

        preallocate(changeLog, registry);

        ArticleStatementEmitter emitter = new ArticleStatementEmitter(settings, changeLog.getReportId(), registry, sink);
        StatementBuckets buckets = new StatementBuckets();
        List<String> markers = new ArrayList<>();
        List<String> sourceRows = new ArrayList<>();

        emitAll(changeLog, emitter, buckets, markers, sourceRows, sink);

        log.info("{}: {} statements, {} markers, {} ids allocated, {} warnings",
                changeLog.getSourceName(), buckets.size(), markers.size(), registry.allocationCount(), warnings.size());

        return new ChangeScript(
                changeLog.getSourceName(),
                changeLog.getReportId(),
                buckets.toOrderedList(),
                markers,
                sourceRows,
                warnings,
                registry.allocationCount()
        );
    }

    // ------------------------------------------------------------
    // pass 1
    // ------------------------------------------------------------
    private void preallocate(ChangeLog changeLog, TemporaryIdRegistry registry) {
        Set<String> usedTokens = new HashSet<>();
        for (ChangeRow row : changeLog.getRows()) {
            if (row.hasArticleToken()) usedTokens.add(IdentifierToken.normalize(row.getArticleToken()));
        }

        int counter = 1;
        for (ChangeRow row : changeLog.getRows()) {
            if (!row.hasValidDate()) continue;
            ProcessingContext ctx = contextOf(changeLog, row);

            try {
                String token = row.getArticleToken();
                if (token != null && !RenumberDirectiveParser.isDirective(token)) {
                    registry.resolve(token, ctx);
                }

                String parent = AttributeParser.parse(row.getAttributeText()).get("parent");
                if (parent != null && !parent.isBlank()) {
                    registry.resolve(parent, ctx);
                }

                if (token == null && classifier.hasCreateShape(row)) {
                    String placeholder;
                    do {
                        placeholder = PLACEHOLDER_PREFIX + counter++;
                    } while (!usedTokens.add(IdentifierToken.normalize(placeholder)));

                    changeLog.assignPlaceholder(row, placeholder);
                    registry.resolve(placeholder, ctx.withToken(placeholder));
                    log.debug("Row {}: placeholder {} assigned", row.getRowNumber(), placeholder);
                }
            } catch (RuntimeException e) {
                // reported again (with a marker) when the row is emitted
                log.warn("Row {}: id pre-allocation failed: {}", row.getRowNumber(), e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------
    // pass 2
    // ------------------------------------------------------------
    private void emitAll(ChangeLog changeLog,
                         ArticleStatementEmitter emitter,
                         StatementBuckets buckets,
                         List<String> markers,
                         List<String> sourceRows,
                         ChangeWarningSink sink) {
        Integer previousBegin = null;

        for (ChangeRow row : changeLog.getRows()) {
            if (!row.isDated()) continue;
            ProcessingContext ctx = contextOf(changeLog, row);

            try {
                if (!row.hasValidDate()) {
                    sink.warn(ChangeWarning.of(WarningCode.INVALID_CHANGE_DATE, ctx,
                            "change date is not a date", row.getChangeDateError()));
                    throw new IllegalArgumentException("invalid change date '" + row.getChangeDateError() + "'");
                }

                sourceRows.add(echo(row));

                Optional<Operation> classified = classifier.classify(row);
                if (classified.isEmpty()) {
                    log.debug("Row {}: no operation", row.getRowNumber());
                    continue;
                }
                Operation op = classified.get();

                switch (op.getKind()) {
                    case RENUMBER: {
                        RenumberDirective d = ((RenumberOperation) op).getDirective();
                        int begin = d.getBeginOrd();
                        if (d.isOpenEnded() && previousBegin != null) {
                            if (previousBegin > begin) {
                                d = d.closedAt(previousBegin - 1);
                            } else {
                                previousBegin = begin;
                                reportUnsupportedOrder(row, ctx, d, markers, sink);
                                continue;
                            }
                        }
                        previousBegin = begin;
                        buckets.addAll(emitter.emit(new RenumberOperation(d), row.getChangeDate(), ctx));
                        break;
                    }
                    case UNRECOGNIZED: {
                        String text = ((UnrecognizedOperation) op).getActionText();
                        log.warn("Row {}: unrecognized action '{}'", row.getRowNumber(), text);
                        markers.add("-- Unrecognized action in row " + row.getRowNumber() + ": " + oneLine(text));
                        sink.warn(ChangeWarning.of(WarningCode.UNRECOGNIZED_ACTION, ctx, "unrecognized action", text));
                        break;
                    }
                    case SKIPPED: {
                        SkippedOperation s = (SkippedOperation) op;
                        log.warn("Row {}: {} omitted, {}", row.getRowNumber(), s.getMatched(), s.getReason());
                        sink.warn(ChangeWarning.of(WarningCode.MISSING_PRECONDITION, ctx,
                                s.getMatched() + " omitted", s.getReason()));
                        break;
                    }
                    default:
                        buckets.addAll(emitter.emit(op, row.getChangeDate(), ctx));
                }
            } catch (RuntimeException e) {
                String marker = "-- ERROR in row " + row.getRowNumber() + ": " + oneLine(e.getMessage());
                markers.add(marker);
                log.error("{}: row {} failed", changeLog.getSourceName(), row.getRowNumber(), e);
                sink.warn(ChangeWarning.of(WarningCode.ROW_FAILED, ctx,
                        e.getClass().getSimpleName(), oneLine(e.getMessage())));
            }
        }
    }

    private static void reportUnsupportedOrder(ChangeRow row,
                                               ProcessingContext ctx,
                                               RenumberDirective d,
                                               List<String> markers,
                                               ChangeWarningSink sink) {
        log.warn("Row {}: open-ended {} does not follow a directive with a higher lower bound, not emitted",
                row.getRowNumber(), d);
        markers.add("-- Unsupported renumber order in row " + row.getRowNumber() + ": " + oneLine(row.getArticleToken()));
        sink.warn(ChangeWarning.of(WarningCode.RENUMBER_ORDER_UNSUPPORTED, ctx,
                "open-ended renumber directive out of descending order", d.toString()));
    }

    private String echo(ChangeRow row) {
        return settings.getDateFormat().format(row.getChangeDate())
                + "\t" + nullToEmpty(row.getArticleToken())
                + "\t" + nullToEmpty(row.getArticleName())
                + "\t" + nullToEmpty(row.getActionText())
                + "\t\"" + nullToEmpty(row.getAttributeText()) + "\"";
    }

    private static ProcessingContext contextOf(ChangeLog changeLog, ChangeRow row) {
        return new ProcessingContext(changeLog.getSourceName(), row.getRowNumber(), row.getArticleToken());
    }

    private static String oneLine(String s) {
        if (s == null) return "";
        return s.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
