package app;

import domain.change.ChangeLog;
import domain.input.ChangeLogReader;
import domain.model.ChangeWarning;
import domain.model.ChangeWarningSink;
import domain.model.FileProcessingResult;
import domain.model.ProcessingContext;
import domain.model.WarningCode;
import domain.emit.StatementCategory;
import domain.output.BalanceSession;
import domain.output.BalanceSessionFactory;
import domain.output.ScriptExecutionException;
import domain.process.ChangeLogProcessor;
import domain.process.ChangeScript;
import cli.CliProgressMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs every input file through read, build and (execute mode) run.
 *
 * <p>A failing file never stops the others unless {@code failFast} is set.</p>
 */
final class FileBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(FileBatchProcessor.class);

    private final ChangeLogReader reader;
    private final ChangeLogProcessor processor;
    private final BalanceSessionFactory sessions;
    private final RunMode mode;
    private final boolean failFast;
    private final ChangeWarningSink warningSink;

    FileBatchProcessor(ChangeLogReader reader,
                       ChangeLogProcessor processor,
                       BalanceSessionFactory sessions,
                       RunMode mode,
                       boolean failFast,
                       ChangeWarningSink warningSink) {
        this.reader = reader;
        this.processor = processor;
        this.sessions = sessions;
        this.mode = mode == null ? RunMode.SCRIPT : mode;
        this.failFast = failFast;
        this.warningSink = warningSink == null ? ChangeWarningSink.none() : warningSink;
    }

    static final class Outcome {
        final List<FileProcessingResult> results;
        final List<ChangeScript> scripts;
        final boolean stoppedEarly;

        Outcome(List<FileProcessingResult> results, List<ChangeScript> scripts, boolean stoppedEarly) {
            this.results = Collections.unmodifiableList(results);
            this.scripts = Collections.unmodifiableList(scripts);
            this.stoppedEarly = stoppedEarly;
        }

        int count(String status) {
            int n = 0;
            for (FileProcessingResult r : results) {
                if (status.equals(r.getStatus())) n++;
            }
            return n;
        }
    }

    Outcome run(List<Path> files) {
        List<FileProcessingResult> results = new ArrayList<>(files.size());
        List<ChangeScript> scripts = new ArrayList<>(files.size());

        long tLoop0 = System.nanoTime();
        int success = 0;
        int skip = 0;
        int failed = 0;
        boolean stopped = false;

        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            String source = file.getFileName().toString();

            FileProcessingResult r = processOne(file, source, scripts);
            results.add(r);

            if (r.isSuccess()) success++;
            else if (FileProcessingResult.SKIP.equals(r.getStatus())) skip++;
            else failed++;

            CliProgressMonitor.logProgress(i + 1, files.size(), success, skip, failed, tLoop0, source);

            if (failFast && FileProcessingResult.FAILED.equals(r.getStatus())) {
                System.out.println("[FAILFAST] stop on first failed file: " + source);
                stopped = true;
                break;
            }
        }
        return new Outcome(results, scripts, stopped);
    }

    private FileProcessingResult processOne(Path file, String source, List<ChangeScript> scripts) {
        ProcessingContext fileCtx = ProcessingContext.ofFile(source);

        ChangeLog changeLog;
        try {
            changeLog = reader.read(file);
        } catch (RuntimeException e) {
            return fail(fileCtx, source, "", "read failed", e);
        }

        try (BalanceSession session = sessions.open()) {
            ChangeScript script = processor.process(changeLog, session.idAllocator());
            for (ChangeWarning w : script.getWarnings()) warningSink.warn(w);

            if (!script.hasStatements()) {
                log.warn("{}: no statements produced", source);
                warningSink.warn(ChangeWarning.of(WarningCode.NO_CHANGES, fileCtx,
                        "no statements produced", "rows=" + changeLog.getRows().size()));
                scripts.add(script);
                return result(FileProcessingResult.SKIP, script, "NO_CHANGES");
            }

            if (mode == RunMode.EXECUTE) {
                session.execute(script);
            }
            scripts.add(script);
            return result(FileProcessingResult.SUCCESS, script, "");

        } catch (ScriptExecutionException e) {
            return fail(fileCtx, source, changeLog.getReportId(), "execution rolled back", e);
        } catch (RuntimeException e) {
            // database unavailable or an unexpected fault outside row handling
            return fail(fileCtx, source, changeLog.getReportId(), "processing failed", e);
        }
    }

    private static FileProcessingResult result(String status, ChangeScript s, String message) {
        return new FileProcessingResult(status, s.getSourceName(), s.getReportId(),
                s.count(StatementCategory.RENUMBER),
                s.count(StatementCategory.ADD),
                s.count(StatementCategory.CHANGE),
                message);
    }

    private FileProcessingResult fail(ProcessingContext ctx, String source, String reportId, String what, Exception e) {
        String msg = e.getClass().getSimpleName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        log.error("{}: {}: {}", source, what, msg, e);
        System.out.println("[ERROR] " + source + " " + what);
        System.out.println("        ex=" + msg);
        warningSink.warn(ChangeWarning.of(WarningCode.FILE_FAILED, ctx, what, msg));
        return new FileProcessingResult(FileProcessingResult.FAILED, source, reportId, 0, 0, 0, msg);
    }
}
