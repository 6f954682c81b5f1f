package app;

import cli.ArticleChangeCli;
import cli.CliArgParser;
import cli.CliPathResolver;
import domain.emit.BalanceApiSettings;
import domain.model.ChangeWarning;
import domain.model.FileProcessingResult;
import domain.model.ListChangeWarningSink;
import domain.output.BalanceSessionFactory;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import infra.config.AppConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link ArticleChangeCli}). */
public final class ArticleChangeCliApp {

    static final String DEFAULT_OUT = "output/output.sql";
    static final String DEFAULT_ENV = ".env";

    private ArticleChangeCliApp() {}

    /**
     * @return process exit code: 0 all files ok or skipped, 1 some file failed, 2 bad arguments/config
     */
    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / mode / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        RunMode mode;
        List<Path> inputs;
        try {
            mode = CliArgParser.parseMode(argv.get("mode"));
            inputs = CliPathResolver.resolveInputFiles(baseDir, argv.get("in"));
        } catch (IllegalArgumentException e) {
            System.out.println("[ERROR] " + e.getMessage());
            printUsage();
            return 2;
        }

        Path outSql = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", DEFAULT_OUT));
        String resultRaw = CliPathResolver.trimToNull(argv.get("result"));
        Path resultXlsx = resultRaw == null ? null : CliPathResolver.resolvePath(baseDir, resultRaw);
        Path envFile = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("env", DEFAULT_ENV));

        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean escapeLiterals = CliArgParser.flag(argv, "escapeLiterals");

        // ------------------------------------------------------------
        // feature toggles (presence-style)
        // ------------------------------------------------------------
        boolean noResult = resultXlsx == null || CliArgParser.flag(argv, "noResult");
        boolean sqlOut = mode == RunMode.SCRIPT;

        AppConfig config = AppConfig.load(argv, envFile);
        BalanceApiSettings settings = config.balanceApiSettings(escapeLiterals);

        System.out.println("==================================================");
        System.out.println("[START] Article change processing");
        System.out.println("[CONF] baseDir        = " + baseDir.toAbsolutePath());
        System.out.println("[CONF] mode           = " + mode);
        System.out.println("[CONF] inputs         = " + inputs.size() + " file(s)");
        System.out.println("[CONF] env            = " + envFile.toAbsolutePath());
        System.out.println("[CONF] schema         = " + settings.getSchema());
        System.out.println("[CONF] newValidDate   = " + settings.getNewValidDate());
        System.out.println("[CONF] escapeLiterals = " + settings.isEscapeLiterals() + " (use --escapeLiterals)");
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] out            = " + (sqlOut ? outSql.toAbsolutePath() : "(execute mode)"));
        System.out.println("[CONF] result         = " + (noResult ? "(disabled)" : resultXlsx.toAbsolutePath()));
        System.out.println("==================================================");

        List<String> missing = config.missingDbKeys();
        if (!missing.isEmpty()) {
            System.out.println("[ERROR] missing database settings: " + String.join(", ", missing));
            System.out.println("        - set them in " + envFile.toAbsolutePath());
            System.out.println("        - or as environment variables / --KEY=value");
            return 2;
        }

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        ArticleChangeComponentsFactory factory = new ArticleChangeComponentsFactory();
        BalanceSessionFactory sessions = factory.createSessionFactory(config, settings);
        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(sqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        // warnings (collected even when result xlsx is disabled)
        List<ChangeWarning> warnings = new ArrayList<>(128);
        ListChangeWarningSink warningSink = new ListChangeWarningSink(warnings);

        FileBatchProcessor batch = new FileBatchProcessor(
                factory.createReader(),
                factory.createProcessor(settings),
                sessions,
                mode,
                failFast,
                warningSink);

        long tLoop0 = System.nanoTime();
        System.out.println("[STEP1] processing start. files=" + inputs.size());
        FileBatchProcessor.Outcome outcome = batch.run(inputs);
        System.out.println("[STEP1] processing done. elapsed=" + ms(tLoop0) + "ms");

        int statements = 0;
        for (FileProcessingResult r : outcome.results) statements += r.getStatementCount();

        System.out.println("[STAT] success=" + outcome.count(FileProcessingResult.SUCCESS)
                + ", skip=" + outcome.count(FileProcessingResult.SKIP)
                + ", failed=" + outcome.count(FileProcessingResult.FAILED));
        System.out.println("[STAT] statements=" + statements + (mode == RunMode.EXECUTE ? " (executed)" : ""));
        System.out.println("[STAT] warnings=" + warnings.size());

        if (sqlOut) {
            long tOut0 = System.nanoTime();
            sqlOutputWriter.write(outSql, outcome.scripts);
            System.out.println("[STEP2] script written: " + outSql.toAbsolutePath() + " elapsed=" + ms(tOut0) + "ms");
        }

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP3] writing result xlsx... rows=" + outcome.results.size());
            resultWriter.write(resultXlsx, outcome.results, warnings);
            System.out.println("[STEP3] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");

        return outcome.count(FileProcessingResult.FAILED) > 0 ? 1 : 0;
    }

    private static void printUsage() {
        System.out.println("usage: --in=<file|dir>[,<file|dir>...] [--mode=script|execute]");
        System.out.println("       [--out=" + DEFAULT_OUT + "] [--result=<xlsx>] [--noResult]");
        System.out.println("       [--env=" + DEFAULT_ENV + "] [--baseDir=<dir>] [--escapeLiterals] [--failFast]");
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
