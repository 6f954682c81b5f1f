package app;

import domain.classify.ActionClassifier;
import domain.emit.BalanceApiSettings;
import domain.input.ChangeLogReader;
import domain.output.BalanceSessionFactory;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.process.ChangeLogProcessor;
import infra.config.AppConfig;
import infra.db.JdbcBalanceSessionFactory;
import infra.db.JdbcConnectionFactory;
import infra.input.ChangeLogReaders;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.ProcessingReportXlsxWriter;
import infra.output.SqlScriptFileWriter;
import infra.output.XlsxResultWriter;

/**
 * Object-assembly factory for {@link ArticleChangeCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object
 * creation ("new") here.
 */
final class ArticleChangeComponentsFactory {

    ChangeLogReader createReader() {
        return new ChangeLogReaders();
    }

    ChangeLogProcessor createProcessor(BalanceApiSettings settings) {
        return new ChangeLogProcessor(new ActionClassifier(), settings);
    }

    BalanceSessionFactory createSessionFactory(AppConfig config, BalanceApiSettings settings) {
        return new JdbcBalanceSessionFactory(new JdbcConnectionFactory(config.dbConfig()), settings.getSchema());
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new SqlScriptFileWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new ProcessingReportXlsxWriter());
    }
}
