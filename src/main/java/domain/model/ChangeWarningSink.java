package domain.model;

/**
 * Sink for change-log warnings.
 *
 * <p>Warnings are produced by the registry, the emitter and the driver. A simple sink
 * collects them without coupling those components to the CLI or the report writer.</p>
 */
public interface ChangeWarningSink {

    static ChangeWarningSink none() {
        return NullChangeWarningSink.INSTANCE;
    }

    void warn(ChangeWarning warning);
}
