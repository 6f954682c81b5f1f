package domain.model;
/** No-op warning sink. */
final class NullChangeWarningSink implements ChangeWarningSink {

    static final NullChangeWarningSink INSTANCE = new NullChangeWarningSink();

    private NullChangeWarningSink() {
    }

    @Override
    public void warn(ChangeWarning warning) {
        // no-op
    }
}
