package domain.output;

/**
 * Opens a {@link BalanceSession} per input file.
 */
@FunctionalInterface
public interface BalanceSessionFactory {

    /**
     * @throws IllegalStateException when the database is not reachable
     */
    BalanceSession open();
}
