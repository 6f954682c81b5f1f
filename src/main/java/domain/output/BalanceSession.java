package domain.output;

import domain.id.IdAllocator;
import domain.process.ChangeScript;

/**
 * Database work for one input file: id allocation while the script is built, then
 * (in execute mode) running the script as one transaction.
 */
public interface BalanceSession extends AutoCloseable {

    IdAllocator idAllocator();

    /**
     * Runs every statement of the script in order and commits; rolls back and throws on
     * the first failure.
     */
    void execute(ChangeScript script) throws ScriptExecutionException;

    @Override
    void close();
}
