package app;

/**
 * script: write one SQL file for review. execute: run each file as a transaction.
 */
public enum RunMode {
    SCRIPT,
    EXECUTE
}
