package io.mnemo.core.consolidation;

/**
 * Thrown from inside a consolidation run once its budget is exhausted or the
 * running thread is interrupted. Writes made before this point are kept.
 */
public final class ConsolidationCancelledException extends RuntimeException {
    public ConsolidationCancelledException(String message) {
        super(message);
    }
}
