package org.javai.faults.boundary;

import org.javai.faults.Fault;

/**
 * Chooses the fault kind for a checked exception caught at a {@link Boundary}.
 *
 * <p>Translators decide kind and message only. The boundary attaches the context
 * (operation, tags, and the exception as cause), replacing any context the translator set.</p>
 */
@FunctionalInterface
public interface FaultTranslator {

    /**
     * @param operation The operation that was being performed
     * @param exception The exception that occurred
     * @return the fault standing for the exception
     */
    Fault translate(String operation, Exception exception);
}
