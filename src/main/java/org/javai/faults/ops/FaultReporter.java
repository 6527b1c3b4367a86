package org.javai.faults.ops;

import org.javai.faults.Fault;

/**
 * Reports faults for observability.
 * Implementations might emit structured logs, JSON lines or alerts. Reporting must not
 * throw into the caller.
 */
@FunctionalInterface
public interface FaultReporter {

	/**
	 * Reports a fault.
	 *
	 * @param operation the operation that failed
	 * @param fault the fault it failed with
	 */
	void report(String operation, Fault fault);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static FaultReporter noOp() {
		return (operation, fault) -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static FaultReporter composite(FaultReporter... reporters) {
		return CompositeFaultReporter.of(reporters);
	}
}
