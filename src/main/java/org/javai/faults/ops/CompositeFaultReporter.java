package org.javai.faults.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.faults.Fault;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link FaultReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every fault. A reporter that throws is logged
 * and skipped; the remaining reporters still run.
 *
 * <pre>{@code
 * FaultReporter reporter = CompositeFaultReporter.of(
 *     new Log4jFaultReporter(),
 *     new JsonLinesFaultReporter()
 * );
 * }</pre>
 */
public final class CompositeFaultReporter implements FaultReporter {

	private static final Logger LOG = LogManager.getLogger(CompositeFaultReporter.class);

	private final List<FaultReporter> reporters;

	private CompositeFaultReporter(List<FaultReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeFaultReporter of(FaultReporter... reporters) {
		return new CompositeFaultReporter(Arrays.asList(reporters));
	}

	public static CompositeFaultReporter of(Collection<? extends FaultReporter> reporters) {
		return new CompositeFaultReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(String operation, Fault fault) {
		for (FaultReporter reporter : reporters) {
			try {
				reporter.report(operation, fault);
			} catch (RuntimeException e) {
				LOG.warn("FaultReporter {} failed for operation [{}]", reporter.getClass().getName(), operation, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}
}
