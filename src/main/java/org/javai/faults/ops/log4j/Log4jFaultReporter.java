package org.javai.faults.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.faults.ErrorContext;
import org.javai.faults.ErrorKind;
import org.javai.faults.Fault;
import org.javai.faults.ops.FaultReporter;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports faults using Log4j2.
 *
 * <p>The level follows the fault's classification:
 * <ul>
 *   <li>retriable → WARN</li>
 *   <li>{@code Validation}, {@code NotFound} → INFO</li>
 *   <li>{@code Internal} → ERROR</li>
 *   <li>non-retriable {@code Custom} → WARN</li>
 * </ul>
 */
public class Log4jFaultReporter implements FaultReporter {

	private static final Marker FAULT_MARKER = MarkerManager.getMarker("FAULT");

	private final Logger logger;

	public Log4jFaultReporter() {
		this(LogManager.getLogger("org.javai.faults.FaultReporter"));
	}

	public Log4jFaultReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jFaultReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, Fault fault) {
		logger.atLevel(levelFor(fault))
			.withMarker(FAULT_MARKER)
			.log(formatFaultMessage(operation, fault));
	}

	static Level levelFor(Fault fault) {
		if (fault.isRetriable()) {
			return Level.WARN;
		}
		ErrorKind kind = fault.kind();
		if (kind == ErrorKind.VALIDATION || kind == ErrorKind.NOT_FOUND) {
			return Level.INFO;
		}
		if (kind == ErrorKind.INTERNAL) {
			return Level.ERROR;
		}
		return Level.WARN;
	}

	static String formatFaultMessage(String operation, Fault fault) {
		return "Fault in operation [%s]: %s | kind=%s, category=%s, retriable=%s%s".formatted(
			operation,
			fault.message(),
			fault.kind().tag(),
			fault.category().categoryName(),
			fault.isRetriable(),
			fault.context().map(Log4jFaultReporter::formatContext).orElse(""));
	}

	private static String formatContext(ErrorContext context) {
		StringBuilder sb = new StringBuilder(", id=").append(context.id());
		if (!context.metadata().isEmpty()) {
			sb.append(", metadata=").append(formatMetadata(context.metadata()));
		}
		context.cause().ifPresent(cause -> sb.append(", cause=")
			.append(cause.metadata(ErrorContext.EXCEPTION_KEY).orElse(cause.id().toString())));
		return sb.toString();
	}

	private static String formatMetadata(Map<String, String> metadata) {
		return metadata.entrySet().stream()
			.map(e -> e.getKey() + "=" + e.getValue())
			.collect(Collectors.joining(", ", "{", "}"));
	}
}
