package org.javai.faults.ops.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.faults.Fault;
import org.javai.faults.json.FaultCodec;
import org.javai.faults.ops.FaultReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports faults as JSON lines via SLF4J, for log shippers and monitoring pipelines.
 *
 * <p>Each fault becomes one INFO line wrapping the {@link FaultCodec} form:</p>
 * <pre>{@code
 * {"eventType":"fault","operation":"OrdersApi.fetch","retriable":true,"fault":{"kind":"Network",...}}
 * }</pre>
 */
public class JsonLinesFaultReporter implements FaultReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.faults.JsonLines";

	private final Logger logger;
	private final ObjectMapper mapper;
	private final FaultCodec codec;

	public JsonLinesFaultReporter() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public JsonLinesFaultReporter(String loggerName) {
		this(LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	JsonLinesFaultReporter(Logger logger) {
		this.logger = logger;
		this.mapper = new ObjectMapper();
		this.codec = new FaultCodec(mapper);
	}

	@Override
	public void report(String operation, Fault fault) {
		try {
			logger.info(mapper.writeValueAsString(buildEvent(operation, fault)));
		} catch (Exception e) {
			logger.warn("Could not report fault for operation [{}]: {}", operation, e.getMessage());
		}
	}

	ObjectNode buildEvent(String operation, Fault fault) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", "fault");
		event.put("operation", operation);
		event.put("category", fault.category().categoryName());
		event.put("retriable", fault.isRetriable());
		event.set("fault", codec.toTree(fault));
		return event;
	}
}
