package org.javai.faults.boundary;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.faults.ErrorContext;
import org.javai.faults.Fault;
import org.javai.faults.Outcome;
import org.javai.faults.ops.FaultReporter;

import java.util.Map;
import java.util.Objects;

/**
 * The adapter between code that throws checked exceptions and code that returns {@link Outcome}.
 * Catches exceptions, translates them into faults, reports them, and returns Outcome.
 *
 * <p>The exception itself is kept as the cause of the fault's context, so its type and message
 * survive into logs and serialized faults:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jFaultReporter());
 *
 * Outcome<Order> order = boundary.call("OrdersRepository.load", () -> repository.load(orderId));
 * }</pre>
 *
 * <p>RuntimeExceptions are defects and are not caught. An {@link InterruptedException} becomes a
 * fault like any other checked exception, but the thread's interrupt flag is set again so the
 * caller can still see the cancellation. A reporter that throws is logged and never fails the call.</p>
 */
public final class Boundary {

    /**
     * Metadata key under which the operation name is recorded.
     */
    public static final String OPERATION_KEY = "operation";

    private static final Logger LOG = LogManager.getLogger(Boundary.class);

    private static final FaultTranslator DEFAULT_TRANSLATOR = new DefaultFaultTranslator();

    private final FaultTranslator translator;
    private final FaultReporter reporter;

    /**
     * Creates a Boundary that translates failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_TRANSLATOR, FaultReporter.noOp());
    }

    /**
     * Creates a Boundary with default translation and the specified reporter.
     */
    public static Boundary withReporter(FaultReporter reporter) {
        return new Boundary(DEFAULT_TRANSLATOR, reporter);
    }

    public static Boundary of(FaultTranslator translator, FaultReporter reporter) {
        return new Boundary(translator, reporter);
    }

    public Boundary(FaultTranslator translator, FaultReporter reporter) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a translated fault
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Map.of(), work);
    }

    /**
     * Executes work, recording the given tags in the context of any resulting fault.
     *
     * @param operation The operation name
     * @param tags Additional metadata, in iteration order
     * @param work The work to execute
     * @return Ok with the result, or Fail with a translated fault
     */
    public <T> Outcome<T> call(String operation, Map<String, String> tags, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            // Defects propagate; they are not operational failures.
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, tags, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Map<String, String> tags, Exception e) {
        ErrorContext context = ErrorContext.causedBy(ErrorContext.describing(e))
                .withMetadata(OPERATION_KEY, operation);
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            context = context.withMetadata(tag.getKey(), tag.getValue());
        }

        Fault fault = Objects.requireNonNull(translator.translate(operation, e),
                "translator returned null for " + e.getClass().getName())
                .withContext(context);

        try {
            reporter.report(operation, fault);
        } catch (RuntimeException reportFailure) {
            LOG.warn("FaultReporter {} failed for operation [{}]", reporter.getClass().getName(), operation, reportFailure);
        }
        return Outcome.fail(fault);
    }
}
