package org.javai.faults.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.faults.BuiltinClassification;
import org.javai.faults.ErrorContext;
import org.javai.faults.ErrorKind;
import org.javai.faults.Fault;
import org.javai.faults.Outcome;
import org.javai.faults.boundary.Boundary;
import org.javai.faults.ops.FaultReporter;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts faults and contexts to and from their JSON form.
 *
 * <p>A fault is written as its kind tag, its formatted message, the structural fields of its
 * kind, and its context when it has one:</p>
 * <pre>{@code
 * {"kind":"NotFound","message":"Not found: user with id 42","resource":"user","identifier":"42",
 *  "context":{"identifier":"6f1c…","timestamp":"2026-10-17T09:30:00.123456Z",
 *             "metadata":{"request":"r-1"},"causes":[{…},{…}]}}
 * }</pre>
 *
 * <p>The cause chain is written flat, oldest first, in the order of {@link ErrorContext#history()},
 * so chain length never adds JSON nesting. Identifiers and timestamps are read only in the
 * canonical form this codec writes (lower-case UUID, {@link Instant#toString()}), which keeps a
 * decoded context equal to the encoded one.</p>
 *
 * <p>Classifications are never written. On reading, built-in kinds get their classification back
 * from the kind tag. A {@code Custom} fault cannot get its classification back and is read with
 * {@link BuiltinClassification#UNCLASSIFIED}; that loss is permanent.</p>
 *
 * <p>Malformed input is reported as a failed outcome holding a
 * {@link Fault#parsing(String) parsing} fault. A failure while writing is reported as a
 * {@link Fault#serialization(String) serialization} fault.</p>
 */
public final class FaultCodec {

    static final String KIND = "kind";
    static final String MESSAGE = "message";
    static final String CONTEXT = "context";
    static final String OPERATION = "operation";
    static final String DETAIL = "detail";
    static final String FIELD = "field";
    static final String RESOURCE = "resource";
    static final String IDENTIFIER = "identifier";
    static final String TIMESTAMP = "timestamp";
    static final String METADATA = "metadata";
    static final String CAUSES = "causes";

    private final ObjectMapper mapper;
    private final Boundary reading;
    private final Boundary writing;

    public FaultCodec() {
        this(new ObjectMapper());
    }

    public FaultCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.reading = Boundary.silent();
        this.writing = Boundary.of((operation, e) -> Fault.serialization(detailOf(e)), FaultReporter.noOp());
    }

    // === Writing ===

    public Outcome<String> encode(Fault fault) {
        ObjectNode tree = toTree(fault);
        return writing.call("FaultCodec.encode", () -> mapper.writeValueAsString(tree));
    }

    public Outcome<String> encodeContext(ErrorContext context) {
        ObjectNode tree = toTree(context);
        return writing.call("FaultCodec.encodeContext", () -> mapper.writeValueAsString(tree));
    }

    public ObjectNode toTree(Fault fault) {
        Objects.requireNonNull(fault, "fault must not be null");
        ObjectNode node = mapper.createObjectNode();
        node.put(KIND, fault.kind().tag());
        node.put(MESSAGE, fault.message());

        if (fault instanceof Fault.Database database) {
            node.put(OPERATION, database.operation());
            node.put(DETAIL, database.detail());
        } else if (fault instanceof Fault.Network network) {
            node.put(DETAIL, network.detail());
        } else if (fault instanceof Fault.Validation validation) {
            node.put(FIELD, validation.field());
            node.put(DETAIL, validation.detail());
        } else if (fault instanceof Fault.NotFound notFound) {
            node.put(RESOURCE, notFound.resource());
            node.put(IDENTIFIER, notFound.identifier());
        } else if (fault instanceof Fault.Internal internal) {
            node.put(DETAIL, internal.detail());
        }
        // Custom: message only, the classification is not serializable.

        fault.context().ifPresent(context -> node.set(CONTEXT, toTree(context)));
        return node;
    }

    public ObjectNode toTree(ErrorContext context) {
        Objects.requireNonNull(context, "context must not be null");
        ObjectNode node = entryTree(context);
        List<ErrorContext> history = context.history();
        if (history.size() > 1) {
            ArrayNode causes = node.putArray(CAUSES);
            for (ErrorContext cause : history.subList(0, history.size() - 1)) {
                causes.add(entryTree(cause));
            }
        }
        return node;
    }

    private ObjectNode entryTree(ErrorContext context) {
        ObjectNode node = mapper.createObjectNode();
        node.put(IDENTIFIER, context.id().toString());
        node.put(TIMESTAMP, context.timestamp().toString());
        ObjectNode metadata = node.putObject(METADATA);
        context.metadata().forEach(metadata::put);
        return node;
    }

    // === Reading ===

    public Outcome<Fault> decode(String json) {
        Objects.requireNonNull(json, "json must not be null");
        return reading.call("FaultCodec.decode", () -> readFault(mapper.readTree(json)));
    }

    public Outcome<ErrorContext> decodeContext(String json) {
        Objects.requireNonNull(json, "json must not be null");
        return reading.call("FaultCodec.decodeContext", () -> readContext(mapper.readTree(json)));
    }

    public Outcome<Fault> fromTree(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return reading.call("FaultCodec.fromTree", () -> readFault(node));
    }

    private Fault readFault(JsonNode node) throws JsonProcessingException {
        requireObject(node, "fault");
        ErrorKind kind = readKind(node);
        Optional<ErrorContext> context = node.hasNonNull(CONTEXT)
                ? Optional.of(readContext(node.get(CONTEXT)))
                : Optional.empty();

        return switch (kind) {
            case DATABASE -> new Fault.Database(text(node, OPERATION), text(node, DETAIL), context);
            case NETWORK -> new Fault.Network(text(node, DETAIL), context);
            case VALIDATION -> new Fault.Validation(text(node, FIELD), text(node, DETAIL), context);
            case NOT_FOUND -> new Fault.NotFound(text(node, RESOURCE), text(node, IDENTIFIER), context);
            case INTERNAL -> new Fault.Internal(text(node, DETAIL), context);
            case CUSTOM -> new Fault.Custom(text(node, MESSAGE), BuiltinClassification.UNCLASSIFIED, context);
        };
    }

    private ErrorKind readKind(JsonNode node) throws JsonProcessingException {
        String tag = text(node, KIND);
        try {
            return ErrorKind.fromTag(tag);
        } catch (IllegalArgumentException e) {
            throw malformed("unknown kind '" + tag + "'");
        }
    }

    private ErrorContext readContext(JsonNode node) throws JsonProcessingException {
        requireObject(node, "context");
        Optional<ErrorContext> cause = Optional.empty();
        JsonNode causes = node.get(CAUSES);
        if (causes != null && !causes.isNull()) {
            if (!causes.isArray()) {
                throw malformed("causes must be a JSON array");
            }
            for (JsonNode entry : causes) {
                requireObject(entry, "cause");
                cause = Optional.of(readEntry(entry, cause));
            }
        }
        return readEntry(node, cause);
    }

    private static ErrorContext readEntry(JsonNode node, Optional<ErrorContext> cause) throws JsonProcessingException {
        String identifier = text(node, IDENTIFIER);
        String instant = text(node, TIMESTAMP);
        UUID id;
        Instant timestamp;
        try {
            id = UUID.fromString(identifier);
            timestamp = Instant.parse(instant);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw malformed("invalid context: " + e.getMessage());
        }
        if (!id.toString().equals(identifier)) {
            throw malformed("identifier '" + identifier + "' is not in canonical form");
        }
        if (!timestamp.toString().equals(instant)) {
            throw malformed("timestamp '" + instant + "' is not in canonical form");
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        JsonNode metadataNode = node.get(METADATA);
        if (metadataNode != null && !metadataNode.isNull()) {
            requireObject(metadataNode, "metadata");
            Iterator<Map.Entry<String, JsonNode>> fields = metadataNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isTextual()) {
                    throw malformed("metadata value for '" + field.getKey() + "' is not a string");
                }
                metadata.put(field.getKey(), field.getValue().textValue());
            }
        }

        return new ErrorContext(id, timestamp, metadata, cause);
    }

    private static String text(JsonNode node, String field) throws JsonProcessingException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw malformed("missing string field '" + field + "'");
        }
        return value.textValue();
    }

    private static void requireObject(JsonNode node, String what) throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            throw malformed(what + " must be a JSON object");
        }
    }

    private static String detailOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }

    private static JsonMappingException malformed(String message) {
        return JsonMappingException.from((JsonParser) null, message);
    }
}
