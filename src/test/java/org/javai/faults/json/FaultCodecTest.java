package org.javai.faults.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.faults.Backoff;
import org.javai.faults.BackoffClassification;
import org.javai.faults.BuiltinClassification;
import org.javai.faults.ErrorContext;
import org.javai.faults.ErrorKind;
import org.javai.faults.Fault;
import org.javai.faults.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class FaultCodecTest {

    private FaultCodec codec;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        codec = new FaultCodec(mapper);
    }

    @Test
    void notFound_roundTrips_withContextIdentifier() {
        ErrorContext context = ErrorContext.create().withMetadata("request", "r-1");
        Fault fault = Fault.notFound("user", "42").withContext(context);

        String json = codec.encode(fault).getOrThrow();
        Fault decoded = codec.decode(json).getOrThrow();

        assertThat(decoded.kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(decoded.message()).isEqualTo("Not found: user with id 42");
        assertThat(decoded.context().orElseThrow().id()).isEqualTo(context.id());
        assertThat(decoded.context().orElseThrow().id().toString()).isEqualTo(context.id().toString());
        assertThat(decoded).isEqualTo(fault);
    }

    @Test
    void builtinKinds_roundTrip() {
        List<Fault> faults = List.of(
                Fault.database("insert_user", "deadlock"),
                Fault.network("timeout"),
                Fault.validation("email", "Invalid format"),
                Fault.notFound("order", "A-17"),
                Fault.internal("invariant broken"));

        for (Fault fault : faults) {
            Fault decoded = codec.decode(codec.encode(fault).getOrThrow()).getOrThrow();

            assertThat(decoded).as(fault.kind().tag()).isEqualTo(fault);
            assertThat(decoded.category()).isSameAs(fault.category());
        }
    }

    @Test
    void context_roundTrips_exactly() {
        ErrorContext cause = ErrorContext.describing(new java.io.IOException("disk error"));
        ErrorContext context = ErrorContext.causedBy(cause)
                .withMetadata("zone", "eu-west-1")
                .withMetadata("attempt", "3")
                .withMetadata("method", "GET");

        ErrorContext decoded = codec.decodeContext(codec.encodeContext(context).getOrThrow()).getOrThrow();

        assertThat(decoded).isEqualTo(context);
        assertThat(decoded.timestamp()).isEqualTo(context.timestamp());
        assertThat(decoded.metadata().keySet()).containsExactly("zone", "attempt", "method");
        assertThat(decoded.history()).hasSize(2);
    }

    @Test
    void context_jsonShape() {
        ErrorContext context = new ErrorContext(
                UUID.fromString("3f2b8a4e-5c1d-4e7f-9a6b-0c8d2e1f4a5b"),
                Instant.parse("2024-01-20T10:30:00.123456Z"),
                Map.of("endpoint", "/api/users"),
                Optional.empty());

        ObjectNode tree = codec.toTree(context);

        assertThat(fieldNames(tree)).containsExactly("identifier", "timestamp", "metadata");
        assertThat(tree.get("identifier").asText()).isEqualTo("3f2b8a4e-5c1d-4e7f-9a6b-0c8d2e1f4a5b");
        assertThat(tree.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00.123456Z");
        assertThat(tree.get("metadata").get("endpoint").asText()).isEqualTo("/api/users");
    }

    @Test
    void context_causes_areWrittenFlatOldestFirst() {
        ErrorContext root = ErrorContext.create().withMetadata("step", "root");
        ErrorContext middle = ErrorContext.causedBy(root).withMetadata("step", "middle");
        ErrorContext top = ErrorContext.causedBy(middle).withMetadata("step", "top");

        ObjectNode tree = codec.toTree(top);

        assertThat(fieldNames(tree)).containsExactly("identifier", "timestamp", "metadata", "causes");
        JsonNode causes = tree.get("causes");
        assertThat(causes.size()).isEqualTo(2);
        assertThat(causes.get(0).get("identifier").asText()).isEqualTo(root.id().toString());
        assertThat(causes.get(1).get("metadata").get("step").asText()).isEqualTo("middle");
        assertThat(tree.get("metadata").get("step").asText()).isEqualTo("top");
    }

    @Test
    void deepCauseChain_roundTrips() {
        ErrorContext context = ErrorContext.create().withMetadata("depth", "0");
        for (int i = 1; i <= 1200; i++) {
            context = ErrorContext.causedBy(context).withMetadata("depth", String.valueOf(i));
        }
        Fault fault = Fault.network("timeout").withContext(context);

        Outcome<String> encoded = codec.encode(fault);
        assertThat(encoded.isOk()).isTrue();

        Fault decoded = codec.decode(encoded.getOrThrow()).getOrThrow();
        ErrorContext decodedContext = decoded.context().orElseThrow();
        assertThat(decodedContext.history()).hasSize(1201);
        assertThat(decodedContext.root().metadata("depth")).contains("0");
        assertThat(decodedContext.root().id()).isEqualTo(context.root().id());
        assertThat(decoded).isEqualTo(fault);
    }

    @Test
    void encode_writeFailure_returnsSerializationFault() {
        JsonFactory shallow = JsonFactory.builder()
                .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(1).build())
                .build();
        FaultCodec limited = new FaultCodec(new ObjectMapper(shallow));

        Outcome<String> outcome = limited.encode(Fault.network("timeout").annotate("endpoint", "/api/users"));

        Fault fault = outcome.fault().orElseThrow();
        assertThat(fault.kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(fault.message()).startsWith("Internal error: Serialization error:");
    }

    @Test
    void fault_jsonShape_isDiscriminatedByKind() {
        ObjectNode tree = codec.toTree(Fault.validation("age", "must be positive"));

        assertThat(fieldNames(tree)).containsExactly("kind", "message", "field", "detail");
        assertThat(tree.get("kind").asText()).isEqualTo("Validation");
        assertThat(tree.get("message").asText()).isEqualTo("Validation error: age: must be positive");
    }

    @Test
    void custom_serializesMessageOnly() {
        Fault fault = Fault.custom("card issuer unavailable",
                new BackoffClassification("PaymentProcessing", true, Backoff.exponential(Duration.ofSeconds(1), 2, Duration.ofMinutes(1))));

        ObjectNode tree = codec.toTree(fault);

        assertThat(fieldNames(tree)).containsExactly("kind", "message");
        assertThat(tree.toString()).doesNotContain("PaymentProcessing");
    }

    @Test
    void custom_decodesWithFallbackClassification() {
        Fault fault = Fault.custom("card issuer unavailable",
                new BackoffClassification("PaymentProcessing", true, Backoff.exponential(Duration.ofSeconds(1), 2, Duration.ofMinutes(1))))
                .annotate("card", "visa");

        Fault decoded = codec.decode(codec.encode(fault).getOrThrow()).getOrThrow();

        assertThat(decoded.kind()).isEqualTo(ErrorKind.CUSTOM);
        assertThat(decoded.message()).isEqualTo("card issuer unavailable");
        assertThat(decoded.category()).isSameAs(BuiltinClassification.UNCLASSIFIED);
        assertThat(decoded.isRetriable()).isFalse();
        assertThat(decoded.context()).isEqualTo(fault.context());
    }

    @Test
    void fromTree_acceptsEmbeddedFault() {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.set("fault", codec.toTree(Fault.network("timeout")));

        Outcome<Fault> decoded = codec.fromTree(envelope.get("fault"));

        assertThat(decoded.getOrThrow()).isEqualTo(Fault.network("timeout"));
    }

    @Test
    void decode_invalidJson_returnsParsingFault() {
        Outcome<Fault> outcome = codec.decode("not valid json");

        assertThat(outcome.isFail()).isTrue();
        Fault fault = outcome.fault().orElseThrow();
        assertThat(fault).isInstanceOf(Fault.Validation.class);
        assertThat(((Fault.Validation) fault).field()).isEqualTo("parsing");
    }

    @Test
    void decode_unknownKind_returnsParsingFault() {
        Outcome<Fault> outcome = codec.decode("{\"kind\":\"Conflict\",\"message\":\"duplicate\"}");

        Fault fault = outcome.fault().orElseThrow();
        assertThat(fault.kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(((Fault.Validation) fault).detail()).contains("Conflict");
    }

    @Test
    void decode_missingField_returnsParsingFault() {
        Outcome<Fault> outcome = codec.decode("{\"kind\":\"NotFound\",\"message\":\"Not found: user with id 42\",\"resource\":\"user\"}");

        Fault fault = outcome.fault().orElseThrow();
        assertThat(((Fault.Validation) fault).detail()).contains("identifier");
    }

    @Test
    void decode_badContext_returnsParsingFault() {
        String json = "{\"kind\":\"Network\",\"message\":\"Network error: timeout\",\"detail\":\"timeout\","
                + "\"context\":{\"identifier\":\"not-a-uuid\",\"timestamp\":\"2024-01-20T10:30:00Z\",\"metadata\":{}}}";

        Outcome<Fault> outcome = codec.decode(json);

        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome.fault().orElseThrow().kind()).isEqualTo(ErrorKind.VALIDATION);
    }

    @Test
    void decodeContext_nonCanonicalIdentifier_returnsParsingFault() {
        String json = "{\"identifier\":\"3F2B8A4E-5C1D-4E7F-9A6B-0C8D2E1F4A5B\","
                + "\"timestamp\":\"2024-01-20T10:30:00Z\",\"metadata\":{}}";

        Outcome<ErrorContext> outcome = codec.decodeContext(json);

        assertThat(outcome.isFail()).isTrue();
        assertThat(((Fault.Validation) outcome.fault().orElseThrow()).detail()).contains("canonical");
    }

    @Test
    void decodeContext_nonCanonicalTimestamp_returnsParsingFault() {
        String json = "{\"identifier\":\"3f2b8a4e-5c1d-4e7f-9a6b-0c8d2e1f4a5b\","
                + "\"timestamp\":\"2024-01-20T10:30:00.1Z\",\"metadata\":{}}";

        assertThat(codec.decodeContext(json).isFail()).isTrue();
    }

    @Test
    void decodeContext_canonicalInput_reEncodesIdentically() {
        String json = "{\"identifier\":\"3f2b8a4e-5c1d-4e7f-9a6b-0c8d2e1f4a5b\","
                + "\"timestamp\":\"2024-01-20T10:30:00.100Z\",\"metadata\":{\"zone\":\"eu\"}}";

        ErrorContext context = codec.decodeContext(json).getOrThrow();

        assertThat(codec.encodeContext(context).getOrThrow()).isEqualTo(json);
    }

    @Test
    void decode_causesNotArray_returnsParsingFault() {
        String json = "{\"identifier\":\"3f2b8a4e-5c1d-4e7f-9a6b-0c8d2e1f4a5b\","
                + "\"timestamp\":\"2024-01-20T10:30:00Z\",\"metadata\":{},\"causes\":{}}";

        assertThat(codec.decodeContext(json).isFail()).isTrue();
    }

    @Test
    void decode_nonObject_returnsParsingFault() {
        assertThat(codec.decode("[1,2,3]").isFail()).isTrue();
        assertThat(codec.decode("").isFail()).isTrue();
    }

    @Test
    void decodeContext_nonStringMetadata_returnsParsingFault() {
        String json = "{\"identifier\":\"3f2b8a4e-5c1d-4e7f-9a6b-0c8d2e1f4a5b\","
                + "\"timestamp\":\"2024-01-20T10:30:00Z\",\"metadata\":{\"attempt\":3}}";

        assertThat(codec.decodeContext(json).isFail()).isTrue();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
