package de.caluga.test.dataapi.driver;

import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.NumCoercionException;
import de.caluga.dataapi.driver.ObjectId;
import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.driver.serdes.NumRep;
import de.caluga.dataapi.driver.serdes.NumericCoercionPolicy;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("inmemory")
public class DataApiJsonTest {
    private static final String BIG = "12345678901234567890123";

    @SuppressWarnings("unchecked")
    private static Map<String, Object> document(Map<String, Object> response) {
        return (Map<String, Object>) ((Map<String, Object>) response.get("data")).get("document");
    }

    @Test
    public void wrappersAreWrittenAndRevived() {
        DataApiJson json = new DataApiJson();
        UUID uuid = UUID.fromString("0190e5c6-7a1b-7cc2-8e36-2a3b4c5d6e7f");
        ObjectId oid = new ObjectId("65f1a2b3c4d5e6f708192a3b");
        String written = json.serialize(Doc.of("u", uuid, "o", oid, "d", Instant.ofEpochMilli(42)));

        assertThat(written).isEqualTo("{\"u\":{\"$uuid\":\"0190e5c6-7a1b-7cc2-8e36-2a3b4c5d6e7f\"},\"o\":{\"$objectId\":\"65f1a2b3c4d5e6f708192a3b\"},\"d\":{\"$date\":42}}");

        Map<String, Object> doc = document(json.deserializeResponse("{\"data\":{\"document\":" + written + "}}"));
        assertThat(doc.get("u")).isEqualTo(uuid);
        assertThat(doc.get("o")).isEqualTo(oid);
        assertThat(doc.get("d")).isEqualTo(Instant.ofEpochMilli(42));
    }

    @Test
    public void deserializeRevivesValues() {
        DataApiJson json = new DataApiJson(new NumericCoercionPolicy().add("n", NumRep.BIG_INTEGER));
        Object value = json.deserialize("{\"d\":{\"$date\":7},\"n\":" + BIG + "}");

        assertThat(value).isEqualTo(Map.of("d", Instant.ofEpochMilli(7), "n", new BigInteger(BIG)));
        assertThat(json.deserialize(" ")).isNull();
    }

    @Test
    public void wrapperWithExtraKeysIsKept() {
        Map<String, Object> doc = document(new DataApiJson().deserializeResponse("{\"data\":{\"document\":{\"x\":{\"$date\":1,\"other\":2}}}}"));
        assertThat(doc.get("x")).isEqualTo(Map.of("$date", 1, "other", 2));
    }

    @Test
    public void stableSerializationSortsKeys() {
        DataApiJson json = new DataApiJson();
        String a = json.stableSerialize(Doc.of("b", 1, "a", Doc.of("d", 1, "c", 2)));
        String b = json.stableSerialize(Doc.of("a", Doc.of("c", 2, "d", 1), "b", 1));

        assertThat(a).isEqualTo("{\"a\":{\"c\":2,\"d\":1},\"b\":1}");
        assertThat(a).isEqualTo(b);
    }

    @Test
    public void plainNumbersWithoutPolicy() {
        Map<String, Object> doc = document(new DataApiJson().deserializeResponse("{\"data\":{\"document\":{\"i\":5,\"l\":5000000000,\"d\":0.5}}}"));

        assertThat(doc.get("i")).isEqualTo(5);
        assertThat(doc.get("l")).isEqualTo(5000000000L);
        assertThat(doc.get("d")).isEqualTo(0.5);
    }

    @Test
    public void policyCoercesDocumentNumbers() {
        NumericCoercionPolicy policy = NumericCoercionPolicy.of(Map.of(
                "price", NumRep.BIG_DECIMAL,
                "big", NumRep.BIG_INTEGER,
                "code", NumRep.STRING,
                "loose", NumRep.NUMBER_OR_STRING));
        DataApiJson json = new DataApiJson(policy);

        Map<String, Object> resp = json.deserializeResponse("{\"status\":{\"count\":3},\"data\":{\"documents\":[{\"price\":12.50000000000000000001,"
                + "\"big\":" + BIG + ",\"code\":7,\"loose\":" + BIG + ",\"plain\":0.1,\"small\":4}]}}");

        @SuppressWarnings("unchecked")
        Map<String, Object> doc = ((List<Map<String, Object>>) ((Map<String, Object>) resp.get("data")).get("documents")).get(0);
        assertThat(doc.get("price")).isEqualTo(new BigDecimal("12.50000000000000000001"));
        assertThat(doc.get("big")).isEqualTo(new BigInteger(BIG));
        assertThat(doc.get("code")).isEqualTo("7");
        assertThat(doc.get("loose")).isEqualTo(BIG);
        assertThat(doc.get("plain")).isEqualTo(0.1);
        assertThat(doc.get("small")).isEqualTo(4);

        @SuppressWarnings("unchecked")
        Map<String, Object> status = (Map<String, Object>) resp.get("status");
        assertThat(status.get("count")).isEqualTo(3);
    }

    @Test
    public void lossyNumberFails() {
        DataApiJson json = new DataApiJson(new NumericCoercionPolicy().add("x", NumRep.BIG_DECIMAL));

        assertThatThrownBy(() -> json.deserializeResponse("{\"data\":{\"document\":{\"nested\":{\"big\":" + BIG + "}}}}"))
            .isInstanceOfSatisfying(NumCoercionException.class, e -> {
                assertThat(e.getPath()).containsExactly("nested", "big");
                assertThat(e.getTo()).isEqualTo(NumRep.NUMBER);
                assertThat(e.getMessage()).isEqualTo("Failed to coerce value from bignumber to number at path: nested.big");
            });
    }

    @Test
    public void fractionIsNoBigInteger() {
        NumericCoercionPolicy policy = new NumericCoercionPolicy().add("n", NumRep.BIG_INTEGER);
        assertThatThrownBy(() -> policy.coerce(new BigDecimal("1.5"), List.of("n"))).isInstanceOf(NumCoercionException.class);
        assertThat(policy.coerce(new BigDecimal("2.000"), List.of("n"))).isEqualTo(BigInteger.TWO);
    }

    @Test
    public void exactSegmentWinsOverWildcard() {
        NumericCoercionPolicy policy = NumericCoercionPolicy.of(Map.of(
                "stats.*.count", NumRep.BIG_INTEGER,
                "stats.daily.count", NumRep.STRING,
                "*", NumRep.BIG_DECIMAL));

        assertThat(policy.repFor(List.of("stats", "weekly", "count"))).isEqualTo(NumRep.BIG_INTEGER);
        assertThat(policy.repFor(List.of("stats", "daily", "count"))).isEqualTo(NumRep.STRING);
        assertThat(policy.repFor(List.of("other"))).isEqualTo(NumRep.BIG_DECIMAL);
        assertThat(policy.repFor(List.of("stats", "weekly", "sum"))).isEqualTo(NumRep.NUMBER);
    }

    @Test
    public void devOpsBodiesMayBeText() {
        DataApiJson json = new DataApiJson();
        assertThat(json.parseOrText("not json at all")).isEqualTo("not json at all");
        assertThat(json.parseOrText("[1,2]")).isEqualTo(List.of(1, 2));
        assertThat(json.parseOrText("  ")).isNull();
    }

    @Test
    public void objectIdTimestamp() {
        Instant t = Instant.ofEpochSecond(1700000000);
        ObjectId id = new ObjectId(t);

        assertThat(id.getTimestamp()).isEqualTo(t);
        assertThat(ObjectId.isValid(id.toHexString())).isTrue();
        assertThat(new ObjectId(id.toHexString())).isEqualTo(id);
        assertThatThrownBy(() -> new ObjectId("xyz")).isInstanceOf(IllegalArgumentException.class);
    }
}
