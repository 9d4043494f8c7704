package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.multipart.secrets.DuplicateKeyException;
import tech.yump.multipart.secrets.EmptyPartException;
import tech.yump.multipart.secrets.MalformedPartException;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DocumentMergerTest {

    private DocumentMerger documentMerger;

    @BeforeEach
    void setUp() {
        documentMerger = new DocumentMerger(new PartCodec(new ObjectMapper()));
    }

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("merge: combines the keys of all parts with their JSON values")
    void merge_combinesParts() {
        Map<Integer, byte[]> parts = Map.of(
                0, json("{\"b\":\"2\",\"a\":\"1\"}"),
                1, json("{\"n\":42,\"flag\":true,\"none\":null,\"list\":[1,2],\"obj\":{\"x\":\"y\"}}"));

        SecretDocument merged = documentMerger.merge("app", parts);

        assertThat(merged.keys()).containsExactly("a", "b", "flag", "list", "n", "none", "obj");
        assertThat(merged.get("n").intValue()).isEqualTo(42);
        assertThat(merged.get("flag").booleanValue()).isTrue();
        assertThat(merged.get("none").isNull()).isTrue();
        assertThat(merged.get("list").isArray()).isTrue();
        assertThat(merged.get("obj").get("x").asText()).isEqualTo("y");
    }

    @Test
    @DisplayName("merge: a key in two parts is reported against the later part in index order")
    void merge_duplicateKeyAcrossParts() {
        Map<Integer, byte[]> parts = new HashMap<>();
        parts.put(2, json("{\"shared\":\"late\"}"));
        parts.put(0, json("{\"shared\":\"early\",\"a\":\"1\"}"));

        DuplicateKeyException ex = catchThrowableOfType(
                () -> documentMerger.merge("app", parts), DuplicateKeyException.class);

        assertThat(ex.getKey()).isEqualTo("shared");
        assertThat(ex.getFirstPartName()).isEqualTo("app");
        assertThat(ex.getDuplicatePartName()).isEqualTo("app-2");
    }

    @Test
    void merge_invalidJson_throwsMalformedPart() {
        Map<Integer, byte[]> parts = Map.of(0, json("{\"a\":\"1\"}"), 1, json("{not json"));

        MalformedPartException ex = catchThrowableOfType(
                () -> documentMerger.merge("app", parts), MalformedPartException.class);

        assertThat(ex.getPartName()).isEqualTo("app-1");
        assertThat(ex).hasMessageContaining("app-1");
    }

    @Test
    void merge_nonObjectPayloads_throwMalformedPart() {
        assertThatThrownBy(() -> documentMerger.merge("app", Map.of(0, json("[1,2,3]"))))
                .isInstanceOf(MalformedPartException.class)
                .hasMessageContaining("ARRAY");
        assertThatThrownBy(() -> documentMerger.merge("app", Map.of(0, json("\"text\""))))
                .isInstanceOf(MalformedPartException.class);
        assertThatThrownBy(() -> documentMerger.merge("app", Map.of(0, json("null"))))
                .isInstanceOf(MalformedPartException.class);
        assertThatThrownBy(() -> documentMerger.merge("app", Map.of(0, new byte[0])))
                .isInstanceOf(MalformedPartException.class);
    }

    @Test
    void merge_trailingContent_throwsMalformedPart() {
        assertThatThrownBy(() -> documentMerger.merge("app", Map.of(0, json("{\"a\":\"1\"} {\"b\":\"2\"}"))))
                .isInstanceOf(MalformedPartException.class);
    }

    @Test
    void merge_duplicateKeyInsideOnePart_throwsMalformedPart() {
        assertThatThrownBy(() -> documentMerger.merge("app", Map.of(0, json("{\"a\":\"1\",\"a\":\"2\"}"))))
                .isInstanceOf(MalformedPartException.class);
    }

    @Test
    void merge_emptyObject_throwsEmptyPart() {
        Map<Integer, byte[]> parts = Map.of(0, json("{\"a\":\"1\"}"), 3, json("{ }"));

        assertThatThrownBy(() -> documentMerger.merge("app", parts))
                .isInstanceOf(EmptyPartException.class)
                .hasMessageContaining("app-3");
    }

    @Test
    void merge_noParts_returnsEmptyDocument() {
        assertThat(documentMerger.merge("app", Map.of()).isEmpty()).isTrue();
    }
}
