package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.multipart.secrets.MalformedPartException;
import tech.yump.multipart.secrets.MultipartSecretException;

import java.io.IOException;

/**
 * The wire encoding of a part: a bare, compact JSON object with its top-level keys in ascending
 * order. The same encoding is used to measure chunk sizes and to write parts.
 */
@Slf4j
@Component
public class PartCodec {

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final ObjectReader reader;

    public PartCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.reader = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public byte[] encode(SecretDocument document) {
        ObjectNode node = objectMapper.createObjectNode();
        document.entries().forEach(node::set);
        return write(node);
    }

    /**
     * Size in bytes of the encoding of a one-entry object {@code {key: value}}.
     */
    public int encodedSize(String key, JsonNode value) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set(key, value);
        return write(node).length;
    }

    /**
     * Parses the raw payload of a part.
     *
     * @throws MalformedPartException if the payload is not a single JSON object.
     */
    public ObjectNode decode(String partName, byte[] payload) {
        if (payload == null) {
            throw new MalformedPartException(partName, "payload is missing");
        }
        JsonNode node;
        try {
            node = reader.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse payload of part '{}': {}", partName, e.getMessage());
            throw new MalformedPartException(partName, "invalid JSON (" + e.getOriginalMessage() + ")", e);
        } catch (IOException e) {
            throw new MalformedPartException(partName, "unreadable payload", e);
        }
        if (node == null || !node.isObject()) {
            String type = node == null ? "MISSING" : node.getNodeType().name();
            throw new MalformedPartException(partName, "expected a JSON object but found " + type);
        }
        return (ObjectNode) node;
    }

    private byte[] write(JsonNode node) {
        try {
            return writer.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new MultipartSecretException("Failed to serialize secret data", e);
        }
    }
}
