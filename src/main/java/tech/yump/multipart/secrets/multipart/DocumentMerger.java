package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.multipart.secrets.DuplicateKeyException;
import tech.yump.multipart.secrets.EmptyPartException;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds the fetched parts of a multipart secret into one {@link SecretDocument}.
 * Parts are merged in ascending index order; a key stored in more than one part is an error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentMerger {

    private final PartCodec partCodec;

    public SecretDocument merge(String baseName, Map<Integer, byte[]> rawParts) {
        SecretDocument merged = new SecretDocument();
        Map<String, String> origin = new HashMap<>();

        for (Map.Entry<Integer, byte[]> part : new TreeMap<>(rawParts).entrySet()) {
            String partName = PartNaming.partName(baseName, part.getKey());
            ObjectNode data = partCodec.decode(partName, part.getValue());
            if (data.isEmpty()) {
                throw new EmptyPartException(partName);
            }

            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String previous = origin.putIfAbsent(field.getKey(), partName);
                if (previous != null) {
                    throw new DuplicateKeyException(field.getKey(), previous, partName);
                }
                merged.put(field.getKey(), field.getValue());
            }
            log.debug("Merged {} keys from part '{}'", data.size(), partName);
        }
        return merged;
    }
}
