package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import tech.yump.multipart.secrets.KeyTooLargeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits a document into chunks whose encoded size stays within {@code maxPartBytes}.
 * <p>
 * Keys are visited in ascending order and packed greedily: a key joins the current chunk unless
 * that would push a non-empty chunk over the limit, in which case the chunk is closed and the key
 * starts the next one. The result depends only on the document's content, never on the order in
 * which its keys were inserted.
 */
@Slf4j
public class Partitioner {

    // "{}" around a compact object; entries are joined by a single ','
    private static final int OBJECT_BRACES_BYTES = 2;
    private static final int ENTRY_SEPARATOR_BYTES = 1;

    private final PartCodec partCodec;
    private final int maxPartBytes;

    public Partitioner(PartCodec partCodec, int maxPartBytes) {
        if (maxPartBytes <= OBJECT_BRACES_BYTES) {
            throw new IllegalArgumentException("Max part size must be greater than " + OBJECT_BRACES_BYTES + " bytes: " + maxPartBytes);
        }
        this.partCodec = partCodec;
        this.maxPartBytes = maxPartBytes;
    }

    public int maxPartBytes() {
        return maxPartBytes;
    }

    public List<SecretDocument> partition(SecretDocument document) {
        List<SecretDocument> chunks = new ArrayList<>();
        SecretDocument current = new SecretDocument();
        int currentSize = OBJECT_BRACES_BYTES;

        for (Map.Entry<String, JsonNode> entry : document.entries().entrySet()) {
            String key = entry.getKey();
            int pairSize = partCodec.encodedSize(key, entry.getValue());
            if (pairSize > maxPartBytes) {
                throw new KeyTooLargeException(key, pairSize, maxPartBytes);
            }

            // The encoded size of a chunk is the braces plus its entries plus one separator per extra entry.
            int entrySize = pairSize - OBJECT_BRACES_BYTES;
            int tentativeSize = current.isEmpty()
                    ? pairSize
                    : currentSize + ENTRY_SEPARATOR_BYTES + entrySize;

            if (!current.isEmpty() && tentativeSize > maxPartBytes) {
                log.debug("Closing chunk {} with {} keys ({} bytes)", chunks.size(), current.size(), currentSize);
                chunks.add(current);
                current = new SecretDocument();
                tentativeSize = pairSize;
            }
            current.put(key, entry.getValue());
            currentSize = tentativeSize;
        }

        if (!current.isEmpty()) {
            log.debug("Closing chunk {} with {} keys ({} bytes)", chunks.size(), current.size(), currentSize);
            chunks.add(current);
        }
        return chunks;
    }
}
