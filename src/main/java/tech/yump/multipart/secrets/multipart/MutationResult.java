package tech.yump.multipart.secrets.multipart;

import java.util.List;

/**
 * Outcome of a successful mutation.
 *
 * @param baseName     The base secret name.
 * @param keyCount     Number of top-level keys in the document after the mutation.
 * @param partCount    Number of parts the document is stored in.
 * @param partNames    Names of all written parts, in index order.
 * @param createdParts Names of the parts that did not exist before.
 */
public record MutationResult(
        String baseName,
        int keyCount,
        int partCount,
        List<String> partNames,
        List<String> createdParts
) {
    public MutationResult {
        partNames = List.copyOf(partNames);
        createdParts = List.copyOf(createdParts);
    }
}
