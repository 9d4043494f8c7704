package tech.yump.multipart.secrets.multipart;

import tech.yump.multipart.secrets.MultipartSecretException;
import tech.yump.multipart.storage.StorageException;

import java.util.Optional;

/**
 * Engine for key-value secrets that are too large for one store record and are therefore spread
 * over a base part and numbered overflow parts.
 */
public interface MultipartSecretEngine {

    /**
     * Merges all parts of a secret, applies the mutation, re-partitions the whole document and
     * writes every part. Nothing is written unless all checks pass.
     *
     * @param baseName    The base secret name. Must not name an overflow part.
     * @param request     The mutation to apply.
     * @param environment The environment recorded in the tags of newly created parts; may be null.
     * @return key and part counts after the write.
     * @throws MultipartSecretException If merging, mutating, partitioning or allocating fails.
     * @throws StorageException         If the base part is missing or the store fails.
     */
    MutationResult mutate(String baseName, MutationRequest request, String environment);

    /**
     * Scans the parts in ascending index order for the first one holding a value at {@code dotPath}.
     *
     * @return the location, or empty when no part has the path.
     */
    Optional<FindResult> find(String baseName, String dotPath);

    /**
     * Returns the merged document of all parts.
     *
     * @throws StorageException If the base part does not exist.
     */
    SecretDocument read(String baseName);
}
