package tech.yump.multipart.secrets;

/**
 * Base exception for errors raised while merging, mutating, partitioning or allocating the parts
 * of a multipart secret. Any of these aborts the operation before a single part is written.
 */
public class MultipartSecretException extends RuntimeException {
    public MultipartSecretException(String message) {
        super(message);
    }

    public MultipartSecretException(String message, Throwable cause) {
        super(message, cause);
    }
}
