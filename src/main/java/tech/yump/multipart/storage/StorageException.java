package tech.yump.multipart.storage;

/**
 * Custom runtime exception for errors occurring within a PartStore implementation.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
