package tech.yump.multipart.storage;

/**
 * Wraps transport and service failures of the remote store. Never retried by the engine.
 */
public class StoreUnavailableException extends StorageException {

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
