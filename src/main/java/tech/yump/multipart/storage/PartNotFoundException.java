package tech.yump.multipart.storage;

import lombok.Getter;

/**
 * Thrown when a part that was listed (or is required, like the base part) cannot be fetched.
 */
@Getter
public class PartNotFoundException extends StorageException {

  private final String partName;

  public PartNotFoundException(String partName) {
    super("Secret part '" + partName + "' not found in store response");
    this.partName = partName;
  }

  public PartNotFoundException(String partName, String message) {
    super(message);
    this.partName = partName;
  }
}
