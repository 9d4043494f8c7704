package tech.yump.multipart.storage;

import java.util.List;
import java.util.Map;

/**
 * Interface defining the contract for the record store holding the parts of multipart secrets.
 * Implementations handle listing, fetching and writing the raw JSON payload of each part.
 */
public interface PartStore {

  /**
   * Lists the part indices currently stored for a base name.
   *
   * @param baseName The base secret name. Must not be null or empty.
   * @return The recognized part indices in ascending order; empty if no part exists.
   * @throws StoreUnavailableException If the store cannot be queried.
   */
  List<Integer> listPartIndices(String baseName) throws StorageException;

  /**
   * Fetches the raw payload of the given parts.
   *
   * @param baseName The base secret name. Must not be null or empty.
   * @param indices  The part indices to fetch. Must not be empty.
   * @return A map from part index to the raw JSON payload of that part.
   * @throws PartNotFoundException     If any requested part is missing from the store response.
   * @throws StoreUnavailableException If the store cannot be queried.
   */
  Map<Integer, byte[]> fetchParts(String baseName, List<Integer> indices) throws StorageException;

  /**
   * Writes a part, overwriting its payload if a record with that name exists, otherwise creating
   * it with the given tags. Calling it twice with the same arguments leaves the same state.
   *
   * @param name    The physical part name (see PartNaming).
   * @param payload The serialized chunk. Must not be null.
   * @param tags    Provenance tags applied when the record is created.
   * @throws StoreUnavailableException If the write fails.
   */
  void upsertPart(String name, byte[] payload, Map<String, String> tags) throws StorageException;
}
