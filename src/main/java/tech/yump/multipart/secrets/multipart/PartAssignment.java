package tech.yump.multipart.secrets.multipart;

/**
 * A chunk bound to the physical part it will be written to.
 *
 * @param index    The part index.
 * @param name     The physical record name for {@code index}.
 * @param chunk    The content of the part.
 * @param existing {@code true} if the part already exists and is overwritten, {@code false} if it is created.
 */
public record PartAssignment(int index, String name, SecretDocument chunk, boolean existing) {
}
