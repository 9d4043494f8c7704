package tech.yump.multipart.secrets.multipart;

import lombok.extern.slf4j.Slf4j;
import tech.yump.multipart.secrets.InsufficientChunksException;
import tech.yump.multipart.secrets.PartLimitExceededException;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds chunks to part slots.
 * <p>
 * Existing indices are reused by position in ascending order. Chunks beyond the existing part
 * count get fresh indices counting up from the highest index in use. Reducing the number of parts
 * is refused, as is allocating past {@code maxOverflowParts}.
 */
@Slf4j
public class SlotAllocator {

    private final int maxOverflowParts;

    public SlotAllocator(int maxOverflowParts) {
        if (maxOverflowParts < 0) {
            throw new IllegalArgumentException("Max overflow parts cannot be negative: " + maxOverflowParts);
        }
        this.maxOverflowParts = maxOverflowParts;
    }

    public List<PartAssignment> allocate(String baseName, List<Integer> existingIndices, List<SecretDocument> chunks) {
        List<Integer> existing = existingIndices.stream().sorted().toList();
        for (int i = 1; i < existing.size(); i++) {
            if (existing.get(i).equals(existing.get(i - 1))) {
                throw new IllegalArgumentException("Duplicate part index: " + existing.get(i));
            }
        }
        if (chunks.size() < existing.size()) {
            throw new InsufficientChunksException(chunks.size(), existing.size());
        }

        int nextIndex = existing.isEmpty() ? PartNaming.BASE_INDEX : existing.get(existing.size() - 1) + 1;
        List<PartAssignment> assignments = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            boolean reuse = i < existing.size();
            int index = reuse ? existing.get(i) : nextIndex++;
            if (!reuse && index > maxOverflowParts) {
                throw new PartLimitExceededException(index, maxOverflowParts);
            }
            assignments.add(new PartAssignment(index, PartNaming.partName(baseName, index), chunks.get(i), reuse));
        }
        log.debug("Allocated {} chunk(s) for '{}': {} reused, {} new", chunks.size(), baseName,
                existing.size(), chunks.size() - existing.size());
        return assignments;
    }
}
