package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.multipart.config.PartTags;
import tech.yump.multipart.storage.PartNotFoundException;
import tech.yump.multipart.storage.PartStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class MultipartSecretEngineImpl implements MultipartSecretEngine {

    private final PartStore partStore;
    private final PartCodec partCodec;
    private final DocumentMerger documentMerger;
    private final DocumentMutator documentMutator;
    private final Partitioner partitioner;
    private final SlotAllocator slotAllocator;
    private final PartTags partTags;

    @Override
    public MutationResult mutate(String baseName, MutationRequest request, String environment) {
        String base = PartNaming.validateBaseName(baseName);
        log.debug("Mutating multipart secret '{}': {} key(s), path='{}', forceUpdate={}",
                base, request.changes().size(), request.path(), request.forceUpdate());

        List<Integer> indices = requireBasePart(base);
        SecretDocument merged = documentMerger.merge(base, partStore.fetchParts(base, indices));
        SecretDocument updated = documentMutator.apply(merged, request);
        List<SecretDocument> chunks = partitioner.partition(updated);
        List<PartAssignment> assignments = slotAllocator.allocate(base, indices, chunks);

        Map<String, String> tags = partTags.forEnvironment(environment);
        List<String> written = new ArrayList<>(assignments.size());
        List<String> created = new ArrayList<>();
        for (PartAssignment assignment : assignments) {
            partStore.upsertPart(assignment.name(), partCodec.encode(assignment.chunk()), tags);
            written.add(assignment.name());
            if (!assignment.existing()) {
                created.add(assignment.name());
            }
        }

        log.info("Redistributed {} keys of '{}' over {} part(s) ({} new)",
                updated.size(), base, assignments.size(), created.size());
        return new MutationResult(base, updated.size(), assignments.size(), written, created);
    }

    @Override
    public Optional<FindResult> find(String baseName, String dotPath) {
        String base = PartNaming.validateBaseName(baseName);
        List<String> segments = JsonPathLookup.segments(dotPath);

        List<Integer> indices = partStore.listPartIndices(base);
        if (indices.isEmpty()) {
            log.info("No parts found for '{}'", base);
            return Optional.empty();
        }
        for (Map.Entry<Integer, byte[]> part : new TreeMap<>(partStore.fetchParts(base, indices)).entrySet()) {
            String name = PartNaming.partName(base, part.getKey());
            ObjectNode data = partCodec.decode(name, part.getValue());
            if (JsonPathLookup.lookup(data, segments).isPresent()) {
                log.info("Path '{}' found in part '{}'", dotPath, name);
                return Optional.of(new FindResult(part.getKey(), name));
            }
        }
        log.info("Path '{}' not found in any of the {} part(s) of '{}'", dotPath, indices.size(), base);
        return Optional.empty();
    }

    @Override
    public SecretDocument read(String baseName) {
        String base = PartNaming.validateBaseName(baseName);
        List<Integer> indices = requireBasePart(base);
        SecretDocument merged = documentMerger.merge(base, partStore.fetchParts(base, indices));
        log.info("Read {} keys from {} part(s) of '{}'", merged.size(), indices.size(), base);
        return merged;
    }

    private List<Integer> requireBasePart(String base) {
        List<Integer> indices = partStore.listPartIndices(base);
        if (!indices.contains(PartNaming.BASE_INDEX)) {
            throw new PartNotFoundException(base,
                    "Base secret '" + base + "' does not exist or cannot be accessed");
        }
        return indices;
    }
}
