package tech.yump.multipart.secrets.multipart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.multipart.secrets.KeyExistsException;
import tech.yump.multipart.secrets.KeyMissingException;
import tech.yump.multipart.secrets.PathSegmentMissingException;
import tech.yump.multipart.secrets.PathSegmentNotObjectException;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Applies a {@link MutationRequest} to a merged document.
 * <p>
 * Every key of the request is checked before anything is written, so a request either applies
 * completely or leaves the document untouched. The input document is never modified; the result
 * is a new document.
 */
@Slf4j
@Component
public class DocumentMutator {

    public SecretDocument apply(SecretDocument document, MutationRequest request) {
        return request.isPathMode()
                ? applyAtPath(document, request)
                : applyAtRoot(document, request);
    }

    private SecretDocument applyAtRoot(SecretDocument document, MutationRequest request) {
        checkConflicts(document::containsKey, request, "");

        SecretDocument result = document.copy();
        request.changes().forEach(result::put);
        log.debug("Applied {} root level change(s), forceUpdate={}", request.changes().size(), request.forceUpdate());
        return result;
    }

    private SecretDocument applyAtPath(SecretDocument document, MutationRequest request) {
        List<String> segments = request.pathSegments();
        String rootKey = segments.get(0);

        // Work on a copy of the touched top-level value so a rejected request leaves no trace.
        ObjectNode rootCopy = asObject(document.get(rootKey), rootKey, rootKey).deepCopy();
        ObjectNode target = rootCopy;
        StringBuilder walked = new StringBuilder(rootKey);
        for (String segment : segments.subList(1, segments.size())) {
            walked.append('.').append(segment);
            target = asObject(target.get(segment), segment, walked.toString());
        }

        ObjectNode located = target;
        checkConflicts(located::has, request, request.path());

        for (Map.Entry<String, JsonNode> change : request.changes().entrySet()) {
            located.set(change.getKey(), change.getValue());
        }
        SecretDocument result = document.copy();
        result.put(rootKey, rootCopy);
        log.debug("Applied {} change(s) at path '{}', forceUpdate={}",
                request.changes().size(), request.path(), request.forceUpdate());
        return result;
    }

    private static ObjectNode asObject(JsonNode node, String segment, String walkedPath) {
        if (node == null || node.isMissingNode()) {
            throw new PathSegmentMissingException(segment, walkedPath);
        }
        if (!node.isObject()) {
            throw new PathSegmentNotObjectException(segment, walkedPath, node.getNodeType().name());
        }
        return (ObjectNode) node;
    }

    private static void checkConflicts(Predicate<String> exists, MutationRequest request, String path) {
        for (String key : request.changes().keySet()) {
            boolean present = exists.test(key);
            if (request.forceUpdate() && !present) {
                throw new KeyMissingException(key, path);
            }
            if (!request.forceUpdate() && present) {
                throw new KeyExistsException(key, path);
            }
        }
    }
}
