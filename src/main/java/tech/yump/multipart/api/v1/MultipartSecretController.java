package tech.yump.multipart.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.multipart.api.dto.FindResponse;
import tech.yump.multipart.api.dto.KeysResponse;
import tech.yump.multipart.api.dto.MutationResponse;
import tech.yump.multipart.audit.AuditHelper;
import tech.yump.multipart.secrets.multipart.FindResult;
import tech.yump.multipart.secrets.multipart.MultipartSecretEngine;
import tech.yump.multipart.secrets.multipart.MutationRequest;
import tech.yump.multipart.secrets.multipart.MutationResult;
import tech.yump.multipart.secrets.multipart.SecretDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1/multipart")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Multipart Secrets", description = "Operations on key-value secrets spread over several store records")
public class MultipartSecretController {

    public static final String EVENT_TYPE = "multipart_operation";

    private final MultipartSecretEngine multipartSecretEngine;
    private final AuditHelper auditHelper;

    @PutMapping("/{*baseName}")
    @Operation(
            summary = "Add keys",
            description = "Adds new key-value pairs to the secret (or to the object at 'path') and redistributes all keys over the secret's parts. Fails if any key already exists."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Keys added and parts rewritten.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = MutationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid secret name, path or request body.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Base secret or path segment not found.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Key already exists, duplicate keys across parts, or part count cannot be kept.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "A stored part is unusable, a path segment is not an object, or a key is too large.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Secret store unavailable.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<MutationResponse> addKeys(
            @Parameter(description = "Base name of the secret (e.g., 'myapp/config'). Do not include a part suffix.", required = true, example = "myapp/config")
            @PathVariable String baseName,
            @Parameter(description = "Dot-separated path of a nested object receiving the keys.", example = "Db")
            @RequestParam(required = false) String path,
            @Parameter(description = "Environment recorded in the tags of newly created parts.", example = "staging")
            @RequestParam(required = false) String env,
            @RequestBody(
                    description = "A JSON object containing the key-value pairs to add.",
                    required = true,
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(type = "object", additionalProperties = Schema.AdditionalPropertiesValue.TRUE, example = "{\"apiKey\": \"123-abc\", \"limits\": {\"rps\": 10}}")
                    )
            )
            @org.springframework.web.bind.annotation.RequestBody Map<String, JsonNode> changes
    ) {
        return mutate("add", sanitize(baseName), MutationRequest.of(changes, path, false), env);
    }

    @PatchMapping("/{*baseName}")
    @Operation(
            summary = "Update keys",
            description = "Overwrites existing key-value pairs of the secret (or of the object at 'path') and redistributes all keys over the secret's parts. Fails if any key does not exist."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Keys updated and parts rewritten.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = MutationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid secret name, path or request body.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Base secret, key or path segment not found.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Duplicate keys across parts, or part count cannot be kept.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "A stored part is unusable, a path segment is not an object, or a key is too large.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Secret store unavailable.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<MutationResponse> updateKeys(
            @Parameter(description = "Base name of the secret.", required = true, example = "myapp/config")
            @PathVariable String baseName,
            @Parameter(description = "Dot-separated path of a nested object holding the keys.", example = "Db")
            @RequestParam(required = false) String path,
            @Parameter(description = "Environment recorded in the tags of newly created parts.", example = "staging")
            @RequestParam(required = false) String env,
            @org.springframework.web.bind.annotation.RequestBody Map<String, JsonNode> changes
    ) {
        return mutate("update", sanitize(baseName), MutationRequest.of(changes, path, true), env);
    }

    @GetMapping("/find/{*baseName}")
    @Operation(
            summary = "Find path",
            description = "Returns the first part (in ascending index order) that holds a value at the given dot-separated path. The value itself is not returned."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Path found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = FindResponse.class))),
            @ApiResponse(responseCode = "404", description = "Path not found in any part.")
    })
    public ResponseEntity<FindResponse> findPath(
            @Parameter(description = "Base name of the secret.", required = true, example = "myapp/config")
            @PathVariable String baseName,
            @Parameter(description = "Dot-separated path to look up.", required = true, example = "Db.User")
            @RequestParam String path
    ) {
        String name = sanitize(baseName);
        log.info("Received request to find path '{}' in secret '{}'", path, name);
        Optional<FindResult> found = multipartSecretEngine.find(name, path);

        Map<String, Object> auditData = new HashMap<>(Map.of("base_name", name, "path", path));
        if (found.isPresent()) {
            auditData.put("part_name", found.get().name());
            auditHelper.logHttpEvent(EVENT_TYPE, "find", "success", HttpStatus.OK.value(), null, auditData);
            return ResponseEntity.ok(new FindResponse(name, path, found.get().index(), found.get().name()));
        }
        auditHelper.logHttpEvent(EVENT_TYPE, "find", "success", HttpStatus.NOT_FOUND.value(),
                "Path not found in any part", auditData);
        return ResponseEntity.notFound().build();
    }

    @GetMapping("/keys/{*baseName}")
    @Operation(
            summary = "List keys",
            description = "Returns the top-level key names of the merged secret. Values are never returned."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Keys listed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = KeysResponse.class))),
            @ApiResponse(responseCode = "404", description = "Base secret not found.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<KeysResponse> listKeys(
            @Parameter(description = "Base name of the secret.", required = true, example = "myapp/config")
            @PathVariable String baseName
    ) {
        String name = sanitize(baseName);
        log.info("Received request to list keys of secret '{}'", name);
        SecretDocument document = multipartSecretEngine.read(name);

        auditHelper.logHttpEvent(EVENT_TYPE, "read_keys", "success", HttpStatus.OK.value(),
                null, Map.of("base_name", name, "key_count", document.size()));
        return ResponseEntity.ok(new KeysResponse(name, document.size(), new ArrayList<>(document.keys())));
    }

    private ResponseEntity<MutationResponse> mutate(String action, String baseName, MutationRequest request, String env) {
        log.info("Received request to {} {} key(s) in secret '{}' (path '{}')",
                action, request.changes().size(), baseName, request.path());
        MutationResult result = multipartSecretEngine.mutate(baseName, request, env);
        log.info("{} operation completed successfully. Total keys: {}, Total secrets: {}",
                action, result.keyCount(), result.partCount());

        auditHelper.logHttpEvent(EVENT_TYPE, action, "success", HttpStatus.OK.value(), null, Map.of(
                "base_name", result.baseName(),
                "key_count", result.keyCount(),
                "part_count", result.partCount(),
                "created_parts", result.createdParts()));
        return ResponseEntity.ok(MutationResponse.from(result));
    }

    private String sanitize(String rawBaseName) {
        if (rawBaseName != null && rawBaseName.startsWith("/")) {
            return rawBaseName.substring(1);
        }
        return rawBaseName;
    }
}
