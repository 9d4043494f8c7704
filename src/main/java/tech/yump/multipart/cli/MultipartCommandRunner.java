package tech.yump.multipart.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import tech.yump.multipart.audit.AuditHelper;
import tech.yump.multipart.secrets.MultipartSecretException;
import tech.yump.multipart.secrets.multipart.FindResult;
import tech.yump.multipart.secrets.multipart.MultipartSecretEngine;
import tech.yump.multipart.secrets.multipart.MutationRequest;
import tech.yump.multipart.secrets.multipart.MutationResult;
import tech.yump.multipart.secrets.multipart.SecretDocument;
import tech.yump.multipart.storage.StorageException;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command line entry point. Runs one operation per invocation:
 * <pre>
 *   --secret-name=NAME --json-data=JSON [--force-update] [--path=a.b] [--env=ENV]
 *   --secret-name=NAME --find=a.b
 *   --secret-name=NAME --read
 * </pre>
 * Exit codes: 0 success, 1 operation failed or path not found, 2 usage error.
 */
@Slf4j
@Component
public class MultipartCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String OPT_SECRET_NAME = "secret-name";
    public static final String OPT_JSON_DATA = "json-data";
    public static final String OPT_FORCE_UPDATE = "force-update";
    public static final String OPT_PATH = "path";
    public static final String OPT_ENV = "env";
    public static final String OPT_FIND = "find";
    public static final String OPT_READ = "read";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String EVENT_TYPE = "multipart_operation";
    private static final TypeReference<Map<String, JsonNode>> CHANGES_TYPE_REFERENCE = new TypeReference<>() {};

    private final MultipartSecretEngine multipartSecretEngine;
    private final AuditHelper auditHelper;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public MultipartCommandRunner(MultipartSecretEngine multipartSecretEngine, AuditHelper auditHelper, ObjectMapper objectMapper) {
        this(multipartSecretEngine, auditHelper, objectMapper, System.out, System.err);
    }

    MultipartCommandRunner(MultipartSecretEngine multipartSecretEngine, AuditHelper auditHelper, ObjectMapper objectMapper,
                           PrintStream out, PrintStream err) {
        this.multipartSecretEngine = multipartSecretEngine;
        this.auditHelper = auditHelper;
        this.objectMapper = objectMapper;
        this.out = out;
        this.err = err;
    }

    public static boolean isCommandLineInvocation(String... args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals("--" + OPT_SECRET_NAME) || arg.startsWith("--" + OPT_SECRET_NAME + "="));
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPT_SECRET_NAME)) {
            return;
        }
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int execute(ApplicationArguments args) {
        Optional<String> secretName = single(args, OPT_SECRET_NAME);
        if (secretName.isEmpty()) {
            return usage("--" + OPT_SECRET_NAME + " is required");
        }
        boolean mutate = args.containsOption(OPT_JSON_DATA);
        boolean find = args.containsOption(OPT_FIND);
        boolean read = args.containsOption(OPT_READ);
        if ((mutate ? 1 : 0) + (find ? 1 : 0) + (read ? 1 : 0) != 1) {
            return usage("exactly one of --" + OPT_JSON_DATA + ", --" + OPT_FIND + " or --" + OPT_READ + " is required");
        }

        String action = find ? "find" : read ? "read_keys" : args.containsOption(OPT_FORCE_UPDATE) ? "update" : "add";
        Map<String, Object> auditData = new HashMap<>(Map.of("base_name", secretName.get().trim()));
        try {
            int code;
            if (mutate) {
                code = runMutation(args, secretName.get(), auditData);
            } else if (find) {
                code = runFind(args, secretName.get(), auditData);
            } else {
                code = runRead(secretName.get(), auditData);
            }
            auditHelper.logInternalEvent(EVENT_TYPE, action, "success", null, auditData);
            return code;
        } catch (MultipartSecretException | StorageException | IllegalArgumentException e) {
            log.debug("Command '{}' failed", action, e);
            err.println("ERROR: " + e.getMessage());
            auditData.put("error", e.getMessage());
            auditHelper.logInternalEvent(EVENT_TYPE, action, "failure", null, auditData);
            return EXIT_FAILURE;
        }
    }

    private int runMutation(ApplicationArguments args, String secretName, Map<String, Object> auditData) {
        boolean forceUpdate = args.containsOption(OPT_FORCE_UPDATE);
        String jsonData = single(args, OPT_JSON_DATA)
                .orElseThrow(() -> new IllegalArgumentException("--" + OPT_JSON_DATA + " requires a value"));
        Map<String, JsonNode> changes = parseChanges(jsonData);
        String path = single(args, OPT_PATH).orElse(null);

        MutationResult result = multipartSecretEngine.mutate(secretName,
                MutationRequest.of(changes, path, forceUpdate), single(args, OPT_ENV).orElse(null));

        auditData.put("key_count", result.keyCount());
        auditData.put("part_count", result.partCount());
        out.printf("%s operation completed successfully. Total keys: %d, Total secrets: %d%n",
                forceUpdate ? "Update" : "Add", result.keyCount(), result.partCount());
        return EXIT_OK;
    }

    private int runFind(ApplicationArguments args, String secretName, Map<String, Object> auditData) {
        String path = single(args, OPT_FIND)
                .orElseThrow(() -> new IllegalArgumentException("--" + OPT_FIND + " requires a path"));
        auditData.put("path", path);
        Optional<FindResult> found = multipartSecretEngine.find(secretName, path);
        if (found.isEmpty()) {
            out.printf("Path '%s' not found in secret '%s'%n", path, secretName.trim());
            return EXIT_FAILURE;
        }
        auditData.put("part_name", found.get().name());
        out.printf("Path '%s' found in secret '%s' (part %d)%n", path, found.get().name(), found.get().index());
        return EXIT_OK;
    }

    private int runRead(String secretName, Map<String, Object> auditData) {
        SecretDocument document = multipartSecretEngine.read(secretName);
        document.keys().forEach(out::println);
        auditData.put("key_count", document.size());
        out.printf("Total keys: %d%n", document.size());
        return EXIT_OK;
    }

    private Map<String, JsonNode> parseChanges(String jsonData) {
        try {
            Map<String, JsonNode> changes = objectMapper.readValue(jsonData, CHANGES_TYPE_REFERENCE);
            if (changes == null) {
                throw new IllegalArgumentException("invalid JSON data: expected a JSON object");
            }
            return changes;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON data: " + e.getOriginalMessage(), e);
        }
    }

    private int usage(String problem) {
        err.println("ERROR: " + problem);
        err.println("Usage: --" + OPT_SECRET_NAME + "=NAME (--" + OPT_JSON_DATA + "=JSON [--" + OPT_FORCE_UPDATE
                + "] [--" + OPT_PATH + "=a.b] [--" + OPT_ENV + "=ENV] | --" + OPT_FIND + "=a.b | --" + OPT_READ + ")");
        return EXIT_USAGE;
    }

    private static Optional<String> single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        String value = values.get(values.size() - 1);
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
