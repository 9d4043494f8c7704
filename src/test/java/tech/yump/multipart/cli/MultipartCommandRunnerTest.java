package tech.yump.multipart.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import tech.yump.multipart.audit.AuditHelper;
import tech.yump.multipart.secrets.KeyExistsException;
import tech.yump.multipart.secrets.multipart.FindResult;
import tech.yump.multipart.secrets.multipart.MultipartSecretEngine;
import tech.yump.multipart.secrets.multipart.MutationRequest;
import tech.yump.multipart.secrets.multipart.MutationResult;
import tech.yump.multipart.secrets.multipart.SecretDocument;
import tech.yump.multipart.storage.PartNotFoundException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MultipartCommandRunnerTest {

    @Mock
    private MultipartSecretEngine engine;
    @Mock
    private AuditHelper auditHelper;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private MultipartCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new MultipartCommandRunner(engine, auditHelper, new ObjectMapper(),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
        return runner.getExitCode();
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void isCommandLineInvocation_detectsSecretNameOption() {
        assertThat(MultipartCommandRunner.isCommandLineInvocation("--secret-name=app", "--read")).isTrue();
        assertThat(MultipartCommandRunner.isCommandLineInvocation("--secret-name", "app")).isTrue();
        assertThat(MultipartCommandRunner.isCommandLineInvocation("--server.port=8200")).isFalse();
        assertThat(MultipartCommandRunner.isCommandLineInvocation()).isFalse();
    }

    @Test
    @DisplayName("Without --secret-name the runner stays out of the way of the web application")
    void run_withoutSecretName_doesNothing() {
        assertThat(run("--server.port=8200")).isZero();
        verifyNoInteractions(engine, auditHelper);
    }

    @Test
    void add_printsSummaryAndAudits() {
        when(engine.mutate(eq("app/config"), any(MutationRequest.class), eq("prod")))
                .thenReturn(new MutationResult("app/config", 4, 2, List.of("app/config", "app/config-1"), List.of()));

        int exitCode = run("--secret-name=app/config", "--json-data={\"b\":\"2\",\"c\":{\"d\":true}}", "--env=prod");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Add operation completed successfully. Total keys: 4, Total secrets: 2");
        ArgumentCaptor<MutationRequest> request = ArgumentCaptor.forClass(MutationRequest.class);
        verify(engine).mutate(eq("app/config"), request.capture(), eq("prod"));
        assertThat(request.getValue().forceUpdate()).isFalse();
        assertThat(request.getValue().changes()).containsEntry("b", TextNode.valueOf("2"));
        assertThat(request.getValue().changes().get("c").get("d").booleanValue()).isTrue();
        verify(auditHelper).logInternalEvent(eq("multipart_operation"), eq("add"), eq("success"), isNull(), anyMap());
    }

    @Test
    void forceUpdate_withPath_reportsUpdate() {
        when(engine.mutate(eq("app"), any(MutationRequest.class), isNull()))
                .thenReturn(new MutationResult("app", 1, 1, List.of("app"), List.of()));

        int exitCode = run("--secret-name=app", "--json-data={\"User\":\"y\"}", "--force-update", "--path=Db");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Update operation completed successfully. Total keys: 1, Total secrets: 1");
        ArgumentCaptor<MutationRequest> request = ArgumentCaptor.forClass(MutationRequest.class);
        verify(engine).mutate(eq("app"), request.capture(), isNull());
        assertThat(request.getValue().forceUpdate()).isTrue();
        assertThat(request.getValue().path()).isEqualTo("Db");
    }

    @Test
    void invalidJson_failsWithoutCallingEngine() {
        int exitCode = run("--secret-name=app", "--json-data={not json");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).startsWith("ERROR: invalid JSON data");
        verify(engine, never()).mutate(any(), any(), any());
        verify(auditHelper).logInternalEvent(eq("multipart_operation"), eq("add"), eq("failure"), isNull(), anyMap());
    }

    @Test
    @DisplayName("A repeated option uses its last value, and a blank last value counts as missing")
    void repeatedJsonData_blankLastValue_fails() {
        assertThat(run("--secret-name=app", "--json-data={\"a\":\"1\"}", "--json-data=")).isEqualTo(1);
        assertThat(stderr()).contains("--json-data requires a value");
        verify(engine, never()).mutate(any(), any(), any());
    }

    @Test
    void nonObjectJson_fails() {
        assertThat(run("--secret-name=app", "--json-data=[1,2]")).isEqualTo(1);
        assertThat(stderr()).contains("invalid JSON data");
    }

    @Test
    void emptyJson_fails() {
        assertThat(run("--secret-name=app", "--json-data={}")).isEqualTo(1);
        assertThat(stderr()).contains("JSON data is empty");
    }

    @Test
    void engineFailure_printsErrorAndExitsWithOne() {
        when(engine.mutate(eq("app"), any(MutationRequest.class), isNull())).thenThrow(new KeyExistsException("b", ""));

        assertThat(run("--secret-name=app", "--json-data={\"b\":\"2\"}")).isEqualTo(1);
        assertThat(stderr()).contains("ERROR: Key already exists: b");
        verify(auditHelper).logInternalEvent(eq("multipart_operation"), eq("add"), eq("failure"), isNull(),
                eq(Map.of("base_name", "app", "error", "Key already exists: b")));
    }

    @Test
    void missingBase_printsErrorAndExitsWithOne() {
        when(engine.mutate(eq("app"), any(MutationRequest.class), isNull()))
                .thenThrow(new PartNotFoundException("app", "Base secret 'app' does not exist or cannot be accessed"));

        assertThat(run("--secret-name=app", "--json-data={\"b\":\"2\"}")).isEqualTo(1);
        assertThat(stderr()).contains("Base secret 'app' does not exist");
    }

    @Test
    void find_found() {
        when(engine.find("app", "Db.User")).thenReturn(Optional.of(new FindResult(2, "app-2")));

        assertThat(run("--secret-name=app", "--find=Db.User")).isZero();
        assertThat(stdout()).contains("Path 'Db.User' found in secret 'app-2' (part 2)");
    }

    @Test
    void find_notFound_exitsWithOne() {
        when(engine.find("app", "Db.Pass")).thenReturn(Optional.empty());

        assertThat(run("--secret-name=app", "--find=Db.Pass")).isEqualTo(1);
        assertThat(stdout()).contains("Path 'Db.Pass' not found in secret 'app'");
    }

    @Test
    void read_listsKeyNames() {
        when(engine.read("app")).thenReturn(SecretDocument.of(Map.of(
                "b", TextNode.valueOf("secret-b"),
                "a", TextNode.valueOf("secret-a"))));

        assertThat(run("--secret-name=app", "--read")).isZero();
        assertThat(stdout()).contains("a", "b", "Total keys: 2").doesNotContain("secret-a");
    }

    @Test
    void conflictingOperations_areAUsageError() {
        assertThat(run("--secret-name=app", "--json-data={\"a\":\"1\"}", "--find=a")).isEqualTo(2);
        assertThat(stderr()).contains("exactly one of");
        verifyNoInteractions(engine);
    }

    @Test
    void noOperation_isAUsageError() {
        assertThat(run("--secret-name=app")).isEqualTo(2);
        assertThat(stderr()).contains("Usage:");
    }

    @Test
    void blankSecretName_isAUsageError() {
        assertThat(run("--secret-name=", "--read")).isEqualTo(2);
        verifyNoInteractions(engine);
    }
}
