package com.iimsoft.uras.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.uras.api.dto.ScheduleResponse;
import com.iimsoft.uras.config.EngineConfig;
import com.iimsoft.uras.service.SchedulingService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulingServiceAppTest {

    private final SchedulingService service = new SchedulingService(new EngineConfig());
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(InputStream stdin, String... args) {
        return SchedulingServiceApp.run(args, stdin,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                service);
    }

    private static InputStream sampleRequest() {
        return SchedulingServiceAppTest.class.getResourceAsStream("/requests/two-machines.json");
    }

    private static InputStream text(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void stdinRequestShouldPrintScheduleAndExitZero() throws IOException {
        int code;
        try (InputStream in = sampleRequest()) {
            code = run(in, "-");
        }

        assertThat(code).isEqualTo(SchedulingServiceApp.EXIT_SCHEDULED);
        JsonNode response = new ObjectMapper().readTree(out.toByteArray());
        assertThat(response.get("success").asBoolean()).isTrue();
        assertThat(response.get("schedule").get("assignments").size()).isEqualTo(3);
    }

    @Test
    void fileRequestShouldBeReadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("request.json");
        try (InputStream in = sampleRequest()) {
            Files.copy(in, file);
        }

        assertThat(run(text(""), file.toString())).isEqualTo(SchedulingServiceApp.EXIT_SCHEDULED);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"success\" : true");
    }

    @Test
    void missingArgumentOrFileShouldExitWithBadInput(@TempDir Path dir) {
        assertThat(run(text(""))).isEqualTo(SchedulingServiceApp.EXIT_BAD_INPUT);
        assertThat(run(text(""), dir.resolve("nope.json").toString())).isEqualTo(SchedulingServiceApp.EXIT_BAD_INPUT);
        assertThat(run(text(""), dir.toString())).isEqualTo(SchedulingServiceApp.EXIT_BAD_INPUT);
        assertThat(out.size()).isZero();
    }

    @Test
    void unparsableJsonShouldExitWithBadInput() {
        assertThat(run(text("{\"resources\": ["), "-")).isEqualTo(SchedulingServiceApp.EXIT_BAD_INPUT);
        assertThat(err.toString(StandardCharsets.UTF_8)).isNotEmpty();
    }

    @Test
    void exitCodeShouldSeparateInputErrorsFromOtherFailures() {
        ScheduleResponse ok = new ScheduleResponse();
        ok.success = true;

        assertThat(SchedulingServiceApp.exitCode(ok)).isEqualTo(SchedulingServiceApp.EXIT_SCHEDULED);
        assertThat(SchedulingServiceApp.exitCode(ScheduleResponse.failure("INVALID_SPEC", "bad")))
                .isEqualTo(SchedulingServiceApp.EXIT_BAD_INPUT);
        assertThat(SchedulingServiceApp.exitCode(ScheduleResponse.failure("INFEASIBLE", "none")))
                .isEqualTo(SchedulingServiceApp.EXIT_NO_SCHEDULE);
        assertThat(SchedulingServiceApp.exitCode(ScheduleResponse.failure("INTERNAL_ERROR", "bug")))
                .isEqualTo(SchedulingServiceApp.EXIT_NO_SCHEDULE);
    }
}
