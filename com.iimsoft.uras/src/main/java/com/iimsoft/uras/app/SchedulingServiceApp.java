package com.iimsoft.uras.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.uras.api.dto.ScheduleRequest;
import com.iimsoft.uras.api.dto.ScheduleResponse;
import com.iimsoft.uras.exception.ErrorKind;
import com.iimsoft.uras.service.SchedulingService;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行入口：ScheduleRequest JSON 进，ScheduleResponse JSON 出。
 * <p>
 * 参数是请求文件路径，{@code -} 表示读 stdin；请求样例见
 * {@code src/test/resources/requests/two-machines.json}。
 * 默认参数可用 {@code -Duras.config='{"ga":{"generations":100}}'} 覆盖。
 */
public class SchedulingServiceApp {

    static final int EXIT_SCHEDULED = 0;
    static final int EXIT_NO_SCHEDULE = 1;
    static final int EXIT_BAD_INPUT = 2;

    static final String STDIN = "-";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err, new SchedulingService());
        if (code != EXIT_SCHEDULED) {
            System.exit(code);
        }
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err, SchedulingService service) {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            err.println("用法: SchedulingServiceApp <request.json | ->");
            return EXIT_BAD_INPUT;
        }
        ScheduleRequest request;
        try {
            request = readRequest(args[0].trim(), stdin);
        } catch (JsonProcessingException e) {
            err.println("请求 JSON 无法解析: " + e.getOriginalMessage());
            return EXIT_BAD_INPUT;
        } catch (IOException e) {
            err.println("读取请求失败: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }

        ScheduleResponse response = service.schedule(request);
        try {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ScheduleResponse 序列化失败", e);
        }
        return exitCode(response);
    }

    static ScheduleRequest readRequest(String source, InputStream stdin) throws IOException {
        if (STDIN.equals(source)) {
            return MAPPER.readValue(stdin, ScheduleRequest.class);
        }
        Path path = Path.of(source);
        if (!Files.isRegularFile(path)) {
            throw new IOException("不是可读的文件: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ScheduleRequest.class);
        }
    }

    /** 输入本身有错给 2，其余失败（不可行、预算耗尽、内部错误）给 1 */
    static int exitCode(ScheduleResponse response) {
        if (response.success) {
            return EXIT_SCHEDULED;
        }
        return ErrorKind.INVALID_SPEC.name().equals(response.failure.kind) ? EXIT_BAD_INPUT : EXIT_NO_SCHEDULE;
    }
}
