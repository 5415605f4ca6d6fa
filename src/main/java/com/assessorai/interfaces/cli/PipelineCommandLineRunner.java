package com.assessorai.interfaces.cli;

import com.assessorai.application.pipeline.PipelineAppService;
import com.assessorai.application.pipeline.exception.RunNotFoundException;
import com.assessorai.application.pipeline.exception.RunNotResumableException;
import com.assessorai.domain.pipeline.model.DeadLetterRecord;
import com.assessorai.domain.pipeline.model.RunReport;
import com.assessorai.interfaces.api.dto.DeadLetterResponse;
import com.assessorai.interfaces.api.dto.RunResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * {@code run <inputs...>}, {@code resume <run-id>}, {@code inspect-deadletter <run-id>}.
 * Exit codes: 0 finalized, 1 blocked, 2 dead-lettered, 64 usage error.
 */
@Slf4j
@Component
@Profile("cli")
@RequiredArgsConstructor
public class PipelineCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_USAGE = 64;

    private final PipelineAppService pipelineAppService;
    private final ObjectMapper objectMapper;

    private PrintStream out = System.out;
    private int exitCode;

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(String... args) throws JsonProcessingException {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String... args) throws JsonProcessingException {
        if (args.length < 2) {
            return usage();
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (args[0]) {
                case "run" -> {
                    return report(pipelineAppService.run(null, rest, null));
                }
                case "resume" -> {
                    return report(pipelineAppService.resume(rest.get(0)));
                }
                case "inspect-deadletter" -> {
                    List<DeadLetterRecord> records = pipelineAppService.inspectDeadLetters(rest.get(0));
                    print(records.stream().map(DeadLetterResponse::from).toList());
                    return records.isEmpty() ? 1 : 0;
                }
                default -> {
                    return usage();
                }
            }
        } catch (RunNotFoundException | RunNotResumableException | IllegalArgumentException e) {
            log.error("[CLI] {}", e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int report(RunReport report) throws JsonProcessingException {
        print(RunResponse.from(report));
        return report.exitCode();
    }

    private void print(Object value) throws JsonProcessingException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private int usage() {
        out.println("usage: run <input>... | resume <run-id> | inspect-deadletter <run-id>");
        return EXIT_USAGE;
    }
}
