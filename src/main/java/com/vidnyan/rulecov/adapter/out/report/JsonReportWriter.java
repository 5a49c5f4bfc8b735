package com.vidnyan.rulecov.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.rulecov.application.port.in.TestRuleUseCase.BatchReport;
import com.vidnyan.rulecov.application.port.out.ReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes batch reports as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(BatchReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), report);
        log.info("Report written to {}", target);
    }
}
