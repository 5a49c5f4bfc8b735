package com.vidnyan.rulecov.application.port.out;

import com.vidnyan.rulecov.application.port.in.TestRuleUseCase.BatchReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for persisting batch reports.
 */
public interface ReportWriter {

    void write(BatchReport report, Path target) throws IOException;
}
