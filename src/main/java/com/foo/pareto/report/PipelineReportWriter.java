package com.foo.pareto.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineReportWriter {

  public static final String REPORT_FILE_NAME = "pipeline_report.json";

  private final ObjectMapper objectMapper;

  public Path write(PipelineReport report, Path outputDirectory) throws IOException {
    Files.createDirectories(outputDirectory);
    Path target = outputDirectory.resolve(REPORT_FILE_NAME);
    objectMapper
        .writer()
        .with(SerializationFeature.INDENT_OUTPUT)
        .writeValue(target.toFile(), report);
    log.info("Run report written to {}", target);
    return target;
  }
}
