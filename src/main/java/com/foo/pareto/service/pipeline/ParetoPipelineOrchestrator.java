package com.foo.pareto.service.pipeline;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.model.CleanSalesRow;
import com.foo.pareto.model.RawTable;
import com.foo.pareto.model.StarSchema;
import com.foo.pareto.report.PipelineReport;
import com.foo.pareto.report.PipelineReportWriter;
import com.foo.pareto.service.pipeline.clean.SalesDataCleaner;
import com.foo.pareto.service.pipeline.consolidate.SalesFileConsolidator;
import com.foo.pareto.service.pipeline.discover.InputFileLocator;
import com.foo.pareto.service.pipeline.export.StarSchemaExporter;
import com.foo.pareto.service.pipeline.pareto.ParetoAnalysisService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ParetoPipelineOrchestrator {

  private final InputFileLocator fileLocator;
  private final SalesFileConsolidator consolidator;
  private final SalesDataCleaner cleaner;
  private final ParetoAnalysisService paretoService;
  private final List<StarSchemaExporter> exporters;
  private final PipelineReportWriter reportWriter;
  private final ParetoEtlProperties properties;

  @Builder
  public record PipelineResult(
      StarSchema schema, PipelineReport report, List<Path> outputFiles, Path reportFile) {}

  public PipelineResult run() throws IOException {
    Path inputDirectory = properties.getInputDirectoryPath();
    Path outputDirectory = properties.getOutputDirectoryPath();
    log.info("Sales Pareto pipeline: {} -> {}", inputDirectory, outputDirectory);

    PipelineReport report = new PipelineReport();
    try {
      // 1. Locate exports
      List<Path> files = fileLocator.locate(inputDirectory, properties.getFilePattern());

      // 2. Sniff + normalize each file, tag with branch, concatenate
      RawTable consolidated = consolidator.consolidate(files, report);

      // 3. Types, net sale, summary rows
      List<CleanSalesRow> cleanRows = cleaner.clean(consolidated, report);

      // 4. Fact table, item dimension, ABC
      StarSchema schema = paretoService.analyze(cleanRows, report);

      // 5. Export
      List<Path> outputFiles = new ArrayList<>();
      for (StarSchemaExporter exporter : exporters) {
        if (properties.getExportFormats().contains(exporter.getFormat())) {
          outputFiles.addAll(exporter.export(schema, outputDirectory));
        }
      }
      report.setOutputFiles(outputFiles.stream().map(Path::toString).toList());

      Path reportFile = null;
      if (properties.isWriteReport()) {
        reportFile = reportWriter.write(report, outputDirectory);
      }

      log.info("Pipeline completed. Files written: {}", outputFiles);
      return PipelineResult.builder()
          .schema(schema)
          .report(report)
          .outputFiles(outputFiles)
          .reportFile(reportFile)
          .build();
    } catch (Exception e) {
      log.error("Pipeline failed: {}", e.getMessage());
      throw e;
    }
  }
}
