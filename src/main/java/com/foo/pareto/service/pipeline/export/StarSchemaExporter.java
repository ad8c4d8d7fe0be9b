package com.foo.pareto.service.pipeline.export;

import com.foo.pareto.config.ParetoEtlProperties.ExportFormat;
import com.foo.pareto.model.StarSchema;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface StarSchemaExporter {

  ExportFormat getFormat();

  /** Writes the tables into {@code outputDirectory}, creating it if needed. */
  List<Path> export(StarSchema schema, Path outputDirectory) throws IOException;
}
