package com.foo.pareto.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "pareto.etl")
public class ParetoEtlProperties {

  public enum ExportFormat {
    CSV,
    XLSX
  }

  @NotBlank private String inputDirectory = "data/raw";
  @NotBlank private String outputDirectory = "data/processed";
  @NotBlank private String filePattern = "*.csv";

  // sniffing
  @NotEmpty
  private List<String> encodings = new ArrayList<>(List.of("UTF-8", "ISO-8859-1", "windows-1252"));

  @NotEmpty
  private List<@PositiveOrZero Integer> headerOffsets = new ArrayList<>(List.of(0, 1, 2, 3));

  private boolean tryHeaderless = true;
  @PositiveOrZero private int fallbackHeaderOffset = 2;
  @NotEmpty private List<Character> delimiters = new ArrayList<>(List.of(',', ';'));

  // pareto
  @DecimalMin(value = "0", inclusive = false)
  @DecimalMax("1")
  private BigDecimal classAThreshold = new BigDecimal("0.80");

  @DecimalMin(value = "0", inclusive = false)
  @DecimalMax("1")
  private BigDecimal classBThreshold = new BigDecimal("0.95");

  @DecimalMin("0")
  private BigDecimal consistencyTolerance = BigDecimal.ONE;

  private boolean failOnMissingTotalColumn = false;

  // export
  private char outputDelimiter = ';';
  private char outputDecimalSeparator = ',';
  @NotEmpty private Set<ExportFormat> exportFormats = EnumSet.of(ExportFormat.CSV);
  private boolean writeReport = true;

  private boolean runOnStartup = true;

  public Path getInputDirectoryPath() {
    return Path.of(inputDirectory);
  }

  public Path getOutputDirectoryPath() {
    return Path.of(outputDirectory);
  }

  public List<Charset> getCharsets() {
    return encodings.stream().map(Charset::forName).toList();
  }

  @AssertTrue(message = "class-a-threshold must be lower than class-b-threshold")
  public boolean isThresholdOrderValid() {
    return classAThreshold == null
        || classBThreshold == null
        || classAThreshold.compareTo(classBThreshold) < 0;
  }
}
