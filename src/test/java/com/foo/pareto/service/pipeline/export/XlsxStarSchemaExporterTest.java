package com.foo.pareto.service.pipeline.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.foo.pareto.support.StarSchemaFixtures;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XlsxStarSchemaExporterTest {

  private final XlsxStarSchemaExporter exporter = new XlsxStarSchemaExporter();

  @TempDir Path tempDir;

  @Test
  void export_oneSheetPerTable() throws IOException {
    List<Path> files = exporter.export(StarSchemaFixtures.singleItem("A1", "CAFE"), tempDir);

    assertThat(files).containsExactly(tempDir.resolve("modelo_estrella.xlsx"));
    try (InputStream is = Files.newInputStream(files.get(0));
        XSSFWorkbook workbook = new XSSFWorkbook(is)) {
      assertThat(workbook.getNumberOfSheets()).isEqualTo(3);

      Sheet items = workbook.getSheet("dim_articulos");
      Cell header = items.getRow(0).getCell(0);
      assertThat(header.getStringCellValue()).isEqualTo("Articulo");
      assertThat(workbook.getFontAt(header.getCellStyle().getFontIndex()).getBold()).isTrue();
      Row first = items.getRow(1);
      assertThat(first.getCell(0).getStringCellValue()).isEqualTo("A1");
      assertThat(first.getCell(2).getNumericCellValue()).isEqualTo(1.0);
      assertThat(first.getCell(3).getStringCellValue()).isEqualTo("A");
      assertThat(first.getCell(4).getNumericCellValue()).isCloseTo(1000.0, within(0.001));
      assertThat(first.getCell(7).getNumericCellValue()).isCloseTo(0.0476, within(0.00001));

      Sheet branches = workbook.getSheet("dim_sucursales");
      assertThat(branches.getLastRowNum()).isEqualTo(2);
      assertThat(branches.getRow(2).getCell(1).getStringCellValue()).isEqualTo("ONLINE");

      Sheet facts = workbook.getSheet("fact_ventas");
      assertThat(facts.getRow(1).getCell(1).getStringCellValue()).isEqualTo("CENTRO");
      assertThat(facts.getRow(1).getCell(2).getNumericCellValue())
          .isCloseTo(800.0, within(0.001));
    }
  }

  @Test
  void export_formulaLikeDescriptionQuoted_keysVerbatim() throws IOException {
    exporter.export(StarSchemaFixtures.singleItem("-5001", "=1+1"), tempDir);

    try (InputStream is = Files.newInputStream(tempDir.resolve("modelo_estrella.xlsx"));
        XSSFWorkbook workbook = new XSSFWorkbook(is)) {
      Row item = workbook.getSheet("dim_articulos").getRow(1);
      assertThat(item.getCell(1).getStringCellValue()).isEqualTo("'=1+1");
      assertThat(item.getCell(0).getStringCellValue()).isEqualTo("-5001");
      assertThat(workbook.getSheet("fact_ventas").getRow(1).getCell(0).getStringCellValue())
          .isEqualTo("-5001");
    }
  }
}
