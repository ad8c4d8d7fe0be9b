package com.foo.pareto.service.pipeline.export;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.support.StarSchemaFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvStarSchemaExporterTest {

  private ParetoEtlProperties properties;
  private CsvStarSchemaExporter exporter;

  @TempDir Path tempDir;

  @BeforeEach
  void setUp() {
    properties = new ParetoEtlProperties();
    exporter = new CsvStarSchemaExporter(properties);
  }

  @Test
  void export_writesThreeTablesWithRegionalFormat() throws IOException {
    Path out = tempDir.resolve("processed");

    List<Path> files = exporter.export(StarSchemaFixtures.singleItem("A1", "CAFE"), out);

    assertThat(files)
        .extracting(p -> p.getFileName().toString())
        .containsExactly("dim_articulos.csv", "dim_sucursales.csv", "fact_ventas.csv");

    List<String> items = read(out.resolve("dim_articulos.csv"));
    assertThat(items.get(0))
        .isEqualTo(
            "Articulo;Descripcion;Ranking;Clasificacion_ABC;Venta_Neta_Total;Venta_Bruta_Total;"
                + "Venta_Devolucion_Total;Tasa_Devolucion;Porcentaje_Articulo_Global;"
                + "Porcentaje_Acumulado");
    assertThat(items.get(1))
        .isEqualTo("A1;CAFE;1;A;1000,00;1050,00;50,00;0,0476;1,0000;1,0000");

    assertThat(read(out.resolve("dim_sucursales.csv")))
        .containsExactly("Sucursal;Tipo", "CENTRO;FISICA", "TIENDA_ONLINE;ONLINE");

    assertThat(read(out.resolve("fact_ventas.csv")))
        .containsExactly(
            "Articulo;Sucursal;Venta_Neta;Venta_Bruta;Venta_Devolucion;Cantidad",
            "A1;CENTRO;800,00;850,00;50,00;8",
            "A1;TIENDA_ONLINE;200,00;200,00;0,00;2");
  }

  @Test
  void export_configuredSeparators() throws IOException {
    properties.setOutputDelimiter(',');
    properties.setOutputDecimalSeparator('.');

    exporter.export(StarSchemaFixtures.singleItem("A1", "CAFE"), tempDir);

    assertThat(read(tempDir.resolve("fact_ventas.csv")).get(1))
        .isEqualTo("A1,CENTRO,800.00,850.00,50.00,8");
  }

  @Test
  void export_formulaLikeText_neutralized() throws IOException {
    exporter.export(StarSchemaFixtures.singleItem("A1", "=HYPERLINK(\"x\")"), tempDir);

    assertThat(read(tempDir.resolve("dim_articulos.csv")).get(1)).contains("'=HYPERLINK");
  }

  @Test
  void export_keyColumnsWrittenVerbatim() throws IOException {
    exporter.export(StarSchemaFixtures.singleItem("-5001", "+ACEITE"), tempDir);

    assertThat(read(tempDir.resolve("dim_articulos.csv")).get(1)).startsWith("-5001;'+ACEITE;");
    assertThat(read(tempDir.resolve("fact_ventas.csv")).get(1)).startsWith("-5001;CENTRO;");
  }

  private static List<String> read(Path file) throws IOException {
    return Files.readAllLines(file, StandardCharsets.UTF_8);
  }
}
