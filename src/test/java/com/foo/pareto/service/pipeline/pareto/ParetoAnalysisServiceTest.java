package com.foo.pareto.service.pipeline.pareto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.exception.NoPositiveSalesException;
import com.foo.pareto.model.AbcClass;
import com.foo.pareto.model.BranchDimension;
import com.foo.pareto.model.BranchType;
import com.foo.pareto.model.CleanSalesRow;
import com.foo.pareto.model.FactSale;
import com.foo.pareto.model.ItemDimension;
import com.foo.pareto.model.StarSchema;
import com.foo.pareto.report.PipelineReport;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParetoAnalysisServiceTest {

  private static final BigDecimal UNIT = new BigDecimal("13.37");

  private ParetoAnalysisService service;
  private PipelineReport report;

  @BeforeEach
  void setUp() {
    service = new ParetoAnalysisService(new ParetoEtlProperties());
    report = new PipelineReport();
  }

  @Test
  void analyze_itemSoldInTwoBranches_factsSumToDimensionTotal() {
    List<CleanSalesRow> rows =
        List.of(
            row("X", "A", "500"),
            row("X", "A", "300"),
            row("X", "B", "200"),
            row("Z", "A", "100"));

    StarSchema schema = service.analyze(rows, report);

    assertThat(schema.facts())
        .filteredOn(f -> f.articulo().equals("X"))
        .extracting(FactSale::sucursal, f -> f.ventaNeta().toPlainString())
        .containsExactly(tuple("A", "800.00"), tuple("B", "200.00"));
    assertThat(item(schema, "X").ventaNetaTotal()).isEqualByComparingTo("1000");
    assertThat(item(schema, "X").ranking()).isEqualTo(1);
  }

  @Test
  void analyze_netReturnItem_excludedFromEveryTable() {
    List<CleanSalesRow> rows =
        List.of(
            row("X", "A", "800"),
            row("Y", "A", "50"),
            row("Y", "B", "-200"),
            row("Z", "A", "200"));

    StarSchema schema = service.analyze(rows, report);

    assertThat(schema.items()).extracting(ItemDimension::articulo).containsExactly("X", "Z");
    assertThat(schema.facts()).noneMatch(f -> f.articulo().equals("Y"));
    assertThat(item(schema, "X").porcentajeArticuloGlobal()).isEqualByComparingTo("0.8000");
    assertThat(schema.consistencyCheck().factTotal()).isEqualByComparingTo("1000.00");
    assertThat(report.getItemsWithoutPositiveSales()).isEqualTo(1);
  }

  @Test
  void analyze_branchOnlyHoldingExcludedItem_notInBranchDimension() {
    List<CleanSalesRow> rows =
        List.of(row("X", "CENTRO", "100"), row("Y", "TIENDA_ONLINE", "-5"));

    StarSchema schema = service.analyze(rows, report);

    assertThat(schema.branches())
        .containsExactly(new BranchDimension("CENTRO", BranchType.FISICA));
  }

  @Test
  void analyze_abcBoundsInclusive() {
    List<CleanSalesRow> rows =
        List.of(
            row("P1", "A", "50"), row("P2", "A", "30"), row("P3", "A", "15"), row("P4", "A", "5"));

    StarSchema schema = service.analyze(rows, report);

    assertThat(schema.items())
        .extracting(ItemDimension::clasificacionAbc)
        .containsExactly(AbcClass.A, AbcClass.A, AbcClass.B, AbcClass.C);
    assertThat(schema.items())
        .extracting(i -> i.porcentajeAcumulado().toPlainString())
        .containsExactly("0.5000", "0.8000", "0.9500", "1.0000");
  }

  @Test
  void analyze_cumulativeShareMonotoneAndEndsAtOne() {
    List<CleanSalesRow> rows = new ArrayList<>();
    for (int i = 1; i <= 7; i++) {
      rows.add(row("ART" + i, "A", UNIT.multiply(BigDecimal.valueOf(i)).toPlainString()));
    }

    StarSchema schema = service.analyze(rows, report);

    BigDecimal previous = BigDecimal.ZERO;
    for (ItemDimension item : schema.items()) {
      assertThat(item.porcentajeAcumulado()).isGreaterThanOrEqualTo(previous);
      previous = item.porcentajeAcumulado();
    }
    assertThat(previous).isBetween(new BigDecimal("0.9990"), new BigDecimal("1.0010"));
    assertThat(schema.items())
        .extracting(ItemDimension::ranking)
        .containsExactly(1, 2, 3, 4, 5, 6, 7);
  }

  @Test
  void analyze_equalTotals_rankedByItemCode() {
    List<CleanSalesRow> rows = List.of(row("B", "A", "10"), row("A", "A", "10"));

    StarSchema schema = service.analyze(rows, report);

    assertThat(schema.items()).extracting(ItemDimension::articulo).containsExactly("A", "B");
  }

  @Test
  void analyze_returnsWithinPositiveItem_grossAndReturnRate() {
    List<CleanSalesRow> rows = List.of(row("W", "A", "100"), row("W", "B", "-20"));

    ItemDimension w = service.analyze(rows, report).items().get(0);

    assertThat(w.ventaNetaTotal()).isEqualByComparingTo("80");
    assertThat(w.ventaBrutaTotal()).isEqualByComparingTo("100");
    assertThat(w.ventaDevolucionTotal()).isEqualByComparingTo("20");
    assertThat(w.tasaDevolucion()).isEqualByComparingTo("0.2000");
  }

  @Test
  void analyze_firstSeenDescriptionKept() {
    List<CleanSalesRow> rows =
        List.of(
            CleanSalesRow.builder()
                .articulo("X")
                .descripcion("CAFE")
                .sucursal("A")
                .cantidad(BigDecimal.ONE)
                .ventaNeta(BigDecimal.TEN)
                .build(),
            CleanSalesRow.builder()
                .articulo("X")
                .descripcion("CAFE MOLIDO")
                .sucursal("B")
                .cantidad(BigDecimal.ONE)
                .ventaNeta(BigDecimal.TEN)
                .build());

    assertThat(service.analyze(rows, report).items().get(0).descripcion()).isEqualTo("CAFE");
  }

  @Test
  void analyze_consistencyWithinCent() {
    List<CleanSalesRow> rows =
        List.of(row("X", "A", "10.005"), row("X", "B", "10.005"), row("Y", "A", "0.333"));

    StarSchema schema = service.analyze(rows, report);

    assertThat(schema.consistencyCheck().difference())
        .isLessThanOrEqualTo(new BigDecimal("0.01"));
    assertThat(schema.consistencyCheck().withinTolerance()).isTrue();
    assertThat(report.getWarnings()).isEmpty();
  }

  @Test
  void analyze_zeroTolerance_matchingTotals_noWarning() {
    ParetoEtlProperties properties = new ParetoEtlProperties();
    properties.setConsistencyTolerance(BigDecimal.ZERO);
    ParetoAnalysisService strict = new ParetoAnalysisService(properties);

    StarSchema schema = strict.analyze(List.of(row("X", "A", "100")), report);

    assertThat(schema.consistencyCheck().withinTolerance()).isTrue();
    assertThat(report.getWarnings()).isEmpty();
  }

  @Test
  void analyze_allSalesZero_throws() {
    List<CleanSalesRow> rows = List.of(row("X", "A", "0"), row("Y", "A", "0"));

    assertThatThrownBy(() -> service.analyze(rows, report))
        .isInstanceOfSatisfying(
            NoPositiveSalesException.class, e -> assertThat(e.getItemCount()).isEqualTo(2));
  }

  @Test
  void aggregateFacts_quantitiesRoundedToUnits() {
    List<CleanSalesRow> rows =
        List.of(
            CleanSalesRow.builder()
                .articulo("X")
                .descripcion("CAFE")
                .sucursal("A")
                .cantidad(new BigDecimal("1.4"))
                .ventaNeta(new BigDecimal("-3"))
                .build(),
            CleanSalesRow.builder()
                .articulo("X")
                .descripcion("CAFE")
                .sucursal("A")
                .cantidad(new BigDecimal("1.4"))
                .ventaNeta(new BigDecimal("10"))
                .build());

    FactSale fact = service.aggregateFacts(rows).get(0);

    assertThat(fact.cantidad().toPlainString()).isEqualTo("3");
    assertThat(fact.ventaNeta()).isEqualByComparingTo("7");
    assertThat(fact.ventaBruta()).isEqualByComparingTo("10");
    assertThat(fact.ventaDevolucion()).isEqualByComparingTo("3");
  }

  private static ItemDimension item(StarSchema schema, String articulo) {
    return schema.items().stream()
        .filter(i -> i.articulo().equals(articulo))
        .findFirst()
        .orElseThrow();
  }

  private static CleanSalesRow row(String articulo, String sucursal, String ventaNeta) {
    return CleanSalesRow.builder()
        .articulo(articulo)
        .descripcion("DESC " + articulo)
        .sucursal(sucursal)
        .cantidad(BigDecimal.ONE)
        .ventaNeta(new BigDecimal(ventaNeta))
        .build();
  }
}
