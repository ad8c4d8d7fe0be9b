package com.foo.pareto.service.pipeline.pareto;

import com.foo.pareto.config.ParetoEtlProperties;
import com.foo.pareto.exception.NoPositiveSalesException;
import com.foo.pareto.model.AbcClass;
import com.foo.pareto.model.BranchDimension;
import com.foo.pareto.model.CleanSalesRow;
import com.foo.pareto.model.ConsistencyCheck;
import com.foo.pareto.model.FactSale;
import com.foo.pareto.model.ItemDimension;
import com.foo.pareto.model.StarSchema;
import com.foo.pareto.report.PipelineReport;
import com.foo.pareto.util.DecimalUtil;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Builds the star schema from clean sales rows.
 *
 * <p>The item dimension is always derived from the already rounded fact rows, never from the
 * clean rows, so that the fact rows of every ranked item add up to the item's total. Items
 * whose net sales are zero or negative are left out of the ranking and, to keep referential
 * integrity, out of the fact rows as well.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParetoAnalysisService {

  private static final int TOP_ITEMS_LOGGED = 5;

  private static final Comparator<FactKey> FACT_ORDER =
      Comparator.comparing(FactKey::articulo).thenComparing(FactKey::sucursal);

  private final ParetoEtlProperties properties;

  private record FactKey(String articulo, String sucursal) {}

  private static final class Totals {
    private BigDecimal neta = BigDecimal.ZERO;
    private BigDecimal bruta = BigDecimal.ZERO;
    private BigDecimal devolucion = BigDecimal.ZERO;
    private BigDecimal cantidad = BigDecimal.ZERO;

    void add(BigDecimal neta, BigDecimal bruta, BigDecimal devolucion, BigDecimal cantidad) {
      this.neta = this.neta.add(neta);
      this.bruta = this.bruta.add(bruta);
      this.devolucion = this.devolucion.add(devolucion);
      this.cantidad = this.cantidad.add(cantidad);
    }
  }

  /**
   * @throws NoPositiveSalesException if no item nets more than zero
   */
  public StarSchema analyze(List<CleanSalesRow> rows, PipelineReport report) {
    log.info("Pareto analysis over {} clean rows", rows.size());

    List<FactSale> facts = aggregateFacts(rows);
    logFactSummary(facts);

    Map<String, String> descriptions = new HashMap<>();
    for (CleanSalesRow row : rows) {
      descriptions.putIfAbsent(row.articulo(), row.descripcion());
    }

    Map<String, Totals> itemTotals = aggregateItems(facts);
    List<Map.Entry<String, Totals>> positive =
        itemTotals.entrySet().stream()
            .filter(e -> e.getValue().neta.signum() > 0)
            .sorted(
                Comparator.comparing((Map.Entry<String, Totals> e) -> e.getValue().neta)
                    .reversed()
                    .thenComparing(Map.Entry::getKey))
            .toList();

    if (positive.isEmpty()) {
      log.error("No item has positive net sales ({} item(s) aggregated)", itemTotals.size());
      throw new NoPositiveSalesException(itemTotals.size());
    }

    List<ItemDimension> items = rank(positive, descriptions);
    BigDecimal positiveTotal =
        items.stream().map(ItemDimension::ventaNetaTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    log.info("  Items with positive net sales: {}", items.size());
    log.info("  Revenue (positive items only): ${}", String.format("%,.2f", positiveTotal));
    logClassSummary(items);

    Set<String> ranked = items.stream().map(ItemDimension::articulo).collect(Collectors.toSet());
    List<FactSale> rankedFacts = facts.stream().filter(f -> ranked.contains(f.articulo())).toList();
    BigDecimal factTotal =
        rankedFacts.stream().map(FactSale::ventaNeta).reduce(BigDecimal.ZERO, BigDecimal::add);

    ConsistencyCheck check =
        ConsistencyCheck.compare(positiveTotal, factTotal, properties.getConsistencyTolerance());
    log.info("  SUM(dim_articulos.Venta_Neta_Total): ${}", String.format("%,.2f", positiveTotal));
    log.info("  SUM(fact_ventas.Venta_Neta):         ${}", String.format("%,.2f", factTotal));
    if (check.withinTolerance()) {
      log.info("  Consistency: OK (difference ${})", check.difference());
    } else {
      log.warn(
          "  Consistency: difference of ${} exceeds tolerance ${}",
          check.difference(),
          check.tolerance());
      report.addWarning(
          "Fact/dimension totals differ by %s (tolerance %s)"
              .formatted(check.difference(), check.tolerance()));
    }

    List<BranchDimension> branches =
        rankedFacts.stream()
            .map(FactSale::sucursal)
            .collect(Collectors.toCollection(TreeSet::new))
            .stream()
            .map(BranchDimension::of)
            .toList();

    report.setFactRows(rankedFacts.size());
    report.setItemsAggregated(itemTotals.size());
    report.setItemsRanked(items.size());
    report.setItemsWithoutPositiveSales(itemTotals.size() - items.size());
    report.setBranches(branches.size());
    report.setConsistencyCheck(check);

    log.info(
        "  Star schema: {} item(s), {} branch(es), {} fact row(s)",
        items.size(),
        branches.size(),
        rankedFacts.size());
    return new StarSchema(items, branches, rankedFacts, check);
  }

  /** One row per (item, branch): money rounded to cents, quantity to units. */
  List<FactSale> aggregateFacts(List<CleanSalesRow> rows) {
    Map<FactKey, Totals> grouped = new TreeMap<>(FACT_ORDER);
    for (CleanSalesRow row : rows) {
      BigDecimal neta = row.ventaNeta();
      BigDecimal bruta = neta.max(BigDecimal.ZERO);
      BigDecimal devolucion = neta.negate().max(BigDecimal.ZERO);
      grouped
          .computeIfAbsent(new FactKey(row.articulo(), row.sucursal()), k -> new Totals())
          .add(neta, bruta, devolucion, row.cantidad());
    }

    List<FactSale> facts = new ArrayList<>(grouped.size());
    grouped.forEach(
        (key, totals) ->
            facts.add(
                new FactSale(
                    key.articulo(),
                    key.sucursal(),
                    DecimalUtil.money(totals.neta),
                    DecimalUtil.money(totals.bruta),
                    DecimalUtil.money(totals.devolucion),
                    DecimalUtil.quantity(totals.cantidad))));
    return facts;
  }

  private Map<String, Totals> aggregateItems(List<FactSale> facts) {
    Map<String, Totals> byItem = new TreeMap<>();
    for (FactSale fact : facts) {
      byItem
          .computeIfAbsent(fact.articulo(), k -> new Totals())
          .add(fact.ventaNeta(), fact.ventaBruta(), fact.ventaDevolucion(), fact.cantidad());
    }
    return byItem;
  }

  /** Expects entries sorted by descending net total. */
  private List<ItemDimension> rank(
      List<Map.Entry<String, Totals>> sorted, Map<String, String> descriptions) {
    BigDecimal total =
        sorted.stream().map(e -> e.getValue().neta).reduce(BigDecimal.ZERO, BigDecimal::add);

    List<ItemDimension> items = new ArrayList<>(sorted.size());
    BigDecimal runningShare = BigDecimal.ZERO;
    int ranking = 0;
    for (Map.Entry<String, Totals> entry : sorted) {
      Totals totals = entry.getValue();
      BigDecimal share = DecimalUtil.ratio(totals.neta, total);
      runningShare = runningShare.add(share);
      BigDecimal cumulative = DecimalUtil.share(runningShare);

      items.add(
          ItemDimension.builder()
              .articulo(entry.getKey())
              .descripcion(descriptions.get(entry.getKey()))
              .ranking(++ranking)
              .clasificacionAbc(
                  AbcClass.of(
                      cumulative,
                      properties.getClassAThreshold(),
                      properties.getClassBThreshold()))
              .ventaNetaTotal(DecimalUtil.money(totals.neta))
              .ventaBrutaTotal(DecimalUtil.money(totals.bruta))
              .ventaDevolucionTotal(DecimalUtil.money(totals.devolucion))
              .tasaDevolucion(DecimalUtil.ratio(totals.devolucion, totals.bruta))
              .porcentajeArticuloGlobal(share)
              .porcentajeAcumulado(cumulative)
              .build());
    }
    return items;
  }

  private void logFactSummary(List<FactSale> facts) {
    BigDecimal bruta = BigDecimal.ZERO;
    BigDecimal devolucion = BigDecimal.ZERO;
    BigDecimal neta = BigDecimal.ZERO;
    for (FactSale fact : facts) {
      bruta = bruta.add(fact.ventaBruta());
      devolucion = devolucion.add(fact.ventaDevolucion());
      neta = neta.add(fact.ventaNeta());
    }
    BigDecimal returnRate = DecimalUtil.ratio(devolucion, bruta).movePointRight(2);
    long branchCount = facts.stream().map(FactSale::sucursal).distinct().count();

    log.info("  fact rows: {}, branches: {}", facts.size(), branchCount);
    log.info("  Gross sales:  ${}", String.format("%,.2f", bruta));
    log.info("  Returns:      ${}", String.format("%,.2f", devolucion));
    log.info("  Net sales:    ${}", String.format("%,.2f", neta));
    log.info("  Return rate:  {}%", returnRate);
  }

  private void logClassSummary(List<ItemDimension> items) {
    Map<AbcClass, Long> counts = new EnumMap<>(AbcClass.class);
    for (AbcClass abc : AbcClass.values()) {
      counts.put(abc, 0L);
    }
    items.forEach(i -> counts.merge(i.clasificacionAbc(), 1L, Long::sum));

    for (AbcClass abc : AbcClass.values()) {
      long count = counts.get(abc);
      log.info(
          "  Class {}: {} item(s) ({}%)",
          abc,
          count,
          String.format("%.1f", count * 100.0 / items.size()));
    }

    log.info("  Top {} items:", Math.min(TOP_ITEMS_LOGGED, items.size()));
    items.stream()
        .limit(TOP_ITEMS_LOGGED)
        .forEach(
            i ->
                log.info(
                    "    #{}: {} {} - ${} ({}%) [{}]",
                    i.ranking(),
                    StringUtils.left(i.articulo(), 15),
                    StringUtils.left(i.descripcion(), 20),
                    String.format("%,.0f", i.ventaNetaTotal()),
                    i.porcentajeArticuloGlobal().movePointRight(2),
                    i.clasificacionAbc()));
  }
}
