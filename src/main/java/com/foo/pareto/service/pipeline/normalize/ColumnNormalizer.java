package com.foo.pareto.service.pipeline.normalize;

import static com.foo.pareto.model.CanonicalColumn.ARTICULO;
import static com.foo.pareto.model.CanonicalColumn.CANTIDAD;
import static com.foo.pareto.model.CanonicalColumn.DESCRIPCION;
import static com.foo.pareto.model.CanonicalColumn.PRECIO;
import static com.foo.pareto.model.CanonicalColumn.TOTAL_PRECIO;

import com.foo.pareto.exception.ColumnNormalizationException;
import com.foo.pareto.model.RawTable;
import com.foo.pareto.util.HeaderTextUtil;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renames the headers of a sales table onto {@link com.foo.pareto.model.CanonicalColumn}
 * labels.
 *
 * <p>Every header is first trimmed and stripped of diacritics. Then, for each column in source
 * order, {@link #RULES} are tried in list order and the first matching rule names the column.
 * The item rule is single-use: the first column that looks like an item code becomes {@code
 * Articulo} and later candidates fall through to the remaining rules. Changing the rule order
 * changes which column becomes the item key on ambiguous files.
 */
@Slf4j
@Service
public class ColumnNormalizer {

  public static final List<ColumnRule> RULES =
      List.of(
          ColumnRule.containsAny(ARTICULO, true, "art", "prod", "codigo", "sku"),
          ColumnRule.containsAny(DESCRIPCION, false, "desc", "nombre"),
          new ColumnRule(
              CANTIDAD,
              key -> key.contains("cant") && !key.contains("total"),
              false,
              List.of("cant")),
          ColumnRule.equalsAny(PRECIO, "precio", "precio unitario", "preciou"),
          new ColumnRule(
              TOTAL_PRECIO,
              key ->
                  (key.contains("total") && key.contains("prec"))
                      || key.equals("total")
                      || key.equals("importe"),
              false,
              List.of("total", "importe", "total precio")));

  /**
   * @param sourceName file or table name used in diagnostics
   * @throws ColumnNormalizationException if no column can serve as {@code Articulo}
   */
  public RawTable normalize(RawTable table, String sourceName) {
    log.debug("{}: original columns {}", sourceName, table.getColumns());

    Map<String, String> cleaning = new LinkedHashMap<>();
    for (String column : table.getColumns()) {
      cleaning.put(column, HeaderTextUtil.cleanLabel(column));
    }
    RawTable cleaned = table.renameColumns(cleaning);

    Map<String, String> mapping = new LinkedHashMap<>();
    Set<ColumnRule> usedRules = new HashSet<>();
    for (String column : cleaned.getColumns()) {
      String key = HeaderTextUtil.matchKey(column);
      for (ColumnRule rule : RULES) {
        if (rule.singleUse() && usedRules.contains(rule)) {
          continue;
        }
        if (rule.matches(key)) {
          mapping.put(column, rule.target().getLabel());
          usedRules.add(rule);
          log.debug("{}: '{}' -> '{}'", sourceName, column, rule.target().getLabel());
          break;
        }
      }
    }

    RawTable normalized = cleaned.renameColumns(mapping);
    if (!normalized.hasColumn(ARTICULO.getLabel())) {
      log.error(
          "{}: column '{}' not found. Available columns: {}",
          sourceName,
          ARTICULO.getLabel(),
          cleaned.getColumns());
      throw new ColumnNormalizationException(
          sourceName, ARTICULO.getLabel(), cleaned.getColumns(), RULES.get(0).hints());
    }

    log.info(
        "{}: columns normalized {} -> {}",
        sourceName,
        table.getColumns(),
        normalized.getColumns());
    return normalized;
  }
}
