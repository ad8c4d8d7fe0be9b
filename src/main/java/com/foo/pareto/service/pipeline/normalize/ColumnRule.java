package com.foo.pareto.service.pipeline.normalize;

import com.foo.pareto.model.CanonicalColumn;
import java.util.List;
import java.util.function.Predicate;

/**
 * Maps a header onto a canonical column when {@code predicate} accepts its match key (trimmed,
 * accent-free, lowercase).
 *
 * @param singleUse once a column has been mapped by this rule, the rule no longer applies
 * @param hints substrings or exact labels that satisfy the rule, for diagnostics
 */
public record ColumnRule(
    CanonicalColumn target, Predicate<String> predicate, boolean singleUse, List<String> hints) {

  public static ColumnRule containsAny(CanonicalColumn target, boolean singleUse, String... parts) {
    List<String> hints = List.of(parts);
    return new ColumnRule(target, key -> hints.stream().anyMatch(key::contains), singleUse, hints);
  }

  public static ColumnRule equalsAny(CanonicalColumn target, String... labels) {
    List<String> hints = List.of(labels);
    return new ColumnRule(target, hints::contains, false, hints);
  }

  public boolean matches(String matchKey) {
    return predicate.test(matchKey);
  }
}
