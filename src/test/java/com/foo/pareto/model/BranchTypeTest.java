package com.foo.pareto.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BranchTypeTest {

  @Test
  void of_onlineWhenNameContainsOnline() {
    assertThat(BranchType.of("TIENDA_ONLINE")).isEqualTo(BranchType.ONLINE);
    assertThat(BranchType.of("CENTRO")).isEqualTo(BranchType.FISICA);
    assertThat(BranchType.of(null)).isEqualTo(BranchType.FISICA);
    assertThat(BranchDimension.of("ONLINE").tipo()).isEqualTo(BranchType.ONLINE);
  }
}
