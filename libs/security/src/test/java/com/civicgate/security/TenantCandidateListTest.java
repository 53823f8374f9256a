package com.civicgate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TenantCandidateList")
class TenantCandidateListTest {

    @Test
    @DisplayName("should order requested root, default root, then observed roots")
    void shouldOrderCandidates() {
        var list = TenantCandidateList.build("statea.citya", "pg", List.of("stateb", "statec"));

        assertThat(list.candidates()).containsExactly("statea", "pg", "stateb", "statec");
    }

    @Test
    @DisplayName("should drop duplicates and keep first position")
    void shouldDeduplicate() {
        var list = TenantCandidateList.build("pg.citya", "pg", List.of("statea", "pg"));

        assertThat(list.candidates()).containsExactly("pg", "statea");
        assertThat(list.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should be empty when nothing is known")
    void shouldBeEmpty() {
        var list = TenantCandidateList.build(null, " ", null);

        assertThat(list.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should reduce tenant ids to their root")
    void rootOfTenant() {
        assertThat(TenantIds.root("pg.citya.ward1")).isEqualTo("pg");
        assertThat(TenantIds.root(" pg ")).isEqualTo("pg");
        assertThat(TenantIds.root("")).isNull();
        assertThat(TenantIds.isRoot("pg")).isTrue();
        assertThat(TenantIds.isRoot("pg.citya")).isFalse();
    }
}
