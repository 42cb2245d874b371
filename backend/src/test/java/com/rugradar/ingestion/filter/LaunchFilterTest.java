package com.rugradar.ingestion.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LaunchFilterTest {

    private final LaunchFilter filter = new LaunchFilter();

    @Test
    @DisplayName("matches the create instruction log")
    void createInstruction_matches() {
        assertThat(filter.isLaunchEvent(List.of(
                "Program 6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P invoke [1]",
                "Program log: Instruction: Create"))).isTrue();
    }

    @Test
    @DisplayName("match is case-insensitive and substring-based")
    void caseInsensitiveSubstring() {
        assertThat(filter.isLaunchEvent(List.of("CREATE"))).isTrue();
        assertThat(filter.isLaunchEvent(List.of("Program log: CreateIdempotent"))).isTrue();
        assertThat(filter.isLaunchEvent(List.of("recreated account"))).isTrue();
    }

    @Test
    @DisplayName("buy/sell traffic without create is not a launch")
    void tradeLogs_doNotMatch() {
        assertThat(filter.isLaunchEvent(List.of(
                "Program log: Instruction: Buy",
                "Program log: Instruction: Sell",
                "Program TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA success"))).isFalse();
    }

    @Test
    void emptyOrNull_doesNotMatch() {
        assertThat(filter.isLaunchEvent(List.of())).isFalse();
        assertThat(filter.isLaunchEvent(null)).isFalse();
        assertThat(filter.isLaunchEvent(Arrays.asList(null, "Program log: Instruction: Buy"))).isFalse();
    }

    @Test
    void nullLinesAreSkipped() {
        assertThat(filter.isLaunchEvent(Arrays.asList(null, "Program log: Instruction: Create"))).isTrue();
    }
}
