package com.rugradar.risk;

import com.rugradar.domain.ResolvedLaunch;
import com.rugradar.domain.RiskVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class RiskEvaluatorTest {

    private static final ResolvedLaunch LAUNCH = new ResolvedLaunch("sig1", "Creator111", "MintAAA111pump");
    private static final String DEV_KEY = "US517G5965aydkZ46HS38QLi7UQiSojurfbQfKCELFx";

    private static final List<String> LP_BURNED_LOGS = List.of(
            "Program log: Instruction: Create",
            "Program log: Burn LP tokens for Raydium pool");
    private static final List<String> PLAIN_LOGS = List.of("Program log: Instruction: Create");

    @Test
    @DisplayName("both authorities revoked and LP burned: three good signs, no red flags")
    void allClear_lowRisk() {
        RiskVerdict verdict = evaluator(data(false, false)).evaluate(LAUNCH, LP_BURNED_LOGS);

        assertThat(verdict.goodSigns()).containsExactly(
                RiskSignals.MINT_AUTHORITY_REVOKED,
                RiskSignals.FREEZE_AUTHORITY_REVOKED,
                RiskSignals.LP_BURNED);
        assertThat(verdict.redFlags()).isEmpty();
        assertThat(verdict.highRisk()).isFalse();
        assertThat(verdict.mint()).isEqualTo("MintAAA111pump");
        assertThat(verdict.creator()).isEqualTo("Creator111");
    }

    @Test
    @DisplayName("mint authority active, freeze revoked, LP not burned: two red flags in order")
    void mintActive_lpNotBurned_highRisk() {
        RiskVerdict verdict = evaluator(data(true, false)).evaluate(LAUNCH, PLAIN_LOGS);

        assertThat(verdict.goodSigns()).containsExactly(RiskSignals.FREEZE_AUTHORITY_REVOKED);
        assertThat(verdict.redFlags()).hasSize(2);
        assertThat(verdict.redFlags().get(0)).startsWith("Mint authority ACTIVE: " + DEV_KEY);
        assertThat(verdict.redFlags().get(1)).startsWith("LP tokens NOT burned");
        assertThat(verdict.highRisk()).isTrue();
    }

    @Test
    void freezeActive_namesHolder() {
        RiskVerdict verdict = evaluator(data(false, true)).evaluate(LAUNCH, LP_BURNED_LOGS);

        assertThat(verdict.redFlags()).containsExactly(RiskSignals.freezeAuthorityActive(DEV_KEY));
        assertThat(verdict.goodSigns()).containsExactly(RiskSignals.MINT_AUTHORITY_REVOKED, RiskSignals.LP_BURNED);
    }

    @Test
    @DisplayName("missing account: unavailable flag regardless of LP burn, no authority signs")
    void accountMissing_flaggedUnavailable() {
        RiskVerdict verdict = evaluator(mint -> Optional.empty()).evaluate(LAUNCH, LP_BURNED_LOGS);

        assertThat(verdict.redFlags()).containsExactly(RiskSignals.MINT_ACCOUNT_UNAVAILABLE);
        assertThat(verdict.goodSigns()).containsExactly(RiskSignals.LP_BURNED);
        assertThat(verdict.highRisk()).isTrue();
    }

    @Test
    void accountFetchThrows_flaggedUnavailable() {
        MintAccountSource failing = mint -> {
            throw new IllegalStateException("getAccountInfo failed after 3 attempts");
        };

        RiskVerdict verdict = evaluator(failing).evaluate(LAUNCH, PLAIN_LOGS);

        assertThat(verdict.redFlags()).containsExactly(RiskSignals.MINT_ACCOUNT_UNAVAILABLE, RiskSignals.LP_NOT_BURNED);
        assertThat(verdict.goodSigns()).isEmpty();
    }

    @Test
    void emptyAccountData_flaggedUnavailable() {
        RiskVerdict verdict = evaluator(mint -> Optional.of(new byte[0])).evaluate(LAUNCH, LP_BURNED_LOGS);

        assertThat(verdict.redFlags()).containsExactly(RiskSignals.MINT_ACCOUNT_UNAVAILABLE);
    }

    @Test
    @DisplayName("short buffer: undecodable slots contribute neither sign nor flag")
    void shortBuffer_slotsSkipped() {
        RiskVerdict tooShort = evaluator(mint -> Optional.of(new byte[20])).evaluate(LAUNCH, LP_BURNED_LOGS);
        RiskVerdict mintOnly = evaluator(mint -> Optional.of(new byte[40])).evaluate(LAUNCH, LP_BURNED_LOGS);

        assertThat(tooShort.goodSigns()).containsExactly(RiskSignals.LP_BURNED);
        assertThat(tooShort.redFlags()).isEmpty();
        assertThat(tooShort.highRisk()).isFalse();
        assertThat(mintOnly.goodSigns()).containsExactly(RiskSignals.MINT_AUTHORITY_REVOKED, RiskSignals.LP_BURNED);
        assertThat(mintOnly.redFlags()).isEmpty();
    }

    @Test
    void sameInputs_yieldEqualVerdicts() {
        RiskEvaluator evaluator = evaluator(data(true, true));

        RiskVerdict first = evaluator.evaluate(LAUNCH, PLAIN_LOGS);
        RiskVerdict second = evaluator.evaluate(LAUNCH, PLAIN_LOGS);

        assertThat(second).isEqualTo(first);
    }

    @ParameterizedTest(name = "mintActive={0} freezeActive={1} lpBurned={2}")
    @MethodSource("allSignalCombinations")
    void highRisk_iffAnyRedFlag(boolean mintActive, boolean freezeActive, boolean lpBurned) {
        RiskVerdict verdict = evaluator(data(mintActive, freezeActive))
                .evaluate(LAUNCH, lpBurned ? LP_BURNED_LOGS : PLAIN_LOGS);

        assertThat(verdict.highRisk()).isEqualTo(!verdict.redFlags().isEmpty());
        assertThat(verdict.highRisk()).isEqualTo(mintActive || freezeActive || !lpBurned);
        assertThat(verdict.goodSigns().size() + verdict.redFlags().size()).isEqualTo(3);
    }

    static Stream<Arguments> allSignalCombinations() {
        Stream.Builder<Arguments> combos = Stream.builder();
        for (boolean mint : new boolean[]{false, true}) {
            for (boolean freeze : new boolean[]{false, true}) {
                for (boolean lp : new boolean[]{false, true}) {
                    combos.add(Arguments.of(mint, freeze, lp));
                }
            }
        }
        return combos.build();
    }

    private static RiskEvaluator evaluator(MintAccountSource source) {
        return new RiskEvaluator(source, new MintAuthorityDecoder(), new LiquidityBurnDetector());
    }

    private static MintAccountSource data(boolean mintActive, boolean freezeActive) {
        byte[] raw = new byte[82];
        if (mintActive) {
            Arrays.fill(raw, 4, 36, (byte) 7);
        }
        if (freezeActive) {
            Arrays.fill(raw, 36, 68, (byte) 7);
        }
        return mint -> Optional.of(raw.clone());
    }
}
