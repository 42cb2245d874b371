package com.rugradar.risk;

import com.rugradar.domain.AuthorityField;
import com.rugradar.domain.AuthorityStatus;
import com.rugradar.domain.MintAuthorityState;
import com.rugradar.domain.ResolvedLaunch;
import com.rugradar.domain.RiskVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rug-pull checks for one resolved launch. Append order is fixed: mint authority, freeze authority, then
 * liquidity burn. Any red flag makes the verdict high risk; there is no scoring.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RiskEvaluator {

    private final MintAccountSource mintAccountSource;
    private final MintAuthorityDecoder authorityDecoder;
    private final LiquidityBurnDetector burnDetector;

    public RiskVerdict evaluate(ResolvedLaunch launch, List<String> logLines) {
        List<String> goodSigns = new ArrayList<>();
        List<String> redFlags = new ArrayList<>();

        Optional<byte[]> accountData = fetchMintAccount(launch);
        if (accountData.isEmpty()) {
            redFlags.add(RiskSignals.MINT_ACCOUNT_UNAVAILABLE);
        } else {
            MintAuthorityState state = authorityDecoder.decode(accountData.get());
            check(state.mintAuthority(), RiskSignals.MINT_AUTHORITY_REVOKED, RiskSignals::mintAuthorityActive,
                    goodSigns, redFlags);
            check(state.freezeAuthority(), RiskSignals.FREEZE_AUTHORITY_REVOKED, RiskSignals::freezeAuthorityActive,
                    goodSigns, redFlags);
        }

        if (burnDetector.lpTokensBurned(logLines)) {
            goodSigns.add(RiskSignals.LP_BURNED);
        } else {
            redFlags.add(RiskSignals.LP_NOT_BURNED);
        }

        return RiskVerdict.of(launch.mint(), launch.creator(), goodSigns, redFlags);
    }

    private Optional<byte[]> fetchMintAccount(ResolvedLaunch launch) {
        try {
            return mintAccountSource.readMintAccount(launch.mint())
                    .filter(data -> data.length > 0);
        } catch (RuntimeException e) {
            log.warn("Mint account fetch failed for {} (tx {}): {}", launch.mint(), launch.signature(), e.getMessage());
            return Optional.empty();
        }
    }

    private static void check(AuthorityField field, String revokedSign, Function<String, String> activeFlag,
                              List<String> goodSigns, List<String> redFlags) {
        if (field.status() == AuthorityStatus.REVOKED) {
            goodSigns.add(revokedSign);
        } else if (field.status() == AuthorityStatus.ACTIVE) {
            redFlags.add(activeFlag.apply(field.holder()));
        }
    }
}
