package com.rugradar.risk;

import com.rugradar.domain.SolanaPrograms;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Log-text heuristic for LP token burns: some line must mention a burn and the Raydium pool program
 * (by name or program id). Can over- and under-detect; it is a signal, not a decoded instruction check.
 */
@Component
public class LiquidityBurnDetector {

    static final String BURN_MARKER = "Burn";
    static final String POOL_PROGRAM_NAME = "Raydium";

    public boolean lpTokensBurned(List<String> logLines) {
        if (logLines == null) {
            return false;
        }
        for (String line : logLines) {
            if (line != null && line.contains(BURN_MARKER) && mentionsPoolProgram(line)) {
                return true;
            }
        }
        return false;
    }

    private static boolean mentionsPoolProgram(String line) {
        return line.contains(POOL_PROGRAM_NAME) || line.contains(SolanaPrograms.RAYDIUM_AMM_PROGRAM);
    }
}
