package com.rugradar.ingestion.pipeline;

import com.rugradar.alert.AlertSink;
import com.rugradar.domain.LaunchAlert;
import com.rugradar.domain.LaunchEvent;
import com.rugradar.domain.LaunchOutcome;
import com.rugradar.domain.ResolvedLaunch;
import com.rugradar.domain.RiskVerdict;
import com.rugradar.ingestion.adapter.solana.MintNotIdentifiedException;
import com.rugradar.ingestion.adapter.solana.SolanaTransactionResolver;
import com.rugradar.ingestion.adapter.solana.TransactionNotFoundException;
import com.rugradar.risk.RiskEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One unit of work per matched launch: resolve the transaction, evaluate risk, publish the alert.
 * Never throws; every failure is folded into a {@link LaunchOutcome} so the feed keeps running.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LaunchPipeline {

    private final SolanaTransactionResolver transactionResolver;
    private final RiskEvaluator riskEvaluator;
    private final AlertSink alertSink;

    public LaunchOutcome process(LaunchEvent event) {
        String signature = event.signature();
        try {
            ResolvedLaunch launch = transactionResolver.resolve(signature);
            RiskVerdict verdict = riskEvaluator.evaluate(launch, event.logLines());
            LaunchAlert alert = LaunchAlert.of(signature, verdict);
            alertSink.publish(alert);
            return LaunchOutcome.alerted(alert);
        } catch (TransactionNotFoundException e) {
            log.info("Skipping {}: no transaction data available", signature);
            return LaunchOutcome.skipped(signature, LaunchOutcome.Status.NOT_FOUND, e.getMessage());
        } catch (MintNotIdentifiedException e) {
            log.info("Skipping {}: could not identify mint address", signature);
            return LaunchOutcome.skipped(signature, LaunchOutcome.Status.MINT_NOT_IDENTIFIED, e.getMessage());
        } catch (Exception e) {
            String detail = e.getMessage();
            if (e.getCause() != null && e.getCause().getMessage() != null && !e.getCause().getMessage().isBlank()) {
                detail = detail + " (" + e.getCause().getMessage() + ")";
            }
            log.warn("Error processing launch {}: {}", signature, detail, e);
            return LaunchOutcome.skipped(signature, LaunchOutcome.Status.FAILED, detail);
        }
    }
}
