package com.rugradar.alert;

import com.rugradar.domain.ExplorerLinks;
import com.rugradar.domain.LaunchAlert;
import com.rugradar.domain.RiskVerdict;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a launch alert as a multi-line, human-readable report. Lists keep the verdict's order.
 */
@Component
public class AlertReportFormatter {

    static final String SAFER_LABEL = "SAFER TOKEN (always DYOR)";
    static final String HIGH_RISK_LABEL = "HIGH RISK - POSSIBLE RUG";
    static final String NO_GOOD_SIGNS = "none";
    static final String NO_RED_FLAGS = "None detected so far";

    private static final String RULE = "=".repeat(80);

    public String format(LaunchAlert alert) {
        RiskVerdict verdict = alert.verdict();
        ExplorerLinks links = alert.links();
        StringBuilder sb = new StringBuilder();
        sb.append("NEW PUMP.FUN LAUNCH\n");
        sb.append("Token mint:  ").append(verdict.mint()).append('\n');
        sb.append("Creator:     ").append(verdict.creator()).append('\n');
        sb.append("Transaction: ").append(links.transaction()).append('\n');
        sb.append("Pump.fun:    ").append(links.launchpad()).append('\n');
        sb.append("Dexscreener: ").append(links.chart()).append('\n');
        appendSection(sb, "GOOD SIGNS:", verdict.goodSigns(), NO_GOOD_SIGNS);
        appendSection(sb, "RED FLAGS:", verdict.redFlags(), NO_RED_FLAGS);
        sb.append(label(verdict)).append('\n');
        sb.append(RULE);
        return sb.toString();
    }

    public String label(RiskVerdict verdict) {
        return verdict.highRisk() ? HIGH_RISK_LABEL : SAFER_LABEL;
    }

    private static void appendSection(StringBuilder sb, String title, List<String> items, String emptyText) {
        sb.append(title).append('\n');
        if (items.isEmpty()) {
            sb.append("   ").append(emptyText).append('\n');
            return;
        }
        for (String item : items) {
            sb.append("   ").append(item).append('\n');
        }
    }
}
