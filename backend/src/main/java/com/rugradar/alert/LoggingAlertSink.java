package com.rugradar.alert;

import com.rugradar.domain.LaunchAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes alert reports to the application log: WARN for high-risk launches, INFO otherwise.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LoggingAlertSink implements AlertSink {

    private final AlertReportFormatter formatter;

    @Override
    public void publish(LaunchAlert alert) {
        String report = formatter.format(alert);
        if (alert.verdict().highRisk()) {
            log.warn("\n{}", report);
        } else {
            log.info("\n{}", report);
        }
    }
}
