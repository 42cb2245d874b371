package com.rugradar.alert;

import com.rugradar.domain.LaunchAlert;

/**
 * Destination for evaluated launches.
 */
public interface AlertSink {

    void publish(LaunchAlert alert);
}
