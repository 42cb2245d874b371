package com.rugradar.ingestion.adapter.solana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rugradar.domain.LaunchEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the logsSubscribe request and classifies frames of the subscription socket.
 * Notification shape: {@code {"method":"logsNotification","params":{"result":{"value":{"signature","err","logs"}}}}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LogsNotificationParser {

    static final String NOTIFICATION_METHOD = "logsNotification";

    private final ObjectMapper objectMapper;

    public String subscribeRequest(String programAddress, String commitment) {
        var request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", 1);
        request.put("method", "logsSubscribe");
        var params = request.putArray("params");
        params.addObject().putArray("mentions").add(programAddress);
        params.addObject().put("commitment", commitment);
        return request.toString();
    }

    public LogStreamMessage parse(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparseable frame: {}", e.getOriginalMessage());
            return LogStreamMessage.ignored();
        }
        if (root == null || !root.isObject()) {
            return LogStreamMessage.ignored();
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            return LogStreamMessage.error(error.toString());
        }
        if (root.has("id") && root.path("result").isIntegralNumber()) {
            return LogStreamMessage.subscribed();
        }
        if (!NOTIFICATION_METHOD.equals(root.path("method").asText())) {
            return LogStreamMessage.ignored();
        }
        JsonNode value = root.path("params").path("result").path("value");
        String signature = value.path("signature").asText(null);
        if (signature == null || signature.isBlank()) {
            return LogStreamMessage.ignored();
        }
        if (!value.path("err").isNull() && !value.path("err").isMissingNode()) {
            return LogStreamMessage.ignored();
        }
        List<String> logs = new ArrayList<>();
        value.path("logs").forEach(line -> {
            if (line.isTextual()) {
                logs.add(line.asText());
            }
        });
        return LogStreamMessage.notification(new LaunchEvent(signature, logs));
    }
}
