package com.rugradar.ingestion.adapter.solana;

import com.rugradar.common.RetryPolicy;
import com.rugradar.domain.LaunchEvent;
import com.rugradar.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * logsSubscribe over a Solana PubSub WebSocket. One socket per subscription; frames are classified by
 * {@link LogsNotificationParser}. After the first acknowledged subscription every drop (error, JSON-RPC error,
 * server close) is followed by a reconnect with exponential backoff; the backoff resets once events flow again.
 */
@Slf4j
public class WebSocketSolanaLogStream implements SolanaLogStream {

    private final WebSocketClient webSocketClient;
    private final URI endpoint;
    private final LogsNotificationParser parser;
    private final RetryPolicy reconnectPolicy;

    public WebSocketSolanaLogStream(WebSocketClient webSocketClient, URI endpoint,
                                    LogsNotificationParser parser, RetryPolicy reconnectPolicy) {
        this.webSocketClient = webSocketClient;
        this.endpoint = endpoint;
        this.parser = parser;
        this.reconnectPolicy = reconnectPolicy;
    }

    @Override
    public Flux<LaunchEvent> logsMentioning(String programAddress, String commitment) {
        AtomicBoolean established = new AtomicBoolean(false);
        return Flux.defer(() -> openSession(programAddress, commitment, established))
                .retryWhen(reconnectSpec(established));
    }

    private Flux<LaunchEvent> openSession(String programAddress, String commitment, AtomicBoolean established) {
        return Flux.create(sink -> {
            log.info("Opening log subscription on {} for program {} ({})", endpoint, programAddress, commitment);
            Disposable session = webSocketClient.execute(endpoint, ws -> {
                String request = parser.subscribeRequest(programAddress, commitment);
                return ws.send(Mono.just(ws.textMessage(request)))
                        .thenMany(ws.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(frame -> dispatch(parser.parse(frame), sink, established)))
                        .then();
            }).subscribe(
                    unused -> { },
                    e -> sink.error(new RpcException("Log subscription failed on " + endpoint + ": " + e.getMessage(), e)),
                    () -> sink.error(new RpcException("Log subscription closed by " + endpoint)));
            sink.onDispose(session);
        });
    }

    private void dispatch(LogStreamMessage message, FluxSink<LaunchEvent> sink, AtomicBoolean established) {
        switch (message.kind()) {
            case SUBSCRIBED -> {
                if (established.compareAndSet(false, true)) {
                    log.info("Log subscription established on {}", endpoint);
                } else {
                    log.info("Log subscription re-established on {}", endpoint);
                }
            }
            case NOTIFICATION -> sink.next(message.event());
            case ERROR -> sink.error(new RpcException("logsSubscribe error: " + message.error()));
            case IGNORED -> { }
        }
    }

    private Retry reconnectSpec(AtomicBoolean established) {
        return Retry.backoff(Long.MAX_VALUE, Duration.ofMillis(Math.max(1L, reconnectPolicy.getBaseDelayMs())))
                .maxBackoff(Duration.ofMillis(Math.max(1L, reconnectPolicy.getMaxDelayMs())))
                .jitter(reconnectPolicy.getJitterFactor())
                .transientErrors(true)
                .filter(e -> established.get())
                .doBeforeRetry(signal -> log.warn("Log subscription dropped ({}); reconnect attempt {}",
                        signal.failure().getMessage(), signal.totalRetriesInARow() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
