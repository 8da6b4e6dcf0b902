package com.example.ordersync.application.service;

import com.example.ordersync.application.dto.BatchSyncReport;
import com.example.ordersync.application.dto.BatchSyncReport.BatchItemFailure;
import com.example.ordersync.application.dto.OrderSyncMessage;
import com.example.ordersync.application.dto.SyncResult;
import com.example.ordersync.application.port.in.SyncOrderBatchUseCase;
import com.example.ordersync.application.port.in.SyncOrderUseCase;
import com.example.ordersync.application.port.out.SyncMetricsPort;
import com.example.ordersync.domain.exception.InvalidOrderEventException;
import com.example.ordersync.domain.model.IncomingOrderEvent;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Batch ingestion controller: runs the synchronization engine once per message and
 * reports the messages that failed transiently.
 *
 * <p>Messages are independent and run concurrently. Each is bounded by the
 * {@value #TIME_LIMITER_NAME} time limiter, the whole batch by {@code order-sync.batch.deadline-ms}.
 * A message that times out or has not finished at the deadline is reported for redelivery.
 * Unparsable messages and non-transient failures are logged and acknowledged.
 */
@Service
public class OrderSyncBatchService implements SyncOrderBatchUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderSyncBatchService.class);

    static final String TIME_LIMITER_NAME = "syncOrder";

    private final SyncOrderUseCase syncOrderUseCase;
    private final IncomingOrderEventParser parser;
    private final SyncMetricsPort metrics;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final long deadlineMs;

    public OrderSyncBatchService(
            SyncOrderUseCase syncOrderUseCase,
            IncomingOrderEventParser parser,
            SyncMetricsPort metrics,
            TimeLimiterRegistry timeLimiterRegistry,
            @Qualifier("orderSyncExecutor") ExecutorService executor,
            @Qualifier("orderSyncScheduler") ScheduledExecutorService scheduler,
            @Value("${order-sync.batch.deadline-ms:25000}") long deadlineMs) {
        this.syncOrderUseCase = syncOrderUseCase;
        this.parser = parser;
        this.metrics = metrics;
        this.timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER_NAME);
        this.executor = executor;
        this.scheduler = scheduler;
        this.deadlineMs = deadlineMs;
    }

    @Override
    public BatchSyncReport processBatch(List<OrderSyncMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return BatchSyncReport.empty();
        }
        long startedAt = System.nanoTime();
        log.info("[BATCH] start size={}", messages.size());

        List<CompletableFuture<MessageOutcome>> outcomes = messages.stream()
                .map(this::submit)
                .toList();

        awaitDeadline(outcomes);

        List<BatchItemFailure> failures = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            OrderSyncMessage message = messages.get(i);
            MessageOutcome outcome = outcomes.get(i).getNow(null);
            if (outcome == null) {
                outcomes.get(i).cancel(true);
                log.warn("[BATCH_DEADLINE] messageId={} did not finish within {}ms, reporting for redelivery",
                        message.messageId(), deadlineMs);
                metrics.syncFailed("DEADLINE_EXCEEDED", true);
                outcome = MessageOutcome.reportForRedelivery();
            }
            if (outcome.reported()) {
                failures.add(new BatchItemFailure(message.messageId()));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        metrics.batchCompleted(messages.size(), failures.size(), elapsed);
        log.info("[BATCH] done size={}, redeliver={}, elapsed={}ms",
                messages.size(), failures.size(), elapsed.toMillis());
        return new BatchSyncReport(failures);
    }

    private CompletableFuture<MessageOutcome> submit(OrderSyncMessage message) {
        IncomingOrderEvent event;
        try {
            event = parser.parse(message.body());
        } catch (InvalidOrderEventException e) {
            log.warn("[PARSE_FAILED] messageId={}, reason={}, message dropped", message.messageId(), e.getMessage());
            metrics.messageDropped("PARSE_FAILED");
            return CompletableFuture.completedFuture(MessageOutcome.acknowledge());
        }

        Supplier<CompletionStage<SyncResult>> sync =
                () -> CompletableFuture.supplyAsync(() -> syncOrderUseCase.syncOrder(event), executor);

        return timeLimiter.executeCompletionStage(scheduler, sync)
                .toCompletableFuture()
                .handle((result, error) -> error == null
                        ? MessageOutcome.acknowledge()
                        : classify(message, error));
    }

    private MessageOutcome classify(OrderSyncMessage message, Throwable error) {
        boolean transientFailure = SyncFailureClassifier.isTransient(error);
        String errorCode = SyncFailureClassifier.errorCode(error);
        Throwable cause = SyncFailureClassifier.unwrap(error);
        metrics.syncFailed(errorCode, transientFailure);

        if (cause instanceof TimeoutException) {
            log.warn("[TIMEOUT] messageId={}, sync exceeded time limit, reporting for redelivery",
                    message.messageId());
        } else if (transientFailure) {
            log.warn("[SYNC_FAILED] messageId={}, error={}, message={}, reporting for redelivery",
                    message.messageId(), errorCode, cause.getMessage());
        } else {
            log.error("[SYNC_REJECTED] messageId={}, error={}, message={}, message dropped",
                    message.messageId(), errorCode, cause.getMessage());
        }
        return transientFailure ? MessageOutcome.reportForRedelivery() : MessageOutcome.acknowledge();
    }

    private void awaitDeadline(List<CompletableFuture<MessageOutcome>> outcomes) {
        CompletableFuture<Void> all = CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]));
        try {
            all.get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[BATCH_DEADLINE] batch deadline of {}ms reached", deadlineMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[BATCH] interrupted while waiting for messages, unfinished ones will be redelivered");
        } catch (ExecutionException e) {
            log.error("[BATCH] unexpected failure while waiting for messages", e);
        }
    }

    private record MessageOutcome(boolean reported) {

        static MessageOutcome reportForRedelivery() {
            return new MessageOutcome(true);
        }

        static MessageOutcome acknowledge() {
            return new MessageOutcome(false);
        }
    }
}
