package com.lbg.markets.surveillance.courier.service.deadletter;

import com.lbg.markets.surveillance.courier.exception.DeadLetterDeliveryException;
import com.lbg.markets.surveillance.courier.exception.ErrorKind;
import com.lbg.markets.surveillance.courier.exception.TransferException;
import com.lbg.markets.surveillance.courier.model.AttemptSnapshot;
import com.lbg.markets.surveillance.courier.model.DeadLetterEntry;
import com.lbg.markets.surveillance.courier.model.TransferEvent;
import com.lbg.markets.surveillance.courier.service.logging.StructuredLogger;
import com.lbg.markets.surveillance.courier.service.metrics.MetricsRecorder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Packages a permanently failed event with its attempt history and hands it to the sink.
 * Delivery is attempted once; a failure is reported to the caller and logged at FATAL.
 */
@ApplicationScoped
public class DeadLetterRouter {

    private final DeadLetterSink sink;
    private final MetricsRecorder metrics;
    private final StructuredLogger log;
    private final Clock clock;

    private final AtomicLong routedCount = new AtomicLong();

    @Inject
    public DeadLetterRouter(DeadLetterSink sink, MetricsRecorder metrics, StructuredLogger log, Clock clock) {
        this.sink = sink;
        this.metrics = metrics;
        this.log = log;
        this.clock = clock;
    }

    public DeadLetterEntry route(TransferEvent event, List<AttemptSnapshot> attemptHistory, Throwable finalError)
            throws DeadLetterDeliveryException {
        ErrorKind kind = finalError instanceof TransferException transferException
                ? transferException.getKind()
                : ErrorKind.UNCLASSIFIED;
        DeadLetterEntry entry = new DeadLetterEntry(event, attemptHistory, kind,
                finalError.getMessage(), clock.instant());

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("attempts", attemptHistory.size());
        fields.put("error_kind", kind.getWireName());
        fields.put("error_message", finalError.getMessage());

        try {
            sink.deliver(entry);
        } catch (DeadLetterDeliveryException e) {
            metrics.recordDeadLetterDeliveryFailure();
            log.fatal(event, "Dead-letter delivery failed; event left unacknowledged", fields, e);
            throw e;
        } catch (RuntimeException e) {
            metrics.recordDeadLetterDeliveryFailure();
            log.fatal(event, "Dead-letter delivery failed; event left unacknowledged", fields, e);
            throw new DeadLetterDeliveryException("Dead-letter sink rejected entry: " + e.getMessage(), e);
        }

        routedCount.incrementAndGet();
        metrics.recordDeadLettered(kind);
        log.error(event, "Routed to dead-letter queue", fields);
        return entry;
    }

    public long getRoutedCount() {
        return routedCount.get();
    }
}
