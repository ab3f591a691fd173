package com.lbg.markets.surveillance.courier.health;

import com.lbg.markets.surveillance.courier.dto.WorkerHealth;
import com.lbg.markets.surveillance.courier.service.TransferOrchestrator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness from the orchestrator health query. Down while degraded or shutting down.
 */
@ApplicationScoped
@Readiness
public class CourierReadinessCheck implements HealthCheck {

    private final TransferOrchestrator orchestrator;

    @Inject
    public CourierReadinessCheck(TransferOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named("courier-readiness");

        try {
            WorkerHealth health = orchestrator.healthSnapshot();
            boolean ready = health.isHealthy() && !orchestrator.isShutdownRequested();

            response.status(ready)
                    .withData("status", health.status())
                    .withData("processed_count", health.processedCount())
                    .withData("dlq_count", health.dlqCount())
                    .withData("success_rate", String.format("%.2f", health.successRate()))
                    .withData("in_flight", health.inFlight())
                    .withData("timestamp", health.timestamp().toString());
            if (orchestrator.isShutdownRequested()) {
                response.withData("reason", "Shutting down");
            }
            return response.build();

        } catch (RuntimeException e) {
            return response.down()
                    .withData("reason", "Health query failed")
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
