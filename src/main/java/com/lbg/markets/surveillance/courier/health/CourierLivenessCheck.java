package com.lbg.markets.surveillance.courier.health;

import com.lbg.markets.surveillance.courier.service.TransferWorker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness of the dispatcher thread.
 */
@ApplicationScoped
@Liveness
public class CourierLivenessCheck implements HealthCheck {

    private final TransferWorker worker;

    @Inject
    public CourierLivenessCheck(TransferWorker worker) {
        this.worker = worker;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("courier-worker")
                .status(worker.isAlive())
                .withData("node", worker.getNodeName())
                .withData("enabled", worker.isEnabled())
                .withData("running", worker.isRunning())
                .build();
    }
}
