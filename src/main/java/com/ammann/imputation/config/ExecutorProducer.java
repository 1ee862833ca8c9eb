/* (C)2026 */
package com.ammann.imputation.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs per-station sweep tasks.
 *
 * <p>Each submitted task owns one station. Transactions are cleared so every store write
 * inside a task runs in its own short transaction.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "imputation.sweep.max-async", defaultValue = "2")
    int maxAsync;

    @ConfigProperty(name = "imputation.sweep.max-queued", defaultValue = "64")
    int maxQueued;

    /**
     * Produces the named executor used by {@code ImputationSweepService}.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>imputation.sweep.max-async</li>
     *   <li>imputation.sweep.max-queued</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("imputation-sweep-executor")
    @ApplicationScoped
    public ManagedExecutor createSweepExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
