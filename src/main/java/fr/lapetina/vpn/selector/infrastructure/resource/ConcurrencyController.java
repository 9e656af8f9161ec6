package fr.lapetina.vpn.selector.infrastructure.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides how many evaluation workers may run at once.
 *
 * Each worker holds at least a probe socket plus bookkeeping, so the pool is capped at
 * {@code (softLimit - inUse) / descriptorsPerWorker}. The result never exceeds the number of
 * candidates and is at least 1.
 */
public final class ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyController.class);

    private final DescriptorBudgetProvider budgetProvider;
    private final int descriptorsPerWorker;
    private final int fallbackParallelism;
    private final int maxParallelism;

    /**
     * @param budgetProvider       source of the descriptor budget
     * @param descriptorsPerWorker descriptors reserved per worker
     * @param fallbackParallelism  width used when the platform cannot report a budget
     * @param maxParallelism       hard upper bound, 0 for none
     */
    public ConcurrencyController(
            DescriptorBudgetProvider budgetProvider,
            int descriptorsPerWorker,
            int fallbackParallelism,
            int maxParallelism
    ) {
        if (descriptorsPerWorker < 1) {
            throw new IllegalArgumentException("descriptorsPerWorker must be at least 1: " + descriptorsPerWorker);
        }
        if (fallbackParallelism < 1) {
            throw new IllegalArgumentException("fallbackParallelism must be at least 1: " + fallbackParallelism);
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("maxParallelism must not be negative: " + maxParallelism);
        }
        this.budgetProvider = budgetProvider;
        this.descriptorsPerWorker = descriptorsPerWorker;
        this.fallbackParallelism = fallbackParallelism;
        this.maxParallelism = maxParallelism;
    }

    public ConcurrencyController(DescriptorBudgetProvider budgetProvider) {
        this(budgetProvider, 2, 16, 0);
    }

    /**
     * Computes the worker count for a run over {@code candidateCount} candidates.
     *
     * @throws IllegalArgumentException if {@code candidateCount < 1}
     * @throws ResourceBudgetException  if the budget query fails or reports impossible values
     */
    public int degreeOfParallelism(int candidateCount) {
        if (candidateCount < 1) {
            throw new IllegalArgumentException("candidateCount must be at least 1: " + candidateCount);
        }

        long ceiling = workerCeiling();
        if (maxParallelism > 0) {
            ceiling = Math.min(ceiling, maxParallelism);
        }
        int parallelism = (int) Math.max(1, Math.min(candidateCount, ceiling));

        log.debug("Parallelism computed: candidates={}, ceiling={}, parallelism={}",
                candidateCount, ceiling, parallelism);
        return parallelism;
    }

    /**
     * Largest worker count the current descriptor budget allows.
     */
    long workerCeiling() {
        Optional<DescriptorBudget> budget;
        try {
            budget = budgetProvider.currentBudget();
        } catch (RuntimeException e) {
            throw new ResourceBudgetException("Failed to query file descriptor budget", e);
        }

        if (budget.isEmpty()) {
            log.warn("File descriptor budget unavailable on this platform, using fallback parallelism: {}",
                    fallbackParallelism);
            return fallbackParallelism;
        }

        DescriptorBudget value = budget.get();
        if (value.isNonsensical()) {
            throw new ResourceBudgetException("Nonsensical file descriptor budget: softLimit="
                    + value.softLimit() + ", inUse=" + value.inUse());
        }
        return value.available() / descriptorsPerWorker;
    }
}
