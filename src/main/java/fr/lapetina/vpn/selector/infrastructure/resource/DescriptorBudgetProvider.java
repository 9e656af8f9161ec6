package fr.lapetina.vpn.selector.infrastructure.resource;

import java.util.Optional;

/**
 * Source of the current descriptor budget.
 */
@FunctionalInterface
public interface DescriptorBudgetProvider {

    /**
     * Reads the current budget.
     *
     * @return the budget, or empty if the platform offers no way to query it
     */
    Optional<DescriptorBudget> currentBudget();
}
