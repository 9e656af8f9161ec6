package fr.lapetina.vpn.selector.infrastructure.resource;

/**
 * Snapshot of the process's file-descriptor allowance.
 *
 * @param softLimit current soft limit on open descriptors
 * @param inUse     descriptors currently open
 */
public record DescriptorBudget(long softLimit, long inUse) {

    public long available() {
        return softLimit - inUse;
    }

    /**
     * True when the numbers cannot describe a real process.
     */
    public boolean isNonsensical() {
        return softLimit <= 0 || inUse < 0 || inUse > softLimit;
    }
}
