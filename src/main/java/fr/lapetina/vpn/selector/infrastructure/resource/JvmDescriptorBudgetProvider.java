package fr.lapetina.vpn.selector.infrastructure.resource;

import com.sun.management.UnixOperatingSystemMXBean;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.Optional;

/**
 * Reads the descriptor budget from the platform MXBean.
 *
 * On Unix the bean reports the soft {@code RLIMIT_NOFILE} and the number of descriptors
 * this JVM holds. Other platforms expose neither and yield an empty budget.
 */
public final class JvmDescriptorBudgetProvider implements DescriptorBudgetProvider {

    private final OperatingSystemMXBean osBean;

    public JvmDescriptorBudgetProvider() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    JvmDescriptorBudgetProvider(OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    @Override
    public Optional<DescriptorBudget> currentBudget() {
        if (!(osBean instanceof UnixOperatingSystemMXBean)) {
            return Optional.empty();
        }
        UnixOperatingSystemMXBean unix = (UnixOperatingSystemMXBean) osBean;
        return Optional.of(new DescriptorBudget(
                unix.getMaxFileDescriptorCount(),
                unix.getOpenFileDescriptorCount()));
    }
}
