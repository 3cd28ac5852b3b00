package org.polycore.tools.core.distance;

import org.polycore.utils.param.ParamUtils;
import org.polycore.utils.runtime.RuntimeUtils;

import java.util.OptionalLong;

/**
 * The heap the JVM can still hand out, scaled down by a safety fraction.
 */
public final class RuntimeMemoryBudgetProvider implements MemoryBudgetProvider {
    private final double safetyFraction;

    /**
     * @param safetyFraction share of the free heap that may be used, in (0, 1]
     */
    public RuntimeMemoryBudgetProvider(final double safetyFraction) {
        ParamUtils.isPositive(safetyFraction, "memory safety fraction must be positive");
        this.safetyFraction = ParamUtils.inRange(safetyFraction, 0.0, 1.0, "memory safety fraction must be at most 1");
    }

    @Override
    public OptionalLong getAvailableBytes() {
        return OptionalLong.of((long) (RuntimeUtils.getAvailableHeapBytes() * safetyFraction));
    }
}
