package org.polycore.tools.core.distance;

import org.polycore.utils.param.ParamUtils;

import java.util.OptionalLong;

/**
 * A budget given explicitly, e.g. with {@code --memory-budget}.
 */
public final class FixedMemoryBudgetProvider implements MemoryBudgetProvider {
    private final long bytes;

    public FixedMemoryBudgetProvider(final long bytes) {
        this.bytes = ParamUtils.isPositiveOrZero(bytes, "memory budget must not be negative");
    }

    @Override
    public OptionalLong getAvailableBytes() {
        return OptionalLong.of(bytes);
    }

    @Override
    public String toString() {
        return "FixedMemoryBudgetProvider{" + bytes + " bytes}";
    }
}
