package org.polycore.tools.core.distance;

import java.util.OptionalLong;

/**
 * Source of the number of bytes the distance computation may use for its working buffers.
 */
public interface MemoryBudgetProvider {

    /**
     * @return the available bytes, or empty when no budget signal is available
     */
    OptionalLong getAvailableBytes();

    /**
     * A provider without a budget signal; the default chunk width applies.
     */
    static MemoryBudgetProvider absent() {
        return OptionalLong::empty;
    }
}
