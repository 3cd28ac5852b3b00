package org.polycore.tools.core;

import org.polycore.utils.param.ParamUtils;

/**
 * Identifies one allele copy: the index of its sample in the alignment and the copy index within the sample.
 */
public final class AlleleCopyId {
    private final int sampleIndex;
    private final int copyIndex;

    public AlleleCopyId(final int sampleIndex, final int copyIndex) {
        this.sampleIndex = (int) ParamUtils.isPositiveOrZero(sampleIndex, "negative sample index");
        this.copyIndex = (int) ParamUtils.isPositiveOrZero(copyIndex, "negative copy index");
    }

    public int getSampleIndex() {
        return sampleIndex;
    }

    public int getCopyIndex() {
        return copyIndex;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof AlleleCopyId)) return false;
        final AlleleCopyId other = (AlleleCopyId) o;
        return sampleIndex == other.sampleIndex && copyIndex == other.copyIndex;
    }

    @Override
    public int hashCode() {
        return 31 * sampleIndex + copyIndex;
    }

    @Override
    public String toString() {
        return sampleIndex + "#" + copyIndex;
    }
}
