package org.polycore.tools.core;

/**
 * One step of the progressive core: after admitting {@code k} samples, the last of them {@code sampleId},
 * a fraction {@code coreFraction} of the alignment columns is still core.
 */
public final class CoreTrajectoryPoint {
    private final int k;
    private final String sampleId;
    private final double coreFraction;
    private final int coreSites;

    public CoreTrajectoryPoint(final int k, final String sampleId, final double coreFraction, final int coreSites) {
        this.k = k;
        this.sampleId = sampleId;
        this.coreFraction = coreFraction;
        this.coreSites = coreSites;
    }

    public int getK() {
        return k;
    }

    public String getSampleId() {
        return sampleId;
    }

    public double getCoreFraction() {
        return coreFraction;
    }

    public int getCoreSites() {
        return coreSites;
    }

    @Override
    public String toString() {
        return k + "\t" + sampleId + "\t" + coreFraction;
    }
}
