package org.polycore.tools.core;

import org.polycore.exceptions.PolyCoreException;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The partition of every allele copy of an alignment into groups of identical sequences, with the index from
 * (sample, copy) to group id. Sample indexes follow the order of {@link #getSamples()}.
 */
public final class CollapsedAlignment {
    private final List<Sample> samples;
    private final List<SequenceGroup> groups;
    private final int[][] groupIndex;
    private final int length;

    CollapsedAlignment(final List<Sample> samples, final List<SequenceGroup> groups, final int[][] groupIndex) {
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.groups = Collections.unmodifiableList(new ArrayList<>(groups));
        this.groupIndex = groupIndex;
        this.length = samples.isEmpty() ? 0 : samples.get(0).length();
        checkIndex();
    }

    private void checkIndex() {
        Utils.validate(groupIndex.length == samples.size(), "group index does not cover every sample");
        for (int s = 0; s < samples.size(); s++) {
            for (int copy = 0; copy < groupIndex[s].length; copy++) {
                final int groupId = groupIndex[s][copy];
                if (groupId < 0 || groupId >= groups.size()
                        || !groups.get(groupId).getMembers().contains(new AlleleCopyId(s, copy))) {
                    throw new PolyCoreException.CorruptGroupIndex(samples.get(s).getId(), copy, groupId);
                }
            }
        }
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public Sample getSample(final int sampleIndex) {
        return samples.get(Utils.validIndex(sampleIndex, samples.size()));
    }

    public int getNumberOfSamples() {
        return samples.size();
    }

    public List<SequenceGroup> getGroups() {
        return groups;
    }

    public SequenceGroup getGroup(final int groupId) {
        return groups.get(Utils.validIndex(groupId, groups.size()));
    }

    public int getNumberOfGroups() {
        return groups.size();
    }

    public int groupOf(final int sampleIndex, final int copyIndex) {
        return groupIndex[sampleIndex][copyIndex];
    }

    /**
     * Group ids of the copies of a sample, in copy order.
     */
    public int[] groupIdsOf(final int sampleIndex) {
        return groupIndex[Utils.validIndex(sampleIndex, samples.size())].clone();
    }

    public int getNumberOfCopies() {
        int copies = 0;
        for (final int[] sampleGroups : groupIndex) {
            copies += sampleGroups.length;
        }
        return copies;
    }

    /**
     * Number of alignment columns.
     */
    public int length() {
        return length;
    }

    /**
     * Symbol of a copy at a column, read from the representative of the copy's group.
     */
    public byte symbol(final int sampleIndex, final int copyIndex, final int column) {
        return groups.get(groupIndex[sampleIndex][copyIndex]).getRepresentative()[column];
    }

    /**
     * Allele rank of the representative of every group at a column (-1 where missing), read once per group.
     */
    public void fillGroupRanks(final int column, final int[] ranks) {
        Utils.validateArg(ranks.length >= groups.size(), "rank buffer is smaller than the number of groups");
        for (int g = 0; g < groups.size(); g++) {
            ranks[g] = groups.get(g).rankAt(column);
        }
    }

    /**
     * Allele rank of every copy of a sample at a column (-1 where missing).
     */
    public void fillCopyRanks(final int sampleIndex, final int column, final int[] ranks) {
        final int[] sampleGroups = groupIndex[sampleIndex];
        for (int copy = 0; copy < sampleGroups.length; copy++) {
            ranks[copy] = groups.get(sampleGroups[copy]).rankAt(column);
        }
    }
}
