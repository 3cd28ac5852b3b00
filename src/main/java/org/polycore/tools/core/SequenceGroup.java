package org.polycore.tools.core;

import org.polycore.utils.Nucleotide;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * A set of allele copies whose sequences are byte-identical, represented by the first of them in input order.
 */
public final class SequenceGroup {
    private final int id;
    private final byte[] representative;
    private final BitSet missingMask;
    private final List<AlleleCopyId> members = new ArrayList<>();

    SequenceGroup(final int id, final byte[] representative, final AlleleCopyId first) {
        this.id = id;
        this.representative = Utils.nonNull(representative);
        this.missingMask = new BitSet(representative.length);
        for (int column = 0; column < representative.length; column++) {
            if (!Nucleotide.isCallable(representative[column])) {
                missingMask.set(column);
            }
        }
        members.add(Utils.nonNull(first));
    }

    void addMember(final AlleleCopyId copyId) {
        members.add(Utils.nonNull(copyId));
    }

    public int getId() {
        return id;
    }

    /**
     * The sequence shared by every member. Must not be modified.
     */
    public byte[] getRepresentative() {
        return representative;
    }

    /**
     * Columns at which the representative holds no callable base.
     */
    public BitSet getMissingMask() {
        return (BitSet) missingMask.clone();
    }

    public boolean isMissing(final int column) {
        return missingMask.get(column);
    }

    public int getMissingCount() {
        return missingMask.cardinality();
    }

    /**
     * Allele rank of the representative at the column, -1 when it is missing there.
     */
    public int rankAt(final int column) {
        return missingMask.get(column) ? -1 : Nucleotide.rank(representative[column]);
    }

    public List<AlleleCopyId> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "group " + id + " " + members;
    }
}
