package org.polycore.tools.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.polycore.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collapses identical allele-copy sequences into {@link SequenceGroup}s.
 *
 * <p>Copies are bucketed by the hash of their bytes and compared byte for byte against the representatives of the
 * bucket, so a hash collision never merges different sequences. Symbols are compared exactly, without any
 * normalization of gaps or ambiguity codes. Group ids are assigned in order of first encounter, so the same input
 * order always gives the same groups.</p>
 */
public final class SequenceCollapser {
    private static final Logger logger = LogManager.getLogger(SequenceCollapser.class);

    private SequenceCollapser() {}

    /**
     * @param samples every sample of the alignment, in the order that defines the sample indexes
     */
    public static CollapsedAlignment collapse(final List<Sample> samples) {
        Utils.nonNull(samples);
        final List<SequenceGroup> groups = new ArrayList<>();
        final Map<Integer, List<SequenceGroup>> buckets = new HashMap<>();
        final int[][] groupIndex = new int[samples.size()][];

        for (int s = 0; s < samples.size(); s++) {
            final Sample sample = samples.get(s);
            groupIndex[s] = new int[sample.getPloidyValue()];
            for (int copy = 0; copy < sample.getPloidyValue(); copy++) {
                final byte[] sequence = sample.getCopy(copy);
                final AlleleCopyId copyId = new AlleleCopyId(s, copy);
                final List<SequenceGroup> bucket = buckets.computeIfAbsent(Arrays.hashCode(sequence), k -> new ArrayList<>(1));
                SequenceGroup match = null;
                for (final SequenceGroup candidate : bucket) {
                    if (Arrays.equals(candidate.getRepresentative(), sequence)) {
                        match = candidate;
                        break;
                    }
                }
                if (match == null) {
                    match = new SequenceGroup(groups.size(), sequence, copyId);
                    groups.add(match);
                    bucket.add(match);
                } else {
                    match.addMember(copyId);
                }
                groupIndex[s][copy] = match.getId();
            }
        }

        for (final SequenceGroup group : groups) {
            if (group.size() > 1) {
                logger.info("Identical sequences will be treated as one: " + group.getMembers().stream()
                        .map(id -> describe(samples, id))
                        .collect(Collectors.joining(", ")));
            }
        }
        logger.info(String.format("Collapsed %d allele copies into %d distinct sequences",
                Arrays.stream(groupIndex).mapToInt(g -> g.length).sum(), groups.size()));
        return new CollapsedAlignment(samples, groups, groupIndex);
    }

    private static String describe(final List<Sample> samples, final AlleleCopyId id) {
        final Sample sample = samples.get(id.getSampleIndex());
        return sample.getPloidyValue() == 1 ? sample.getId() : sample.getId() + "#" + (id.getCopyIndex() + 1);
    }
}
