package com.raditha.formscope.clustering;

import com.raditha.formscope.similarity.ControlGroupSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges near-duplicate candidate groups.
 * <p>
 * Groups are visited from most to least frequent. Each unprocessed group
 * absorbs the forms of every other unprocessed group that is similar enough;
 * absorbed groups are dropped from the output.
 */
public class SimilarGroupMerger {
    private static final Logger logger = LoggerFactory.getLogger(SimilarGroupMerger.class);

    private final double similarityThreshold;
    private final ControlGroupSimilarity similarity;

    /**
     * Create merger with default 80% group and 70% label thresholds.
     */
    public SimilarGroupMerger() {
        this(0.8, new ControlGroupSimilarity());
    }

    /**
     * @param similarityThreshold Minimum similarity (0.0-1.0) for merging
     * @param similarity          Group similarity calculator
     */
    public SimilarGroupMerger(double similarityThreshold, ControlGroupSimilarity similarity) {
        this.similarityThreshold = similarityThreshold;
        this.similarity = similarity;
    }

    /**
     * Merge similar groups. Mutates the form sets of the surviving groups.
     *
     * @param groups Candidate groups in first-seen order
     * @return Surviving groups in processing order
     */
    public List<CandidateGroup> merge(List<CandidateGroup> groups) {
        // Stable sort: ties keep first-seen order
        List<CandidateGroup> ordered = groups.stream()
                .sorted(Comparator.comparingInt(CandidateGroup::occurrenceCount).reversed())
                .toList();

        List<CandidateGroup> merged = new ArrayList<>();
        Set<String> processed = new HashSet<>();

        for (CandidateGroup anchor : ordered) {
            if (processed.contains(anchor.groupId())) {
                continue;
            }

            List<CandidateGroup> similarGroups = new ArrayList<>();
            for (CandidateGroup other : ordered) {
                if (!processed.contains(other.groupId())
                        && !other.groupId().equals(anchor.groupId())
                        && other.size() == anchor.size()
                        && similarity.calculate(anchor.controls(), other.controls()) >= similarityThreshold) {
                    similarGroups.add(other);
                }
            }

            for (CandidateGroup similar : similarGroups) {
                anchor.absorb(similar);
                processed.add(similar.groupId());
                logger.debug("Merged '{}' into '{}'", similar.groupId(), anchor.groupId());
            }

            merged.add(anchor);
            processed.add(anchor.groupId());
        }

        return merged;
    }
}
