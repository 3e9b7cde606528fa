package com.raditha.formscope.clustering;

import com.raditha.formscope.model.ControlSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finds control sequences shared by several forms using a sliding window.
 * Every window of every size between the minimum and maximum is keyed by its
 * control signatures; windows with the same key in different forms are the
 * same candidate group.
 */
public class CandidateGroupMiner {
    private static final Logger logger = LoggerFactory.getLogger(CandidateGroupMiner.class);

    private final int minGroupSize;
    private final int maxGroupSize;
    private final int minOccurrences;

    /**
     * @param minGroupSize   Smallest window
     * @param maxGroupSize   Largest window
     * @param minOccurrences Minimum number of forms a group must appear in
     */
    public CandidateGroupMiner(int minGroupSize, int maxGroupSize, int minOccurrences) {
        if (minGroupSize < 1) {
            throw new IllegalArgumentException("Minimum group size must be at least 1");
        }
        if (maxGroupSize < minGroupSize) {
            throw new IllegalArgumentException("Maximum group size must be >= minimum group size");
        }
        this.minGroupSize = minGroupSize;
        this.maxGroupSize = maxGroupSize;
        this.minOccurrences = minOccurrences;
    }

    /**
     * Mine candidate groups.
     *
     * @param formSequences Control sequence per form identifier, in the order
     *                      forms should be scanned
     * @return Groups found in at least {@code minOccurrences} forms, in
     *         first-seen order
     */
    public List<CandidateGroup> mine(Map<String, List<ControlSignature>> formSequences) {
        Map<String, CandidateGroup> groups = new LinkedHashMap<>();

        for (Map.Entry<String, List<ControlSignature>> form : formSequences.entrySet()) {
            List<ControlSignature> sequence = form.getValue();

            for (int size = minGroupSize; size <= maxGroupSize; size++) {
                for (int start = 0; start <= sequence.size() - size; start++) {
                    List<ControlSignature> window = sequence.subList(start, start + size);
                    String groupKey = generateGroupKey(window);

                    groups.computeIfAbsent(groupKey, k -> new CandidateGroup(k, window))
                            .addForm(form.getKey());
                }
            }
        }

        List<CandidateGroup> frequent = groups.values().stream()
                .filter(g -> g.occurrenceCount() >= minOccurrences)
                .toList();

        logger.debug("Mined {} candidate groups, {} found in at least {} forms",
                groups.size(), frequent.size(), minOccurrences);
        return frequent;
    }

    /**
     * Key of a control sequence: {@code Type_LABEL} parts joined by {@code |}.
     */
    public static String generateGroupKey(List<ControlSignature> controls) {
        return controls.stream()
                .map(c -> c.key().toGroupKeyPart())
                .collect(Collectors.joining("|"));
    }
}
