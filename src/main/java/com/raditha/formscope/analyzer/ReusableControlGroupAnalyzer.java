package com.raditha.formscope.analyzer;

import com.raditha.formscope.clustering.CandidateGroup;
import com.raditha.formscope.clustering.CandidateGroupMiner;
import com.raditha.formscope.clustering.GroupNameGenerator;
import com.raditha.formscope.clustering.SimilarGroupMerger;
import com.raditha.formscope.config.MiningConfig;
import com.raditha.formscope.extraction.ControlSequenceExtractor;
import com.raditha.formscope.extraction.RepeatingSectionInventory;
import com.raditha.formscope.model.AnalysisResult;
import com.raditha.formscope.model.ControlGroup;
import com.raditha.formscope.model.ControlKey;
import com.raditha.formscope.model.ControlSignature;
import com.raditha.formscope.model.FormDefinition;
import com.raditha.formscope.model.RepeatingSectionInfo;
import com.raditha.formscope.similarity.ControlGroupSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Main orchestrator for reusable control group mining.
 * Coordinates sequence extraction, candidate mining, merging, naming and
 * result aggregation. Stateless between calls.
 */
public class ReusableControlGroupAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ReusableControlGroupAnalyzer.class);

    private final MiningConfig config;
    private final ControlSequenceExtractor extractor;
    private final RepeatingSectionInventory inventory;
    private final GroupNameGenerator nameGenerator;
    private final ControlFrequencyCalculator frequencyCalculator;
    private final PatternSummarizer patternSummarizer;

    /**
     * Create analyzer with default configuration.
     */
    public ReusableControlGroupAnalyzer() {
        this(MiningConfig.defaults());
    }

    /**
     * Create analyzer with custom configuration.
     */
    public ReusableControlGroupAnalyzer(MiningConfig config) {
        this.config = config;
        this.extractor = new ControlSequenceExtractor();
        this.inventory = new RepeatingSectionInventory();
        this.nameGenerator = new GroupNameGenerator();
        this.frequencyCalculator = new ControlFrequencyCalculator();
        this.patternSummarizer = new PatternSummarizer();
    }

    public MiningConfig getConfig() {
        return config;
    }

    /**
     * Mine a corpus using the configured bounds.
     *
     * @param formDefinitions Forms keyed by identifier
     * @return Mining result
     */
    public AnalysisResult analyzeForReusableGroups(Map<String, FormDefinition> formDefinitions) {
        return analyzeForReusableGroups(formDefinitions,
                config.minOccurrences(), config.minGroupSize(), config.maxGroupSize());
    }

    /**
     * Mine a corpus for control sequences that recur across forms.
     * <p>
     * Bounds are not validated: occurrence and size minimums below 1 count
     * as 1, and a minimum size above the maximum finds no groups.
     *
     * @param formDefinitions Forms keyed by identifier
     * @param minOccurrences  Minimum number of forms a group must appear in
     * @param minGroupSize    Smallest group
     * @param maxGroupSize    Largest group
     * @return Ranked, named groups with frequency and pattern statistics
     */
    public AnalysisResult analyzeForReusableGroups(Map<String, FormDefinition> formDefinitions,
            int minOccurrences, int minGroupSize, int maxGroupSize) {
        int occurrences = Math.max(1, minOccurrences);
        int smallest = Math.max(1, minGroupSize);

        // Ascending id order keeps results independent of the caller's map
        Map<String, FormDefinition> forms = new TreeMap<>(formDefinitions);

        // Step 1: Repeating section inventory (descriptive only)
        List<RepeatingSectionInfo> repeatingSections = new ArrayList<>();
        int controlsInRepeatingSections = 0;
        for (Map.Entry<String, FormDefinition> form : forms.entrySet()) {
            repeatingSections.addAll(inventory.describe(form.getKey(), form.getValue()));
            controlsInRepeatingSections += extractor.countRepeatingControls(form.getValue());
        }

        // Step 2: Extract control sequences
        Map<String, List<ControlSignature>> sequences = new LinkedHashMap<>();
        int totalControls = 0;
        for (Map.Entry<String, FormDefinition> form : forms.entrySet()) {
            List<ControlSignature> sequence = extractor.extractSequence(form.getValue());
            sequences.put(form.getKey(), sequence);
            totalControls += sequence.size();
        }

        // Step 3: Mine candidate groups
        List<CandidateGroup> candidates = List.of();
        if (smallest <= maxGroupSize) {
            candidates = new CandidateGroupMiner(smallest, maxGroupSize, occurrences).mine(sequences);
        } else {
            logger.debug("Minimum group size {} exceeds maximum {}, no windows to scan", smallest, maxGroupSize);
        }

        // Step 4: Merge near-duplicates
        SimilarGroupMerger merger = new SimilarGroupMerger(
                config.groupSimilarityThreshold(),
                new ControlGroupSimilarity(config.labelSimilarityThreshold()));
        List<CandidateGroup> merged = merger.merge(candidates);

        // Step 5: Rank and name
        List<ControlGroup> groups = merged.stream()
                .sorted(Comparator.comparingInt(CandidateGroup::occurrenceCount).reversed()
                        .thenComparing(Comparator.comparingInt(CandidateGroup::size).reversed()))
                .map(g -> g.toControlGroup(nameGenerator.generateName(g.groupId(), g.controls())))
                .toList();

        // Step 6: Frequency table
        Map<ControlKey, Integer> frequency = frequencyCalculator.calculate(sequences.values());

        // Step 7: Pattern summary
        List<String> patterns = patternSummarizer.summarize(groups);

        logger.info("Analyzed {} forms ({} controls): {} candidate groups, {} after merging",
                forms.size(), totalControls, candidates.size(), groups.size());

        return new AnalysisResult(
                groups,
                frequency,
                forms.size(),
                totalControls,
                controlsInRepeatingSections,
                patterns,
                repeatingSections);
    }
}
