package com.raditha.formscope.extraction;

import com.raditha.formscope.model.ControlDefinition;
import com.raditha.formscope.model.ControlSignature;
import com.raditha.formscope.model.FormDefinition;
import com.raditha.formscope.model.ViewDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Extracts the ordered sequence of input controls from a form.
 * <p>
 * Containers, labels and anything inside a repeating section are skipped;
 * positions are zero-based and continue across views.
 */
public class ControlSequenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ControlSequenceExtractor.class);

    public static final String LABEL_TYPE = "Label";

    private static final Set<String> CONTAINER_TYPES = Set.of("Section", "RepeatingSection", "RepeatingTable");

    /**
     * Extract the control sequence of a form.
     *
     * @param form Form definition
     * @return Signatures in document order
     */
    public List<ControlSignature> extractSequence(FormDefinition form) {
        List<ControlSignature> sequence = new ArrayList<>();
        int position = 0;

        for (ViewDefinition view : form.views()) {
            for (ControlDefinition control : view.controls()) {
                if (control.mergedIntoParent() || !isEligible(control)) {
                    continue;
                }

                String label = control.displayLabel();
                sequence.add(new ControlSignature(
                        label,
                        control.type(),
                        control.name(),
                        position++,
                        LabelNormalizer.normalize(label)));
            }
        }

        return sequence;
    }

    /**
     * Count controls of a form that are excluded because they are repeating
     * content.
     */
    public int countRepeatingControls(FormDefinition form) {
        return (int) form.allControls().filter(ControlDefinition::isRepeating).count();
    }

    private boolean isEligible(ControlDefinition control) {
        if (control.type() != null && CONTAINER_TYPES.contains(control.type())) {
            return false;
        }

        // Only input controls
        if (LABEL_TYPE.equals(control.type())) {
            logger.debug("Skipping label control: '{}'", control.label());
            return false;
        }

        if (control.inRepeatingSection()) {
            logger.debug("Skipping control '{}' - inside repeating section '{}'",
                    control.displayLabel(), control.repeatingSectionName());
            return false;
        }

        if (ControlDefinition.REPEATING_SECTION_TYPE.equals(control.sectionType())) {
            logger.debug("Skipping control '{}' - section type is repeating", control.displayLabel());
            return false;
        }

        return true;
    }
}
