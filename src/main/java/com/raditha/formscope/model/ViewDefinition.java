package com.raditha.formscope.model;

import java.util.List;

/**
 * A view of a form with its controls in document order.
 *
 * @param viewName View name
 * @param controls Controls in document order
 */
public record ViewDefinition(String viewName, List<ControlDefinition> controls) {

    public ViewDefinition {
        controls = controls == null ? List.of() : List.copyOf(controls);
    }
}
