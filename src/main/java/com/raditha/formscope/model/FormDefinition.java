package com.raditha.formscope.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * A parsed form definition: ordered views and the form's rules.
 *
 * @param name  Form name
 * @param views Views in order
 * @param rules Rules declared by the form
 */
public record FormDefinition(String name, List<ViewDefinition> views, List<FormRule> rules) {

    public FormDefinition {
        views = views == null ? List.of() : List.copyOf(views);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Create a form with a single view and no rules.
     */
    public static FormDefinition singleView(String name, List<ControlDefinition> controls) {
        return new FormDefinition(name, List.of(new ViewDefinition("View 1", controls)), List.of());
    }

    /**
     * Top-level controls of all views, in view order.
     */
    public Stream<ControlDefinition> allControls() {
        return views.stream().flatMap(v -> v.controls().stream());
    }
}
