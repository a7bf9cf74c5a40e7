package com.dcruver.notegraph.graph;

import java.util.List;

/**
 * Raised when an assembled graph breaks a structural invariant, such as a relationship
 * pointing at a node that does not exist. This is a defect in resolution or assembly,
 * not in the notes, so the whole run fails.
 */
public class GraphConsistencyException extends RuntimeException {

    private static final int SHOWN = 5;

    private final List<String> violations;

    public GraphConsistencyException(List<String> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String describe(List<String> violations) {
        StringBuilder sb = new StringBuilder();
        sb.append(violations.size()).append(" consistency violation(s): ");
        sb.append(String.join("; ", violations.subList(0, Math.min(SHOWN, violations.size()))));
        if (violations.size() > SHOWN) {
            sb.append("; ...");
        }
        return sb.toString();
    }
}
