package com.metabolic.lumping.problem;

import java.util.Objects;

/**
 * Base type of everything that can be registered in an {@link OptimizationProblem}.
 * Each concrete subtype declares the naming prefix that makes its names unique
 * across element kinds built from the same reaction or metabolite.
 */
public abstract class ProblemElement {

    private final String id;

    protected ProblemElement(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * @return the prefix prepended to the id to form the element name
     */
    protected abstract String getPrefix();

    public String getId() {
        return id;
    }

    public String getName() {
        return getPrefix() + id;
    }

    @Override
    public String toString() {
        return getName();
    }
}
