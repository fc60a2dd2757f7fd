package io.chaosgrade.api.scorecard;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Letter grade for a resilience score.
 */
public enum Grade {

    A("A"),
    B("B"),
    C("C"),
    D("D"),
    F("F"),

    /**
     * No log was analyzed.
     */
    NOT_AVAILABLE("N/A");

    private final String label;

    Grade(String label) {
        this.label = label;
    }

    /**
     * Map a rounded resilience score to a grade: 90 and above is A, then
     * 10-point bands down to D at 60; anything lower is F.
     */
    public static Grade fromScore(double score) {
        if (score >= 90) {
            return A;
        } else if (score >= 80) {
            return B;
        } else if (score >= 70) {
            return C;
        } else if (score >= 60) {
            return D;
        }
        return F;
    }

    /**
     * @return true for D and F
     */
    public boolean isFailing() {
        return this == D || this == F;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
