/**
 *
 */
package org.marinedata.edna.match;

/**
 * This enum describes the confidence levels for a species match.  Each level has a minimum score; a score
 * belongs to the highest level whose minimum it reaches.
 *
 */
public enum ConfidenceLevel {
    HIGH("high", 85.0),
    MEDIUM("medium", 70.0),
    LOW("low", 50.0),
    VERY_LOW("very_low", Double.NEGATIVE_INFINITY);

    /** external label */
    private final String label;
    /** minimum score for this level */
    private final double minScore;

    private ConfidenceLevel(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    /**
     * @return the confidence level for a matching score
     *
     * @param score		matching score (0 to 100)
     */
    public static ConfidenceLevel classify(double score) {
        ConfidenceLevel retVal;
        if (score >= HIGH.minScore)
            retVal = HIGH;
        else if (score >= MEDIUM.minScore)
            retVal = MEDIUM;
        else if (score >= LOW.minScore)
            retVal = LOW;
        else
            retVal = VERY_LOW;
        return retVal;
    }

    /**
     * @return the external label for this level
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the minimum score for this level
     */
    public double getMinScore() {
        return this.minScore;
    }

    @Override
    public String toString() {
        return this.label;
    }

}
