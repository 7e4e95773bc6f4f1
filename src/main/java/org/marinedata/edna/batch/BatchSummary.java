/**
 *
 */
package org.marinedata.edna.batch;

import java.util.Collection;

/**
 * This object contains the summary statistics for a batch:  the success tally and, for queries with an expected
 * species, the accuracy tally.  Percentages are 0 when their denominator is 0.
 *
 */
public class BatchSummary {

    // FIELDS
    /** number of queries */
    private final int total;
    /** number of queries with at least one match */
    private final int successful;
    /** number of queries with an expected species */
    private final int expected;
    /** number of queries whose best match was the expected species */
    private final int correct;

    /**
     * Compute the summary for a set of batch results.
     *
     * @param results	results to summarize
     */
    public BatchSummary(Collection<BatchResult> results) {
        int successCount = 0;
        int expectCount = 0;
        int correctCount = 0;
        for (BatchResult result : results) {
            if (result.isSuccessful())
                successCount++;
            if (result.hasExpectation()) {
                expectCount++;
                if (result.isCorrect())
                    correctCount++;
            }
        }
        this.total = results.size();
        this.successful = successCount;
        this.expected = expectCount;
        this.correct = correctCount;
    }

    /**
     * @return the number of queries
     */
    public int getTotal() {
        return this.total;
    }

    /**
     * @return the number of queries that produced at least one match
     */
    public int getSuccessful() {
        return this.successful;
    }

    /**
     * @return the number of queries that failed or produced no matches
     */
    public int getFailed() {
        return this.total - this.successful;
    }

    /**
     * @return the percent of queries that produced at least one match
     */
    public double getSuccessRate() {
        return (this.total == 0 ? 0.0 : this.successful * 100.0 / this.total);
    }

    /**
     * @return the number of queries with an expected species
     */
    public int getExpected() {
        return this.expected;
    }

    /**
     * @return the number of queries whose best match was the expected species
     */
    public int getCorrect() {
        return this.correct;
    }

    /**
     * @return the percent of queries with an expectation whose best match was the expected species
     */
    public double getAccuracy() {
        return (this.expected == 0 ? 0.0 : this.correct * 100.0 / this.expected);
    }

    /**
     * @return TRUE if any query had an expected species
     */
    public boolean hasAccuracy() {
        return (this.expected > 0);
    }

    @Override
    public String toString() {
        String retVal = String.format("%d sequences, %d successful (%4.1f%%)", this.total, this.successful,
                this.getSuccessRate());
        if (this.expected > 0)
            retVal += String.format(", accuracy %4.1f%% (%d/%d)", this.getAccuracy(), this.correct, this.expected);
        return retVal;
    }

}
