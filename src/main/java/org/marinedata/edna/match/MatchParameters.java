/**
 *
 */
package org.marinedata.edna.match;

import org.marinedata.edna.index.ReferenceIndexBuilder;

/**
 * This object contains the tuning parameters for species matching:  the kmer size, the minimum score for a
 * match to be reported, and the maximum number of matches to report for each query.  The parameters are
 * validated when the object is constructed.
 *
 */
public class MatchParameters {

    // FIELDS
    /** default minimum score */
    public static final double DEFAULT_MIN_SCORE = 50.0;
    /** default number of matches to report */
    public static final int DEFAULT_TOP_N = 5;
    /** kmer size */
    private final int kmerSize;
    /** minimum score */
    private final double minScore;
    /** maximum matches per query */
    private final int topN;

    /**
     * Create a parameter object with the default values.
     */
    public MatchParameters() {
        this(ReferenceIndexBuilder.DEFAULT_KMER_SIZE, DEFAULT_MIN_SCORE, DEFAULT_TOP_N);
    }

    /**
     * Create a parameter object.
     *
     * @param kmerSize	kmer size (must be positive)
     * @param minScore	minimum reportable score (0 to 100)
     * @param topN		maximum number of matches per query (must be positive)
     */
    public MatchParameters(int kmerSize, double minScore, int topN) {
        if (kmerSize <= 0)
            throw new IllegalArgumentException("Kmer size must be positive, but " + kmerSize + " was specified.");
        checkMatchLimits(minScore, topN);
        this.kmerSize = kmerSize;
        this.minScore = minScore;
        this.topN = topN;
    }

    /**
     * Verify that a minimum score and a result limit are valid.
     *
     * @param minScore	minimum reportable score
     * @param topN		maximum number of matches per query
     */
    public static void checkMatchLimits(double minScore, int topN) {
        if (topN <= 0)
            throw new IllegalArgumentException("Number of matches to return must be positive, but " + topN
                    + " was specified.");
        if (! (minScore >= 0.0 && minScore <= 100.0))
            throw new IllegalArgumentException("Minimum score must be between 0 and 100, but " + minScore
                    + " was specified.");
    }

    /**
     * @return the kmer size
     */
    public int getKmerSize() {
        return this.kmerSize;
    }

    /**
     * @return the minimum reportable score
     */
    public double getMinScore() {
        return this.minScore;
    }

    /**
     * @return the maximum number of matches per query
     */
    public int getTopN() {
        return this.topN;
    }

    @Override
    public String toString() {
        return String.format("k=%d, minScore=%4.2f, top=%d", this.kmerSize, this.minScore, this.topN);
    }

}
