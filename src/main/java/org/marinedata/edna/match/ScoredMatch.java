/**
 *
 */
package org.marinedata.edna.match;

import org.marinedata.edna.index.SpeciesMetadata;

/**
 * This object describes a single species match for a query sequence.
 *
 */
public class ScoredMatch {

    // FIELDS
    /** metadata of the matching species */
    private final SpeciesMetadata species;
    /** matching score (0 to 100) */
    private final double score;
    /** confidence level of the match */
    private final ConfidenceLevel confidence;
    /** length of the query sequence as supplied */
    private final int queryLength;
    /** number of distinct kmers in the query */
    private final int queryKmerCount;

    /**
     * Create a species match.
     *
     * @param species			metadata for the matching species
     * @param score				matching score
     * @param queryLength		length of the query sequence
     * @param queryKmerCount	number of distinct kmers in the query
     */
    public ScoredMatch(SpeciesMetadata species, double score, int queryLength, int queryKmerCount) {
        this.species = species;
        this.score = score;
        this.confidence = ConfidenceLevel.classify(score);
        this.queryLength = queryLength;
        this.queryKmerCount = queryKmerCount;
    }

    /**
     * @return the ID of the matching species
     */
    public String getSpeciesId() {
        return this.species.getSpeciesId();
    }

    /**
     * @return the scientific name of the matching species
     */
    public String getScientificName() {
        return this.species.getScientificName();
    }

    /**
     * @return the common name of the matching species
     */
    public String getCommonName() {
        return this.species.getCommonName();
    }

    /**
     * @return the phylum of the matching species
     */
    public String getPhylum() {
        return this.species.getPhylum();
    }

    /**
     * @return the full metadata of the matching species
     */
    public SpeciesMetadata getSpecies() {
        return this.species;
    }

    /**
     * @return the matching score
     */
    public double getScore() {
        return this.score;
    }

    /**
     * @return the confidence level
     */
    public ConfidenceLevel getConfidence() {
        return this.confidence;
    }

    /**
     * @return the length of the query sequence
     */
    public int getQueryLength() {
        return this.queryLength;
    }

    /**
     * @return the number of distinct kmers in the query
     */
    public int getQueryKmerCount() {
        return this.queryKmerCount;
    }

    @Override
    public String toString() {
        return String.format("%s (%s) %4.2f %s", this.getSpeciesId(), this.getCommonName(), this.score,
                this.confidence);
    }

}
