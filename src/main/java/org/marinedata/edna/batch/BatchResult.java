/**
 *
 */
package org.marinedata.edna.batch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.marinedata.edna.match.ScoredMatch;

/**
 * This object contains the result of matching a single batch query.  A query that could not be processed has an
 * error message and no matches.
 *
 */
public class BatchResult {

    // FIELDS
    /** query ID */
    private final String id;
    /** original query */
    private final BatchQuery query;
    /** list of matches, best first */
    private final List<ScoredMatch> matches;
    /** error message, or NULL if the query was processed */
    private final String error;

    /**
     * Create a result for a processed query.
     *
     * @param id		query ID
     * @param query		original query
     * @param matches	list of matches, best first
     */
    public BatchResult(String id, BatchQuery query, List<ScoredMatch> matches) {
        this.id = id;
        this.query = query;
        this.matches = Collections.unmodifiableList(matches);
        this.error = null;
    }

    /**
     * Create a result for a failed query.
     *
     * @param id		query ID
     * @param query		original query
     * @param error		error message
     */
    public BatchResult(String id, BatchQuery query, String error) {
        this.id = id;
        this.query = query;
        this.matches = Collections.emptyList();
        this.error = error;
    }

    /**
     * @return the query ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the query sequence
     */
    public String getSequence() {
        return this.query.getSequence();
    }

    /**
     * @return the sample metadata of the query
     */
    public Map<String, Object> getMetadata() {
        return this.query.getMetadata();
    }

    /**
     * @return the ID of the expected species, or NULL if there is no expectation
     */
    public String getExpectedSpecies() {
        return this.query.getExpectedSpecies();
    }

    /**
     * @return TRUE if the query has an expected species
     */
    public boolean hasExpectation() {
        return this.query.hasExpectation();
    }

    /**
     * @return the description of the query, or NULL if there is none
     */
    public String getDescription() {
        return this.query.getDescription();
    }

    /**
     * @return the list of matches, best first
     */
    public List<ScoredMatch> getMatches() {
        return this.matches;
    }

    /**
     * @return the best match, or NULL if there are no matches
     */
    public ScoredMatch getBestMatch() {
        return (this.matches.isEmpty() ? null : this.matches.get(0));
    }

    /**
     * @return the error message, or NULL if the query was processed
     */
    public String getError() {
        return this.error;
    }

    /**
     * @return TRUE if the query could not be processed
     */
    public boolean isError() {
        return (this.error != null);
    }

    /**
     * @return TRUE if the query was processed and produced at least one match
     */
    public boolean isSuccessful() {
        return (this.error == null && ! this.matches.isEmpty());
    }

    /**
     * @return TRUE if the query has an expectation and the best match satisfies it
     */
    public boolean isCorrect() {
        boolean retVal = false;
        if (this.query.hasExpectation()) {
            ScoredMatch best = this.getBestMatch();
            retVal = (best != null && best.getSpeciesId().equals(this.query.getExpectedSpecies()));
        }
        return retVal;
    }

}
