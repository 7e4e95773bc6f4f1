/**
 *
 */
package org.marinedata.edna.batch;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.marinedata.edna.match.ScoredMatch;

/**
 * This object contains the results of a batch run, in input order, along with the batch summary.
 *
 */
public class BatchRun implements Iterable<BatchResult> {

    // FIELDS
    /** list of results, in input order */
    private final List<BatchResult> results;
    /** batch summary */
    private final BatchSummary summary;

    /**
     * Create a batch run from its results.
     *
     * @param results	list of results, in input order
     */
    public BatchRun(List<BatchResult> results) {
        this.results = Collections.unmodifiableList(results);
        this.summary = new BatchSummary(results);
    }

    /**
     * @return the list of results, in input order
     */
    public List<BatchResult> getResults() {
        return this.results;
    }

    /**
     * @return the batch summary
     */
    public BatchSummary getSummary() {
        return this.summary;
    }

    /**
     * @return a map from query IDs to match lists, in input order; if an ID repeats, the last query wins
     */
    public Map<String, List<ScoredMatch>> asMap() {
        Map<String, List<ScoredMatch>> retVal = new LinkedHashMap<String, List<ScoredMatch>>(this.results.size() * 2);
        for (BatchResult result : this.results)
            retVal.put(result.getId(), result.getMatches());
        return retVal;
    }

    /**
     * @return the number of results
     */
    public int size() {
        return this.results.size();
    }

    @Override
    public Iterator<BatchResult> iterator() {
        return this.results.iterator();
    }

}
