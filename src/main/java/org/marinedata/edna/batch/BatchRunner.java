/**
 *
 */
package org.marinedata.edna.batch;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;
import org.marinedata.edna.match.SequenceMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object runs a batch of queries through a sequence matcher.  Each query is processed independently:  a query
 * that is empty or fails produces an error result, and the rest of the batch continues.  Queries without an ID
 * are named "seq_N", where N is the 1-based position in the batch.
 *
 * In parallel mode the queries are distributed over the common fork-join pool.  The results are always returned
 * in input order.
 *
 */
public class BatchRunner {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BatchRunner.class);
    /** error message for an empty query */
    public static final String EMPTY_ERROR = "Empty sequence";
    /** matcher to use */
    private final SequenceMatcher matcher;
    /** maximum matches per query */
    private final int topN;
    /** minimum score for a match */
    private final double minScore;
    /** TRUE to process queries in parallel */
    private boolean parallel;

    /**
     * Create a batch runner.
     *
     * @param matcher	sequence matcher to use
     * @param topN		maximum number of matches per query
     * @param minScore	minimum score for a match
     */
    public BatchRunner(SequenceMatcher matcher, int topN, double minScore) {
        MatchParameters.checkMatchLimits(minScore, topN);
        this.matcher = matcher;
        this.topN = topN;
        this.minScore = minScore;
        this.parallel = false;
    }

    /**
     * Create a batch runner using the limits in a parameter object.
     *
     * @param matcher	sequence matcher to use
     * @param parms		matching parameters
     */
    public BatchRunner(SequenceMatcher matcher, MatchParameters parms) {
        this(matcher, parms.getTopN(), parms.getMinScore());
    }

    /**
     * Specify whether or not queries should be processed in parallel.
     *
     * @param parallel	TRUE for parallel processing
     *
     * @return this object, for chaining
     */
    public BatchRunner setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    /**
     * Process a batch of queries.
     *
     * @param queries	list of queries to process
     *
     * @return the results of the batch
     */
    public BatchRun run(List<BatchQuery> queries) {
        final int n = queries.size();
        log.info("Processing batch of {} queries.", n);
        IntStream positions = IntStream.range(0, n);
        if (this.parallel)
            positions = positions.parallel();
        List<BatchResult> results = positions.mapToObj(i -> this.process(i, queries.get(i)))
                .collect(Collectors.toList());
        BatchRun retVal = new BatchRun(results);
        log.info("Batch complete: {}.", retVal.getSummary());
        return retVal;
    }

    /**
     * Process a single query.
     *
     * @param idx		0-based position of the query in the batch
     * @param query		query to process
     *
     * @return the result for the query
     */
    protected BatchResult process(int idx, BatchQuery query) {
        String id = query.getId();
        if (id == null || id.isBlank())
            id = "seq_" + (idx + 1);
        BatchResult retVal;
        String sequence = query.getSequence();
        if (sequence.isBlank()) {
            log.debug("Query {} is empty.", id);
            retVal = new BatchResult(id, query, EMPTY_ERROR);
        } else {
            try {
                List<ScoredMatch> matches = this.matcher.match(sequence, this.topN, this.minScore);
                log.debug("Query {} produced {} matches.", id, matches.size());
                retVal = new BatchResult(id, query, matches);
            } catch (RuntimeException e) {
                log.error("Error processing query {}.", id, e);
                retVal = new BatchResult(id, query, "Processing failed: " + e.getMessage());
            }
        }
        return retVal;
    }

}
