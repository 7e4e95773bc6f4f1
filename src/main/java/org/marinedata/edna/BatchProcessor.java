/**
 *
 */
package org.marinedata.edna;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.marinedata.edna.batch.BatchQuery;
import org.marinedata.edna.batch.BatchQueryFile;
import org.marinedata.edna.batch.BatchResult;
import org.marinedata.edna.batch.BatchRun;
import org.marinedata.edna.batch.BatchRunner;
import org.marinedata.edna.batch.BatchSummary;
import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;
import org.marinedata.edna.match.SequenceMatcher;
import org.marinedata.edna.reports.MatchReporter;
import org.marinedata.edna.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command identifies the species for a batch of eDNA sequences.  The positional parameters are the name of
 * the reference sequence file and the name of a JSON batch file.  The batch file contains an object with a
 * "sequences" array; each element has an "id", a "sequence", optional "metadata", and optionally the ID of the
 * species it is expected to match ("expected_match").  When expected matches are present, the accuracy of the
 * predictions is computed.
 *
 * The command-line options are as follows.
 *
 * -h	display command usage
 * -v	display more detailed progress messages
 * -o	output file for the report (if not STDOUT)
 * -K	kmer size (default 5)
 * -t	type of reference file (TAB or FASTA, default TAB)
 * -m	minimum matching score (default 50.0)
 * -n	maximum number of matches to return per query (default 3, at most 10)
 *
 * --taxonomy	tab-delimited taxonomy file containing species metadata
 * --speciesCol	index (1-based) or name of the species ID column in a tabbed reference file
 * --seqCol		index (1-based) or name of the sequence column in a tabbed reference file
 * --format		report format (TABLE, HTML, or JSON; default TABLE)
 * --para		process the queries in parallel
 * --maxBatch	maximum number of queries allowed in the batch (default 50)
 *
 */
public class BatchProcessor extends ReferenceIndexProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BatchProcessor.class);
    /** matching parameters */
    private MatchParameters parms;
    /** list of queries */
    private List<BatchQuery> queries;
    /** default number of matches per query */
    public static final int DEFAULT_TOP = 3;
    /** maximum number of matches that can be requested */
    public static final int MAX_TOP = 10;
    /** accuracy considered good */
    private static final double GOOD_ACCURACY = 80.0;

    // COMMAND-LINE OPTIONS

    /** minimum matching score */
    @Option(name = "-m", aliases = { "--min", "--minScore" }, metaVar = "70.0", usage = "minimum matching score")
    private double minScore;

    /** number of matches to return */
    @Option(name = "-n", aliases = { "--top" }, metaVar = "5", usage = "maximum number of matches to return per query")
    private int topN;

    /** report format */
    @Option(name = "--format", usage = "report format")
    private MatchReporter.Type format;

    /** TRUE for parallel processing */
    @Option(name = "--para", usage = "if specified, queries will be processed in parallel")
    private boolean paraMode;

    /** maximum batch size */
    @Option(name = "--maxBatch", metaVar = "100", usage = "maximum number of queries in a batch")
    private int maxBatch;

    /** batch file */
    @Argument(index = 1, metaVar = "batch.json", usage = "JSON batch file", required = true)
    private File batchFile;

    @Override
    protected void setReporterDefaults() {
        this.initIndexParms();
        this.minScore = MatchParameters.DEFAULT_MIN_SCORE;
        this.topN = DEFAULT_TOP;
        this.format = MatchReporter.Type.TABLE;
        this.paraMode = false;
        this.maxBatch = 50;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        this.validateIndexParms();
        this.parms = this.computeMatchParms(this.minScore, this.topN, MAX_TOP);
        if (this.maxBatch < 1)
            throw new ParseFailureException("Maximum batch size must be at least 1.");
        this.queries = BatchQueryFile.load(this.batchFile);
        if (this.queries.isEmpty())
            throw new ParseFailureException("At least one sequence is required in the batch.");
        if (this.queries.size() > this.maxBatch)
            throw new ParseFailureException("Maximum " + this.maxBatch + " sequences allowed per batch, but "
                    + this.queries.size() + " were found in " + this.batchFile + ".");
        log.info("{} queries loaded from {}.", this.queries.size(), this.batchFile);
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReferenceIndex index = this.buildIndex();
        SequenceMatcher matcher = new SequenceMatcher(index);
        BatchRunner runner = new BatchRunner(matcher, this.parms).setParallel(this.paraMode);
        BatchRun results = runner.run(this.queries);
        try (MatchReporter reporter = this.format.create(writer, this.parms)) {
            for (BatchResult result : results) {
                reporter.startQuery(result.getId(), result.getSequence());
                if (result.isError())
                    reporter.recordError(result.getError());
                for (ScoredMatch match : result.getMatches())
                    reporter.recordMatch(match);
                this.logPrediction(result);
            }
            reporter.recordSummary(results.getSummary());
        }
        BatchSummary summary = results.getSummary();
        log.info("Processed {} sequences with {} successful matches ({}% success rate).", summary.getTotal(),
                summary.getSuccessful(), String.format("%4.1f", summary.getSuccessRate()));
        if (summary.hasAccuracy()) {
            log.info("Accuracy: {}% ({}/{}).  Algorithm performance: {}.",
                    String.format("%4.1f", summary.getAccuracy()), summary.getCorrect(), summary.getExpected(),
                    (summary.getAccuracy() >= GOOD_ACCURACY ? "good" : "needs improvement"));
        }
    }

    /**
     * Log the best prediction for a query and whether or not it was correct.
     *
     * @param result	result of the query
     */
    private void logPrediction(BatchResult result) {
        ScoredMatch best = result.getBestMatch();
        if (best == null)
            log.debug("{}: no matches found.", result.getId());
        else
            log.debug("{}: best match {}.", result.getId(), best);
        if (result.hasExpectation() && ! result.isCorrect())
            log.info("{}: incorrect prediction, expected {}.", result.getId(), result.getExpectedSpecies());
    }

}
