/**
 *
 */
package org.marinedata.edna;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;
import org.marinedata.edna.match.SequenceMatcher;
import org.marinedata.edna.match.SequenceValidator;
import org.marinedata.edna.reports.MatchReporter;
import org.marinedata.edna.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command identifies the species for a single eDNA sequence.  The positional parameters are the name of the
 * reference sequence file and the query sequence.  The query may contain only the bases A, C, G, T, and N (in
 * either case).  The report is written to the standard output.
 *
 * The command-line options are as follows.
 *
 * -h	display command usage
 * -v	display more detailed progress messages
 * -o	output file for the report (if not STDOUT)
 * -K	kmer size (default 5)
 * -t	type of reference file (TAB or FASTA, default TAB)
 * -m	minimum matching score (default 50.0)
 * -n	maximum number of matches to return (default 5, at most 20)
 *
 * --taxonomy	tab-delimited taxonomy file containing species metadata
 * --speciesCol	index (1-based) or name of the species ID column in a tabbed reference file
 * --seqCol		index (1-based) or name of the sequence column in a tabbed reference file
 * --format		report format (TABLE, HTML, or JSON; default TABLE)
 * --id			ID to give the query in the report (default "query")
 *
 */
public class IdentifyProcessor extends ReferenceIndexProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(IdentifyProcessor.class);
    /** matching parameters */
    private MatchParameters parms;
    /** normalized query sequence */
    private String query;
    /** maximum number of matches that can be requested */
    public static final int MAX_TOP = 20;

    // COMMAND-LINE OPTIONS

    /** minimum matching score */
    @Option(name = "-m", aliases = { "--min", "--minScore" }, metaVar = "70.0", usage = "minimum matching score")
    private double minScore;

    /** number of matches to return */
    @Option(name = "-n", aliases = { "--top" }, metaVar = "10", usage = "maximum number of matches to return")
    private int topN;

    /** report format */
    @Option(name = "--format", usage = "report format")
    private MatchReporter.Type format;

    /** query ID */
    @Option(name = "--id", metaVar = "sample1", usage = "ID for the query in the report")
    private String queryId;

    /** query sequence */
    @Argument(index = 1, metaVar = "ATGCGATCG...", usage = "query DNA sequence", required = true)
    private String sequence;

    @Override
    protected void setReporterDefaults() {
        this.initIndexParms();
        this.minScore = MatchParameters.DEFAULT_MIN_SCORE;
        this.topN = MatchParameters.DEFAULT_TOP_N;
        this.format = MatchReporter.Type.TABLE;
        this.queryId = "query";
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        this.validateIndexParms();
        this.parms = this.computeMatchParms(this.minScore, this.topN, MAX_TOP);
        this.query = SequenceValidator.validate(this.sequence);
        log.info("Query sequence has length {}.", this.query.length());
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReferenceIndex index = this.buildIndex();
        SequenceMatcher matcher = new SequenceMatcher(index);
        List<ScoredMatch> matches = matcher.match(this.query, this.parms);
        try (MatchReporter reporter = this.format.create(writer, this.parms)) {
            reporter.startQuery(this.queryId, this.query);
            for (ScoredMatch match : matches)
                reporter.recordMatch(match);
        }
        if (matches.isEmpty())
            log.info("No species matches found above {}% similarity threshold.", this.parms.getMinScore());
        else
            log.info("Found {} species matches.  Best is {}.", matches.size(), matches.get(0));
    }

}
