/**
 *
 */
package org.marinedata.edna.reports;

import java.io.PrintWriter;

import org.apache.commons.lang3.StringUtils;
import org.marinedata.edna.batch.BatchSummary;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;

/**
 * This is the base class for reports about species matches.  The report is organized into sections, one per
 * query sequence.  Each section is started by {@link #startQuery}, and then each match or error for the query
 * is recorded.  For batches, a summary can be recorded before the report is closed.
 *
 */
public abstract class MatchReporter implements AutoCloseable {

    // FIELDS
    /** matching parameters for the report */
    private MatchParameters parms;
    /** ID of the current query */
    private String queryId;
    /** current query sequence */
    private String sequence;
    /** number of matches recorded for the current query */
    private int matchCount;
    /** TRUE if an error was recorded for the current query */
    private boolean queryFailed;
    /** output stream for the report */
    private PrintWriter writer;
    /** number of sequence characters to show in a query preview */
    public static final int PREVIEW_LEN = 50;

    /**
     * Enumeration for type of report.
     */
    public enum Type {
        /** tab-delimited report, one line per match */
        TABLE {
            @Override
            public MatchReporter create(PrintWriter writer, MatchParameters parms) {
                return new MatchTableReporter(writer, parms);
            }
        },
        /** web page with a table per query */
        HTML {
            @Override
            public MatchReporter create(PrintWriter writer, MatchParameters parms) {
                return new MatchHtmlReporter(writer, parms);
            }
        },
        /** JSON document */
        JSON {
            @Override
            public MatchReporter create(PrintWriter writer, MatchParameters parms) {
                return new MatchJsonReporter(writer, parms);
            }
        };

        /**
         * Create a match reporter of this type.
         *
         * @param writer	output writer for the report
         * @param parms		matching parameters used
         *
         * @return the reporter
         */
        public abstract MatchReporter create(PrintWriter writer, MatchParameters parms);
    }

    /**
     * Construct a blank report.
     *
     * @param writer	output writer for the report
     * @param parms		matching parameters used
     */
    protected MatchReporter(PrintWriter writer, MatchParameters parms) {
        this.writer = writer;
        this.parms = parms;
        // Denote we don't have a query yet.
        this.queryId = null;
        // Start the report.
        this.openReport();
    }

    /**
     * Begin the report.
     */
    protected abstract void openReport();

    /**
     * Specify the current query for this section of the report.
     *
     * @param queryId	ID of the query
     * @param sequence	query sequence
     */
    public void startQuery(String queryId, String sequence) {
        // Clean up the old query (if any).
        if (this.queryId != null)
            this.closeQuery();
        this.queryId = queryId;
        this.sequence = sequence;
        this.matchCount = 0;
        this.queryFailed = false;
        this.openQuery();
    }

    /**
     * Begin reporting on a new query.
     */
    protected abstract void openQuery();

    /**
     * Record a match for the current query.
     *
     * @param match		species match to record
     */
    public void recordMatch(ScoredMatch match) {
        this.matchCount++;
        this.processMatch(match);
    }

    /**
     * Process a species match.
     *
     * @param match		species match to process
     */
    protected abstract void processMatch(ScoredMatch match);

    /**
     * Record an error for the current query.
     *
     * @param message	error message
     */
    public void recordError(String message) {
        this.queryFailed = true;
        this.processError(message);
    }

    /**
     * Process an error for the current query.
     *
     * @param message	error message
     */
    protected abstract void processError(String message);

    /**
     * Finish reporting of the current query.
     */
    protected void closeQuery() {
        this.finishQuery();
        this.queryId = null;
    }

    /**
     * Finish the current query section.
     */
    protected abstract void finishQuery();

    /**
     * Record the summary of a batch.  This must be called after the last query.
     *
     * @param summary	batch summary
     */
    public void recordSummary(BatchSummary summary) {
        if (this.queryId != null)
            this.closeQuery();
        this.processSummary(summary);
    }

    /**
     * Process the summary of a batch.
     *
     * @param summary	batch summary
     */
    protected abstract void processSummary(BatchSummary summary);

    /**
     * Finish the entire report.
     */
    protected abstract void closeReport();

    @Override
    public void close() {
        // Make sure we've terminated the current query.
        if (this.queryId != null)
            this.closeQuery();
        // Terminate the whole report.
        this.closeReport();
        this.writer.flush();
    }

    /**
     * @return the matching parameters
     */
    public MatchParameters getParms() {
        return this.parms;
    }

    /**
     * @return the ID of the current query
     */
    public String getQueryId() {
        return this.queryId;
    }

    /**
     * @return the current query sequence
     */
    public String getSequence() {
        return this.sequence;
    }

    /**
     * @return the number of matches recorded for the current query
     */
    public int getMatchCount() {
        return this.matchCount;
    }

    /**
     * @return TRUE if an error was recorded for the current query
     */
    public boolean isQueryFailed() {
        return this.queryFailed;
    }

    /**
     * @return a preview of the current query sequence
     */
    public String getPreview() {
        String retVal = this.sequence;
        if (retVal.length() > PREVIEW_LEN)
            retVal = StringUtils.left(retVal, PREVIEW_LEN) + "...";
        return retVal;
    }

    /**
     * @return the message to use when a query has no matches
     */
    public String getNoMatchMessage() {
        return String.format("No species matches found above %4.2f%% similarity threshold", this.parms.getMinScore());
    }

    /**
     * Write a formatted output line.
     */
    protected void print(String format, Object... args) {
        this.writer.format(format, args);
    }

    /**
     * Write an unformatted output line.
     */
    protected void println(String line) {
        this.writer.println(line);
    }

}
