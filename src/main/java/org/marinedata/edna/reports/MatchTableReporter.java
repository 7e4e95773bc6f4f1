/**
 *
 */
package org.marinedata.edna.reports;

import java.io.PrintWriter;

import org.marinedata.edna.batch.BatchSummary;
import org.marinedata.edna.index.SpeciesMetadata;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;

/**
 * This report produces a tab-delimited table with one line per match.  A query with no matches gets a single
 * line with rank 0 and an explanatory note.  The batch summary is not part of the table.
 *
 */
public class MatchTableReporter extends MatchReporter {

    public MatchTableReporter(PrintWriter writer, MatchParameters parms) {
        super(writer, parms);
    }

    @Override
    protected void openReport() {
        this.println("query_id\tquery_length\tquery_kmers\trank\tspecies_id\tscientific_name\tcommon_name\tkingdom\t"
                + "phylum\tclass\torder\tfamily\tgenus\tmatching_score\tconfidence_level\tnote");
    }

    @Override
    protected void openQuery() {
    }

    @Override
    protected void processMatch(ScoredMatch match) {
        SpeciesMetadata species = match.getSpecies();
        this.print("%s\t%d\t%d\t%d\t%s\t%s\t%s\t%s\t%s\t%s\t%s\t%s\t%s\t%4.2f\t%s\t%n", this.getQueryId(),
                match.getQueryLength(), match.getQueryKmerCount(), this.getMatchCount(), match.getSpeciesId(),
                species.getScientificName(), species.getCommonName(), species.getKingdom(), species.getPhylum(),
                species.getTaxClass(), species.getOrder(), species.getFamily(), species.getGenus(),
                match.getScore(), match.getConfidence());
    }

    @Override
    protected void processError(String message) {
        this.printEmptyLine(message);
    }

    /**
     * Write a line for a query with no matches.
     *
     * @param note	explanation to put in the note column
     */
    private void printEmptyLine(String note) {
        this.print("%s\t%d\t\t0\t\t\t\t\t\t\t\t\t\t\t\t%s%n", this.getQueryId(), this.getSequence().length(), note);
    }

    @Override
    protected void finishQuery() {
        if (this.getMatchCount() == 0 && ! this.isQueryFailed())
            this.printEmptyLine(this.getNoMatchMessage());
    }

    @Override
    protected void processSummary(BatchSummary summary) {
    }

    @Override
    protected void closeReport() {
    }

}
