/**
 *
 */
package org.marinedata.edna.reports;

import static j2html.TagCreator.*;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import org.marinedata.edna.batch.BatchSummary;
import org.marinedata.edna.index.SpeciesMetadata;
import org.marinedata.edna.match.ConfidenceLevel;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;

import j2html.tags.ContainerTag;
import j2html.tags.DomContent;

/**
 * This produces a web page describing the species matches.  Each query gets a heading, a description line,
 * and a table of matches in which the score cell is colored by confidence level.
 *
 */
public class MatchHtmlReporter extends MatchReporter {

    // FIELDS
    /** list of page sections */
    private List<DomContent> pieces;
    /** table rows for the current query */
    private List<DomContent> rows;
    /** page title */
    private static final String TITLE = "eDNA Species Identification";
    /** style sheet */
    private static final String CSS = "table { border-collapse: collapse; } "
            + "th, td { border: 1px solid #999; padding: 2px 6px; } "
            + "td.num { text-align: right; } "
            + "td.high { background-color: #1B7837; color: white; } "
            + "td.medium { background-color: #D9C400; } "
            + "td.low { background-color: #F4A442; } "
            + "td.very_low { background-color: #D73027; color: white; } "
            + "p.error { color: #D73027; font-weight: bold; }";

    /**
     * Construct a new HTML match report.
     *
     * @param writer	output writer
     * @param parms		matching parameters
     */
    public MatchHtmlReporter(PrintWriter writer, MatchParameters parms) {
        super(writer, parms);
    }

    @Override
    protected void openReport() {
        // We will store the parts of the report in here.
        this.pieces = new ArrayList<DomContent>();
        this.pieces.add(h1(TITLE));
        MatchParameters parms = this.getParms();
        this.pieces.add(p(String.format("Kmer size %d, minimum score %4.2f%%, at most %d matches per query.",
                parms.getKmerSize(), parms.getMinScore(), parms.getTopN())));
    }

    @Override
    protected void openQuery() {
        this.pieces.add(h2(this.getQueryId()));
        this.pieces.add(p(String.format("Sequence length %d: %s", this.getSequence().length(), this.getPreview())));
        this.rows = new ArrayList<DomContent>();
        this.rows.add(tr(th("Rank"), th("Species ID"), th("Scientific Name"), th("Common Name"), th("Phylum"),
                th("Class"), th("Family"), th("Score"), th("Confidence")));
    }

    @Override
    protected void processMatch(ScoredMatch match) {
        SpeciesMetadata species = match.getSpecies();
        ConfidenceLevel confidence = match.getConfidence();
        this.rows.add(tr(td(Integer.toString(this.getMatchCount())).withClass("num"), td(match.getSpeciesId()),
                td(i(species.getScientificName())), td(species.getCommonName()), td(species.getPhylum()),
                td(species.getTaxClass()), td(species.getFamily()),
                td(String.format("%4.2f", match.getScore())).withClass("num " + confidence.getLabel()),
                td(confidence.getLabel())));
    }

    @Override
    protected void processError(String message) {
        this.pieces.add(p(message).withClass("error"));
    }

    @Override
    protected void finishQuery() {
        if (this.getMatchCount() > 0)
            this.pieces.add(table().with(this.rows));
        else if (! this.isQueryFailed())
            this.pieces.add(p(this.getNoMatchMessage()));
        this.rows = null;
    }

    @Override
    protected void processSummary(BatchSummary summary) {
        this.pieces.add(h2("Summary"));
        List<DomContent> items = new ArrayList<DomContent>();
        items.add(li(String.format("Total sequences: %d", summary.getTotal())));
        items.add(li(String.format("Successful matches: %d", summary.getSuccessful())));
        items.add(li(String.format("Failed sequences: %d", summary.getFailed())));
        items.add(li(String.format("Success rate: %4.1f%%", summary.getSuccessRate())));
        if (summary.hasAccuracy())
            items.add(li(String.format("Accuracy: %4.1f%% (%d/%d)", summary.getAccuracy(), summary.getCorrect(),
                    summary.getExpected())));
        this.pieces.add(ul().with(items));
    }

    @Override
    protected void closeReport() {
        ContainerTag page = html(head(title(TITLE), style(CSS)), body().with(this.pieces));
        this.println(page.render());
    }

}
