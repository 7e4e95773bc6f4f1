/**
 *
 */
package org.marinedata.edna.reports;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;

import org.apache.commons.math3.util.Precision;
import org.marinedata.edna.batch.BatchSummary;
import org.marinedata.edna.index.SpeciesMetadata;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * This produces a JSON document describing the species matches.  The document has a "query_info" object with the
 * matching parameters, a "results" array with one object per query, and (for batches) a "summary" object.
 * Scores are rounded to two decimal places.
 *
 */
public class MatchJsonReporter extends MatchReporter {

    // FIELDS
    /** JSON object mapper */
    private ObjectMapper mapper;
    /** root of the output document */
    private ObjectNode root;
    /** array of query results */
    private ArrayNode results;
    /** object for the current query */
    private ObjectNode current;
    /** match array for the current query */
    private ArrayNode matches;

    /**
     * Construct a new JSON match report.
     *
     * @param writer	output writer
     * @param parms		matching parameters
     */
    public MatchJsonReporter(PrintWriter writer, MatchParameters parms) {
        super(writer, parms);
    }

    @Override
    protected void openReport() {
        this.mapper = new ObjectMapper();
        this.root = this.mapper.createObjectNode();
        MatchParameters parms = this.getParms();
        ObjectNode info = this.root.putObject("query_info");
        info.put("k_mer_size", parms.getKmerSize());
        info.put("min_score_threshold", parms.getMinScore());
        info.put("top_matches", parms.getTopN());
        this.results = this.root.putArray("results");
    }

    @Override
    protected void openQuery() {
        this.current = this.results.addObject();
        this.current.put("id", this.getQueryId());
        this.current.put("sequence_length", this.getSequence().length());
        this.current.put("processed_sequence", this.getPreview());
        this.matches = this.current.putArray("matches");
    }

    @Override
    protected void processMatch(ScoredMatch match) {
        SpeciesMetadata species = match.getSpecies();
        ObjectNode node = this.matches.addObject();
        node.put("species_id", match.getSpeciesId());
        node.put("scientific_name", match.getScientificName());
        node.put("common_name", match.getCommonName());
        node.put("matching_score", Precision.round(match.getScore(), 2));
        node.put("confidence_level", match.getConfidence().getLabel());
        ObjectNode taxonomy = node.putObject("taxonomy");
        taxonomy.put("kingdom", species.getKingdom());
        taxonomy.put("phylum", species.getPhylum());
        taxonomy.put("class", species.getTaxClass());
        taxonomy.put("order", species.getOrder());
        taxonomy.put("family", species.getFamily());
        taxonomy.put("genus", species.getGenus());
        ObjectNode stats = node.putObject("sequence_stats");
        stats.put("query_length", match.getQueryLength());
        stats.put("query_kmers", match.getQueryKmerCount());
    }

    @Override
    protected void processError(String message) {
        this.current.put("error", message);
    }

    @Override
    protected void finishQuery() {
        this.current.put("total_matches", this.getMatchCount());
        if (this.getMatchCount() == 0 && ! this.isQueryFailed())
            this.current.put("message", this.getNoMatchMessage());
        this.current = null;
        this.matches = null;
    }

    @Override
    protected void processSummary(BatchSummary summary) {
        ObjectNode node = this.root.putObject("summary");
        node.put("total_sequences", summary.getTotal());
        node.put("successful_matches", summary.getSuccessful());
        node.put("failed_sequences", summary.getFailed());
        node.put("success_rate", Precision.round(summary.getSuccessRate(), 2));
        if (summary.hasAccuracy()) {
            node.put("expected_sequences", summary.getExpected());
            node.put("correct_predictions", summary.getCorrect());
            node.put("accuracy", Precision.round(summary.getAccuracy(), 2));
        }
    }

    @Override
    protected void closeReport() {
        try {
            this.println(this.mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this.root));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

}
