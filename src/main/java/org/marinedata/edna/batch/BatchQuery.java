/**
 *
 */
package org.marinedata.edna.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * This object describes a single query in a batch.  The query has an ID, a DNA sequence, and optional sample
 * metadata.  When the batch is used for accuracy testing, the query also names the species it is expected to
 * match.
 *
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchQuery {

    // FIELDS
    /** query ID (may be NULL) */
    @JsonProperty("id")
    @JsonAlias({ "test_id" })
    private String id;
    /** DNA sequence */
    @JsonProperty("sequence")
    private String sequence;
    /** sample metadata */
    @JsonProperty("metadata")
    private Map<String, Object> metadata;
    /** ID of the expected species (may be NULL) */
    @JsonProperty("expected_match")
    @JsonAlias({ "expected_species" })
    private String expectedSpecies;
    /** description of the query (may be NULL) */
    @JsonProperty("description")
    private String description;

    /**
     * Create a blank query for deserialization.
     */
    protected BatchQuery() {
        this.metadata = new LinkedHashMap<String, Object>();
    }

    /**
     * Create a query.
     *
     * @param id			query ID, or NULL to have one assigned by position
     * @param sequence		DNA sequence
     */
    public BatchQuery(String id, String sequence) {
        this();
        this.id = id;
        this.sequence = sequence;
    }

    /**
     * Create a query with an expected species.
     *
     * @param id				query ID, or NULL to have one assigned by position
     * @param sequence			DNA sequence
     * @param expectedSpecies	ID of the species the query should match
     */
    public BatchQuery(String id, String sequence, String expectedSpecies) {
        this(id, sequence);
        this.expectedSpecies = expectedSpecies;
    }

    /**
     * @return the query ID, or NULL if none was specified
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the DNA sequence (never NULL)
     */
    public String getSequence() {
        return (this.sequence == null ? "" : this.sequence);
    }

    /**
     * @return the sample metadata
     */
    public Map<String, Object> getMetadata() {
        return (this.metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(this.metadata));
    }

    /**
     * @return the ID of the expected species, or NULL if there is no expectation
     */
    public String getExpectedSpecies() {
        return this.expectedSpecies;
    }

    /**
     * @return TRUE if this query has an expected species
     */
    public boolean hasExpectation() {
        return (this.expectedSpecies != null && ! this.expectedSpecies.isBlank());
    }

    /**
     * @return the description, or NULL if there is none
     */
    public String getDescription() {
        return this.description;
    }

}
