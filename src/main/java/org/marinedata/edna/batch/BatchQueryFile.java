/**
 *
 */
package org.marinedata.edna.batch;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * This object represents a JSON batch file.  The file contains a single object with a "sequences" array
 * (or "test_sequences" for accuracy test files) of query objects.
 *
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchQueryFile {

    // FIELDS
    /** list of queries */
    @JsonProperty("sequences")
    @JsonAlias({ "test_sequences" })
    private List<BatchQuery> queries;
    /** shared JSON mapper */
    private static final ObjectMapper MAPPER = new ObjectMapper();

    protected BatchQueryFile() {
        this.queries = new ArrayList<BatchQuery>();
    }

    /**
     * Load the queries from a batch file.
     *
     * @param inFile	JSON batch file
     *
     * @return the list of queries in the file
     *
     * @throws IOException
     */
    public static List<BatchQuery> load(File inFile) throws IOException {
        if (! inFile.canRead())
            throw new FileNotFoundException("Batch file " + inFile + " is not found or unreadable.");
        BatchQueryFile batch = MAPPER.readValue(inFile, BatchQueryFile.class);
        return batch.getQueries();
    }

    /**
     * Load the queries from a batch stream.
     *
     * @param inStream	stream containing the JSON batch
     *
     * @return the list of queries in the stream
     *
     * @throws IOException
     */
    public static List<BatchQuery> load(InputStream inStream) throws IOException {
        BatchQueryFile batch = MAPPER.readValue(inStream, BatchQueryFile.class);
        return batch.getQueries();
    }

    /**
     * @return the queries in this batch
     */
    private List<BatchQuery> getQueries() {
        return (this.queries == null ? new ArrayList<BatchQuery>() : this.queries);
    }

}
