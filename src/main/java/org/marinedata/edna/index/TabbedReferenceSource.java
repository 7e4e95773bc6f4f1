/**
 *
 */
package org.marinedata.edna.index;

import java.io.File;
import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.marinedata.edna.utils.TabbedLineReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This reference corpus is read from a tab-delimited file with a header line.  One column contains the species ID
 * and one contains the DNA sequence.  If there is a "sequence_id" column, it is used to identify the sequence in
 * log messages.  Lines with no species ID are skipped.
 *
 */
public class TabbedReferenceSource extends ReferenceSource {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TabbedReferenceSource.class);
    /** species ID column specifier */
    private String speciesCol;
    /** sequence column specifier */
    private String seqCol;
    /** default species ID column */
    public static final String DEFAULT_SPECIES_COL = "matched_species_id";
    /** default sequence column */
    public static final String DEFAULT_SEQ_COL = "sequence";

    /**
     * Load a tabbed reference corpus.
     *
     * @param inFile		input file
     * @param speciesCol	species ID column name or 1-based index
     * @param seqCol		sequence column name or 1-based index
     *
     * @throws IOException
     */
    public TabbedReferenceSource(File inFile, String speciesCol, String seqCol) throws IOException {
        super(inFile);
        this.speciesCol = speciesCol;
        this.seqCol = seqCol;
        this.load();
    }

    /**
     * Load a tabbed reference corpus using the default column names.
     *
     * @param inFile		input file
     *
     * @throws IOException
     */
    public TabbedReferenceSource(File inFile) throws IOException {
        this(inFile, DEFAULT_SPECIES_COL, DEFAULT_SEQ_COL);
    }

    @Override
    protected void readRecords(File inFile) throws IOException {
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int speciesIdx = inStream.findField(this.speciesCol);
            int seqIdx = inStream.findField(this.seqCol);
            int idIdx = inStream.findOptionalField("sequence_id");
            int skipped = 0;
            for (TabbedLineReader.Line line : inStream) {
                String speciesId = line.get(speciesIdx);
                if (StringUtils.isBlank(speciesId))
                    skipped++;
                else {
                    String seqId = (idIdx < 0 ? null : StringUtils.defaultIfBlank(line.get(idIdx), null));
                    this.addRecord(new ReferenceRecord(seqId, speciesId.strip(), line.get(seqIdx)));
                }
            }
            log.info("{} reference sequences read from {}.  {} lines without a species ID skipped.",
                    this.size(), inFile, skipped);
        }
    }

}
