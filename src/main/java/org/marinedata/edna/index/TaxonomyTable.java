/**
 *
 */
package org.marinedata.edna.index;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.marinedata.edna.utils.TabbedLineReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is an in-memory table of species metadata.  It is usually loaded from a tab-delimited taxonomy file.
 * The file must have a "species_id" column.  The other columns recognized are the attribute keys in
 * {@link SpeciesMetadata#ATTRIBUTES}; any of them may be missing.  Species IDs are stripped of surrounding
 * white space, and lines with a blank species ID are skipped.  If a species ID occurs more than once, the first
 * occurrence is kept.
 *
 */
public class TaxonomyTable implements SpeciesMetadataProvider {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TaxonomyTable.class);
    /** map of species IDs to metadata */
    private Map<String, SpeciesMetadata> speciesMap;
    /** name of the species ID column */
    public static final String ID_COLUMN = "species_id";

    /**
     * Create an empty taxonomy table.
     */
    public TaxonomyTable() {
        this.speciesMap = new HashMap<String, SpeciesMetadata>();
    }

    /**
     * Load a taxonomy table from a tab-delimited file.
     *
     * @param inFile	file to load
     *
     * @return the loaded table
     *
     * @throws IOException
     */
    public static TaxonomyTable load(File inFile) throws IOException {
        if (! inFile.canRead())
            throw new FileNotFoundException("Taxonomy file " + inFile + " is not found or unreadable.");
        TaxonomyTable retVal = new TaxonomyTable();
        try (TabbedLineReader inStream = new TabbedLineReader(inFile)) {
            int idIdx = inStream.findField(ID_COLUMN);
            // Find the attribute columns that are present.
            final int nAttrs = SpeciesMetadata.ATTRIBUTES.length;
            int[] attrCols = new int[nAttrs];
            for (int i = 0; i < nAttrs; i++)
                attrCols[i] = inStream.findOptionalField(SpeciesMetadata.ATTRIBUTES[i]);
            int dups = 0;
            int blanks = 0;
            for (TabbedLineReader.Line line : inStream) {
                String speciesId = line.get(idIdx).strip();
                if (speciesId.isEmpty()) {
                    blanks++;
                    continue;
                }
                Map<String, String> attributes = new HashMap<String, String>(nAttrs * 2);
                for (int i = 0; i < nAttrs; i++) {
                    if (attrCols[i] >= 0)
                        attributes.put(SpeciesMetadata.ATTRIBUTES[i], line.get(attrCols[i]));
                }
                if (! retVal.add(SpeciesMetadata.of(speciesId, attributes)))
                    dups++;
            }
            log.info("{} species loaded from {}.  {} duplicates and {} blank IDs skipped.", retVal.size(), inFile,
                    dups, blanks);
        }
        return retVal;
    }

    /**
     * Add a species to this table.
     *
     * @param metadata	metadata record for the species
     *
     * @return TRUE if the species was added, FALSE if it was already present
     */
    public boolean add(SpeciesMetadata metadata) {
        return (this.speciesMap.putIfAbsent(metadata.getSpeciesId(), metadata) == null);
    }

    @Override
    public Optional<SpeciesMetadata> lookup(String speciesId) {
        return Optional.ofNullable(this.speciesMap.get(speciesId));
    }

    /**
     * @return the number of species in this table
     */
    public int size() {
        return this.speciesMap.size();
    }

}
