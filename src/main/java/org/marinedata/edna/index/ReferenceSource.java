/**
 *
 */
package org.marinedata.edna.index;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * This is the base class for a reference corpus.  A corpus is read once, when it is created, and then
 * presents its sequences in file order.
 *
 */
public abstract class ReferenceSource implements Iterable<ReferenceRecord> {

    // FIELDS
    /** list of reference records */
    private List<ReferenceRecord> records;
    /** name of the source file */
    private File sourceFile;

    /**
     * This enum describes the supported reference file formats.
     */
    public enum Type {
        /** tab-delimited file with a header line */
        TAB {
            @Override
            public ReferenceSource create(File inFile, String speciesCol, String seqCol) throws IOException {
                return new TabbedReferenceSource(inFile, speciesCol, seqCol);
            }
        },
        /** FASTA file with the species ID in the label comment */
        FASTA {
            @Override
            public ReferenceSource create(File inFile, String speciesCol, String seqCol) throws IOException {
                return new FastaReferenceSource(inFile);
            }
        };

        /**
         * Load a reference corpus of this type.
         *
         * @param inFile		file containing the corpus
         * @param speciesCol	species ID column specifier (tabbed files only)
         * @param seqCol		sequence column specifier (tabbed files only)
         *
         * @return the loaded corpus
         *
         * @throws IOException
         */
        public abstract ReferenceSource create(File inFile, String speciesCol, String seqCol) throws IOException;
    }

    /**
     * Prepare to load a reference corpus.  The subclass constructor must call {@link #load()} once its own
     * fields are set.
     *
     * @param inFile	file containing the corpus
     *
     * @throws FileNotFoundException
     */
    protected ReferenceSource(File inFile) throws FileNotFoundException {
        if (! inFile.canRead())
            throw new FileNotFoundException("Reference file " + inFile + " is not found or unreadable.");
        this.sourceFile = inFile;
        this.records = new ArrayList<ReferenceRecord>();
    }

    /**
     * Read the records from the source file.
     *
     * @throws IOException
     */
    protected void load() throws IOException {
        this.records.clear();
        this.readRecords(this.sourceFile);
    }

    /**
     * Read the reference records from the input file.  The subclass must call {@link #addRecord} for each one.
     *
     * @param inFile	file containing the corpus
     *
     * @throws IOException
     */
    protected abstract void readRecords(File inFile) throws IOException;

    /**
     * Store a reference record.
     *
     * @param record	record to store
     */
    protected void addRecord(ReferenceRecord record) {
        this.records.add(record);
    }

    /**
     * @return the number of records in this corpus
     */
    public int size() {
        return this.records.size();
    }

    @Override
    public Iterator<ReferenceRecord> iterator() {
        return this.records.iterator();
    }

    @Override
    public String toString() {
        return this.sourceFile.toString();
    }

}
