/**
 *
 */
package org.marinedata.edna.index;

import java.io.File;
import java.io.IOException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;

/**
 * This reference corpus is read from a FASTA file.  The first word of each label is the sequence ID and the
 * second word is the species ID.  If there is no second word, the sequence ID is used as the species ID.
 * Sequence data may span multiple lines.
 *
 */
public class FastaReferenceSource extends ReferenceSource {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(FastaReferenceSource.class);

    /**
     * Load a FASTA reference corpus.
     *
     * @param inFile	input FASTA file
     *
     * @throws IOException
     */
    public FastaReferenceSource(File inFile) throws IOException {
        super(inFile);
        this.load();
    }

    @Override
    protected void readRecords(File inFile) throws IOException {
        // The full label is kept so the species ID can be taken from the second word.
        try (FastaSequenceFile inStream = new FastaSequenceFile(inFile.toPath(), false)) {
            for (ReferenceSequence seq = inStream.nextSequence(); seq != null; seq = inStream.nextSequence()) {
                String[] label = StringUtils.split(seq.getName());
                String seqId = label[0];
                String speciesId = (label.length > 1 ? label[1] : seqId);
                this.addRecord(new ReferenceRecord(seqId, speciesId, seq.getBaseString()));
            }
        } catch (SAMException e) {
            throw new IOException("Error reading FASTA file " + inFile + ": " + e.getMessage(), e);
        }
        log.info("{} reference sequences read from {}.", this.size(), inFile);
    }

}
