/**
 *
 */
package org.marinedata.edna.index;

/**
 * This object represents a single reference sequence associated with a species.
 *
 */
public class ReferenceRecord {

    // FIELDS
    /** ID of the sequence (may be NULL) */
    private final String sequenceId;
    /** ID of the species the sequence belongs to */
    private final String speciesId;
    /** DNA sequence */
    private final String sequence;

    /**
     * Create a reference record with no sequence ID.
     *
     * @param speciesId		ID of the species
     * @param sequence		DNA sequence
     */
    public ReferenceRecord(String speciesId, String sequence) {
        this(null, speciesId, sequence);
    }

    /**
     * Create a reference record.
     *
     * @param sequenceId	ID of the sequence, or NULL if it has none
     * @param speciesId		ID of the species
     * @param sequence		DNA sequence
     */
    public ReferenceRecord(String sequenceId, String speciesId, String sequence) {
        if (speciesId == null)
            throw new IllegalArgumentException("Reference record must have a species ID.");
        this.sequenceId = sequenceId;
        this.speciesId = speciesId;
        this.sequence = (sequence == null ? "" : sequence);
    }

    /**
     * @return the sequence ID, or NULL if there is none
     */
    public String getSequenceId() {
        return this.sequenceId;
    }

    /**
     * @return the species ID
     */
    public String getSpeciesId() {
        return this.speciesId;
    }

    /**
     * @return the DNA sequence
     */
    public String getSequence() {
        return this.sequence;
    }

    @Override
    public String toString() {
        String retVal = (this.sequenceId == null ? this.speciesId : this.sequenceId + " (" + this.speciesId + ")");
        return retVal;
    }

}
