/**
 *
 */
package org.marinedata.edna.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.marinedata.edna.kmers.KmerProfile;

/**
 * This object is the reference database used for species matching.  It maps each species ID to the accumulated
 * kmer profile of all its reference sequences, and to the species metadata.  The species are kept in the order
 * they were first encountered in the corpus.
 *
 * The index cannot be modified after construction, so it can be shared freely between threads.  It is created by
 * {@link ReferenceIndexBuilder}.
 *
 */
public class ReferenceIndex {

    // FIELDS
    /** kmer size of all the profiles */
    private final int kmerSize;
    /** map of species IDs to profiles */
    private final Map<String, KmerProfile> profiles;
    /** map of species IDs to metadata */
    private final Map<String, SpeciesMetadata> metadata;
    /** number of reference sequences indexed */
    private final int sequenceCount;

    /**
     * Construct a reference index.
     *
     * @param kmerSize		kmer size of the profiles
     * @param profiles		map of species IDs to kmer profiles, in discovery order
     * @param metadata		map of species IDs to metadata
     * @param seqCount		number of reference sequences indexed
     */
    protected ReferenceIndex(int kmerSize, Map<String, KmerProfile> profiles, Map<String, SpeciesMetadata> metadata,
            int seqCount) {
        this.kmerSize = kmerSize;
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<String, KmerProfile>(profiles));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<String, SpeciesMetadata>(metadata));
        this.sequenceCount = seqCount;
    }

    /**
     * @return the kmer size used by this index
     */
    public int getKmerSize() {
        return this.kmerSize;
    }

    /**
     * @return the number of species in this index
     */
    public int size() {
        return this.profiles.size();
    }

    /**
     * @return TRUE if this index contains no species
     */
    public boolean isEmpty() {
        return this.profiles.isEmpty();
    }

    /**
     * @return the number of reference sequences indexed
     */
    public int getSequenceCount() {
        return this.sequenceCount;
    }

    /**
     * @return the IDs of the indexed species, in discovery order
     */
    public Set<String> getSpeciesIds() {
        return this.profiles.keySet();
    }

    /**
     * @return TRUE if the specified species is in this index
     *
     * @param speciesId		ID of the species to check
     */
    public boolean contains(String speciesId) {
        return this.profiles.containsKey(speciesId);
    }

    /**
     * @return the kmer profile for a species, or NULL if the species is not indexed
     *
     * @param speciesId		ID of the species whose profile is desired
     */
    public KmerProfile getProfile(String speciesId) {
        return this.profiles.get(speciesId);
    }

    /**
     * @return the species profile map, in discovery order
     */
    public Map<String, KmerProfile> getProfiles() {
        return this.profiles;
    }

    /**
     * @return the metadata for a species; unknown species get an all-unknown record
     *
     * @param speciesId		ID of the species whose metadata is desired
     */
    public SpeciesMetadata getMetadata(String speciesId) {
        SpeciesMetadata retVal = this.metadata.get(speciesId);
        if (retVal == null)
            retVal = SpeciesMetadata.unknown(speciesId);
        return retVal;
    }

    /**
     * @return the total number of distinct kmers summed over all the species profiles
     */
    public long getTotalKmers() {
        long retVal = 0;
        for (KmerProfile profile : this.profiles.values())
            retVal += profile.size();
        return retVal;
    }

    @Override
    public String toString() {
        return "ReferenceIndex[k=" + this.kmerSize + ", species=" + this.profiles.size() + ", sequences="
                + this.sequenceCount + "]";
    }

}
