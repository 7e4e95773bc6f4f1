/**
 *
 */
package org.marinedata.edna.index;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.marinedata.edna.kmers.KmerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object builds a {@link ReferenceIndex} from a corpus of reference sequences and a source of species
 * metadata.  The kmers of every sequence are added to the profile of its species.  The first time a species is
 * seen, its metadata is looked up; species the metadata source does not know are still indexed, with
 * all-unknown display values.
 *
 * A malformed or empty sequence never causes an error.  It simply contributes no kmers.
 *
 */
public class ReferenceIndexBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReferenceIndexBuilder.class);
    /** default kmer size */
    public static final int DEFAULT_KMER_SIZE = 5;
    /** kmer size */
    private final int kmerSize;

    /**
     * Create a builder with the default kmer size.
     */
    public ReferenceIndexBuilder() {
        this(DEFAULT_KMER_SIZE);
    }

    /**
     * Create a builder with a specified kmer size.
     *
     * @param kmerSize	kmer size to use (must be positive)
     */
    public ReferenceIndexBuilder(int kmerSize) {
        if (kmerSize <= 0)
            throw new IllegalArgumentException("Kmer size must be positive, but " + kmerSize + " was specified.");
        this.kmerSize = kmerSize;
    }

    /**
     * Build a reference index.
     *
     * @param corpus		reference sequences to index
     * @param metadataSource	source of species metadata
     *
     * @return the completed index
     */
    public ReferenceIndex build(Iterable<ReferenceRecord> corpus, SpeciesMetadataProvider metadataSource) {
        long start = System.currentTimeMillis();
        log.info("Building kmer reference index with kmer size {}.", this.kmerSize);
        Map<String, KmerProfile.Builder> builders = new LinkedHashMap<String, KmerProfile.Builder>();
        Map<String, SpeciesMetadata> metadata = new LinkedHashMap<String, SpeciesMetadata>();
        int seqCount = 0;
        int unknownCount = 0;
        for (ReferenceRecord record : corpus) {
            seqCount++;
            String speciesId = record.getSpeciesId();
            KmerProfile.Builder builder = builders.get(speciesId);
            if (builder == null) {
                // Here we have a new species.
                builder = new KmerProfile.Builder(this.kmerSize);
                builders.put(speciesId, builder);
                var found = metadataSource.lookup(speciesId);
                if (found.isEmpty()) {
                    log.debug("No metadata found for species {}.", speciesId);
                    unknownCount++;
                }
                metadata.put(speciesId, found.orElseGet(() -> SpeciesMetadata.unknown(speciesId)));
            }
            int kmers = builder.add(record.getSequence());
            if (kmers == 0)
                log.debug("Reference sequence {} contributed no valid kmers.", record);
        }
        Map<String, KmerProfile> profiles = new LinkedHashMap<String, KmerProfile>(builders.size() * 4 / 3 + 1);
        for (Map.Entry<String, KmerProfile.Builder> entry : builders.entrySet())
            profiles.put(entry.getKey(), entry.getValue().build());
        ReferenceIndex retVal = new ReferenceIndex(this.kmerSize, profiles, metadata, seqCount);
        if (log.isInfoEnabled()) {
            Duration duration = Duration.ofMillis(System.currentTimeMillis() - start);
            log.info("Reference index built from {} sequences with {} species ({} without metadata) in {}.",
                    seqCount, retVal.size(), unknownCount, duration);
            log.info("Total kmer profile size is {}.", retVal.getTotalKmers());
        }
        return retVal;
    }

    /**
     * @return the kmer size for this builder
     */
    public int getKmerSize() {
        return this.kmerSize;
    }

}
