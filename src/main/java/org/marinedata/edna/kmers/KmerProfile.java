/**
 *
 */
package org.marinedata.edna.kmers;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * This object is a frequency count of the DNA kmers in one or more sequences.  Sequences are normalized to upper
 * case with leading and trailing whitespace removed, then every window of the kmer size is examined.  Windows
 * containing anything other than A, C, G, or T (including the ambiguity code N) are discarded.
 *
 * A profile is immutable.  Profiles covering multiple sequences are assembled using a {@link Builder}.
 *
 */
public class KmerProfile implements Iterable<String> {

    // FIELDS
    /** map of kmers to occurrence counts */
    private final Map<String, Integer> counts;
    /** kmer size */
    private final int kmerSize;
    /** total number of kmer occurrences */
    private final long total;

    /**
     * This class accumulates kmer counts from multiple sequences into a single profile.
     */
    public static class Builder {

        /** kmer size */
        private final int kmerSize;
        /** accumulated counts */
        private Map<String, Integer> counts;
        /** total occurrences */
        private long total;

        /**
         * Create an empty profile builder.
         *
         * @param kmerSize	kmer size to use
         */
        public Builder(int kmerSize) {
            checkKmerSize(kmerSize);
            this.kmerSize = kmerSize;
            this.counts = new HashMap<String, Integer>();
            this.total = 0;
        }

        /**
         * Add the kmers of a sequence to this builder.
         *
         * @param sequence	DNA sequence to add
         *
         * @return the number of valid kmers found in the sequence
         */
        public int add(String sequence) {
            int retVal = 0;
            if (sequence != null) {
                String seq = normalize(sequence);
                final int k = this.kmerSize;
                // "run" is the number of consecutive valid bases ending at the current position.
                int run = 0;
                for (int i = 0; i < seq.length(); i++) {
                    if (isBase(seq.charAt(i))) {
                        run++;
                        if (run >= k) {
                            this.counts.merge(seq.substring(i - k + 1, i + 1), 1, Integer::sum);
                            retVal++;
                        }
                    } else
                        run = 0;
                }
                this.total += retVal;
            }
            return retVal;
        }

        /**
         * Merge another profile into this builder.
         *
         * @param other		profile to merge
         */
        public void addAll(KmerProfile other) {
            if (other.kmerSize != this.kmerSize)
                throw new IllegalArgumentException("Cannot merge a profile with kmer size " + other.kmerSize
                        + " into one of kmer size " + this.kmerSize + ".");
            for (Map.Entry<String, Integer> entry : other.counts.entrySet())
                this.counts.merge(entry.getKey(), entry.getValue(), Integer::sum);
            this.total += other.total;
        }

        /**
         * @return the profile built so far
         */
        public KmerProfile build() {
            return new KmerProfile(new HashMap<String, Integer>(this.counts), this.kmerSize, this.total);
        }

    }

    /**
     * Construct a profile from pre-computed counts.
     *
     * @param counts	kmer count map (which is taken over by this object)
     * @param kmerSize	kmer size
     * @param total		total kmer occurrences
     */
    private KmerProfile(Map<String, Integer> counts, int kmerSize, long total) {
        this.counts = counts;
        this.kmerSize = kmerSize;
        this.total = total;
    }

    /**
     * Create a profile for a single sequence.
     *
     * @param sequence	DNA sequence to profile
     * @param kmerSize	kmer size to use
     *
     * @return the kmer profile of the sequence
     */
    public static KmerProfile of(String sequence, int kmerSize) {
        Builder builder = new Builder(kmerSize);
        builder.add(sequence);
        return builder.build();
    }

    /**
     * Create an empty profile.
     *
     * @param kmerSize	kmer size of the profile
     *
     * @return a profile with no kmers
     */
    public static KmerProfile empty(int kmerSize) {
        checkKmerSize(kmerSize);
        return new KmerProfile(Collections.emptyMap(), kmerSize, 0);
    }

    /**
     * @return the normalized form of a sequence (trimmed and upper case)
     *
     * @param sequence	sequence to normalize
     */
    public static String normalize(String sequence) {
        return sequence.strip().toUpperCase();
    }

    /**
     * @return TRUE if the specified character is an unambiguous DNA base
     *
     * @param c		character to check
     */
    public static boolean isBase(char c) {
        return (c == 'A' || c == 'C' || c == 'G' || c == 'T');
    }

    /**
     * Verify that a kmer size is valid.
     *
     * @param kmerSize	proposed kmer size
     */
    private static void checkKmerSize(int kmerSize) {
        if (kmerSize <= 0)
            throw new IllegalArgumentException("Kmer size must be positive, but " + kmerSize + " was specified.");
    }

    /**
     * @return the number of times the specified kmer occurs (0 if it is absent)
     *
     * @param kmer	kmer to check
     */
    public int getCount(String kmer) {
        return this.counts.getOrDefault(kmer, 0);
    }

    /**
     * @return TRUE if the specified kmer is in this profile
     *
     * @param kmer	kmer to check
     */
    public boolean contains(String kmer) {
        return this.counts.containsKey(kmer);
    }

    /**
     * @return the number of distinct kmers
     */
    public int size() {
        return this.counts.size();
    }

    /**
     * @return the total number of kmer occurrences
     */
    public long totalCount() {
        return this.total;
    }

    /**
     * @return TRUE if there are no kmers in this profile
     */
    public boolean isEmpty() {
        return this.counts.isEmpty();
    }

    /**
     * @return the kmer size
     */
    public int getKmerSize() {
        return this.kmerSize;
    }

    /**
     * @return the set of distinct kmers
     */
    public Set<String> kmers() {
        return Collections.unmodifiableSet(this.counts.keySet());
    }

    @Override
    public Iterator<String> iterator() {
        return this.kmers().iterator();
    }

    @Override
    public String toString() {
        return "KmerProfile[k=" + this.kmerSize + ", distinct=" + this.counts.size() + ", total=" + this.total + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.counts.hashCode();
        result = prime * result + this.kmerSize;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof KmerProfile)) {
            return false;
        }
        KmerProfile other = (KmerProfile) obj;
        return this.kmerSize == other.kmerSize && this.counts.equals(other.counts);
    }

}
