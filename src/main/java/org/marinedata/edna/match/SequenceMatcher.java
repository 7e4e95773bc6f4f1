/**
 *
 */
package org.marinedata.edna.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.kmers.KmerProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object scores query sequences against a reference index.  The score of a species blends two measures
 * computed on the kmer profiles.  The first is the Jaccard similarity of the distinct kmer sets.  The second is
 * the mean, over the kmers the profiles share, of the ratio between the smaller and larger occurrence count.
 * The blend is 70% Jaccard and 30% frequency similarity; when no kmers are shared, the score is the Jaccard
 * value alone (which is then 0).  Both measures are expressed as percentages.
 *
 * Matches are sorted by descending score.  Species with equal scores stay in index order.
 *
 * The matcher has no state other than the index, so a single matcher can serve concurrent requests.
 *
 */
public class SequenceMatcher {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SequenceMatcher.class);
    /** reference index */
    private final ReferenceIndex index;
    /** weight of the Jaccard measure in the blended score */
    public static final double JACCARD_WEIGHT = 0.7;
    /** weight of the frequency measure in the blended score */
    public static final double FREQUENCY_WEIGHT = 0.3;
    /** comparator for sorting by descending score */
    private static final Comparator<ScoredMatch> SCORE_ORDER =
            Comparator.comparingDouble(ScoredMatch::getScore).reversed();

    /**
     * Create a matcher for a reference index.
     *
     * @param index		reference index to search
     */
    public SequenceMatcher(ReferenceIndex index) {
        this.index = index;
    }

    /**
     * Match a query using the default limits.
     *
     * @param query		query DNA sequence
     *
     * @return the best matches, in descending score order
     */
    public List<ScoredMatch> match(String query) {
        return this.match(query, MatchParameters.DEFAULT_TOP_N, MatchParameters.DEFAULT_MIN_SCORE);
    }

    /**
     * Match a query using the limits in a parameter object.
     *
     * @param query		query DNA sequence
     * @param parms		matching parameters
     *
     * @return the best matches, in descending score order
     */
    public List<ScoredMatch> match(String query, MatchParameters parms) {
        return this.match(query, parms.getTopN(), parms.getMinScore());
    }

    /**
     * Match a query sequence against the index.
     *
     * @param query		query DNA sequence
     * @param topN		maximum number of matches to return
     * @param minScore	minimum score for a match to be returned
     *
     * @return the best matches, in descending score order
     */
    public List<ScoredMatch> match(String query, int topN, double minScore) {
        MatchParameters.checkMatchLimits(minScore, topN);
        List<ScoredMatch> retVal = new ArrayList<ScoredMatch>();
        // A null query is treated as an empty one.
        final int queryLength = (query == null ? 0 : query.length());
        KmerProfile queryKmers = KmerProfile.of(query, this.index.getKmerSize());
        if (queryKmers.isEmpty())
            log.debug("Query of length {} has no valid kmers.", queryLength);
        else {
            final int queryKmerCount = queryKmers.size();
            for (Map.Entry<String, KmerProfile> entry : this.index.getProfiles().entrySet()) {
                double score = computeScore(queryKmers, entry.getValue());
                if (score >= minScore) {
                    String speciesId = entry.getKey();
                    retVal.add(new ScoredMatch(this.index.getMetadata(speciesId), score, queryLength,
                            queryKmerCount));
                }
            }
            // List.sort is stable, so ties keep the index order.
            retVal.sort(SCORE_ORDER);
            if (retVal.size() > topN)
                retVal = new ArrayList<ScoredMatch>(retVal.subList(0, topN));
            log.debug("{} matches returned for query of length {}.", retVal.size(), queryLength);
        }
        return retVal;
    }

    /**
     * Compute the blended matching score between a query profile and a reference profile.
     *
     * @param query			query kmer profile
     * @param reference		reference kmer profile
     *
     * @return the matching score (0 to 100)
     */
    public static double computeScore(KmerProfile query, KmerProfile reference) {
        double retVal = 0.0;
        if (! query.isEmpty() && ! reference.isEmpty()) {
            int common = 0;
            double freqSum = 0.0;
            for (String kmer : query) {
                int rCount = reference.getCount(kmer);
                if (rCount > 0) {
                    common++;
                    int qCount = query.getCount(kmer);
                    freqSum += (double) Math.min(qCount, rCount) / Math.max(qCount, rCount);
                }
            }
            int union = query.size() + reference.size() - common;
            double jaccard = (union == 0 ? 0.0 : (double) common / union * 100.0);
            if (common == 0)
                retVal = jaccard;
            else {
                double frequency = freqSum / common * 100.0;
                retVal = jaccard * JACCARD_WEIGHT + frequency * FREQUENCY_WEIGHT;
            }
        }
        return retVal;
    }

    /**
     * @return the reference index used by this matcher
     */
    public ReferenceIndex getIndex() {
        return this.index;
    }

}
