/**
 *
 */
package org.marinedata.edna;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.index.SpeciesMetadata;
import org.marinedata.edna.kmers.KmerProfile;
import org.marinedata.edna.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command builds the reference index and writes a table describing each species profile.  The output
 * columns are the species ID, the common name, the number of distinct kmers, and the total number of kmer
 * occurrences.  The mean, maximum, and standard deviation of the distinct-kmer counts are written to the log,
 * along with a warning for any species whose profile is empty (these can never match a query).
 *
 * The positional parameter is the name of the reference sequence file.
 *
 * The command-line options are as follows.
 *
 * -h	display command usage
 * -v	display more detailed progress messages
 * -o	output file for the report (if not STDOUT)
 * -K	kmer size (default 5)
 * -t	type of reference file (TAB or FASTA, default TAB)
 *
 * --taxonomy	tab-delimited taxonomy file containing species metadata
 * --speciesCol	index (1-based) or name of the species ID column in a tabbed reference file
 * --seqCol		index (1-based) or name of the sequence column in a tabbed reference file
 *
 */
public class StatsProcessor extends ReferenceIndexProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StatsProcessor.class);

    @Override
    protected void setReporterDefaults() {
        this.initIndexParms();
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        this.validateIndexParms();
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReferenceIndex index = this.buildIndex();
        writer.println("species_id\tcommon_name\tdistinct_kmers\ttotal_kmers");
        SummaryStatistics stats = new SummaryStatistics();
        List<String> emptySpecies = new ArrayList<String>();
        for (var entry : index.getProfiles().entrySet()) {
            String speciesId = entry.getKey();
            KmerProfile profile = entry.getValue();
            SpeciesMetadata species = index.getMetadata(speciesId);
            writer.format("%s\t%s\t%d\t%d%n", speciesId, species.getCommonName(), profile.size(),
                    profile.totalCount());
            stats.addValue(profile.size());
            if (profile.isEmpty())
                emptySpecies.add(speciesId);
        }
        log.info("{} species from {} reference sequences.  {} distinct kmers in all profiles.", index.size(),
                index.getSequenceCount(), index.getTotalKmers());
        if (stats.getN() > 0)
            log.info("Maximum profile size is {}, mean is {}, standard deviation is {}.", stats.getMax(),
                    stats.getMean(), stats.getStandardDeviation());
        if (! emptySpecies.isEmpty())
            log.warn("{} species have no kmers and cannot be matched: {}", emptySpecies.size(),
                    String.join(", ", emptySpecies));
    }

}
