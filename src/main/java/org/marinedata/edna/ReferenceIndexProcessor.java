/**
 *
 */
package org.marinedata.edna;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.index.ReferenceIndexBuilder;
import org.marinedata.edna.index.ReferenceSource;
import org.marinedata.edna.index.SpeciesMetadataProvider;
import org.marinedata.edna.index.TabbedReferenceSource;
import org.marinedata.edna.index.TaxonomyTable;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.utils.BaseReportProcessor;
import org.marinedata.edna.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the base class for commands that need a reference index.  The first positional parameter is the
 * reference sequence file.  The species metadata comes from an optional taxonomy file; without one, every species
 * is displayed as unknown.
 *
 * The command-line options are as follows.
 *
 * -K	kmer size (default 5)
 * -t	type of reference file (TAB or FASTA, default TAB)
 *
 * --taxonomy	tab-delimited taxonomy file containing species metadata
 * --speciesCol	index (1-based) or name of the species ID column in a tabbed reference file
 * --seqCol		index (1-based) or name of the sequence column in a tabbed reference file
 *
 */
public abstract class ReferenceIndexProcessor extends BaseReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReferenceIndexProcessor.class);

    // COMMAND-LINE OPTIONS

    /** kmer size */
    @Option(name = "-K", aliases = { "--kmer", "--kmerSize" }, metaVar = "8", usage = "DNA kmer size")
    private int kmerSize;

    /** reference file type */
    @Option(name = "-t", aliases = { "--type" }, usage = "type of reference file")
    private ReferenceSource.Type sourceType;

    /** taxonomy file */
    @Option(name = "--taxonomy", aliases = { "--meta" }, metaVar = "taxonomy.tbl", usage = "species metadata file")
    private File taxFile;

    /** species ID column */
    @Option(name = "--speciesCol", metaVar = "species_id", usage = "species ID column index (1-based) or name")
    private String speciesCol;

    /** sequence column */
    @Option(name = "--seqCol", metaVar = "dna", usage = "sequence column index (1-based) or name")
    private String seqCol;

    /** reference sequence file */
    @Argument(index = 0, metaVar = "refFile", usage = "reference sequence file", required = true)
    private File refFile;

    /**
     * Initialize the reference index parameters.
     */
    protected void initIndexParms() {
        this.kmerSize = ReferenceIndexBuilder.DEFAULT_KMER_SIZE;
        this.sourceType = ReferenceSource.Type.TAB;
        this.taxFile = null;
        this.speciesCol = TabbedReferenceSource.DEFAULT_SPECIES_COL;
        this.seqCol = TabbedReferenceSource.DEFAULT_SEQ_COL;
    }

    /**
     * Validate the reference index parameters.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected void validateIndexParms() throws IOException, ParseFailureException {
        if (this.kmerSize < 1)
            throw new ParseFailureException("Kmer size must be at least 1.");
        if (! this.refFile.canRead())
            throw new FileNotFoundException("Reference file " + this.refFile + " is not found or unreadable.");
        if (this.taxFile != null && ! this.taxFile.canRead())
            throw new FileNotFoundException("Taxonomy file " + this.taxFile + " is not found or unreadable.");
        log.info("Kmer size is {}.", this.kmerSize);
    }

    /**
     * Validate the matching limits and create the parameter object.  A result limit above the maximum is reduced
     * to the maximum.
     *
     * @param minScore	minimum score for a match
     * @param topN		number of matches to return per query
     * @param maxTop	maximum permissible number of matches per query
     *
     * @return the matching parameters
     *
     * @throws ParseFailureException
     */
    protected MatchParameters computeMatchParms(double minScore, int topN, int maxTop) throws ParseFailureException {
        if (minScore < 0.0 || minScore > 100.0)
            throw new ParseFailureException("Minimum score must be between 0 and 100.");
        if (topN < 1)
            throw new ParseFailureException("Number of matches to return must be at least 1.");
        if (topN > maxTop) {
            log.warn("Number of matches to return reduced from {} to {}.", topN, maxTop);
            topN = maxTop;
        }
        MatchParameters retVal = new MatchParameters(this.kmerSize, minScore, topN);
        log.info("Matching parameters are {}.", retVal);
        return retVal;
    }

    /**
     * Load the reference corpus and build the index.
     *
     * @return the reference index
     *
     * @throws IOException
     */
    protected ReferenceIndex buildIndex() throws IOException {
        SpeciesMetadataProvider metadata;
        if (this.taxFile == null) {
            log.info("No taxonomy file specified.  Species metadata will be unknown.");
            metadata = SpeciesMetadataProvider.empty();
        } else
            metadata = TaxonomyTable.load(this.taxFile);
        ReferenceSource corpus = this.sourceType.create(this.refFile, this.speciesCol, this.seqCol);
        ReferenceIndexBuilder builder = new ReferenceIndexBuilder(this.kmerSize);
        ReferenceIndex retVal = builder.build(corpus, metadata);
        if (retVal.isEmpty())
            log.warn("Reference file {} contains no species.  No query will match.", this.refFile);
        return retVal;
    }

}
