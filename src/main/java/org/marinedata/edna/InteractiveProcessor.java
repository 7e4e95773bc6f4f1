/**
 *
 */
package org.marinedata.edna;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import org.apache.commons.io.input.CloseShieldInputStream;
import org.kohsuke.args4j.Option;
import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;
import org.marinedata.edna.match.SequenceMatcher;
import org.marinedata.edna.match.SequenceValidator;
import org.marinedata.edna.utils.ParseFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This command identifies species for sequences entered one per line.  Each sequence is validated and matched
 * against the reference index, and the results are written in readable form.  Processing stops at end-of-file or
 * when the user enters "quit", "exit", or "q".  Invalid sequences are reported and skipped.
 *
 * The positional parameter is the name of the reference sequence file.
 *
 * The command-line options are as follows.
 *
 * -h	display command usage
 * -v	display more detailed progress messages
 * -o	output file for the results (if not STDOUT)
 * -i	input file of sequences (if not STDIN)
 * -K	kmer size (default 5)
 * -t	type of reference file (TAB or FASTA, default TAB)
 * -m	minimum matching score (default 50.0)
 * -n	maximum number of matches to return (default 5, at most 20)
 *
 * --taxonomy	tab-delimited taxonomy file containing species metadata
 * --speciesCol	index (1-based) or name of the species ID column in a tabbed reference file
 * --seqCol		index (1-based) or name of the sequence column in a tabbed reference file
 *
 */
public class InteractiveProcessor extends ReferenceIndexProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(InteractiveProcessor.class);
    /** matching parameters */
    private MatchParameters parms;
    /** commands that terminate the session */
    private static final Set<String> QUIT_COMMANDS = Set.of("quit", "exit", "q");

    // COMMAND-LINE OPTIONS

    /** minimum matching score */
    @Option(name = "-m", aliases = { "--min", "--minScore" }, metaVar = "70.0", usage = "minimum matching score")
    private double minScore;

    /** number of matches to return */
    @Option(name = "-n", aliases = { "--top" }, metaVar = "10", usage = "maximum number of matches to return")
    private int topN;

    /** input file (if not STDIN) */
    @Option(name = "-i", aliases = { "--input" }, metaVar = "queries.txt", usage = "input file (if not STDIN)")
    private File inFile;

    @Override
    protected void setReporterDefaults() {
        this.initIndexParms();
        this.minScore = MatchParameters.DEFAULT_MIN_SCORE;
        this.topN = MatchParameters.DEFAULT_TOP_N;
        this.inFile = null;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        this.validateIndexParms();
        this.parms = this.computeMatchParms(this.minScore, this.topN, IdentifyProcessor.MAX_TOP);
        if (this.inFile != null && ! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReferenceIndex index = this.buildIndex();
        SequenceMatcher matcher = new SequenceMatcher(index);
        writer.format("Reference index loaded with %d species (kmer size %d).%n", index.size(), index.getKmerSize());
        writer.println("Enter DNA sequences, one per line.  Type 'quit' to exit.");
        writer.flush();
        InputStream inStream;
        if (this.inFile == null)
            inStream = CloseShieldInputStream.wrap(System.in);
        else
            inStream = new FileInputStream(this.inFile);
        int count = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null && ! QUIT_COMMANDS.contains(line.strip().toLowerCase())) {
                if (! line.isBlank()) {
                    this.processLine(line, matcher, writer);
                    count++;
                }
                writer.flush();
                line = reader.readLine();
            }
        }
        log.info("{} sequences processed.", count);
    }

    /**
     * Match a single input sequence and write the results.
     *
     * @param line		input line containing the sequence
     * @param matcher	sequence matcher to use
     * @param writer	output writer
     */
    protected void processLine(String line, SequenceMatcher matcher, PrintWriter writer) {
        try {
            String query = SequenceValidator.validate(line);
            List<ScoredMatch> matches = matcher.match(query, this.parms);
            writer.format("%nSequence length %d.%n", query.length());
            if (matches.isEmpty())
                writer.format("No species matches found above %4.2f%% similarity threshold.%n",
                        this.parms.getMinScore());
            else {
                int rank = 0;
                for (ScoredMatch match : matches) {
                    rank++;
                    writer.format("%d. %s (%s) [%s]%n", rank, match.getScientificName(), match.getCommonName(),
                            match.getSpeciesId());
                    writer.format("   Score: %4.2f%%  Confidence: %s  Phylum: %s%n", match.getScore(),
                            match.getConfidence(), match.getPhylum());
                }
            }
        } catch (ParseFailureException e) {
            writer.format("Error: %s%n", e.getMessage());
        }
    }

}
