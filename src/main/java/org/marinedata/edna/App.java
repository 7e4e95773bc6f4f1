package org.marinedata.edna;

import java.util.Arrays;

import org.marinedata.edna.utils.BaseProcessor;

/**
 * These are commands for identifying marine species from environmental DNA sequences.
 *
 * identify		find the species that best match a single DNA sequence
 * batch		find the best-matching species for each sequence in a JSON batch file
 * interactive	find the best-matching species for sequences entered one per line
 * stats		display the kmer profile statistics for a reference file
 *
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("Command required: identify, batch, interactive, or stats.");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Parse the parameters.
        switch (command) {
        case "identify" :
            processor = new IdentifyProcessor();
            break;
        case "batch" :
            processor = new BatchProcessor();
            break;
        case "interactive" :
            processor = new InteractiveProcessor();
            break;
        case "stats" :
            processor = new StatsProcessor();
            break;
        default :
            throw new IllegalArgumentException("Invalid command " + command);
        }
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
        if (processor.isFailed())
            System.exit(1);
    }
}
