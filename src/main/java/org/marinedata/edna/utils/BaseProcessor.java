/**
 *
 */
package org.marinedata.edna.utils;

import java.io.IOException;
import java.time.Duration;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all the command processors.  The subclass declares its parameters using args4j
 * annotations.  Parsing happens in {@link #parseCommand(String[])}, which fills in the defaults, parses the
 * command line, and asks the subclass to validate the result.  If parsing succeeds, {@link #run()} executes
 * the command and records whether or not it failed.
 *
 * The following command-line options are common to all processors.
 *
 * -h	display command usage
 * -v	display more detailed progress messages
 *
 */
public abstract class BaseProcessor implements Runnable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the last run failed */
    private boolean failed;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command usage")
    private boolean helpMode;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command line parameters.
     *
     * @param args	command-line parameters
     *
     * @return TRUE if the command is ready to run, else FALSE
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.helpMode = false;
        this.debug = false;
        this.failed = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.helpMode) {
                parser.printUsage(System.err);
            } else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger rootLogger =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    rootLogger.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.failed = true;
        } catch (IOException e) {
            log.error("Error processing parameters: {}", e.toString());
            this.failed = true;
        }
        return retVal;
    }

    @Override
    public void run() {
        long start = System.currentTimeMillis();
        try {
            this.runCommand();
            if (log.isInfoEnabled()) {
                Duration duration = Duration.ofMillis(System.currentTimeMillis() - start);
                log.info("{} to run command.", duration);
            }
        } catch (Exception e) {
            log.error("Command failed.", e);
            this.failed = true;
        }
    }

    /**
     * @return TRUE if the command failed during parsing or execution
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options.
     *
     * @return TRUE if the command should run, FALSE if it should be skipped
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
