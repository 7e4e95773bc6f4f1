/**
 *
 */
package org.marinedata.edna.utils;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.output.CloseShieldOutputStream;
import org.kohsuke.args4j.Option;

/**
 * This is the base class for processors that produce a report.  The report goes to the standard output unless
 * an output file is specified.
 *
 * The following command-line options are supported in addition to the ones in the base class.
 *
 * -o	output file for the report (if not STDOUT)
 *
 */
public abstract class BaseReportProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "report.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (this.outFile != null) {
            File parent = this.outFile.getAbsoluteFile().getParentFile();
            if (parent != null && ! parent.isDirectory())
                throw new FileNotFoundException("Output directory " + parent + " is not found or invalid.");
            log.info("Report will be written to {}.", this.outFile);
        }
        this.validateReporterParms();
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        OutputStream outStream;
        if (this.outFile == null)
            outStream = CloseShieldOutputStream.wrap(System.out);
        else
            outStream = new FileOutputStream(this.outFile);
        try (PrintWriter writer = new PrintWriter(new OutputStreamWriter(outStream, StandardCharsets.UTF_8))) {
            this.runReporter(writer);
        }
    }

    /**
     * Set the default values of the subclass options.
     */
    protected abstract void setReporterDefaults();

    /**
     * Validate the subclass options.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    /**
     * Produce the report.
     *
     * @param writer	print writer for the report output
     *
     * @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
