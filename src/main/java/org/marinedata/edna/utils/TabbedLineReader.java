/**
 *
 */
package org.marinedata.edna.utils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.StringUtils;

/**
 * This object reads a tab-delimited file with a header line.  Columns can be located by name or by
 * 1-based index, and the data lines are returned through an iterator.  Blank lines are skipped.
 *
 */
public class TabbedLineReader implements Closeable, Iterable<TabbedLineReader.Line> {

    // FIELDS
    /** underlying reader */
    private BufferedReader reader;
    /** column names from the header */
    private String[] labels;
    /** next line to return, or NULL at end-of-file */
    private String nextLine;
    /** number of data lines read */
    private int lineCount;

    /**
     * This represents a single data line.
     */
    public static class Line {

        /** fields in the line */
        private String[] fields;

        private Line(String line) {
            this.fields = StringUtils.splitPreserveAllTokens(line, '\t');
        }

        /**
         * @return the value of the specified field, or an empty string if the line is too short
         *
         * @param idx	0-based index of the field
         */
        public String get(int idx) {
            String retVal = "";
            if (idx >= 0 && idx < this.fields.length)
                retVal = this.fields[idx];
            return retVal;
        }

    }

    /**
     * Open a tab-delimited file for input.
     *
     * @param inFile	file to read
     *
     * @throws IOException
     */
    public TabbedLineReader(File inFile) throws IOException {
        this(new FileInputStream(inFile));
    }

    /**
     * Open a tab-delimited stream for input.
     *
     * @param inStream	stream to read
     *
     * @throws IOException
     */
    public TabbedLineReader(InputStream inStream) throws IOException {
        this.reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8));
        String header = this.reader.readLine();
        if (header == null)
            this.labels = new String[0];
        else
            this.labels = StringUtils.splitPreserveAllTokens(header, '\t');
        this.lineCount = 0;
        this.readAhead();
    }

    /**
     * Read the next non-blank line into the look-ahead buffer.
     *
     * @throws IOException
     */
    private void readAhead() throws IOException {
        this.nextLine = this.reader.readLine();
        while (this.nextLine != null && this.nextLine.isBlank())
            this.nextLine = this.reader.readLine();
    }

    /**
     * Locate a column.  The column specifier can be a 1-based column index or a column name from the header.
     *
     * @param spec	column specifier
     *
     * @return the 0-based index of the column
     *
     * @throws IOException	if the column is not found
     */
    public int findField(String spec) throws IOException {
        int retVal = -1;
        for (int i = 0; retVal < 0 && i < this.labels.length; i++) {
            if (this.labels[i].equals(spec))
                retVal = i;
        }
        if (retVal < 0 && StringUtils.isNumeric(spec)) {
            int idx = Integer.parseInt(spec) - 1;
            if (idx >= 0 && idx < this.labels.length)
                retVal = idx;
        }
        if (retVal < 0)
            throw new IOException("Field \"" + spec + "\" not found in input header.");
        return retVal;
    }

    /**
     * @return the 0-based index of the named column, or -1 if it is not present
     *
     * @param name	column name
     */
    public int findOptionalField(String name) {
        int retVal = -1;
        for (int i = 0; retVal < 0 && i < this.labels.length; i++) {
            if (this.labels[i].equals(name))
                retVal = i;
        }
        return retVal;
    }

    /**
     * @return the column names from the header
     */
    public String[] getLabels() {
        return this.labels;
    }

    /**
     * @return the number of data lines read so far
     */
    public int linesRead() {
        return this.lineCount;
    }

    @Override
    public Iterator<Line> iterator() {
        return new Iterator<Line>() {

            @Override
            public boolean hasNext() {
                return TabbedLineReader.this.nextLine != null;
            }

            @Override
            public Line next() {
                if (TabbedLineReader.this.nextLine == null)
                    throw new NoSuchElementException("Attempt to read past end of tabbed file.");
                Line retVal = new Line(TabbedLineReader.this.nextLine);
                TabbedLineReader.this.lineCount++;
                try {
                    TabbedLineReader.this.readAhead();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return retVal;
            }

        };
    }

    @Override
    public void close() throws IOException {
        this.reader.close();
    }

}
