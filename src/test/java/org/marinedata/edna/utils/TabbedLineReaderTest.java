package org.marinedata.edna.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for the tab-delimited file reader.
 */
class TabbedLineReaderTest {

    /**
     * @return a reader for the specified text
     *
     * @param text	text to read
     */
    private static TabbedLineReader readerFor(String text) throws IOException {
        return new TabbedLineReader(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testFields() throws IOException {
        try (TabbedLineReader reader = readerFor("id\tname\tvalue\na\tAlpha\t1\n\nb\t\t2\nc\n")) {
            assertThat(reader.getLabels(), arrayContaining("id", "name", "value"));
            assertThat(reader.findField("name"), equalTo(1));
            assertThat(reader.findField("3"), equalTo(2));
            assertThat(reader.findOptionalField("missing"), equalTo(-1));
            assertThrows(IOException.class, () -> reader.findField("missing"));
            assertThrows(IOException.class, () -> reader.findField("4"));
            List<String> names = new ArrayList<String>();
            List<String> values = new ArrayList<String>();
            for (TabbedLineReader.Line line : reader) {
                names.add(line.get(1));
                values.add(line.get(2));
            }
            // The blank line is skipped, and short lines fill with empty strings.
            assertThat(names, contains("Alpha", "", ""));
            assertThat(values, contains("1", "2", ""));
            assertThat(reader.linesRead(), equalTo(3));
        }
    }

    @Test
    void testEmptyInput() throws IOException {
        try (TabbedLineReader reader = readerFor("")) {
            assertThat(reader.getLabels().length, equalTo(0));
            assertThat(reader.iterator().hasNext(), equalTo(false));
        }
    }

    @Test
    void testFile() throws IOException {
        try (TabbedLineReader reader = new TabbedLineReader(new File("data", "taxonomy.tbl"))) {
            int idIdx = reader.findField("species_id");
            int genusIdx = reader.findField("genus");
            int count = 0;
            for (TabbedLineReader.Line line : reader) {
                count++;
                assertThat(line.get(idIdx), startsWith("sp_"));
                if (line.get(idIdx).equals("sp_104"))
                    assertThat(line.get(genusIdx), emptyString());
            }
            assertThat(count, equalTo(6));
        }
    }

}
