package org.marinedata.edna.index;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for loading reference corpora.
 */
class ReferenceSourceTest {

    /** temporary directory for generated corpus files */
    @TempDir
    File tempDir;

    /**
     * @return the records in a reference corpus, as a list
     *
     * @param corpus	corpus to list
     */
    private static List<ReferenceRecord> listOf(ReferenceSource corpus) {
        List<ReferenceRecord> retVal = new ArrayList<ReferenceRecord>();
        for (ReferenceRecord record : corpus)
            retVal.add(record);
        return retVal;
    }

    @Test
    void testTabbedFile() throws IOException {
        File refFile = new File("data", "reference.tbl");
        ReferenceSource corpus = ReferenceSource.Type.TAB.create(refFile, TabbedReferenceSource.DEFAULT_SPECIES_COL,
                TabbedReferenceSource.DEFAULT_SEQ_COL);
        assertThat(corpus, instanceOf(TabbedReferenceSource.class));
        // The line with no species ID is skipped.
        assertThat(corpus.size(), equalTo(7));
        List<ReferenceRecord> records = listOf(corpus);
        ReferenceRecord first = records.get(0);
        assertThat(first.getSequenceId(), equalTo("ref_001"));
        assertThat(first.getSpeciesId(), equalTo("sp_101"));
        assertThat(first.getSequence(), equalTo("GACTGGAGCAGTGGAATGCTACTGAGG"));
        assertThat(records.get(3).getSpeciesId(), equalTo("sp_101"));
        assertThat(records.get(4).getSequenceId(), equalTo("ref_006"));
        // The sequence text is kept as is; normalization happens during profiling.
        assertThat(records.get(2).getSequence(), startsWith("aattcatt"));
        assertThat(corpus.toString(), containsString("reference.tbl"));
    }

    @Test
    void testTabbedColumnIndexes() throws IOException {
        ReferenceSource corpus = new TabbedReferenceSource(new File("data", "reference.tbl"), "2", "3");
        assertThat(corpus.size(), equalTo(7));
        assertThat(listOf(corpus).get(1).getSpeciesId(), equalTo("sp_102"));
        assertThrows(IOException.class,
                () -> new TabbedReferenceSource(new File("data", "reference.tbl"), "species", "sequence"));
    }

    @Test
    void testFastaFile() throws IOException {
        ReferenceSource corpus = ReferenceSource.Type.FASTA.create(new File("data", "reference.fa"), null, null);
        assertThat(corpus, instanceOf(FastaReferenceSource.class));
        assertThat(corpus.size(), equalTo(5));
        List<ReferenceRecord> records = listOf(corpus);
        assertThat(records.get(0).getSequenceId(), equalTo("ref_001"));
        assertThat(records.get(0).getSpeciesId(), equalTo("sp_101"));
        // Multi-line sequences are joined.
        assertThat(records.get(1).getSequence(),
                equalTo("CGAGCGTAGCGGCGTGAGAGTCATTGTCGCGCAAGCAGGGCCCGCCCTATACGGAAGAAA"));
        // With no species in the label, the sequence ID is the species ID.
        ReferenceRecord last = records.get(4);
        assertThat(last.getSequenceId(), equalTo("sp_104"));
        assertThat(last.getSpeciesId(), equalTo("sp_104"));
        assertThat(last.getSequence().length(), equalTo(60));
    }

    @Test
    void testFastaMatchesTabbed() throws IOException {
        ReferenceIndexBuilder builder = new ReferenceIndexBuilder();
        ReferenceIndex fastaIndex = builder.build(new FastaReferenceSource(new File("data", "reference.fa")),
                SpeciesMetadataProvider.empty());
        ReferenceIndex tabIndex = builder.build(new TabbedReferenceSource(new File("data", "reference.tbl")),
                SpeciesMetadataProvider.empty());
        for (String speciesId : fastaIndex.getSpeciesIds())
            assertThat(speciesId, fastaIndex.getProfile(speciesId), equalTo(tabIndex.getProfile(speciesId)));
    }

    @Test
    void testFastaLabels() throws IOException {
        File faFile = new File(this.tempDir, "labels.fa");
        FileUtils.writeStringToFile(faFile, ">  seq_A   sp_900  extra words\nacgtacgt\nACGT\n>seq_B\nGGGG\n>seq_C sp_900\nTTTT\n",
                StandardCharsets.UTF_8);
        List<ReferenceRecord> records = listOf(new FastaReferenceSource(faFile));
        assertThat(records.size(), equalTo(3));
        assertThat(records.get(0).getSequenceId(), equalTo("seq_A"));
        assertThat(records.get(0).getSpeciesId(), equalTo("sp_900"));
        assertThat(records.get(0).getSequence(), equalTo("acgtacgtACGT"));
        assertThat(records.get(1).getSpeciesId(), equalTo("seq_B"));
        assertThat(records.get(1).getSequence(), equalTo("GGGG"));
        assertThat(records.get(2).getSpeciesId(), equalTo("sp_900"));
        // Sequence data with no label is a format error.
        File badFile = new File(this.tempDir, "bad.fa");
        FileUtils.writeStringToFile(badFile, "ACGTACGT\n>seq_A\nACGT\n", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> new FastaReferenceSource(badFile));
    }

    @Test
    void testMissingFile() {
        assertThrows(FileNotFoundException.class,
                () -> ReferenceSource.Type.TAB.create(new File("data", "nosuch.tbl"), "1", "2"));
        assertThrows(FileNotFoundException.class, () -> new FastaReferenceSource(new File("data", "nosuch.fa")));
    }

}
