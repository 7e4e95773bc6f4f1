package org.marinedata.edna.batch;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.marinedata.edna.index.ReferenceIndex;
import org.marinedata.edna.index.ReferenceIndexBuilder;
import org.marinedata.edna.index.TabbedReferenceSource;
import org.marinedata.edna.index.TaxonomyTable;
import org.marinedata.edna.match.MatchParameters;
import org.marinedata.edna.match.ScoredMatch;
import org.marinedata.edna.match.SequenceMatcher;

/**
 * Tests for batch matching.
 */
class BatchRunnerTest {

    /** matcher for the marine reference fixture */
    private static SequenceMatcher matcher;

    @BeforeAll
    static void setup() throws IOException {
        ReferenceIndex index = new ReferenceIndexBuilder().build(
                new TabbedReferenceSource(new File("data", "reference.tbl")),
                TaxonomyTable.load(new File("data", "taxonomy.tbl")));
        matcher = new SequenceMatcher(index);
    }

    @Test
    void testBatchFile() throws IOException {
        List<BatchQuery> queries = BatchQueryFile.load(new File("data", "batch.json"));
        BatchRun run = new BatchRunner(matcher, new MatchParameters()).run(queries);
        assertThat(run.size(), equalTo(5));
        List<BatchResult> results = run.getResults();
        BatchResult dolphin = results.get(0);
        assertThat(dolphin.getId(), equalTo("dolphin_pod"));
        assertThat(dolphin.isSuccessful(), equalTo(true));
        assertThat(dolphin.getBestMatch().getSpeciesId(), equalTo("sp_102"));
        assertThat(dolphin.isCorrect(), equalTo(true));
        assertThat(dolphin.getMetadata().get("location"), equalTo("Monterey Bay"));
        BatchResult cod = results.get(1);
        assertThat(cod.getBestMatch().getSpeciesId(), equalTo("sp_103"));
        assertThat(cod.isCorrect(), equalTo(true));
        // The third query has no ID, so it gets one from its position.
        BatchResult mussel = results.get(2);
        assertThat(mussel.getId(), equalTo("seq_3"));
        assertThat(mussel.getBestMatch().getSpeciesId(), equalTo("sp_104"));
        assertThat(mussel.hasExpectation(), equalTo(true));
        assertThat(mussel.isCorrect(), equalTo(false));
        BatchResult blank = results.get(3);
        assertThat(blank.isError(), equalTo(true));
        assertThat(blank.getError(), equalTo(BatchRunner.EMPTY_ERROR));
        assertThat(blank.getMatches(), empty());
        assertThat(blank.getBestMatch(), nullValue());
        BatchResult polyA = results.get(4);
        assertThat(polyA.isError(), equalTo(false));
        assertThat(polyA.isSuccessful(), equalTo(false));
        assertThat(polyA.getMatches(), empty());
        assertThat(polyA.getDescription(), equalTo("homopolymer control"));
        BatchSummary summary = run.getSummary();
        assertThat(summary.getTotal(), equalTo(5));
        assertThat(summary.getSuccessful(), equalTo(3));
        assertThat(summary.getFailed(), equalTo(2));
        assertThat(summary.getSuccessRate(), closeTo(60.0, 1e-9));
        assertThat(summary.hasAccuracy(), equalTo(true));
        assertThat(summary.getExpected(), equalTo(3));
        assertThat(summary.getCorrect(), equalTo(2));
        assertThat(summary.getAccuracy(), closeTo(200.0 / 3.0, 1e-9));
        Map<String, List<ScoredMatch>> resultMap = run.asMap();
        assertThat(resultMap.keySet(), contains("dolphin_pod", "cod_partial", "seq_3", "blank_sample", "poly_a"));
    }

    @Test
    void testIndependence() {
        String dolphin = "CGAGCGTAGCGGCGTGAGAGTCATTGTCGCGCAAGCAGGGCCCGCCCTATACGGAAGAAA";
        String cod = "AATTCATTGTGCTCGCTCGGAACACCGGCCCCATTAAGAAATCTGTT";
        List<BatchQuery> queries = List.of(new BatchQuery("a", dolphin), new BatchQuery("b", cod),
                new BatchQuery("c", dolphin));
        BatchRun run = new BatchRunner(matcher, 3, 0.0).run(queries);
        List<ScoredMatch> single = matcher.match(cod, 3, 0.0);
        List<ScoredMatch> batched = run.getResults().get(1).getMatches();
        assertThat(batched.size(), equalTo(single.size()));
        for (int i = 0; i < single.size(); i++) {
            assertThat(batched.get(i).getSpeciesId(), equalTo(single.get(i).getSpeciesId()));
            assertThat(batched.get(i).getScore(), equalTo(single.get(i).getScore()));
        }
        assertThat(run.getResults().get(0).getMatches().size(), equalTo(3));
        assertThat(run.getResults().get(2).getBestMatch().getScore(), equalTo(100.0));
        assertThat(run.getSummary().hasAccuracy(), equalTo(false));
        assertThat(run.getSummary().getAccuracy(), equalTo(0.0));
    }

    @Test
    void testDuplicateIds() {
        String dolphin = "CGAGCGTAGCGGCGTGAGAGTCATTGTCGCGCAAGCAGGGCCCGCCCTATACGGAAGAAA";
        List<BatchQuery> queries = List.of(new BatchQuery("dup", dolphin), new BatchQuery("dup", "AAAAAAAAAA"));
        BatchRun run = new BatchRunner(matcher, new MatchParameters()).run(queries);
        // Both results are kept in the list, but the map holds only the last one.
        assertThat(run.size(), equalTo(2));
        assertThat(run.getSummary().getTotal(), equalTo(2));
        Map<String, List<ScoredMatch>> resultMap = run.asMap();
        assertThat(resultMap.size(), equalTo(1));
        assertThat(resultMap.get("dup"), empty());
    }

    @Test
    void testParallel() {
        String[] seqs = new String[] { "CGAGCGTAGCGGCGTGAGAGTCATTGTCGCGCAAGCAGGGCCCGCCCTATACGGAAGAAA",
                "TCCAGCAGAGTGTCCTGGACAAGGTGGACGTACCTATGAGCAGTTAAGGGTAACTGGCTA",
                "AGACCTTTACTGTCCTGCTGGACAAAACTATCCGAATTAGCCTGCCTGCCGACTAGACTT", "", "ACGT" };
        List<BatchQuery> queries = new ArrayList<BatchQuery>();
        for (int i = 0; i < 40; i++)
            queries.add(new BatchQuery(null, seqs[i % seqs.length]));
        BatchRun serial = new BatchRunner(matcher, 5, 0.0).run(queries);
        BatchRun parallel = new BatchRunner(matcher, 5, 0.0).setParallel(true).run(queries);
        assertThat(parallel.size(), equalTo(40));
        for (int i = 0; i < 40; i++) {
            BatchResult s = serial.getResults().get(i);
            BatchResult p = parallel.getResults().get(i);
            assertThat(p.getId(), equalTo("seq_" + (i + 1)));
            assertThat(p.getId(), equalTo(s.getId()));
            assertThat(p.isError(), equalTo(s.isError()));
            assertThat(p.getMatches().size(), equalTo(s.getMatches().size()));
            if (! s.getMatches().isEmpty())
                assertThat(p.getBestMatch().getSpeciesId(), equalTo(s.getBestMatch().getSpeciesId()));
        }
        assertThat(parallel.getSummary().getSuccessful(), equalTo(serial.getSummary().getSuccessful()));
    }

    @Test
    void testProcessingFailure() {
        SequenceMatcher broken = new SequenceMatcher(matcher.getIndex()) {
            @Override
            public List<ScoredMatch> match(String query, int topN, double minScore) {
                if (query.startsWith("T"))
                    throw new IllegalStateException("index unavailable");
                return super.match(query, topN, minScore);
            }
        };
        List<BatchQuery> queries = List.of(new BatchQuery("x", "ACGTACGTAC"), new BatchQuery("y", "TTGCATTGCA"),
                new BatchQuery("z", "CGAGCGTAGCGGCGTGAGAGTCATTGTCGCGCAAGCAGGGCCCGCCCTATACGGAAGAAA"));
        BatchRun run = new BatchRunner(broken, new MatchParameters()).run(queries);
        // One failure does not stop the batch.
        assertThat(run.getResults().get(0).isError(), equalTo(false));
        assertThat(run.getResults().get(1).getError(), equalTo("Processing failed: index unavailable"));
        assertThat(run.getResults().get(2).getBestMatch().getSpeciesId(), equalTo("sp_102"));
        assertThat(run.getSummary().getFailed(), equalTo(2));
    }

}
