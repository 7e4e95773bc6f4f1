package org.marinedata.edna.kmers;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for DNA kmer profiles.
 */
class KmerProfileTest {

    @Test
    void testSlidingWindow() {
        KmerProfile profile = KmerProfile.of("ATGCGATCG", 5);
        assertThat(profile.size(), equalTo(5));
        assertThat(profile.totalCount(), equalTo(5L));
        assertThat(profile.kmers(), containsInAnyOrder("ATGCG", "TGCGA", "GCGAT", "CGATC", "GATCG"));
        assertThat(profile.getKmerSize(), equalTo(5));
        assertThat(profile.getCount("ATGCG"), equalTo(1));
        assertThat(profile.getCount("AAAAA"), equalTo(0));
        assertThat(profile.contains("GATCG"), equalTo(true));
        assertThat(profile.contains("ATCGA"), equalTo(false));
    }

    @Test
    void testRepeats() {
        KmerProfile profile = KmerProfile.of("AAAAAAAAAAA", 5);
        assertThat(profile.size(), equalTo(1));
        assertThat(profile.getCount("AAAAA"), equalTo(7));
        assertThat(profile.totalCount(), equalTo(7L));
        profile = KmerProfile.of("ACGACGACG", 3);
        assertThat(profile.getCount("ACG"), equalTo(3));
        assertThat(profile.getCount("CGA"), equalTo(2));
        assertThat(profile.getCount("GAC"), equalTo(2));
        assertThat(profile.size(), equalTo(3));
    }

    @Test
    void testInvalidCharacters() {
        // N breaks the window, so nothing spanning it survives.
        KmerProfile profile = KmerProfile.of("ACGTNACGT", 4);
        assertThat(profile.size(), equalTo(1));
        assertThat(profile.getCount("ACGT"), equalTo(2));
        for (String kmer : profile)
            assertThat(kmer, not(containsString("N")));
        profile = KmerProfile.of("ACGXTTGCA-GGG", 3);
        assertThat(profile.kmers(), containsInAnyOrder("ACG", "TTG", "TGC", "GCA", "GGG"));
        profile = KmerProfile.of("NNNNNNNN", 3);
        assertThat(profile.isEmpty(), equalTo(true));
    }

    @Test
    void testNormalization() {
        KmerProfile upper = KmerProfile.of("ATGCGATCG", 5);
        KmerProfile lower = KmerProfile.of("  atgcgatcg\n", 5);
        KmerProfile mixed = KmerProfile.of("AtGcGaTcG", 5);
        assertThat(lower, equalTo(upper));
        assertThat(mixed, equalTo(upper));
        assertThat(mixed.hashCode(), equalTo(upper.hashCode()));
        assertThat(KmerProfile.normalize(" acgt\t"), equalTo("ACGT"));
    }

    @Test
    void testShortSequences() {
        assertThat(KmerProfile.of("ACGT", 5).isEmpty(), equalTo(true));
        assertThat(KmerProfile.of("", 5).isEmpty(), equalTo(true));
        assertThat(KmerProfile.of("ACGTA", 5).size(), equalTo(1));
        KmerProfile empty = KmerProfile.empty(5);
        assertThat(empty.size(), equalTo(0));
        assertThat(empty.totalCount(), equalTo(0L));
        assertThat(empty, equalTo(KmerProfile.of("AC", 5)));
    }

    @Test
    void testBuilder() {
        KmerProfile.Builder builder = new KmerProfile.Builder(5);
        assertThat(builder.add("ATGCGATCG"), equalTo(5));
        assertThat(builder.add("ATGCGA"), equalTo(2));
        assertThat(builder.add(null), equalTo(0));
        assertThat(builder.add("NNNNNNN"), equalTo(0));
        KmerProfile profile = builder.build();
        assertThat(profile.getCount("ATGCG"), equalTo(2));
        assertThat(profile.getCount("TGCGA"), equalTo(2));
        assertThat(profile.getCount("GATCG"), equalTo(1));
        assertThat(profile.totalCount(), equalTo(7L));
        // The builder can keep going after a build without changing the built profile.
        builder.addAll(KmerProfile.of("CGATCGATT", 5));
        KmerProfile bigger = builder.build();
        assertThat(profile.getCount("CGATC"), equalTo(1));
        assertThat(bigger.getCount("CGATC"), equalTo(2));
        assertThat(bigger.getCount("CGATT"), equalTo(1));
        assertThat(bigger.totalCount(), equalTo(12L));
        assertThrows(IllegalArgumentException.class, () -> builder.addAll(KmerProfile.of("ACGTACGT", 4)));
    }

    @Test
    void testImmutable() {
        KmerProfile profile = KmerProfile.of("ATGCGATCG", 5);
        assertThrows(UnsupportedOperationException.class, () -> profile.kmers().clear());
    }

    @Test
    void testBadKmerSize() {
        assertThrows(IllegalArgumentException.class, () -> KmerProfile.of("ACGT", 0));
        assertThrows(IllegalArgumentException.class, () -> KmerProfile.empty(-1));
        assertThrows(IllegalArgumentException.class, () -> new KmerProfile.Builder(0));
    }

}
