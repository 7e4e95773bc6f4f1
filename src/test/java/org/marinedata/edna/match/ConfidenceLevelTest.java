package org.marinedata.edna.match;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

/**
 * Tests for confidence classification.
 */
class ConfidenceLevelTest {

    @Test
    void testBands() {
        assertThat(ConfidenceLevel.classify(100.0), equalTo(ConfidenceLevel.HIGH));
        assertThat(ConfidenceLevel.classify(85.0), equalTo(ConfidenceLevel.HIGH));
        assertThat(ConfidenceLevel.classify(84.999), equalTo(ConfidenceLevel.MEDIUM));
        assertThat(ConfidenceLevel.classify(70.0), equalTo(ConfidenceLevel.MEDIUM));
        assertThat(ConfidenceLevel.classify(69.99), equalTo(ConfidenceLevel.LOW));
        assertThat(ConfidenceLevel.classify(50.0), equalTo(ConfidenceLevel.LOW));
        assertThat(ConfidenceLevel.classify(49.999), equalTo(ConfidenceLevel.VERY_LOW));
        assertThat(ConfidenceLevel.classify(0.0), equalTo(ConfidenceLevel.VERY_LOW));
    }

    @Test
    void testLabels() {
        assertThat(ConfidenceLevel.HIGH.getLabel(), equalTo("high"));
        assertThat(ConfidenceLevel.MEDIUM.getLabel(), equalTo("medium"));
        assertThat(ConfidenceLevel.LOW.getLabel(), equalTo("low"));
        assertThat(ConfidenceLevel.VERY_LOW.toString(), equalTo("very_low"));
        assertThat(ConfidenceLevel.MEDIUM.getMinScore(), equalTo(70.0));
    }

}
