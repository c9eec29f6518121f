package com.meetinganalyzer.analysis;

import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.analysis.service.ScoreCalculator;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreCalculatorTest {

    @Test
    void parsesDecoratedScores() {
        assertThat(ScoreCalculator.parseScore("8")).hasValue(8);
        assertThat(ScoreCalculator.parseScore(" 7.5 ")).hasValue(8);
        assertThat(ScoreCalculator.parseScore("6.4")).hasValue(6);
        assertThat(ScoreCalculator.parseScore("9/10")).hasValue(9);
        assertThat(ScoreCalculator.parseScore("Score: 4")).hasValue(4);
        assertThat(ScoreCalculator.parseScore("70%")).hasValue(10);
        assertThat(ScoreCalculator.parseScore("-2")).hasValue(0);
    }

    @Test
    void unparsableScoresAreEmpty() {
        assertThat(ScoreCalculator.parseScore("N/A")).isEmpty();
        assertThat(ScoreCalculator.parseScore("good")).isEmpty();
        assertThat(ScoreCalculator.parseScore("")).isEmpty();
        assertThat(ScoreCalculator.parseScore(null)).isEmpty();
    }

    @Test
    void rewritesSubScoresAndTotals() {
        CanonicalRecord record = CanonicalRecord.of(Map.of(
                CanonicalSchema.OPENING_PITCH_SCORE, "8.0",
                CanonicalSchema.PRODUCT_PITCH_SCORE, "7",
                CanonicalSchema.CROSS_SELL, "9",
                CanonicalSchema.CLOSING_EFFECTIVENESS, "6",
                CanonicalSchema.NEGOTIATION_STRENGTH, "12"
        ));

        CanonicalRecord scored = ScoreCalculator.apply(record);

        assertThat(scored.get(CanonicalSchema.OPENING_PITCH_SCORE)).isEqualTo("8");
        assertThat(scored.get(CanonicalSchema.NEGOTIATION_STRENGTH)).isEqualTo("10");
        assertThat(scored.get(CanonicalSchema.TOTAL_SCORE)).isEqualTo("40");
        assertThat(scored.get(CanonicalSchema.PERCENT_SCORE)).isEqualTo("80.0%");
    }

    @Test
    void percentageKeepsOneDecimal() {
        CanonicalRecord record = CanonicalRecord.of(Map.of(
                CanonicalSchema.OPENING_PITCH_SCORE, "3",
                CanonicalSchema.PRODUCT_PITCH_SCORE, "3",
                CanonicalSchema.CROSS_SELL, "3",
                CanonicalSchema.CLOSING_EFFECTIVENESS, "3",
                CanonicalSchema.NEGOTIATION_STRENGTH, "4"
        ));

        CanonicalRecord scored = ScoreCalculator.apply(record);

        assertThat(scored.get(CanonicalSchema.TOTAL_SCORE)).isEqualTo("16");
        assertThat(scored.get(CanonicalSchema.PERCENT_SCORE)).isEqualTo("32.0%");
    }

    @Test
    void emptyRecordStaysEmpty() {
        assertThat(ScoreCalculator.apply(CanonicalRecord.empty()).isEmpty()).isTrue();
    }
}
