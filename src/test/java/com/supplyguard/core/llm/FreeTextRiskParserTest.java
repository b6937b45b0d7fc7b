package com.supplyguard.core.llm;

import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FreeTextRiskParserTest {

    @Test
    @DisplayName("severity words set the level and the whole text is the summary")
    void severity() {
        var score = FreeTextRiskParser.parse("This is a critical situation for suppliers.", RiskDimension.POLITICAL);

        assertEquals(RiskLevel.CRITICAL, score.level());
        assertEquals(85.0, score.score());
        assertEquals("This is a critical situation for suppliers.", score.summary());
        assertEquals(Provenance.AI, score.provenance());
        assertTrue(score.hasCondition(RiskCondition.FREE_TEXT_RESPONSE));
        assertEquals(FreeTextRiskParser.FREE_TEXT_CONFIDENCE, score.confidence());
    }

    @Test
    @DisplayName("text without severity words is medium")
    void defaultMedium() {
        var score = FreeTextRiskParser.parse("Conditions are mixed.", RiskDimension.LOGISTICS);

        assertEquals(RiskLevel.MEDIUM, score.level());
        assertEquals(50.0, score.score());
    }

    @Test
    @DisplayName("recommendation lines are extracted without bullets")
    void recommendations() {
        String text = """
                Risk is low overall.
                - We recommend a second supplier.
                2. You should check port capacity.
                Nothing else to add.
                """;

        var score = FreeTextRiskParser.parse(text, RiskDimension.LOGISTICS);

        assertEquals(RiskLevel.LOW, score.level());
        assertEquals(List.of("We recommend a second supplier.", "You should check port capacity."),
                score.recommendations());
    }

    @Test
    @DisplayName("null text parses to an empty medium answer")
    void nullText() {
        var score = FreeTextRiskParser.parse(null, RiskDimension.TARIFF);

        assertEquals("", score.summary());
        assertEquals(RiskLevel.MEDIUM, score.level());
    }
}
