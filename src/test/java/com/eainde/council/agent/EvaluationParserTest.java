package com.eainde.council.agent;

import com.eainde.council.gateway.SchemaViolationException;
import com.eainde.council.model.Recommendation;
import org.junit.jupiter.api.Test;

import static com.eainde.council.CouncilFixtures.evaluationJson;
import static com.eainde.council.CouncilFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationParserTest {

    private final EvaluationParser parser = new EvaluationParser();

    @Test
    void parsesWellFormedEvaluation() {
        EvaluationDraft draft = parser.parse(evaluationJson(0.8, "approve", 0.9));

        assertThat(draft.score()).isEqualTo(0.8);
        assertThat(draft.recommendation()).isEqualTo(Recommendation.APPROVE);
        assertThat(draft.confidence()).isEqualTo(0.9);
        assertThat(draft.strengths()).containsExactly("clear plan");
        assertThat(draft.questions()).isEmpty();
        assertThat(draft.revisionRationale()).isEqualTo("Peers raised nothing new.");
    }

    @Test
    void scoreOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> parser.parse(evaluationJson(1.4, "approve", 0.9)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("score");
    }

    @Test
    void textualScoreIsRejected() {
        String text = """
                {"score": "0.8", "recommendation": "approve", "confidence": 0.9, "rationale": "ok",
                 "strengths": [], "concerns": [], "questions": []}
                """;

        assertThatThrownBy(() -> parser.parse(json(text)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("must be a number");
    }

    @Test
    void unknownRecommendationIsRejected() {
        assertThatThrownBy(() -> parser.parse(evaluationJson(0.5, "maybe", 0.5)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("recommendation");
    }

    @Test
    void blankRationaleIsRejected() {
        String text = """
                {"score": 0.5, "recommendation": "reject", "confidence": 0.5, "rationale": "  ",
                 "strengths": [], "concerns": [], "questions": []}
                """;

        assertThatThrownBy(() -> parser.parse(json(text)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("rationale");
    }

    @Test
    void nonStringListItemsAreRejected() {
        String text = """
                {"score": 0.5, "recommendation": "reject", "confidence": 0.5, "rationale": "ok",
                 "strengths": [1, 2], "concerns": [], "questions": []}
                """;

        assertThatThrownBy(() -> parser.parse(json(text)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("strengths");
    }
}
