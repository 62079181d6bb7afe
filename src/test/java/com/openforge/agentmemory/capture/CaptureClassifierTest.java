package com.openforge.agentmemory.capture;

import com.openforge.agentmemory.memory.MemoryCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CaptureClassifier Tests")
class CaptureClassifierTest {

    private final CaptureClassifier classifier = new CaptureClassifier(CaptureProperties.defaults());

    @Nested
    @DisplayName("categories")
    class Categories {

        @ParameterizedTest(name = "[{index}] {0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "Actually, the port is 6333 not 6334      | CORRECTION",
                "I prefer dark mode in every editor       | PREFERENCE",
                "We decided to use Postgres for storage   | DECISION",
                "Decided to use batching for all writes.  | DECISION",
                "I realized the cache was stale all along | LEARNING",
                "Remember the deploy window is Friday     | CONTEXT",
                "Call me at +420123456789 tomorrow        | CONTEXT",
                "Reach me at dev@example.com anytime      | CONTEXT",
                "My timezone is Central European Time     | CONTEXT",
                "It is important to run the migrations    | CONTEXT"
        })
        @DisplayName("Should assign the category of the first matching trigger")
        void shouldAssignCategory(String text, MemoryCategory expected) {
            CaptureDecision decision = classifier.classify(text);

            assertThat(decision.capture()).isTrue();
            assertThat(decision.category()).isEqualTo(expected);
            assertThat(decision.reason()).isNull();
        }

        @Test
        @DisplayName("Correction language wins over preference language")
        void correctionWinsOverPreference() {
            CaptureDecision decision = classifier.classify("Actually, that's wrong. I prefer tabs over spaces.");

            assertThat(decision.category()).isEqualTo(MemoryCategory.CORRECTION);
        }

        @Test
        @DisplayName("Preference language wins over decision language")
        void preferenceWinsOverDecision() {
            CaptureDecision decision = classifier.classify("We decided on Java because I love records.");

            assertThat(decision.category()).isEqualTo(MemoryCategory.PREFERENCE);
        }

        @Test
        @DisplayName("Categorizing triggers are ordered by precedence")
        void triggerTableIsOrderedByPrecedence() {
            assertThat(CaptureTrigger.TABLE)
                    .filteredOn(t -> t.category() != null)
                    .extracting(CaptureTrigger::category)
                    .containsExactly(MemoryCategory.CORRECTION, MemoryCategory.PREFERENCE,
                            MemoryCategory.DECISION, MemoryCategory.LEARNING);
        }
    }

    @Nested
    @DisplayName("gates")
    class Gates {

        @Test
        @DisplayName("Should reject text below the minimum length")
        void shouldRejectShortText() {
            assertThat(classifier.shouldCapture("ok ok ok")).isFalse();
            assertThat(classifier.classify("never").reason()).startsWith("Content too short");
        }

        @Test
        @DisplayName("Should reject text above the maximum length")
        void shouldRejectLongText() {
            String text = "remember this ".repeat(72).substring(0, 1000);

            assertThat(text).hasSize(1000);
            assertThat(classifier.classify(text).reason()).startsWith("Content too long");
        }

        @Test
        @DisplayName("Should never re-capture injected memory blocks")
        void shouldRejectInjectedMemoryBlock() {
            assertThat(classifier.shouldCapture(CaptureClassifier.INJECTED_MEMORY_MARKER)).isFalse();
            assertThat(classifier.shouldCapture(
                    "Context: <relevant-memories>\n- [preference] I prefer tabs\n</relevant-memories>"))
                    .isFalse();
        }

        @Test
        @DisplayName("Should reject markup")
        void shouldRejectMarkup() {
            assertThat(classifier.classify("<div>I prefer tabs</div>").reason()).isEqualTo("Content looks like markup");
        }

        @Test
        @DisplayName("Should reject formatted lists")
        void shouldRejectFormattedList() {
            assertThat(classifier.classify("**Summary**\n- I prefer tabs\n- always lint").reason())
                    .isEqualTo("Content looks like a formatted list");
        }

        @Test
        @DisplayName("Should reject emoji-dense text")
        void shouldRejectEmojiDenseText() {
            assertThat(classifier.shouldCapture("I love this 😀😀😀😀"))
                    .isFalse();
            assertThat(classifier.shouldCapture("I love this 😀😀😀"))
                    .isTrue();
        }

        @Test
        @DisplayName("Should reject text without any trigger")
        void shouldRejectUntriggeredText() {
            CaptureDecision decision = classifier.classify("The weather is mild today");

            assertThat(decision.capture()).isFalse();
            assertThat(decision.category()).isNull();
            assertThat(decision.reason()).isEqualTo("No memory trigger matched");
        }

        @Test
        @DisplayName("Triggers match at word starts only")
        void shouldNotMatchInsideWords() {
            assertThat(classifier.shouldCapture("This function is unlikely to matter much")).isFalse();
        }

        @Test
        @DisplayName("Should never throw, even on null")
        void shouldNotThrowOnNull() {
            CaptureDecision decision = classifier.classify(null);

            assertThat(decision.capture()).isFalse();
        }
    }
}
