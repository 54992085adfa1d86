package ch.so.arp.rag.qa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class QuestionAnswerKnowledgeBaseTest {

    private final List<List<ChatMessage>> prompts = new ArrayList<>();
    private LlmClient llmClient;
    private QuestionAnswerKnowledgeBase knowledgeBase;

    @BeforeEach
    void setUp() {
        llmClient = (model, messages) -> {
            prompts.add(messages);
            return "Which city is Germany's capital?\nName the German capital.";
        };
        knowledgeBase = knowledgeBase(new InMemorySimilarityStore(new DeterministicEmbeddingProvider(64)));
    }

    @Test
    void answersQueriesAndUpdates() {
        knowledgeBase.addQa("What is the capital of Germany?", "Berlin");
        knowledgeBase.addQa("Who is the president of the USA?", "Joe Biden");
        knowledgeBase.addQa("What is the answer to life, the universe, and everything?", "42");

        assertThat(knowledgeBase.query("What is the capital of Germany?").get(0).answer()).isEqualTo("Berlin");
        assertThat(knowledgeBase.query("Who is the president of the USA?").get(0).answer()).isEqualTo("Joe Biden");
        assertThat(knowledgeBase.query("What is the answer to life, the universe, and everything?").get(0).answer())
                .isEqualTo("42");

        knowledgeBase.updateAnswer("What is the capital of Germany?", "Munich");

        assertThat(knowledgeBase.query("What is the capital of Germany?").get(0).answer()).isEqualTo("Munich");
    }

    @Test
    void filtersByMetadata() {
        knowledgeBase.addQa("What is the capital of Germany?", "Berlin");
        knowledgeBase.addQa("What is the capital of France?", "Paris", Map.of("source", "Wikipedia"), 0);

        KnowledgeBaseMatch unfiltered = knowledgeBase.query("What is the capital of France?").get(0);
        assertThat(unfiltered.metadata()).containsEntry("source", "Wikipedia").doesNotContainKey("answer");

        assertThat(knowledgeBase.query("What is the capital of France?", 5, Map.of("source", "Wikipedia"), 0))
                .extracting(KnowledgeBaseMatch::answer)
                .containsExactly("Paris");
        assertThat(knowledgeBase.query("What is the capital of France?", 5, Map.of("source", "github"), 0)).isEmpty();
    }

    @Test
    void identicalQuestionScoresFullSimilarity() {
        knowledgeBase.addQa("What is the capital of Germany?", "Berlin");

        assertThat(knowledgeBase.query("What is the capital of Germany?").get(0).similarity())
                .isCloseTo(1.0d, within(1.0e-5));
    }

    @Test
    void deduplicatesFanOutByAnswerAndRespectsTheLimit() {
        SimilarityStore store = mock(SimilarityStore.class);
        when(store.query(eq("first"), anyInt(), any())).thenReturn(List.of(
                hit("Capital of Germany?", "Berlin", 0.30d),
                hit("Largest German city?", "Berlin", 0.10d),
                hit("Capital of France?", "Paris", 0.40d)));
        when(store.query(eq("second"), anyInt(), any())).thenReturn(List.of(
                hit("German capital?", "Berlin", 0.05d),
                hit("Capital of Italy?", "Rome", 0.20d),
                hit("Capital of Spain?", "Madrid", 0.50d)));
        QuestionAnswerKnowledgeBase fanOut = knowledgeBase(store);

        List<KnowledgeBaseMatch> matches = fanOut.query(List.of("first", "second"), 3, null);

        assertThat(matches).extracting(KnowledgeBaseMatch::answer).containsExactly("Rome", "Berlin", "Paris");
        assertThat(matches.get(1).question()).isEqualTo("Capital of Germany?");
        assertThat(matches.get(1).similarity()).isCloseTo(0.7d, within(1.0e-9));
        assertThat(fanOut.query(List.of("first", "second"), 1, null)).hasSize(1);
    }

    @Test
    void noHitsYieldAnEmptyResult() {
        assertThat(knowledgeBase.query("Anything?", 5, null, 2)).isEmpty();
    }

    @Test
    void fansOutOverGeneratedRewordings() {
        SimilarityStore store = mock(SimilarityStore.class);
        when(store.query(any(), anyInt(), any())).thenReturn(List.of());
        QuestionAnswerKnowledgeBase fanOut = knowledgeBase(store);

        fanOut.query("What is the capital of Germany?", 4, Map.of("from_tree", true), 2);

        verify(store).query(eq("What is the capital of Germany?"), eq(4), eq(Map.of("from_tree", true)));
        verify(store).query(eq("Which city is Germany's capital?"), eq(4), eq(Map.of("from_tree", true)));
        verify(store).query(eq("Name the German capital."), eq(4), eq(Map.of("from_tree", true)));
        assertThat(prompts).hasSize(1);
    }

    @Test
    void rewordingFailuresPropagate() {
        QuestionAnswerKnowledgeBase failing = new QuestionAnswerKnowledgeBase(
                new InMemorySimilarityStore(new DeterministicEmbeddingProvider(64)),
                new QuestionRewriter((model, messages) -> {
                    throw new ExternalServiceException("timeout");
                }, "gpt-4o-mini"),
                new QaPairExtractor(llmClient, new ObjectMapper(), "gpt-4o-mini", 0), 5);

        assertThatThrownBy(() -> failing.query("Capital?", 5, null, 3))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("timeout");
        assertThatThrownBy(() -> failing.addQa("Capital?", "Berlin", Map.of(), 3))
                .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    void indexesRewordingsAndVerbatimLists() {
        assertThat(knowledgeBase.addQa("What is the capital of Germany?", "Berlin", Map.of(), 2))
                .containsExactly("What is the capital of Germany?", "Which city is Germany's capital?",
                        "Name the German capital.");
        assertThat(knowledgeBase.addQa(List.of("Capital of France?", "French capital?"), "Paris", null))
                .containsExactly("Capital of France?", "French capital?");

        assertThat(knowledgeBase.getAllQuestions()).hasSize(5);
        assertThat(prompts).hasSize(1);
    }

    @Test
    void updatingAnEmptyKnowledgeBaseFails() {
        assertThatThrownBy(() -> knowledgeBase.updateAnswer("Unknown?", "x"))
                .isInstanceOf(QuestionNotFoundException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void tracksTreeQuestions() {
        knowledgeBase.addQa("Unrelated?", "no");
        knowledgeBase.addTreeQuestion("What is the main goal?", 1L, null);
        knowledgeBase.addQa(List.of("Main goal, reworded?"), null, Map.of("tree_id", 1, "from_tree", true));

        assertThat(knowledgeBase.getTreeQuestions()).hasSize(2)
                .allSatisfy(document -> assertThat(QuestionAnswerKnowledgeBase.treeIdOf(document)).isEqualTo(1L));

        assertThat(knowledgeBase.updateTreeQuestion(1L, "Ship it")).isEqualTo(2);
        assertThat(knowledgeBase.updateTreeQuestion(1L, "Ship it")).isZero();
        assertThat(knowledgeBase.getTreeQuestions())
                .allSatisfy(document -> assertThat(document.metadataValue("answer")).isEqualTo("Ship it"));
        assertThatThrownBy(() -> knowledgeBase.updateTreeQuestion(2L, "x"))
                .isInstanceOf(QuestionNotFoundException.class);
    }

    @Test
    void mirroringATreeQuestionIndexesItWhenMissing() {
        assertThat(knowledgeBase.mirrorTreeQuestion(7L, "Who pays?", "The client")).isEqualTo(1);
        assertThat(knowledgeBase.mirrorTreeQuestion(7L, "Who pays?", "The client")).isZero();
        assertThat(knowledgeBase.mirrorTreeQuestion(7L, "Who pays?", "The sponsor")).isEqualTo(1);

        assertThat(knowledgeBase.getTreeQuestions()).singleElement().satisfies(document -> {
            assertThat(document.document()).isEqualTo("Who pays?");
            assertThat(QuestionAnswerKnowledgeBase.treeIdOf(document)).isEqualTo(7L);
            assertThat(document.metadataValue("answer")).isEqualTo("The sponsor");
        });
    }

    @Test
    void clearAndResetRemoveEverything() {
        knowledgeBase.addQa("Q1?", "A1");
        knowledgeBase.addQa("Q2?", "A2");

        knowledgeBase.clear();
        assertThat(knowledgeBase.getAllQuestions()).isEmpty();

        knowledgeBase.addQa("Q3?", "A3");
        knowledgeBase.resetDatabase();
        assertThat(knowledgeBase.getAllQuestions()).isEmpty();
    }

    @Test
    void documentIdsDoNotDependOnCollectionSize() {
        SimilarityStore store = mock(SimilarityStore.class);
        QuestionAnswerKnowledgeBase kb = knowledgeBase(store);

        kb.addQa("Q?", "A");

        verify(store, never()).count();
    }

    private QuestionAnswerKnowledgeBase knowledgeBase(SimilarityStore store) {
        return new QuestionAnswerKnowledgeBase(store, new QuestionRewriter(llmClient, "gpt-4o-mini"),
                new QaPairExtractor(llmClient, new ObjectMapper(), "gpt-4o-mini", 0), 5);
    }

    private static SimilarityHit hit(String question, String answer, double distance) {
        return new SimilarityHit(new SimilarityDocument(question, question, Map.of("answer", answer)), distance);
    }
}
