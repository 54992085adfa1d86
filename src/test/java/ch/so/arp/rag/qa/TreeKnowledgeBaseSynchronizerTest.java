package ch.so.arp.rag.qa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class TreeKnowledgeBaseSynchronizerTest {

    private JdbcQuestionTree tree;
    private InMemorySimilarityStore store;
    private QuestionAnswerKnowledgeBase knowledgeBase;
    private TreeKnowledgeBaseSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        tree = new JdbcQuestionTree(H2Databases.freshJdbcClient());
        store = new InMemorySimilarityStore(new DeterministicEmbeddingProvider(32));
        MockLlmClient llmClient = new MockLlmClient();
        knowledgeBase = new QuestionAnswerKnowledgeBase(store, new QuestionRewriter(llmClient, "gpt-4o-mini"),
                new QaPairExtractor(llmClient, new ObjectMapper(), "gpt-4o-mini", 0), 5);
        synchronizer = new TreeKnowledgeBaseSynchronizer(tree, knowledgeBase);
    }

    @Test
    void treeToKbOverwritesTaggedAnswersAndIsIdempotent() {
        long id = mirrored("What is the main goal?");
        knowledgeBase.addQa(List.of("Main goal, reworded?"), "stale", Map.of("tree_id", id, "from_tree", true));
        tree.updateAnswer(id, "Reduce cost");

        SyncReport first = synchronizer.syncTreeToKb();
        List<SimilarityDocument> afterFirst = store.get(null);
        SyncReport second = synchronizer.syncTreeToKb();

        assertThat(first.changed()).isEqualTo(2);
        assertThat(first.isSuccessful()).isTrue();
        assertThat(second.changed()).isZero();
        assertThat(store.get(null)).isEqualTo(afterFirst);
        assertThat(afterFirst).allSatisfy(
                document -> assertThat(document.metadataValue(QuestionAnswerKnowledgeBase.ANSWER_KEY))
                        .isEqualTo("Reduce cost"));
    }

    @Test
    void kbToTreeFillsOnlyUnansweredQuestions() {
        long open = mirrored("Open question?");
        long answered = mirrored("Answered question?");
        tree.updateAnswer(answered, "tree answer");
        knowledgeBase.updateTreeQuestion(open, "kb answer");
        knowledgeBase.updateTreeQuestion(answered, "other kb answer");

        SyncReport report = synchronizer.syncKbToTree();

        assertThat(report.changed()).isEqualTo(1);
        assertThat(tree.getQuestion(open).answer()).isEqualTo("kb answer");
        assertThat(tree.getQuestion(answered).answer()).isEqualTo("tree answer");
        assertThat(synchronizer.syncKbToTree().changed()).isZero();
    }

    @Test
    void kbToTreeIgnoresTaggedEntriesWithoutAnswer() {
        long id = mirrored("Still open?");

        assertThat(synchronizer.syncKbToTree().changed()).isZero();
        assertThat(tree.isAnswered(id)).isFalse();
    }

    @Test
    void treeToKbIndexesMissingTaggedEntriesAgain() {
        long missingMirror = tree.addQuestion("Never mirrored?", null);
        long mirrored = mirrored("Mirrored?");
        tree.updateAnswer(missingMirror, "a1");
        tree.updateAnswer(mirrored, "a2");

        SyncReport report = synchronizer.syncTreeToKb();

        assertThat(report.examined()).isEqualTo(2);
        assertThat(report.changed()).isEqualTo(2);
        assertThat(report.isSuccessful()).isTrue();
        assertThat(knowledgeBase.getTreeQuestions())
                .extracting(QuestionAnswerKnowledgeBase::treeIdOf, document -> document.metadataValue("answer"))
                .containsExactlyInAnyOrder(tuple(missingMirror, "a1"), tuple(mirrored, "a2"));
        assertThat(synchronizer.syncTreeToKb().changed()).isZero();
    }

    @Test
    void failuresAreCollectedAndThePassContinues() {
        long failing = tree.addQuestion("Store down?", null);
        long working = tree.addQuestion("Store up?", null);
        tree.updateAnswer(failing, "a1");
        tree.updateAnswer(working, "a2");
        QuestionAnswerKnowledgeBase failingKnowledgeBase = mock(QuestionAnswerKnowledgeBase.class);
        when(failingKnowledgeBase.mirrorTreeQuestion(failing, "Store down?", "a1"))
                .thenThrow(new ExternalServiceException("store unavailable"));
        when(failingKnowledgeBase.mirrorTreeQuestion(working, "Store up?", "a2")).thenReturn(1);

        SyncReport report = new TreeKnowledgeBaseSynchronizer(tree, failingKnowledgeBase).syncTreeToKb();

        assertThat(report.examined()).isEqualTo(2);
        assertThat(report.changed()).isEqualTo(1);
        assertThat(report.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.treeId()).isEqualTo(failing);
            assertThat(failure.reason()).isEqualTo("store unavailable");
        });
    }

    @Test
    void orphanedTaggedEntriesAreReported() {
        knowledgeBase.addTreeQuestion("Deleted upstream?", 99L, "answer");
        long id = mirrored("Present?");
        knowledgeBase.updateTreeQuestion(id, "present answer");

        SyncReport report = synchronizer.syncKbToTree();

        assertThat(report.failures()).extracting(SyncReport.Failure::treeId).containsExactly(99L);
        assertThat(tree.getQuestion(id).answer()).isEqualTo("present answer");
    }

    private long mirrored(String question) {
        long id = tree.addQuestion(question, null);
        knowledgeBase.addTreeQuestion(question, id, null);
        return id;
    }
}
