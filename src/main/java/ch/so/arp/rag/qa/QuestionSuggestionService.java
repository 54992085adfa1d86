package ch.so.arp.rag.qa;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for working with the question hierarchy. Adding and answering a
 * question writes the tree first and then mirrors the change into the tagged
 * knowledge base documents right away; the bulk synchronizer passes repair
 * anything that drifted apart.
 */
@Service
public class QuestionSuggestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuestionSuggestionService.class);

    private final QuestionTree tree;
    private final QuestionPrioritizer prioritizer;
    private final QuestionAnswerKnowledgeBase knowledgeBase;
    private final TreeKnowledgeBaseSynchronizer synchronizer;

    public QuestionSuggestionService(QuestionTree tree, QuestionPrioritizer prioritizer,
            QuestionAnswerKnowledgeBase knowledgeBase, TreeKnowledgeBaseSynchronizer synchronizer) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.prioritizer = Objects.requireNonNull(prioritizer, "prioritizer");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
    }

    public long addQuestion(String question, Long parentId) {
        long id = tree.addQuestion(question, parentId);
        knowledgeBase.addTreeQuestion(question, id, null);
        LOGGER.info("Added question {} '{}' under parent {}", id, question, parentId);
        return id;
    }

    public void answerQuestion(long id, String answer) {
        Objects.requireNonNull(answer, "answer");
        tree.updateAnswer(id, answer);
        knowledgeBase.mirrorTreeQuestion(id, tree.getQuestion(id).question(), answer);
        LOGGER.info("Answered question {}", id);
    }

    public QuestionNode getQuestion(long id) {
        return tree.getQuestion(id);
    }

    public List<QuestionNode> getChildren(long id) {
        return tree.getChildren(id);
    }

    public List<QuestionNode> getUnansweredQuestions() {
        return tree.getUnansweredQuestions();
    }

    public List<QuestionNode> getAnsweredQuestions() {
        return tree.getAnsweredQuestions();
    }

    /**
     * Ranking as of the last priority calculation.
     */
    public List<RankedQuestion> getHighPriorityQuestions(Integer limit) {
        return limit == null ? prioritizer.getHighPriorityQuestions() : prioritizer.getHighPriorityQuestions(limit);
    }

    public SyncReport syncKbToTree() {
        return synchronizer.syncKbToTree();
    }

    public SyncReport syncTreeToKb() {
        return synchronizer.syncTreeToKb();
    }

    /**
     * Recalculate priorities and return the highest ranked unanswered question.
     *
     * @return the suggestion with its score, empty if the tree is empty or fully
     *         answered
     */
    public Optional<RankedQuestion> suggestNextQuestion() {
        prioritizer.calculatePriorities();
        Optional<RankedQuestion> suggestion = prioritizer.getHighPriorityQuestions().stream()
                .filter(ranked -> !ranked.node().isAnswered())
                .findFirst();
        suggestion.ifPresentOrElse(
                ranked -> LOGGER.debug("Suggesting question {} with priority {}", ranked.id(), ranked.priority()),
                () -> LOGGER.debug("No unanswered question left to suggest"));
        return suggestion;
    }

    public List<KnowledgeBaseMatch> query(String question, int nResults, Map<String, ?> metadataFilter,
            int numRewordings) {
        return knowledgeBase.query(question, nResults, metadataFilter, numRewordings);
    }
}
