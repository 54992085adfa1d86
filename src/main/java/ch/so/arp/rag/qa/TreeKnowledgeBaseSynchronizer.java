package ch.so.arp.rag.qa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles answers between the question tree and the tagged documents of the
 * knowledge base. The two passes are independent full scans without a shared
 * transaction: running them alongside live answer updates can let either value
 * win for a question, repeated passes without intervening changes write
 * nothing.
 */
public class TreeKnowledgeBaseSynchronizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeKnowledgeBaseSynchronizer.class);

    private final QuestionTree tree;
    private final QuestionAnswerKnowledgeBase knowledgeBase;

    public TreeKnowledgeBaseSynchronizer(QuestionTree tree, QuestionAnswerKnowledgeBase knowledgeBase) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
    }

    /**
     * Copy answers of tagged documents into tree questions that are still
     * unanswered. Answered tree questions are never overwritten.
     */
    public SyncReport syncKbToTree() {
        List<SimilarityDocument> tagged = knowledgeBase.getTreeQuestions();
        List<SyncReport.Failure> failures = new ArrayList<>();
        int changed = 0;
        for (SimilarityDocument document : tagged) {
            Long treeId = QuestionAnswerKnowledgeBase.treeIdOf(document);
            Object answer = document.metadataValue(QuestionAnswerKnowledgeBase.ANSWER_KEY);
            try {
                if (treeId == null) {
                    throw new QuestionReferenceException("Document " + document.id() + " carries no tree id");
                }
                if (answer != null && !tree.isAnswered(treeId)) {
                    tree.updateAnswer(treeId, answer.toString());
                    changed++;
                }
            } catch (RuntimeException ex) {
                failures.add(new SyncReport.Failure(treeId, ex.getMessage()));
                LOGGER.warn("Could not sync document {} into tree question {}: {}", document.id(), treeId,
                        ex.getMessage());
            }
        }
        return report("kb-to-tree", tagged.size(), changed, failures);
    }

    /**
     * Push the answer of every answered tree question into its tagged documents,
     * replacing whatever answer they held. Missing tagged documents are
     * indexed again.
     */
    public SyncReport syncTreeToKb() {
        List<QuestionNode> answered = tree.getAnsweredQuestions();
        List<SyncReport.Failure> failures = new ArrayList<>();
        int changed = 0;
        for (QuestionNode node : answered) {
            try {
                changed += knowledgeBase.mirrorTreeQuestion(node.id(), node.question(), node.answer());
            } catch (RuntimeException ex) {
                failures.add(new SyncReport.Failure(node.id(), ex.getMessage()));
                LOGGER.warn("Could not sync tree question {} into the knowledge base: {}", node.id(), ex.getMessage());
            }
        }
        return report("tree-to-kb", answered.size(), changed, failures);
    }

    private SyncReport report(String direction, int examined, int changed, List<SyncReport.Failure> failures) {
        SyncReport report = new SyncReport(direction, examined, changed, failures);
        if (report.isSuccessful()) {
            LOGGER.info("Sync {} examined {} records and changed {}", direction, examined, changed);
        } else {
            LOGGER.warn("Sync {} examined {} records, changed {}, {} failed", direction, examined, changed,
                    failures.size());
        }
        return report;
    }
}
