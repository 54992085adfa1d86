package ch.so.arp.rag.qa;

import java.util.List;

/**
 * Durable store of the question hierarchy. Nodes reference their parent by id,
 * children are derived by looking up all nodes pointing at a given parent.
 * Every mutation is persisted before the call returns.
 */
public interface QuestionTree {

    /**
     * Store a new, unanswered question.
     *
     * @param question the question text, must not be blank
     * @param parentId the id of an existing parent question or {@code null} for
     *                 a root
     * @return the id assigned to the new question
     * @throws QuestionReferenceException if the parent does not exist
     */
    long addQuestion(String question, Long parentId);

    /**
     * @throws QuestionNotFoundException if no question has the given id
     */
    QuestionNode getQuestion(long id);

    /**
     * Direct children of a question in insertion order.
     *
     * @throws QuestionNotFoundException if no question has the given id
     */
    List<QuestionNode> getChildren(long id);

    /**
     * Overwrite the answer of a question. Later calls replace earlier answers.
     *
     * @throws QuestionNotFoundException if no question has the given id
     */
    void updateAnswer(long id, String answer);

    boolean isAnswered(long id);

    List<QuestionNode> getAllQuestions();

    List<QuestionNode> getUnansweredQuestions();

    List<QuestionNode> getAnsweredQuestions();

    /**
     * Read the whole tree into an immutable snapshot used for ranking. Each call
     * reflects the state of the store at the time of the call.
     *
     * @throws QuestionReferenceException if a stored parent chain is broken
     */
    QuestionTreeView buildTree();
}
