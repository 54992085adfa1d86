package ch.so.arp.rag.qa;

/**
 * One question of the hierarchy. A {@code null} answer marks the question as
 * unanswered, a {@code null} parent id marks a root.
 */
public record QuestionNode(long id, String question, String answer, Long parentId) {

    public boolean isAnswered() {
        return answer != null;
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
