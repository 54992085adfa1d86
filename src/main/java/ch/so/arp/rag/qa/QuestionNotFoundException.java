package ch.so.arp.rag.qa;

/**
 * Raised when a question id is unknown to the tree, or when an answer update
 * targets a question that the knowledge base does not contain.
 */
public class QuestionNotFoundException extends RuntimeException {

    public QuestionNotFoundException(String message) {
        super(message);
    }

    public static QuestionNotFoundException forId(long id) {
        return new QuestionNotFoundException("Question " + id + " does not exist");
    }
}
