package ch.so.arp.rag.qa;

/**
 * Raised when a parent reference names a question that does not exist or when
 * a parent chain loops back onto itself.
 */
public class QuestionReferenceException extends RuntimeException {

    public QuestionReferenceException(String message) {
        super(message);
    }
}
