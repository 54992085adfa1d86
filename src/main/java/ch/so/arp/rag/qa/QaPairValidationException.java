package ch.so.arp.rag.qa;

/**
 * Extracted question/answer pairs do not have the expected shape.
 */
public class QaPairValidationException extends RuntimeException {

    public QaPairValidationException(String message) {
        super(message);
    }
}
