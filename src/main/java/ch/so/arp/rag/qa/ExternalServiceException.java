package ch.so.arp.rag.qa;

/**
 * Failure of a call into the language model, the embedding service or the
 * similarity store: transport errors, timeouts and malformed responses.
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
