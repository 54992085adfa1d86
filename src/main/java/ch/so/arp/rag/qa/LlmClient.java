package ch.so.arp.rag.qa;

import java.util.List;

/**
 * Abstraction over the hosted text-completion service. Implementations can
 * either invoke the real OpenAI API or return predictable responses for
 * testing.
 */
public interface LlmClient {

    /**
     * Complete the conversation with a single text response.
     *
     * @param model    name of the chat model to use
     * @param messages the conversation so far
     * @return the content of the model's reply
     * @throws ExternalServiceException if the call fails, times out or the
     *                                  response carries no content
     */
    String complete(String model, List<ChatMessage> messages);
}
