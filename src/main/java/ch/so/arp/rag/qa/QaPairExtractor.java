package ch.so.arp.rag.qa;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Extracts question/answer pairs from prose with the language model. This is
 * best-effort enrichment: malformed replies are retried with the previous error
 * appended to the prompt and an exhausted extraction yields an empty list.
 */
public class QaPairExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(QaPairExtractor.class);

    private static final String QA_PAIRS_PROMPT = """
            Generate a balanced set (2 or more) of relevant questions together with
            their answers, based only on the given text.
            Mix factual, analytical, application-based, cause-and-effect, comparison
            and scenario-based questions so that both surface-level and in-depth
            knowledge of the subject is covered.
            Only ask questions whose answers are present in the text. Do not speculate.
            Format the result as a JSON array of objects where each object has a 'q'
            key for the question and an 'a' key for the answer.

            ## Example:
            [INPUT TEXT]
            The ego is a psychological concept that represents the part of the human
            psyche responsible for mediating between the unconscious and the conscious
            mind. It plays a crucial role in personality development, decision-making
            and reality testing.

            [OUTPUT JSON]
            [{"q": "What is the ego in psychological terms?", "a": "The ego is the part of the human psyche responsible for mediating between the unconscious and the conscious mind."},
             {"q": "Which functions does the ego play a role in?", "a": "Personality development, decision-making and reality testing."}]
            """;

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final int maxRetries;

    public QaPairExtractor(LlmClient llmClient, ObjectMapper objectMapper, String model, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.model = Objects.requireNonNull(model, "model");
        this.maxRetries = maxRetries;
    }

    /**
     * @param inputText the prose to extract pairs from
     * @return the extracted pairs, empty if every attempt failed
     */
    public List<QaPair> generateQaPairs(String inputText) {
        String prompt = "[INPUT TEXT]\n" + inputText + "\n\n[JSON OUTPUT]\n";
        String previousError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            String userMessage = previousError == null ? prompt
                    : prompt + "\nThe previous reply could not be used (" + previousError
                            + "). Reply with valid JSON only.\n";
            try {
                String content = llmClient.complete(model,
                        List.of(ChatMessage.system(QA_PAIRS_PROMPT), ChatMessage.user(userMessage)));
                return parse(content);
            } catch (JsonProcessingException ex) {
                previousError = "invalid JSON: " + ex.getOriginalMessage();
            } catch (QaPairValidationException | ExternalServiceException ex) {
                previousError = ex.getMessage();
            }
            LOGGER.warn("QA pair extraction attempt {} of {} failed: {}", attempt + 1, maxRetries + 1, previousError);
        }
        LOGGER.error("Giving up on QA pair extraction after {} attempts, last error: {}", maxRetries + 1,
                previousError);
        return List.of();
    }

    /**
     * Parse a model reply. Accepted shapes are a JSON array of pairs, an object
     * whose first value is such an array, or a single pair object.
     *
     * @throws JsonProcessingException    if the reply is not JSON
     * @throws QaPairValidationException  if the JSON does not describe pairs
     */
    List<QaPair> parse(String content) throws JsonProcessingException {
        if (content == null) {
            throw new QaPairValidationException("Reply carries no content");
        }
        JsonNode root = objectMapper.readTree(content);
        JsonNode pairs = unwrap(root);
        List<QaPair> result = new ArrayList<>(pairs.size());
        for (JsonNode pair : pairs) {
            JsonNode question = pair.get("q");
            JsonNode answer = pair.get("a");
            if (!pair.isObject() || question == null || answer == null || answer.isNull()
                    || !question.isTextual()) {
                throw new QaPairValidationException("Invalid QA pair format in the response: " + pair);
            }
            result.add(new QaPair(question.asText(), answer.isTextual() ? answer.asText() : answer.toString()));
        }
        return List.copyOf(result);
    }

    private JsonNode unwrap(JsonNode root) {
        if (root == null || root.isMissingNode()) {
            throw new QaPairValidationException("Reply is empty");
        }
        if (root.isArray()) {
            return root;
        }
        if (!root.isObject()) {
            throw new QaPairValidationException("Expected a list of QA pairs but got " + root.getNodeType());
        }
        Iterator<JsonNode> values = root.elements();
        if (!values.hasNext()) {
            throw new QaPairValidationException("Expected a list of QA pairs but got an empty object");
        }
        JsonNode first = values.next();
        if (first.isArray()) {
            return first;
        }
        LOGGER.warn("Reply does not contain a list, treating the object as a single QA pair");
        return objectMapper.createArrayNode().add(root);
    }
}
