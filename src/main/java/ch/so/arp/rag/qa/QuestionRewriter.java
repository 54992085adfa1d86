package ch.so.arp.rag.qa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the language model for alternative phrasings of a question. Failures are
 * not masked: a caller who asked for variants either gets them or an
 * {@link ExternalServiceException}.
 */
public class QuestionRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuestionRewriter.class);

    private static final String REWORDING_PROMPT = """
            Rephrase the [ORIGINAL QUESTION] provided in %d distinct ways,
            keeping its meaning and context intact.
            Aim for original phrasings rather than simple synonym swaps and avoid
            repeating yourself.
            Return one rephrased question per line, without numbers or bullets.

            ## Example:
            [ORIGINAL QUESTION]: What is the capital of Italy?
            [REWRITTEN QUESTIONS]:
            Which city serves as the capital of Italy?
            Can you name the capital city of Italy?
            What is the name of Italy's capital?

            ## Input:
            [ORIGINAL QUESTION]: %s
            [REWRITTEN QUESTIONS]:
            """;

    private final LlmClient llmClient;
    private final String model;

    public QuestionRewriter(LlmClient llmClient, String model) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.model = Objects.requireNonNull(model, "model");
    }

    /**
     * The original question followed by the generated rephrasings.
     *
     * @param question       the question to rephrase
     * @param numRewordings  how many variants to request, zero skips the model
     * @return the query set, never empty
     * @throws ExternalServiceException if the model call fails or returns no
     *                                  usable line
     */
    public List<String> generateRewordings(String question, int numRewordings) {
        if (numRewordings < 0) {
            throw new IllegalArgumentException("numRewordings must not be negative");
        }
        if (numRewordings == 0) {
            return List.of(question);
        }
        String response = llmClient.complete(model,
                List.of(ChatMessage.user(REWORDING_PROMPT.formatted(numRewordings, question))));
        if (response == null) {
            throw new ExternalServiceException("Rewording request for '" + question + "' returned no content");
        }
        List<String> questions = new ArrayList<>();
        questions.add(question.strip());
        response.strip().lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .forEach(questions::add);
        if (questions.size() == 1) {
            throw new ExternalServiceException("Rewording request for '" + question + "' returned no rephrasings");
        }
        for (int i = 0; i < questions.size(); i++) {
            LOGGER.trace("Reworded question {}: {}", i + 1, questions.get(i));
        }
        return List.copyOf(questions);
    }
}
