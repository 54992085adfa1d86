package ch.so.arp.rag.qa;

import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted. Rewording prompts are answered with
 * numbered variants of the original question, any other prompt with a single
 * QA pair quoting the first sentence of the input text.
 */
class MockLlmClient implements LlmClient {

    private static final Pattern REWORDING_COUNT = Pattern.compile("in (\\d+) distinct ways");
    private static final Pattern ORIGINAL_QUESTION = Pattern.compile("\\[ORIGINAL QUESTION]: (.+)");

    @Override
    public String complete(String model, List<ChatMessage> messages) {
        String prompt = messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
        Matcher count = REWORDING_COUNT.matcher(prompt);
        if (count.find()) {
            return rewordings(prompt, Integer.parseInt(count.group(1)));
        }
        return qaPairs(prompt);
    }

    private String rewordings(String prompt, int count) {
        Matcher matcher = ORIGINAL_QUESTION.matcher(prompt);
        String question = "";
        while (matcher.find()) {
            question = matcher.group(1).trim();
        }
        StringJoiner lines = new StringJoiner("\n");
        for (int i = 1; i <= count; i++) {
            lines.add("[mocked rewording " + i + "] " + question);
        }
        return lines.toString();
    }

    private String qaPairs(String prompt) {
        String text = prompt.replace("[INPUT TEXT]", "").replace("[JSON OUTPUT]", "").strip();
        int end = text.indexOf('.');
        String sentence = end > 0 ? text.substring(0, end + 1) : text;
        return "{\"pairs\": [{\"q\": \"What does the text state first?\", \"a\": \""
                + sentence.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ") + "\"}]}";
    }
}
