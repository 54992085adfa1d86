package ch.so.arp.rag.qa;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link LlmClient} calling the {@code /chat/completions} endpoint of an OpenAI
 * compatible API. Timeouts are configured on the {@link RestClient.Builder}
 * handed in.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;

    OpenAiLlmClient(OpenAiClientProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'qa.openai.api-key' or 'spring.ai.openai.api-key' must be provided when mocks are disabled");
        }
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public String complete(String model, List<ChatMessage> messages) {
        LOGGER.debug("Requesting completion from model {} with {} messages", model, messages.size());
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "messages", messages))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new ExternalServiceException("Completion request to model " + model + " failed: " + ex.getMessage(),
                    ex);
        }
        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new ExternalServiceException("Completion response of model " + model + " carries no content");
        }
        return content.asText();
    }
}
