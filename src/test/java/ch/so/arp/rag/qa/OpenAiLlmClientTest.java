package ch.so.arp.rag.qa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OpenAiLlmClientTest {

    private RestClient.Builder builder;
    private MockRestServiceServer server;
    private OpenAiClientProperties properties;

    @BeforeEach
    void setUp() {
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        properties = new OpenAiClientProperties();
        properties.setApiKey("secret-key");
        properties.setBaseUrl("https://llm.example.com/v1");
    }

    @Test
    void returnsTheFirstChoice() {
        server.expect(requestTo("https://llm.example.com/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret-key"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("Rephrase this"))
                .andRespond(withSuccess("{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"Done\"}}]}",
                        MediaType.APPLICATION_JSON));

        String reply = new OpenAiLlmClient(properties, builder)
                .complete("gpt-4o-mini", List.of(ChatMessage.user("Rephrase this")));

        assertThat(reply).isEqualTo("Done");
        server.verify();
    }

    @Test
    void serverErrorsBecomeExternalServiceFailures() {
        server.expect(requestTo("https://llm.example.com/v1/chat/completions")).andRespond(withServerError());

        OpenAiLlmClient client = new OpenAiLlmClient(properties, builder);

        assertThatThrownBy(() -> client.complete("gpt-4o-mini", List.of(ChatMessage.user("hi"))))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("gpt-4o-mini");
    }

    @Test
    void repliesWithoutContentAreRejected() {
        server.expect(requestTo("https://llm.example.com/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        OpenAiLlmClient client = new OpenAiLlmClient(properties, builder);

        assertThatThrownBy(() -> client.complete("gpt-4o-mini", List.of(ChatMessage.user("hi"))))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("no content");
    }

    @Test
    void requiresAnApiKey() {
        assertThatThrownBy(() -> new OpenAiLlmClient(new OpenAiClientProperties(), builder))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
