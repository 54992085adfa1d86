package ch.so.arp.rag.qa;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the question tree, the knowledge base and their
 * collaborators together. It exposes toggles that decide whether mocked or real
 * infrastructure components should be used.
 */
@Configuration
@EnableConfigurationProperties({ OpenAiClientProperties.class, QaStoreProperties.class })
public class QaConfiguration {

    @Bean
    @ConditionalOnProperty(name = "qa.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "qa.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties properties) {
        return new OpenAiLlmClient(properties, openAiRestClientBuilder(properties));
    }

    @Bean
    @ConditionalOnProperty(name = "qa.embedding.provider", havingValue = "deterministic", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(@Value("${qa.embedding.dimensions:384}") int dimensions) {
        return new DeterministicEmbeddingProvider(dimensions);
    }

    @Bean
    @ConditionalOnProperty(name = "qa.embedding.provider", havingValue = "openai")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties) {
        return new OpenAiEmbeddingProvider(properties, openAiRestClientBuilder(properties));
    }

    @Bean
    @ConditionalOnProperty(name = "qa.mock-similarity-store", havingValue = "true", matchIfMissing = true)
    public SimilarityStore inMemorySimilarityStore(EmbeddingProvider embeddingProvider) {
        return new InMemorySimilarityStore(embeddingProvider);
    }

    @Bean
    @ConditionalOnProperty(name = "qa.mock-similarity-store", havingValue = "false")
    public SimilarityStore postgresSimilarityStore(JdbcClient jdbcClient, EmbeddingProvider embeddingProvider,
            ObjectProvider<ObjectMapper> objectMapper, QaStoreProperties properties) {
        return new PostgresSimilarityStore(jdbcClient, embeddingProvider, objectMapper.getIfAvailable(ObjectMapper::new),
                properties.getCollectionName());
    }

    @Bean
    @ConditionalOnMissingBean
    public QuestionTree questionTree(JdbcClient jdbcClient) {
        return new JdbcQuestionTree(jdbcClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public PriorityFormula priorityFormula() {
        return new BreadthFirstPriorityFormula();
    }

    @Bean
    public QuestionPrioritizer questionPrioritizer(QuestionTree questionTree, PriorityFormula priorityFormula) {
        return new QuestionPrioritizer(questionTree, priorityFormula);
    }

    @Bean
    public QuestionRewriter questionRewriter(LlmClient llmClient, QaStoreProperties properties) {
        return new QuestionRewriter(llmClient, properties.getRewordingModel());
    }

    @Bean
    public QaPairExtractor qaPairExtractor(LlmClient llmClient, ObjectProvider<ObjectMapper> objectMapper,
            QaStoreProperties properties) {
        return new QaPairExtractor(llmClient, objectMapper.getIfAvailable(ObjectMapper::new),
                properties.getQaPairsModel(), properties.getQaPairsMaxRetries());
    }

    @Bean
    public QuestionAnswerKnowledgeBase questionAnswerKnowledgeBase(SimilarityStore similarityStore,
            QuestionRewriter questionRewriter, QaPairExtractor qaPairExtractor, QaStoreProperties properties) {
        return new QuestionAnswerKnowledgeBase(similarityStore, questionRewriter, qaPairExtractor,
                properties.getDefaultResults());
    }

    @Bean
    public TreeKnowledgeBaseSynchronizer treeKnowledgeBaseSynchronizer(QuestionTree questionTree,
            QuestionAnswerKnowledgeBase questionAnswerKnowledgeBase) {
        return new TreeKnowledgeBaseSynchronizer(questionTree, questionAnswerKnowledgeBase);
    }

    private static RestClient.Builder openAiRestClientBuilder(OpenAiClientProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return RestClient.builder().requestFactory(requestFactory);
    }
}
