package ch.so.arp.rag.qa;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the QA knowledge base and the question tree.
 */
@ConfigurationProperties(prefix = "qa.store")
public class QaStoreProperties {

    /**
     * Name of the similarity store collection holding the QA documents.
     */
    private String collectionName = "qa_kb";

    /**
     * Chat model that rephrases questions for query fan-out.
     */
    private String rewordingModel = "gpt-4o-mini";

    /**
     * Chat model that extracts question/answer pairs from prose.
     */
    private String qaPairsModel = "gpt-4o-mini";

    /**
     * Additional attempts after a failed QA pair extraction.
     */
    private int qaPairsMaxRetries = 3;

    private int defaultResults = 5;

    public String getCollectionName() {
        return collectionName;
    }

    public void setCollectionName(String collectionName) {
        this.collectionName = collectionName;
    }

    public String getRewordingModel() {
        return rewordingModel;
    }

    public void setRewordingModel(String rewordingModel) {
        this.rewordingModel = rewordingModel;
    }

    public String getQaPairsModel() {
        return qaPairsModel;
    }

    public void setQaPairsModel(String qaPairsModel) {
        this.qaPairsModel = qaPairsModel;
    }

    public int getQaPairsMaxRetries() {
        return qaPairsMaxRetries;
    }

    public void setQaPairsMaxRetries(int qaPairsMaxRetries) {
        this.qaPairsMaxRetries = qaPairsMaxRetries;
    }

    public int getDefaultResults() {
        return defaultResults;
    }

    public void setDefaultResults(int defaultResults) {
        this.defaultResults = defaultResults;
    }
}
