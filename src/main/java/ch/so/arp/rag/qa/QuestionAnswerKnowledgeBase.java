package ch.so.arp.rag.qa;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Question/answer pairs kept in a {@link SimilarityStore}. Every document is a
 * question text whose answer lives in the {@code answer} metadata key.
 * Questions mirrored from the question tree are tagged with {@code from_tree}
 * and {@code tree_id}.
 */
public class QuestionAnswerKnowledgeBase {

    public static final String ANSWER_KEY = "answer";
    public static final String TREE_ID_KEY = "tree_id";
    public static final String FROM_TREE_KEY = "from_tree";

    private static final Logger LOGGER = LoggerFactory.getLogger(QuestionAnswerKnowledgeBase.class);

    private final SimilarityStore store;
    private final QuestionRewriter rewriter;
    private final QaPairExtractor extractor;
    private final int defaultResults;

    public QuestionAnswerKnowledgeBase(SimilarityStore store, QuestionRewriter rewriter, QaPairExtractor extractor,
            int defaultResults) {
        this.store = Objects.requireNonNull(store, "store");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.defaultResults = defaultResults;
    }

    public Set<String> addQa(String question, String answer) {
        return addQa(question, answer, Map.of(), 0);
    }

    /**
     * Index a question, optionally with generated rephrasings, under one answer.
     *
     * @return all question texts that were indexed
     * @throws ExternalServiceException if rephrasings were requested and could
     *                                  not be generated
     */
    public Set<String> addQa(String question, String answer, Map<String, ?> metadata, int numRewordings) {
        return index(rewriter.generateRewordings(question, numRewordings), answer, metadata);
    }

    /**
     * Index the given question texts verbatim under one answer.
     */
    public Set<String> addQa(List<String> questions, String answer, Map<String, ?> metadata) {
        return index(questions, answer, metadata);
    }

    private Set<String> index(List<String> questions, String answer, Map<String, ?> metadata) {
        if (questions.isEmpty()) {
            throw new IllegalArgumentException("At least one question is required");
        }
        Map<String, Object> documentMetadata = new LinkedHashMap<>(SimilarityDocument.normalize(metadata));
        if (answer != null) {
            documentMetadata.put(ANSWER_KEY, answer);
        }
        List<SimilarityDocument> documents = new ArrayList<>(questions.size());
        for (String question : questions) {
            if (!StringUtils.hasText(question)) {
                throw new IllegalArgumentException("question must not be blank");
            }
            LOGGER.trace("Adding question: {}", question);
            documents.add(new SimilarityDocument(nextDocumentId(), question, documentMetadata));
        }
        store.add(documents);
        return new LinkedHashSet<>(questions);
    }

    public List<KnowledgeBaseMatch> query(String question) {
        return query(question, defaultResults, null, 0);
    }

    /**
     * Query with the question and, if requested, generated rephrasings of it.
     *
     * @see #query(List, int, Map)
     */
    public List<KnowledgeBaseMatch> query(String question, int nResults, Map<String, ?> metadataFilter,
            int numRewordings) {
        return query(rewriter.generateRewordings(question, numRewordings), nResults, metadataFilter);
    }

    /**
     * Run one similarity query per question text, pool all hits, keep the first
     * hit per answer value and return the best {@code nResults} by similarity.
     *
     * @return matches by descending similarity, empty if nothing matched
     */
    public List<KnowledgeBaseMatch> query(List<String> questions, int nResults, Map<String, ?> metadataFilter) {
        if (nResults <= 0) {
            throw new IllegalArgumentException("nResults must be positive");
        }
        List<KnowledgeBaseMatch> pooled = new ArrayList<>();
        for (String question : questions) {
            LOGGER.trace("Querying question: {}", question);
            for (SimilarityHit hit : store.query(question, nResults, metadataFilter)) {
                pooled.add(toMatch(hit));
            }
        }

        Set<String> seenAnswers = new HashSet<>();
        List<KnowledgeBaseMatch> unique = new ArrayList<>();
        for (KnowledgeBaseMatch match : pooled) {
            if (seenAnswers.add(match.answer())) {
                unique.add(match);
            }
        }

        List<KnowledgeBaseMatch> results = unique.stream()
                .sorted(Comparator.comparingDouble(KnowledgeBaseMatch::similarity).reversed())
                .limit(nResults)
                .toList();
        LOGGER.debug("{} queries produced {} hits, {} unique answers, returning {}", questions.size(), pooled.size(),
                unique.size(), results.size());
        return results;
    }

    /**
     * Replace the answer of the document closest to the question text.
     *
     * @throws QuestionNotFoundException if the knowledge base is empty
     */
    public void updateAnswer(String question, String newAnswer) {
        List<SimilarityHit> hits = store.query(question, 1, null);
        if (hits.isEmpty()) {
            throw new QuestionNotFoundException("Question not found in knowledge base: " + question);
        }
        SimilarityDocument current = hits.get(0).document();
        store.update(List.of(new SimilarityDocument(current.id(), question, current.metadata())
                .withMetadata(ANSWER_KEY, newAnswer)));
        LOGGER.info("Answer to question '{}' has been updated", question);
    }

    public List<String> getAllQuestions() {
        return store.get(null).stream().map(SimilarityDocument::document).toList();
    }

    /**
     * Delete every document of the collection.
     */
    public void clear() {
        List<String> ids = store.get(null).stream().map(SimilarityDocument::id).toList();
        store.delete(ids);
        LOGGER.info("Knowledge base cleared, {} documents deleted", ids.size());
    }

    /**
     * Drop the collection and recreate it empty.
     */
    public void resetDatabase() {
        store.reset();
    }

    public List<QaPair> generateQaPairs(String inputText) {
        return extractor.generateQaPairs(inputText);
    }

    /**
     * Mirror a tree question as a tagged document.
     */
    public void addTreeQuestion(String question, long treeId, String answer) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(TREE_ID_KEY, treeId);
        metadata.put(FROM_TREE_KEY, true);
        index(List.of(question), answer, metadata);
    }

    /**
     * All documents mirrored from the question tree, in insertion order.
     */
    public List<SimilarityDocument> getTreeQuestions() {
        return store.get(Map.of(FROM_TREE_KEY, true));
    }

    /**
     * Set the answer on every document tagged with the tree id. Documents that
     * already carry the answer are left untouched.
     *
     * @return the number of documents whose answer changed
     * @throws QuestionNotFoundException if no document carries the tree id
     */
    public int updateTreeQuestion(long treeId, String answer) {
        List<SimilarityDocument> tagged = store.get(treeFilter(treeId));
        if (tagged.isEmpty()) {
            throw new QuestionNotFoundException("Tree question " + treeId + " not found in knowledge base");
        }
        List<SimilarityDocument> changed = tagged.stream()
                .filter(document -> !Objects.equals(document.metadataValue(ANSWER_KEY), answer))
                .map(document -> document.withMetadata(ANSWER_KEY, answer))
                .toList();
        if (!changed.isEmpty()) {
            store.update(changed);
        }
        return changed.size();
    }

    /**
     * Bring the tagged documents of a tree question in line with the tree. A
     * question whose tagged document is missing, for example after the store
     * was reset, is indexed again.
     *
     * @return the number of documents added or changed
     */
    public int mirrorTreeQuestion(long treeId, String question, String answer) {
        if (store.get(treeFilter(treeId)).isEmpty()) {
            LOGGER.info("Tree question {} has no tagged document, indexing it again", treeId);
            addTreeQuestion(question, treeId, answer);
            return 1;
        }
        return updateTreeQuestion(treeId, answer);
    }

    private static Map<String, Object> treeFilter(long treeId) {
        return Map.of(TREE_ID_KEY, treeId, FROM_TREE_KEY, true);
    }

    static Long treeIdOf(SimilarityDocument document) {
        Object value = document.metadataValue(TREE_ID_KEY);
        return value instanceof Number number ? number.longValue() : null;
    }

    private KnowledgeBaseMatch toMatch(SimilarityHit hit) {
        SimilarityDocument document = hit.document();
        Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
        Object answer = metadata.remove(ANSWER_KEY);
        return new KnowledgeBaseMatch(document.document(), answer == null ? null : answer.toString(),
                Map.copyOf(metadata), 1.0d - hit.distance());
    }

    private static String nextDocumentId() {
        return "qa_" + UUID.randomUUID();
    }
}
