package ch.so.arp.rag.qa;

import java.util.List;
import java.util.Set;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint for the QA knowledge base.
 */
@RestController
@RequestMapping(path = "/api/kb", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class KnowledgeBaseController {

    private final QuestionAnswerKnowledgeBase knowledgeBase;
    private final QaStoreProperties properties;

    public KnowledgeBaseController(QuestionAnswerKnowledgeBase knowledgeBase, QaStoreProperties properties) {
        this.knowledgeBase = knowledgeBase;
        this.properties = properties;
    }

    @PostMapping(path = "/qa", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Set<String>> addQa(@Valid @RequestBody QaEntryRequest request) {
        Set<String> indexed = request.questions().size() == 1
                ? knowledgeBase.addQa(request.questions().get(0), request.answer(), request.metadata(),
                        request.numRewordings())
                : knowledgeBase.addQa(request.questions(), request.answer(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(indexed);
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<KnowledgeBaseMatch> query(@Valid @RequestBody KnowledgeBaseQueryRequest request) {
        int nResults = request.nResults() != null ? request.nResults() : properties.getDefaultResults();
        int numRewordings = request.numRewordings() != null ? request.numRewordings() : 0;
        return knowledgeBase.query(request.question(), nResults, request.metadataFilter(), numRewordings);
    }

    @PutMapping(path = "/answer", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> updateAnswer(@Valid @RequestBody KnowledgeBaseAnswerRequest request) {
        knowledgeBase.updateAnswer(request.question(), request.answer());
        return ResponseEntity.noContent().build();
    }

    /**
     * Extract QA pairs from the text and, if requested, index each of them.
     */
    @PostMapping(path = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<QaPair> extract(@Valid @RequestBody QaExtractionRequest request) {
        List<QaPair> pairs = knowledgeBase.generateQaPairs(request.text());
        if (request.index()) {
            pairs.forEach(pair -> knowledgeBase.addQa(pair.question(), pair.answer()));
        }
        return pairs;
    }

    @GetMapping("/questions")
    public List<String> questions() {
        return knowledgeBase.getAllQuestions();
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        knowledgeBase.clear();
        return ResponseEntity.noContent().build();
    }
}
