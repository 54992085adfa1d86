package ch.so.arp.rag.qa;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint for the question hierarchy: adding and answering questions,
 * ranking, suggestions and the synchronization passes.
 */
@RestController
@RequestMapping(path = "/api/questions", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class QuestionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuestionController.class);

    private final QuestionSuggestionService suggestionService;

    public QuestionController(QuestionSuggestionService suggestionService) {
        this.suggestionService = suggestionService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Long>> addQuestion(@Valid @RequestBody QuestionRequest request) {
        long id = suggestionService.addQuestion(request.question(), request.parentId());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping
    public List<QuestionNode> listQuestions(@RequestParam(name = "answered") boolean answered) {
        return answered ? suggestionService.getAnsweredQuestions() : suggestionService.getUnansweredQuestions();
    }

    @GetMapping("/{id}")
    public QuestionNode getQuestion(@PathVariable long id) {
        return suggestionService.getQuestion(id);
    }

    @GetMapping("/{id}/children")
    public List<QuestionNode> getChildren(@PathVariable long id) {
        return suggestionService.getChildren(id);
    }

    @PutMapping(path = "/{id}/answer", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> answerQuestion(@PathVariable long id, @Valid @RequestBody AnswerRequest request) {
        suggestionService.answerQuestion(id, request.answer());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/ranking")
    public List<RankedQuestion> ranking(@RequestParam(name = "limit", required = false) Integer limit) {
        return suggestionService.getHighPriorityQuestions(limit);
    }

    @GetMapping("/next")
    public ResponseEntity<RankedQuestion> nextQuestion() {
        return suggestionService.suggestNextQuestion()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/sync/kb-to-tree")
    public SyncReport syncKbToTree() {
        SyncReport report = suggestionService.syncKbToTree();
        LOGGER.debug("kb-to-tree sync requested: {}", report);
        return report;
    }

    @PostMapping("/sync/tree-to-kb")
    public SyncReport syncTreeToKb() {
        SyncReport report = suggestionService.syncTreeToKb();
        LOGGER.debug("tree-to-kb sync requested: {}", report);
        return report;
    }
}
