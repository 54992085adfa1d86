package ch.so.arp.rag.qa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class QuestionControllerTest {

    private final QuestionSuggestionService service = mock(QuestionSuggestionService.class);
    private final QuestionController controller = new QuestionController(service);

    @Test
    void createsQuestions() {
        when(service.addQuestion("Who benefits?", 1L)).thenReturn(2L);

        ResponseEntity<Map<String, Long>> response = controller.addQuestion(new QuestionRequest("Who benefits?", 1L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).containsEntry("id", 2L);
    }

    @Test
    void answersQuestions() {
        ResponseEntity<Void> response = controller.answerQuestion(3L, new AnswerRequest("42"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        verify(service).answerQuestion(3L, "42");
    }

    @Test
    void returnsTheNextSuggestionOrNoContent() {
        RankedQuestion ranked = new RankedQuestion(new QuestionNode(4L, "Why?", null, null), 2.0d);
        when(service.suggestNextQuestion()).thenReturn(Optional.of(ranked), Optional.empty());

        assertThat(controller.nextQuestion().getBody()).isEqualTo(ranked);
        assertThat(controller.nextQuestion().getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    }

    @Test
    void listsByAnswerState() {
        QuestionNode answered = new QuestionNode(1L, "A?", "yes", null);
        QuestionNode open = new QuestionNode(2L, "B?", null, 1L);
        when(service.getAnsweredQuestions()).thenReturn(List.of(answered));
        when(service.getUnansweredQuestions()).thenReturn(List.of(open));

        assertThat(controller.listQuestions(true)).containsExactly(answered);
        assertThat(controller.listQuestions(false)).containsExactly(open);
    }

    @Test
    void runsSyncPasses() {
        SyncReport report = new SyncReport("tree-to-kb", 2, 1, List.of(new SyncReport.Failure(7L, "missing")));
        when(service.syncTreeToKb()).thenReturn(report);

        assertThat(controller.syncTreeToKb()).isSameAs(report);
        assertThat(report.isSuccessful()).isFalse();
    }
}
