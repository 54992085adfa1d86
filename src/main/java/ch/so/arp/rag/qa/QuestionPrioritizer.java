package ch.so.arp.rag.qa;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the derived priority of every question. Priorities are recomputed
 * wholesale on request and go stale after later mutations of the tree; they
 * only influence which question gets suggested.
 */
public class QuestionPrioritizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(QuestionPrioritizer.class);

    private static final Comparator<RankedQuestion> RANKING = Comparator
            .comparingDouble(RankedQuestion::priority).reversed()
            .thenComparingLong(RankedQuestion::id);

    private final QuestionTree tree;
    private final PriorityFormula formula;
    private volatile Map<Long, Double> priorities = Map.of();

    public QuestionPrioritizer(QuestionTree tree, PriorityFormula formula) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.formula = Objects.requireNonNull(formula, "formula");
    }

    /**
     * Score every question currently in the tree and replace the previous
     * scores in one step.
     */
    public void calculatePriorities() {
        QuestionTreeView view = tree.buildTree();
        Map<Long, Double> scores = new HashMap<>();
        for (QuestionNode node : view.nodes()) {
            scores.put(node.id(), formula.score(view.descendantCount(node.id()), view.depth(node.id())));
        }
        priorities = Map.copyOf(scores);
        LOGGER.debug("Calculated priorities for {} questions", scores.size());
    }

    public double priorityOf(long id) {
        return priorities.getOrDefault(id, 0.0d);
    }

    /**
     * All questions ranked by descending priority, ties broken by ascending id.
     * Questions without a calculated priority count as zero.
     */
    public List<RankedQuestion> getHighPriorityQuestions() {
        return rank(tree.getAllQuestions());
    }

    public List<RankedQuestion> getHighPriorityQuestions(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return getHighPriorityQuestions().stream().limit(limit).toList();
    }

    List<RankedQuestion> rank(List<QuestionNode> questions) {
        Map<Long, Double> current = priorities;
        return questions.stream()
                .map(node -> new RankedQuestion(node, current.getOrDefault(node.id(), 0.0d)))
                .sorted(RANKING)
                .toList();
    }
}
