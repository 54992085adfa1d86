package ch.so.arp.rag.qa;

/**
 * Scores a question purely from its position in the tree. Higher scores are
 * asked first.
 */
@FunctionalInterface
public interface PriorityFormula {

    /**
     * @param descendantCount number of transitive children of the question
     * @param depth           distance from the root, zero for roots
     * @return the priority score
     */
    double score(int descendantCount, int depth);
}
