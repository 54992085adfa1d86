package ch.so.arp.rag.qa;

/**
 * Prefers broad, shallow questions: {@code (descendants + 1) / (depth + 1)}.
 * The score grows with the size of the subtree a question gates and shrinks
 * with its depth.
 */
class BreadthFirstPriorityFormula implements PriorityFormula {

    @Override
    public double score(int descendantCount, int depth) {
        return (descendantCount + 1.0d) / (depth + 1.0d);
    }
}
