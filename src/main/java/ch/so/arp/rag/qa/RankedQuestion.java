package ch.so.arp.rag.qa;

/**
 * A question together with the priority score it was ranked with.
 */
public record RankedQuestion(QuestionNode node, double priority) {

    public long id() {
        return node.id();
    }
}
