package ch.so.arp.rag.qa;

import java.util.List;

/**
 * Outcome of one synchronization pass.
 *
 * @param direction human readable direction of the pass
 * @param examined  number of records the pass looked at
 * @param changed   number of records the pass wrote
 * @param failures  records that could not be synchronized, the pass continued
 *                  past them
 */
public record SyncReport(String direction, int examined, int changed, List<Failure> failures) {

    public SyncReport {
        failures = List.copyOf(failures);
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * @param treeId the question the failure belongs to, {@code null} if the
     *               record carried no tree id
     * @param reason the failure message
     */
    public record Failure(Long treeId, String reason) {
    }
}
