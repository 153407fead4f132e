package fun.fengwk.mah.core.service.crawl.model;

/**
 * @author fengwk
 */
public enum JobStatus {

    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

}
