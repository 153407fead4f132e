package fun.fengwk.mah.core.service.extract.model;

import lombok.Getter;

/**
 * Outcome of an extraction, a record together with the winning strategy, or a failure reason.
 *
 * @author fengwk
 */
@Getter
public class ExtractionResult {

    private final ArticleRecord record;

    private final String strategy;

    private final String failureReason;

    private ExtractionResult(ArticleRecord record, String strategy, String failureReason) {
        this.record = record;
        this.strategy = strategy;
        this.failureReason = failureReason;
    }

    public static ExtractionResult success(ArticleRecord record, String strategy) {
        return new ExtractionResult(record, strategy, null);
    }

    public static ExtractionResult failure(String reason) {
        return new ExtractionResult(null, null, reason);
    }

    public boolean isSuccess() {
        return record != null;
    }

}
