package fun.fengwk.mah.core.service.discovery.model;

/**
 * @author fengwk
 */
public enum CandidateKind {

    /**
     * Article page, extracted and counted against the job budget.
     */
    ARTICLE,

    /**
     * Account history or album directory page, only fetched for links.
     */
    LISTING

}
