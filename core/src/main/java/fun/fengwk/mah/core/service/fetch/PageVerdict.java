package fun.fengwk.mah.core.service.fetch;

/**
 * Classification of a rendered page.
 *
 * @author fengwk
 */
public enum PageVerdict {

    OK,
    SOFT_BLOCK,
    NOT_FOUND,
    REMOVED

}
