package fun.fengwk.mah.core.service.storage;

/**
 * @author fengwk
 */
public enum SaveResult {

    SUCCESS,
    DUPLICATE,
    ERROR

}
