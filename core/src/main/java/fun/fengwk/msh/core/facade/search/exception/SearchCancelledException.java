package fun.fengwk.msh.core.facade.search.exception;

/**
 * Search aborted by the caller.
 *
 * @author fengwk
 */
public class SearchCancelledException extends RuntimeException {

    public SearchCancelledException(String message) {
        super(message);
    }

    public SearchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

}
