package fun.fengwk.msh.core.facade.search.exception;

/**
 * Malformed search request.
 *
 * @author fengwk
 */
public class SearchRequestValidationException extends RuntimeException {

    public SearchRequestValidationException(String message) {
        super(message);
    }

}
