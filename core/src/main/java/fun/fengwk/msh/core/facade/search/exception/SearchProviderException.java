package fun.fengwk.msh.core.facade.search.exception;

/**
 * Failure of a single provider call, the executor falls back to the next candidate.
 *
 * @author fengwk
 */
public class SearchProviderException extends RuntimeException {

    public SearchProviderException(String message) {
        super(message);
    }

    public SearchProviderException(String message, Throwable cause) {
        super(message, cause);
    }

}
