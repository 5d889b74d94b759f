package fun.fengwk.msh.core.facade.search.exception;

/**
 * Backend reported throttling (HTTP 429).
 *
 * @author fengwk
 */
public class VendorRateLimitedException extends SearchProviderException {

    public VendorRateLimitedException(String message) {
        super(message);
    }

}
