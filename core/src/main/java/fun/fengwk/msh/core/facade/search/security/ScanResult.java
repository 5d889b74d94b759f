package fun.fengwk.msh.core.facade.search.security;

import lombok.Builder;
import lombok.Value;

/**
 * Verdict of a content scan.
 *
 * @author fengwk
 */
@Value
@Builder
public class ScanResult {

    private static final ScanResult ALLOWED = ScanResult.builder().action(ScanAction.ALLOW).build();

    ScanAction action;

    /**
     * Human readable reason for WARN/BLOCK.
     */
    String message;

    public static ScanResult allowed() {
        return ALLOWED;
    }

}
