package org.axioms.session;

import lombok.Builder;
import lombok.Getter;

/**
 * 会话的简单统计，用于诊断与测试。
 */
@Getter
@Builder
public class VerifierStats {

    private final int structuresLoaded;
    private final int loadRequests;
    private final int cacheHits;
    private final int verifications;
    private final int declaredOperations;

    @Override
    public String toString() {
        return "VerifierStats{structuresLoaded=" + structuresLoaded + ", loadRequests=" + loadRequests
                + ", cacheHits=" + cacheHits + ", verifications=" + verifications
                + ", declaredOperations=" + declaredOperations + "}";
    }
}
