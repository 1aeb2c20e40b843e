package com.taxidispatch.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class AffiliationResult {

    private boolean accepted;
    private String entityId;
    private String reason;

    public static AffiliationResult accepted(String entityId) {
        return new AffiliationResult(true, entityId, null);
    }

    public static AffiliationResult rejected(String reason) {
        return new AffiliationResult(false, null, reason);
    }
}
