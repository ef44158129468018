package com.vantage.domain;

import java.time.OffsetDateTime;

/**
 * Message published on the case channels whenever a case is created or reassigned.
 */
public class CaseChange {

    private CaseChangeType changeType;
    private SecurityCase securityCase;
    private String previousAssigneeId;
    private String actorId;
    private OffsetDateTime occurredAt;

    public CaseChange() {
    }

    public CaseChangeType getChangeType() {
        return changeType;
    }

    public void setChangeType(CaseChangeType changeType) {
        this.changeType = changeType;
    }

    public SecurityCase getSecurityCase() {
        return securityCase;
    }

    public void setSecurityCase(SecurityCase securityCase) {
        this.securityCase = securityCase;
    }

    public String getPreviousAssigneeId() {
        return previousAssigneeId;
    }

    public void setPreviousAssigneeId(String previousAssigneeId) {
        this.previousAssigneeId = previousAssigneeId;
    }

    public String getActorId() {
        return actorId;
    }

    public void setActorId(String actorId) {
        this.actorId = actorId;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(OffsetDateTime occurredAt) {
        this.occurredAt = occurredAt;
    }
}
