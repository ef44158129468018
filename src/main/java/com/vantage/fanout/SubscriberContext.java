package com.vantage.fanout;

/**
 * Who is subscribed: identity and tenant.
 */
public class SubscriberContext {

    private final String subscriberId;
    private final String tenantId;

    public SubscriberContext(String subscriberId, String tenantId) {
        this.subscriberId = subscriberId;
        this.tenantId = tenantId;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public String getTenantId() {
        return tenantId;
    }

    @Override
    public String toString() {
        return "SubscriberContext{subscriberId=" + subscriberId + ", tenantId=" + tenantId + "}";
    }
}
