package com.vantage.secops;

import com.vantage.domain.CaseChange;
import com.vantage.domain.IocChange;
import com.vantage.domain.SecurityEvent;
import com.vantage.fanout.EventChannel;

/**
 * Live channels of the security operations dashboard.
 */
public final class SecurityChannels {

    public static final EventChannel<SecurityEvent> EVENT_STREAM =
            EventChannel.of("security-event-stream", SecurityEvent.class);
    public static final EventChannel<SecurityEvent> EVENT_DELETIONS =
            EventChannel.of("security-event-deletions", SecurityEvent.class);
    public static final EventChannel<SecurityEvent> CRITICAL_ALERTS =
            EventChannel.of("critical-security-alerts", SecurityEvent.class);
    public static final EventChannel<CaseChange> CASE_UPDATES =
            EventChannel.of("case-updates", CaseChange.class);
    public static final EventChannel<CaseChange> CASE_ASSIGNMENTS =
            EventChannel.of("case-assignments", CaseChange.class);
    public static final EventChannel<IocChange> IOC_UPDATES =
            EventChannel.of("ioc-updates", IocChange.class);

    private SecurityChannels() {
    }
}
