package com.callqueue.dispatch.queue.service;

import com.callqueue.dispatch.common.config.DispatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RealtimeMemberRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeMemberRefreshScheduler.class);

    private final QueueConfigurationService configurationService;
    private final DispatchProperties props;

    public RealtimeMemberRefreshScheduler(QueueConfigurationService configurationService, DispatchProperties props) {
        this.configurationService = configurationService;
        this.props = props;
    }

    @Scheduled(
            fixedDelayString = "${app.dispatch.realtime-refresh-interval-ms:60000}",
            initialDelayString = "${app.dispatch.realtime-refresh-interval-ms:60000}"
    )
    public void refresh() {
        if (!props.realtimeEnabled()) return;
        try {
            configurationService.refreshRealtimeQueues();
        } catch (RuntimeException e) {
            log.warn("realtime_member_refresh_failed", e);
        }
    }
}
