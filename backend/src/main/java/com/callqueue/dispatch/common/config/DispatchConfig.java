package com.callqueue.dispatch.common.config;

import com.callqueue.dispatch.directory.StaticQueueProperties;
import com.callqueue.dispatch.telephony.TelephonyChannelService;
import com.callqueue.dispatch.telephony.UnavailableTelephonyChannelService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({DispatchProperties.class, StaticQueueProperties.class})
public class DispatchConfig {

    @Bean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.dispatch", name = "telephony", havingValue = "none", matchIfMissing = true)
    public TelephonyChannelService unavailableTelephonyChannelService() {
        return new UnavailableTelephonyChannelService();
    }
}
