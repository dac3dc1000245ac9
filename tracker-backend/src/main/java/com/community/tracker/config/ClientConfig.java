package com.community.tracker.config;

import com.community.tracker.client.LoggingRoleGrantClient;
import com.community.tracker.client.RoleGrantClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * 外部服务相关的 Bean 配置
 */
@Configuration
public class ClientConfig {

    @Bean
    public WebClient aniListWebClient(TrackerProperties properties) {
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
                .codecs(configurer -> {
                    configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder());
                    configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder());
                    // 重度用户的统计响应会超过默认的 256 KB
                    configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024);
                }).build();

        return WebClient.builder()
                .baseUrl(properties.getAnilist().getBaseUrl())
                .exchangeStrategies(exchangeStrategies)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(RoleGrantClient.class)
    public RoleGrantClient roleGrantClient() {
        return new LoggingRoleGrantClient();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
