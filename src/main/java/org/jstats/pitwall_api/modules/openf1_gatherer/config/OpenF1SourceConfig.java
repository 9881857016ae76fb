package org.jstats.pitwall_api.modules.openf1_gatherer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties(prefix = "openf1.api")
record OpenF1SourceProperties(
        String baseUrl,
        @DurationUnit(ChronoUnit.MILLIS) Duration connectTimeout,
        @DurationUnit(ChronoUnit.MILLIS) Duration readTimeout,
        String userAgent) {}

@Configuration
@EnableConfigurationProperties(OpenF1SourceProperties.class)
public class OpenF1SourceConfig {

    private static final Logger log = LoggerFactory.getLogger(OpenF1SourceConfig.class);

    @Bean(name = "openf1")
    RestClient openF1RestClient(RestClient.Builder builder, OpenF1SourceProperties p) {
        if (!StringUtils.hasText(p.baseUrl())) {
            throw new IllegalStateException("OpenF1 base URL missing. Set openf1.api.base-url.");
        }
        log.info("OpenF1 client targeting {} (connect={}, read={})", p.baseUrl(), p.connectTimeout(), p.readTimeout());

        // Connect timeout is configured on the underlying JDK HttpClient:
        var httpClientBuilder = HttpClient.newBuilder();
        if (p.connectTimeout() != null) {
            httpClientBuilder.connectTimeout(p.connectTimeout());
        }
        final var jdkClient = httpClientBuilder.build();

        final var factory = new JdkClientHttpRequestFactory(jdkClient);
        if (p.readTimeout() != null) {
            factory.setReadTimeout(p.readTimeout());
        }

        var configured = builder
                .baseUrl(p.baseUrl())
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(p.userAgent())) {
            configured.defaultHeader(HttpHeaders.USER_AGENT, p.userAgent());
        }
        return configured.build();
    }
}
