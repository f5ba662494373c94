package com.dingdangmaoup.bootsync.config;

import com.dingdangmaoup.bootsync.config.properties.SimplestreamsProperties;
import com.dingdangmaoup.bootsync.config.properties.SyncProperties;
import com.dingdangmaoup.bootsync.simplestreams.DownloadAuthenticator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig {

    private final SimplestreamsProperties simplestreamsProperties;
    private final SyncProperties syncProperties;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Configured ObjectMapper with JavaTimeModule for Java 8 date/time support");
        return mapper;
    }

    /**
     * Mapper for custom storage layout documents
     */
    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    @Bean
    @ConditionalOnMissingBean
    public DownloadAuthenticator downloadAuthenticator() {
        return DownloadAuthenticator.NONE;
    }

    /**
     * Client for simplestreams index and product documents
     */
    @Bean
    public WebClient simplestreamsWebClient() {
        Duration timeout = simplestreamsProperties.getTimeout();
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize((int) simplestreamsProperties.getMaxInMemorySize().toBytes()))
                .build();

        log.info("Initialized simplestreams WebClient with timeout: {}, user agent: {}",
                timeout, simplestreamsProperties.getUserAgent());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient("simplestreams", timeout)))
                .defaultHeader("User-Agent", simplestreamsProperties.getUserAgent())
                .exchangeStrategies(strategies)
                .build();
    }

    /**
     * Client used to stream boot resource files from upstream mirrors and peer regions
     */
    @Bean
    public WebClient downloadWebClient() {
        Duration timeout = syncProperties.getDownloadTimeout();
        log.info("Initialized download WebClient with timeout: {}", timeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient("boot-resources", timeout)))
                .defaultHeader("User-Agent", simplestreamsProperties.getUserAgent())
                .build();
    }

    private HttpClient httpClient(String name, Duration timeout) {
        ConnectionProvider provider = ConnectionProvider.builder(name)
                .maxConnections(100)
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofMinutes(5))
                .pendingAcquireTimeout(Duration.ofSeconds(60))
                .evictInBackground(Duration.ofSeconds(120))
                .build();

        return HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 30_000)
                .responseTimeout(timeout)
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS)));
    }
}
