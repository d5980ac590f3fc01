package com.newsaggregator.collector.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final CollectorProperties properties;

    @Bean
    public WebClient webClient() {
        CollectorProperties.Http http = properties.getHttp();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.getConnectTimeout())
                .responseTimeout(Duration.ofMillis(http.getReadTimeout()))
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(http.getReadTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(http.getReadTimeout(), TimeUnit.MILLISECONDS))
                )
                .followRedirect(true);

        // 피드/페이지 본문이 기본 256KB 버퍼를 넘는 경우가 많다
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(http.getMaxInMemorySize()))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .defaultHeader("User-Agent", http.getUserAgent())
                .build();
    }
}
