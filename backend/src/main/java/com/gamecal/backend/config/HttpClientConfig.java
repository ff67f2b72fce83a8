package com.gamecal.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    @Bean
    public WebClient upstreamWebClient(
            WebClient.Builder builder,
            @Value("${app.http.max-in-memory-bytes:16777216}") int maxInMemoryBytes
    ) {
        // Some publisher CDNs misbehave on HTTP/2 negotiation
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .protocol(HttpProtocol.HTTP11);

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
