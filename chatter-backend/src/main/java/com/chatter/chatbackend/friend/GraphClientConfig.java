package com.chatter.chatbackend.friend;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class GraphClientConfig {

    @Bean
    public RestClient graphRestClient(
            RestClient.Builder builder,
            @Value("${app.graph.url:http://localhost:8080}") String graphUrl,
            @Value("${app.graph.timeout:3s}") Duration timeout
    ) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder
                .baseUrl(graphUrl.replaceAll("/+$", ""))
                .requestFactory(requestFactory)
                .build();
    }
}
