package org.kpa.tap.configuration;

import org.kpa.tap.client.RetrySleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient kpaRestClient(RestClient.Builder builder, KpaProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getHttp().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getHttp().getReadTimeout().toMillis());

        return builder
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    if (StringUtils.hasText(properties.getUserAgent())) {
                        headers.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
                    }
                })
                .build();
    }

    @Bean
    public RetrySleeper retrySleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
