package com.phillippitts.groundstation.config;

import com.phillippitts.groundstation.config.properties.SpeechServiceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * HTTP client used for the speech services, with connect and read timeouts taken from
 * {@link SpeechServiceProperties}.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient speechRestClient(RestClient.Builder builder, SpeechServiceProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());
        return builder.requestFactory(requestFactory).build();
    }
}
