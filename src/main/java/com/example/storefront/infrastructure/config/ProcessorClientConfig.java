package com.example.storefront.infrastructure.config;

import com.example.storefront.config.CheckoutProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ProcessorClientConfig {

    @Bean
    public RestClient paymentProcessorRestClient(RestClient.Builder builder, CheckoutProperties properties) {
        CheckoutProperties.Processor processor = properties.getProcessor();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) processor.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) processor.getReadTimeout().toMillis());

        return builder
                .baseUrl(processor.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
