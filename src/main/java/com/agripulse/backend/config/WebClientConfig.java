package com.agripulse.backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    @Qualifier("weatherClient")
    public WebClient weatherClient(WebClient.Builder builder,
                                   @Value("${weather.base-url:http://api.weatherapi.com/v1}") String baseUrl) {
        return builder.clone().baseUrl(baseUrl).build();
    }

    @Bean
    @Qualifier("mandiClient")
    public WebClient mandiClient(WebClient.Builder builder,
                                 @Value("${mandi.base-url:https://api.data.gov.in/resource/9ef84268-d588-465a-a308-a864a43d0070}") String baseUrl) {
        return builder.clone()
                .baseUrl(baseUrl)
                // the mandi dataset answers with several MB when the limit is high
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build();
    }

    @Bean
    @Qualifier("geminiClient")
    public WebClient geminiClient(WebClient.Builder builder,
                                  @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl) {
        return builder.clone().baseUrl(baseUrl).build();
    }
}
