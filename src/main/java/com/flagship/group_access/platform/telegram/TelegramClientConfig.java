package com.flagship.group_access.platform.telegram;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class TelegramClientConfig {

    /**
     * Base URL already carries the bot token, so call sites only name the method.
     */
    @Bean("telegramRestClient")
    public RestClient telegramRestClient(TelegramProperties properties) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(properties.getReadTimeout());

        return RestClient.builder()
                .baseUrl(properties.getApiBaseUrl() + "/bot" + properties.getBotToken())
                .requestFactory(rf)
                .build();
    }
}
