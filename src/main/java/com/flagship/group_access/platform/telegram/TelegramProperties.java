package com.flagship.group_access.platform.telegram;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "telegram")
public class TelegramProperties {

    private String apiBaseUrl = "https://api.telegram.org";

    private String botToken = "";

    /** The paid group. Supergroup ids are negative. */
    private long groupChatId;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);
}
