package com.flagship.group_access.platform.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.group_access.access.GroupAccessPlatform;
import com.flagship.group_access.access.PlatformCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link GroupAccessPlatform} over the Telegram Bot API.
 *
 * Every method is a plain POST of a JSON body to {@code /bot<token>/<method>}. Answers with
 * {@code ok=false}, HTTP errors and network failures all surface as {@link PlatformCallException}.
 */
@Component
@Slf4j
public class TelegramBotApiClient implements GroupAccessPlatform {

    private final RestClient http;
    private final TelegramProperties properties;
    private final Clock clock;

    public TelegramBotApiClient(@Qualifier("telegramRestClient") RestClient http,
                                TelegramProperties properties,
                                Clock clock) {
        this.http = http;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void grantAccess(long userId) {
        try {
            call("approveChatJoinRequest", Map.of(
                "chat_id", properties.getGroupChatId(),
                "user_id", userId));
            log.info("Join request approved: userId={}", userId);
        } catch (PlatformCallException e) {
            if (e.getMessage() != null && e.getMessage().contains("USER_ALREADY_PARTICIPANT")) {
                log.info("User already in group: userId={}", userId);
                return;
            }
            throw e;
        }
    }

    /**
     * Ban followed by unban, which removes the member but lets them request to join again.
     */
    @Override
    public void revokeAccess(long userId) {
        call("banChatMember", Map.of(
            "chat_id", properties.getGroupChatId(),
            "user_id", userId));
        call("unbanChatMember", Map.of(
            "chat_id", properties.getGroupChatId(),
            "user_id", userId,
            "only_if_banned", true));
        log.info("Member removed from group: userId={}", userId);
    }

    @Override
    public String createInviteLink(long userId, Duration ttl) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("chat_id", properties.getGroupChatId());
        params.put("name", "member-" + userId);
        params.put("expire_date", clock.instant().plus(ttl).getEpochSecond());
        params.put("member_limit", 1);

        JsonNode result = call("createChatInviteLink", params);
        String link = result.path("invite_link").asText(null);
        if (link == null) {
            throw PlatformCallException.retryable("EMPTY_RESULT", "createChatInviteLink returned no link", null);
        }
        return link;
    }

    @Override
    public void stopRecurringCharges(long userId, String chargeId) {
        if (chargeId == null) {
            throw PlatformCallException.fatal("NO_CHARGE_ID", "No recurring charge recorded for user " + userId);
        }
        call("editUserStarSubscription", Map.of(
            "user_id", userId,
            "telegram_payment_charge_id", chargeId,
            "is_canceled", true));
        log.info("Star subscription cancelled: userId={}, chargeId={}", userId, chargeId);
    }

    /**
     * @return the {@code result} field of a successful answer
     */
    JsonNode call(String method, Map<String, ?> params) {
        JsonNode response;
        try {
            response = http.post()
                    .uri("/{method}", method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(params)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RuntimeException e) {
            throw TelegramErrorMapper.map(method, e);
        }

        if (response == null) {
            throw PlatformCallException.retryable("EMPTY_RESPONSE", method + " returned no body", null);
        }
        if (!response.path("ok").asBoolean(false)) {
            JsonNode retryAfter = response.path("parameters").path("retry_after");
            throw TelegramErrorMapper.fromResponse(method,
                    response.path("error_code").asInt(0),
                    response.path("description").asText(null),
                    retryAfter.isNumber() ? retryAfter.asInt() : null);
        }
        return response.path("result");
    }
}
