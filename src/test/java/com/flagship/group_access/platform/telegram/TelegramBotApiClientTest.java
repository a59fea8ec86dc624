package com.flagship.group_access.platform.telegram;

import com.flagship.group_access.access.PlatformCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TelegramBotApiClientTest {

    private static final String BASE = "https://api.telegram.org/bot123:abc";
    private static final long GROUP = -1001234567890L;
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private MockRestServiceServer server;
    private TelegramBotApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();

        TelegramProperties properties = new TelegramProperties();
        properties.setGroupChatId(GROUP);
        client = new TelegramBotApiClient(builder.build(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Granting approves the pending join request")
    void grantApprovesJoinRequest() {
        server.expect(requestTo(BASE + "/approveChatJoinRequest"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.chat_id").value(GROUP))
            .andExpect(jsonPath("$.user_id").value(42))
            .andRespond(withSuccess("{\"ok\":true,\"result\":true}", MediaType.APPLICATION_JSON));

        client.grantAccess(42L);

        server.verify();
    }

    @Test
    @DisplayName("A member already in the group counts as granted")
    void alreadyParticipant() {
        server.expect(requestTo(BASE + "/approveChatJoinRequest"))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST).contentType(MediaType.APPLICATION_JSON)
                .body("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: USER_ALREADY_PARTICIPANT\"}"));

        assertDoesNotThrow(() -> client.grantAccess(42L));
    }

    @Test
    @DisplayName("Rate limits surface as retryable with the platform's wait")
    void rateLimited() {
        server.expect(requestTo(BASE + "/approveChatJoinRequest"))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).contentType(MediaType.APPLICATION_JSON)
                .body("{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 3\",\"parameters\":{\"retry_after\":3}}"));

        PlatformCallException e = assertThrows(PlatformCallException.class, () -> client.grantAccess(42L));

        assertTrue(e.isRetryable());
        assertEquals(Duration.ofSeconds(3), e.getRetryAfter());
    }

    @Test
    @DisplayName("Revoking bans and then lifts the ban")
    void revokeBansThenUnbans() {
        server.expect(requestTo(BASE + "/banChatMember"))
            .andExpect(jsonPath("$.user_id").value(42))
            .andRespond(withSuccess("{\"ok\":true,\"result\":true}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/unbanChatMember"))
            .andExpect(jsonPath("$.only_if_banned").value(true))
            .andRespond(withSuccess("{\"ok\":true,\"result\":true}", MediaType.APPLICATION_JSON));

        client.revokeAccess(42L);

        server.verify();
    }

    @Test
    @DisplayName("Invite links are single-use and expire after the ttl")
    void inviteLink() {
        server.expect(requestTo(BASE + "/createChatInviteLink"))
            .andExpect(jsonPath("$.member_limit").value(1))
            .andExpect(jsonPath("$.expire_date").value(NOW.plus(Duration.ofMinutes(5)).getEpochSecond()))
            .andRespond(withSuccess("{\"ok\":true,\"result\":{\"invite_link\":\"https://t.me/+abc\"}}",
                MediaType.APPLICATION_JSON));

        assertEquals("https://t.me/+abc", client.createInviteLink(42L, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Stopping renewal cancels the star subscription by charge id")
    void stopRecurringCharges() {
        server.expect(requestTo(BASE + "/editUserStarSubscription"))
            .andExpect(jsonPath("$.telegram_payment_charge_id").value("charge-9"))
            .andExpect(jsonPath("$.is_canceled").value(true))
            .andRespond(withSuccess("{\"ok\":true,\"result\":true}", MediaType.APPLICATION_JSON));

        client.stopRecurringCharges(42L, "charge-9");

        server.verify();
    }

    @Test
    @DisplayName("An ok=false answer with HTTP 200 is still an error")
    void okFalseWithSuccessStatus() {
        server.expect(requestTo(BASE + "/banChatMember"))
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andRespond(withSuccess("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}",
                MediaType.APPLICATION_JSON));

        PlatformCallException e = assertThrows(PlatformCallException.class, () -> client.revokeAccess(42L));
        assertFalse(e.isRetryable());
    }
}
