package com.flagship.group_access.access;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AccessController.class)
class AccessControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AccessRecoveryService recoveryService;

    @Test
    @DisplayName("A paid member gets an invite link")
    void inviteLink() throws Exception {
        when(recoveryService.enter(42L)).thenReturn(
            RecoveryResult.inviteLink("https://t.me/+abc", Instant.parse("2025-01-01T00:05:00Z")));

        mockMvc.perform(post("/api/access/42/enter"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("INVITE_LINK"))
            .andExpect(jsonPath("$.inviteLink").value("https://t.me/+abc"));
    }

    @Test
    @DisplayName("A member without paid access is refused")
    void noAccess() throws Exception {
        when(recoveryService.enter(42L)).thenReturn(RecoveryResult.noActiveAccess());

        mockMvc.perform(post("/api/access/42/enter"))
            .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("An unreachable platform answers 503")
    void unavailable() throws Exception {
        when(recoveryService.enter(42L)).thenReturn(RecoveryResult.unavailable("NETWORK_ERROR"));

        mockMvc.perform(post("/api/access/42/enter"))
            .andExpect(status().isServiceUnavailable());
    }
}
