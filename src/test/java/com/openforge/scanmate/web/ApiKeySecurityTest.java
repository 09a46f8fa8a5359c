package com.openforge.scanmate.web;

import com.openforge.scanmate.config.JacksonConfig;
import com.openforge.scanmate.config.SecurityConfig;
import com.openforge.scanmate.security.SecurityProperties;
import com.openforge.scanmate.store.SessionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HistoryController.class, properties = "scanmate.security.api-key=s3cret-key")
@Import({SecurityConfig.class, JacksonConfig.class})
class ApiKeySecurityTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    SessionStore store;

    @Test
    @DisplayName("With a key configured, the HTTP API answers 401 without it")
    void missingKey_isUnauthorized() throws Exception {
        mvc.perform(get("/history/nina"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.error").value("Missing or invalid API key"));
    }

    @Test
    @DisplayName("An anonymous principal does not count as an authenticated API client")
    void anonymousPrincipal_isUnauthorized() throws Exception {
        mvc.perform(get("/history/nina").with(anonymous()))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Missing or invalid API key"));
    }

    @Test
    void wrongKey_isUnauthorized() throws Exception {
        mvc.perform(get("/history/nina").header(SecurityProperties.API_KEY_HEADER, "guess"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void matchingKey_isAccepted() throws Exception {
        given(store.loadConversation("nina")).willReturn(List.of());

        mvc.perform(get("/history/nina").header(SecurityProperties.API_KEY_HEADER, "s3cret-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.history").isArray());
    }
}
