package com.calypso.dispatch.api;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.deploy.PreviewAccessException;
import com.calypso.deploy.PreviewInfo;
import com.calypso.deploy.PreviewManager;
import com.calypso.deploy.PreviewSiteStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PreviewController.class)
class PreviewControllerTest {

    private static final String BASE = "/api/v1/projects/p1/preview";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PreviewManager previewManager;

    @Test
    @DisplayName("POST /preview returns the preview address and token")
    void create() throws Exception {
        when(previewManager.createPreview("p1"))
                .thenReturn(new PreviewInfo("https://pv-abc.calypso.build", "tok", true));

        mockMvc.perform(post(BASE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.url").value("https://pv-abc.calypso.build"))
                .andExpect(jsonPath("$.token").value("tok"))
                .andExpect(jsonPath("$.ready").value(true));
    }

    @Test
    @DisplayName("POST /preview without a build is 404")
    void createWithoutBuild() throws Exception {
        when(previewManager.createPreview("p1")).thenThrow(new NoCompletedBuildException("p1"));

        mockMvc.perform(post(BASE)).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /preview reports a missing preview as not ready")
    void getNotReady() throws Exception {
        when(previewManager.getPreview("p1")).thenReturn(PreviewInfo.notReady());

        mockMvc.perform(get(BASE))
                .andExpect(jsonPath("$.ready").value(false))
                .andExpect(jsonPath("$.url").doesNotExist());
    }

    @Nested
    @DisplayName("GET /preview/status")
    class StatusTests {

        @Test
        @DisplayName("answers with CORS headers")
        void status() throws Exception {
            when(previewManager.previewStatus("p1", "tok"))
                    .thenReturn(new PreviewSiteStatus(true, false, "https://demo.calypso.build"));

            mockMvc.perform(get(BASE + "/status").param("token", "tok"))
                    .andExpect(MockMvcResultMatchers.status().isOk())
                    .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                    .andExpect(jsonPath("$.published").value(true))
                    .andExpect(jsonPath("$.isStale").value(false));
        }

        @Test
        @DisplayName("a missing token is 401 and a wrong one 403")
        void tokenErrors() throws Exception {
            when(previewManager.previewStatus("p1", null)).thenThrow(PreviewAccessException.missingToken());
            when(previewManager.previewStatus("p1", "bad")).thenThrow(PreviewAccessException.invalidToken());

            mockMvc.perform(get(BASE + "/status"))
                    .andExpect(MockMvcResultMatchers.status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("Missing token"));
            mockMvc.perform(get(BASE + "/status").param("token", "bad"))
                    .andExpect(MockMvcResultMatchers.status().isForbidden())
                    .andExpect(jsonPath("$.error").value("Invalid token"));
        }

        @Test
        @DisplayName("answers a cross-origin preflight")
        void preflight() throws Exception {
            mockMvc.perform(options(BASE + "/status")
                            .header("Origin", "https://pv-abc.calypso.build")
                            .header("Access-Control-Request-Method", "GET"))
                    .andExpect(MockMvcResultMatchers.status().isOk())
                    .andExpect(header().string("Access-Control-Allow-Origin", "*"));
        }
    }
}
