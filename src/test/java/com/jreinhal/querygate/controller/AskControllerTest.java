package com.jreinhal.querygate.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.querygate.exception.GlobalExceptionHandler;
import com.jreinhal.querygate.filter.SecurityContext;
import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.policy.ResourceMenuEntry;
import com.jreinhal.querygate.response.RenderedResponse;
import com.jreinhal.querygate.service.QueryGatewayService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AskControllerTest {

    @Mock
    private QueryGatewayService gatewayService;

    private MockMvc mockMvc;
    private final User user = User.withId("op-1");

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AskController(gatewayService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        SecurityContext.setCurrentUser(user);
    }

    @AfterEach
    void tearDown() {
        SecurityContext.clear();
    }

    @Test
    void answersQuestion() throws Exception {
        when(gatewayService.ask(eq("How many sites?"), any()))
                .thenReturn(new RenderedResponse("Found 1 record. Pune", List.of(Map.of("site_name", "Pune")), 1, true, false));

        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"How many sites?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("Found 1 record. Pune"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.hasData").value(true))
                .andExpect(jsonPath("$.clarification").value(false))
                .andExpect(jsonPath("$.data[0].site_name").value("Pune"));

        verify(gatewayService).ask("How many sites?", user);
    }

    @Test
    void rejectsMissingOrNonStringMessage() throws Exception {
        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON).content("{\"message\":42}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing or invalid 'message' in request body."));
        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(gatewayService);
    }

    @Test
    void rejectsUnparseableBody() throws Exception {
        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void requiresCaller() throws Exception {
        SecurityContext.clear();

        mockMvc.perform(post("/api/ask").contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"hi\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void listsResources() throws Exception {
        when(gatewayService.menuFor(user)).thenReturn(List.of(new ResourceMenuEntry("sites", "Sites", List.of("site_name"))));

        mockMvc.perform(get("/api/ask/resources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("sites"))
                .andExpect(jsonPath("$[0].fields[0]").value("site_name"));
    }
}
