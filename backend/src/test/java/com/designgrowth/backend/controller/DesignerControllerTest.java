package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.request.CreateDesignerRequest;
import com.designgrowth.backend.model.Designer;
import com.designgrowth.backend.service.DesignerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DesignerController.class)
class DesignerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DesignerService designerService;

    @Test
    void createDesigner() throws Exception {
        given(designerService.createDesigner(any(CreateDesignerRequest.class))).willReturn("665f1c2ab7e4a93d1c0f0002");

        mockMvc.perform(post("/api/designers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Ada\", \"email\": \"ada@x.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("665f1c2ab7e4a93d1c0f0002"));
    }

    @Test
    void rejectsInvalidEmail() throws Exception {
        mockMvc.perform(post("/api/designers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Ada\", \"email\": \"not-an-email\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void listDesigners() throws Exception {
        Designer ada = Designer.builder().id("x1").name("Ada").email("ada@x.com")
                .currentLevel("Junior").guilds(List.of()).build();
        given(designerService.listDesigners()).willReturn(List.of(ada));

        mockMvc.perform(get("/api/designers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]._id").value("x1"))
                .andExpect(jsonPath("$[0].current_level").value("Junior"))
                .andExpect(jsonPath("$[0].guilds").isEmpty());
    }

    @Test
    @DisplayName("designers cannot be updated")
    void noUpdateEndpoint() throws Exception {
        mockMvc.perform(put("/api/designers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    @DisplayName("CORS preflight from any origin is allowed with credentials")
    void corsPreflight() throws Exception {
        mockMvc.perform(options("/api/designers")
                        .header("Origin", "https://growth.example.com")
                        .header("Access-Control-Request-Method", "POST")
                        .header("Access-Control-Request-Headers", "content-type"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://growth.example.com"))
                .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
    }
}
