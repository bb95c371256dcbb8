package com.planrunner.api;

import com.planrunner.tools.ToolDescriptor;
import com.planrunner.tools.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ToolRegistry toolRegistry;

    @Test
    void listsRegisteredTools() throws Exception {
        when(toolRegistry.describeTools()).thenReturn(List.of(
                new ToolDescriptor("KNOWLEDGE_SEARCH", "Searches the knowledge base.", "structured",
                        Map.of("query", "pricing", "limit", 5))));

        mockMvc.perform(get("/api/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("KNOWLEDGE_SEARCH"))
                .andExpect(jsonPath("$[0].invocation").value("structured"))
                .andExpect(jsonPath("$[0].exampleParameters.limit").value(5));
    }
}
