package com.fieldlink.controller;

import com.fieldlink.resolver.GraphResolver;
import com.fieldlink.resolver.ResolutionResult;
import com.fieldlink.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class FieldLinkControllerTest {

    @Mock
    private GraphResolver graphResolver;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FieldLinkController(graphResolver))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should pass query parameters as seeds and render the data")
    @SuppressWarnings("unchecked")
    void testQuery() throws Exception {
        TreeMap<String, List<String>> data = new TreeMap<>(Map.of(
                "email", List.of("a@x.com"),
                "country", List.of("US")));
        when(graphResolver.resolve(anyMap())).thenReturn(ResolutionResult.success("", data));

        mockMvc.perform(get("/query").param("user_id", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value(""))
                .andExpect(jsonPath("$.data.email[0]").value("a@x.com"))
                .andExpect(jsonPath("$.data.country[0]").value("US"));

        ArgumentCaptor<Map<String, String>> seeds = ArgumentCaptor.forClass(Map.class);
        verify(graphResolver).resolve(seeds.capture());
        assertEquals(Map.of("user_id", "42"), seeds.getValue());
    }

    @Test
    @DisplayName("Should answer 200 with success=false on resolution failures")
    void testFailure() throws Exception {
        when(graphResolver.resolve(anyMap()))
                .thenReturn(ResolutionResult.failure("no relation has field `bogus_field`"));

        mockMvc.perform(get("/query").param("bogus_field", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("no relation has field `bogus_field`"))
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("Should reject a field given more than once without resolving")
    void testRepeatedField() throws Exception {
        mockMvc.perform(get("/query").param("email", "a@x.com").param("email", "b@x.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("field `email` is given more than once"))
                .andExpect(jsonPath("$.data").isEmpty());

        verifyNoInteractions(graphResolver);
    }

    @Test
    @DisplayName("Should render unexpected errors in the same envelope")
    void testUnexpectedError() throws Exception {
        when(graphResolver.resolve(anyMap())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/query").param("user_id", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("internal error: boom"))
                .andExpect(jsonPath("$.data").isEmpty());
    }
}
