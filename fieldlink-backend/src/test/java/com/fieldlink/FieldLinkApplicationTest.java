package com.fieldlink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end: YAML schema, H2-backed relations, resolver and HTTP envelope.
 */
@SpringBootTest(properties = "fieldlink.config-path=classpath:fieldlink-test.yaml")
@AutoConfigureMockMvc
class FieldLinkApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Should link user 42 to its email and country")
    void testResolveUser() throws Exception {
        mockMvc.perform(get("/query").param("user_id", "42").header("X-Request-Id", "it-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "it-1"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value(""))
                .andExpect(jsonPath("$.data.email.length()").value(1))
                .andExpect(jsonPath("$.data.email[0]").value("a@x.com"))
                .andExpect(jsonPath("$.data.country.length()").value(1))
                .andExpect(jsonPath("$.data.country[0]").value("US"))
                .andExpect(jsonPath("$.data.user_id").doesNotExist());
    }

    @Test
    @DisplayName("Should reject an undeclared seed field")
    void testBogusField() throws Exception {
        mockMvc.perform(get("/query").param("bogus_field", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("no relation has field `bogus_field`"))
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("Should not expand the non-distinct country field")
    void testCountryNotExpanded() throws Exception {
        // both users live in the US; only the seeded one may be reached
        mockMvc.perform(get("/query").param("email", "b@x.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.user_id[0]").value("7"))
                .andExpect(jsonPath("$.data.user_id.length()").value(1))
                .andExpect(jsonPath("$.data.country[0]").value("FR"))
                .andExpect(jsonPath("$.data.email").doesNotExist());
    }
}
