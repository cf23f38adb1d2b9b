package com.fieldlink.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A relation: one table in one external data source, exposing a subset of the declared fields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RelationConfig {
    public static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

    @NotBlank(message = "relation name is required")
    private String name;

    @NotBlank(message = "connect is required")
    private String connect;

    @NotBlank(message = "table_name is required")
    @Pattern(regexp = IDENTIFIER + "(\\." + IDENTIFIER + ")*", message = "table_name must be a plain (optionally schema-qualified) SQL identifier")
    private String tableName;

    @Valid
    @NotEmpty(message = "relation does not have any field")
    private List<RelationFieldConfig> fields = new ArrayList<>();
}
