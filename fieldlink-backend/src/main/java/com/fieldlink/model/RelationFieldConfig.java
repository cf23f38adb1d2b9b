package com.fieldlink.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Binds a declared field to a relation. {@code query} is the SQL expression producing the
 * field's value from a row of the relation's table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RelationFieldConfig {
    @NotBlank(message = "relation field id is required")
    private String id;

    @NotBlank(message = "query is required")
    private String query;
}
