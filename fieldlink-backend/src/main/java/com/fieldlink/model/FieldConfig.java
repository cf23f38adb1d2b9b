package com.fieldlink.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A declared field. Values discovered for a {@code distinct} field seed further lookups,
 * values of any other field are reported but never expanded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FieldConfig {
    @NotBlank(message = "field id is required")
    @Pattern(regexp = RelationConfig.IDENTIFIER, message = "field id must be a plain SQL identifier")
    private String id;

    private boolean distinct;
}
