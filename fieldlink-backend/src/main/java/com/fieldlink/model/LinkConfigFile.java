package com.fieldlink.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the link schema file: the bind address, the declared fields and the relations exposing them.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LinkConfigFile {
    private String listen;

    @Valid
    @NotEmpty(message = "at least one field must be declared")
    private List<FieldConfig> fields = new ArrayList<>();

    @Valid
    private List<RelationConfig> relations = new ArrayList<>();
}
