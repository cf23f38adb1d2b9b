package com.fieldlink.config;

import com.fieldlink.model.FieldConfig;
import com.fieldlink.model.LinkConfigFile;
import com.fieldlink.model.RelationConfig;
import com.fieldlink.model.RelationFieldConfig;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates a parsed link schema.
 *
 * <p>Per-property constraints (blank values, identifier syntax, empty lists) are declared on the
 * model and checked with Bean Validation. Cross-references (unique ids and names, relation fields
 * pointing at declared fields) are checked here.
 */
public class LinkConfigValidator {

    private final Validator validator;

    public LinkConfigValidator() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            this.validator = factory.getValidator();
        }
    }

    /**
     * Validate the schema.
     *
     * @param config parsed schema
     * @throws ConfigException on the first violation found
     */
    public void validate(LinkConfigFile config) {
        if (config == null) {
            throw new ConfigException("configuration is empty");
        }

        Set<ConstraintViolation<LinkConfigFile>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new ConfigException("invalid configuration: " + details);
        }

        Set<String> fieldIds = new HashSet<>();
        for (FieldConfig field : config.getFields()) {
            if (!fieldIds.add(field.getId())) {
                throw new ConfigException("duplicate field `" + field.getId() + "`");
            }
        }

        Set<String> relationNames = new HashSet<>();
        for (RelationConfig relation : config.getRelations()) {
            if (!relationNames.add(relation.getName())) {
                throw new ConfigException("duplicate relation name `" + relation.getName() + "`");
            }
            Set<String> relationFieldIds = new HashSet<>();
            for (RelationFieldConfig field : relation.getFields()) {
                if (!fieldIds.contains(field.getId())) {
                    throw new ConfigException("undeclared field `" + field.getId() + "` used in relation `"
                            + relation.getName() + "`, you have to declare it in `fields`");
                }
                if (!relationFieldIds.add(field.getId())) {
                    throw new ConfigException("field `" + field.getId() + "` is bound twice in relation `"
                            + relation.getName() + "`");
                }
            }
        }
    }
}
