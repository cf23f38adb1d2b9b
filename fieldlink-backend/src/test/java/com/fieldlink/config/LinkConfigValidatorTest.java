package com.fieldlink.config;

import com.fieldlink.model.FieldConfig;
import com.fieldlink.model.LinkConfigFile;
import com.fieldlink.model.RelationConfig;
import com.fieldlink.model.RelationFieldConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkConfigValidatorTest {

    private LinkConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new LinkConfigValidator();
    }

    private static LinkConfigFile config(List<FieldConfig> fields, List<RelationConfig> relations) {
        LinkConfigFile config = new LinkConfigFile();
        config.setFields(new ArrayList<>(fields));
        config.setRelations(new ArrayList<>(relations));
        return config;
    }

    private static RelationConfig relation(String name, RelationFieldConfig... fields) {
        return new RelationConfig(name, "jdbc:h2:mem:" + name, "t_" + name, new ArrayList<>(List.of(fields)));
    }

    @Test
    @DisplayName("Should accept a well-formed schema")
    void testValidSchema() {
        LinkConfigFile config = config(
                List.of(new FieldConfig("user_id", true), new FieldConfig("email", true)),
                List.of(relation("users", new RelationFieldConfig("user_id", "id"), new RelationFieldConfig("email", "email"))));
        assertDoesNotThrow(() -> validator.validate(config));
    }

    @Test
    @DisplayName("Should reject a relation referencing an undeclared field")
    void testUndeclaredField() {
        LinkConfigFile config = config(
                List.of(new FieldConfig("user_id", true)),
                List.of(relation("users", new RelationFieldConfig("user_id", "id"), new RelationFieldConfig("email", "email"))));
        ConfigException e = assertThrows(ConfigException.class, () -> validator.validate(config));
        assertTrue(e.getMessage().contains("undeclared field `email` used in relation `users`"));
    }

    @Test
    @DisplayName("Should reject duplicate field ids")
    void testDuplicateField() {
        LinkConfigFile config = config(
                List.of(new FieldConfig("user_id", true), new FieldConfig("user_id", false)),
                List.of());
        ConfigException e = assertThrows(ConfigException.class, () -> validator.validate(config));
        assertTrue(e.getMessage().contains("duplicate field `user_id`"));
    }

    @Test
    @DisplayName("Should reject duplicate relation names")
    void testDuplicateRelation() {
        LinkConfigFile config = config(
                List.of(new FieldConfig("user_id", true)),
                List.of(relation("users", new RelationFieldConfig("user_id", "id")),
                        relation("users", new RelationFieldConfig("user_id", "uid"))));
        ConfigException e = assertThrows(ConfigException.class, () -> validator.validate(config));
        assertTrue(e.getMessage().contains("duplicate relation name `users`"));
    }

    @Test
    @DisplayName("Should reject a relation without fields")
    void testRelationWithoutFields() {
        LinkConfigFile config = config(
                List.of(new FieldConfig("user_id", true)),
                List.of(relation("users")));
        ConfigException e = assertThrows(ConfigException.class, () -> validator.validate(config));
        assertTrue(e.getMessage().contains("relation does not have any field"));
    }

    @Test
    @DisplayName("Should reject a field bound twice in one relation")
    void testFieldBoundTwice() {
        LinkConfigFile config = config(
                List.of(new FieldConfig("user_id", true)),
                List.of(relation("users", new RelationFieldConfig("user_id", "id"), new RelationFieldConfig("user_id", "uid"))));
        assertThrows(ConfigException.class, () -> validator.validate(config));
    }

    @Test
    @DisplayName("Should reject field ids and table names that are not plain identifiers")
    void testIdentifierSyntax() {
        LinkConfigFile badField = config(List.of(new FieldConfig("user id; drop", true)), List.of());
        assertThrows(ConfigException.class, () -> validator.validate(badField));

        RelationConfig badTable = relation("users", new RelationFieldConfig("user_id", "id"));
        badTable.setTableName("users; drop table users");
        LinkConfigFile config = config(List.of(new FieldConfig("user_id", true)), List.of(badTable));
        ConfigException e = assertThrows(ConfigException.class, () -> validator.validate(config));
        assertTrue(e.getMessage().contains("tableName"));
    }

    @Test
    @DisplayName("Should accept schema-qualified table names")
    void testQualifiedTableName() {
        RelationConfig qualified = relation("users", new RelationFieldConfig("user_id", "id"));
        qualified.setTableName("public.users");
        LinkConfigFile config = config(List.of(new FieldConfig("user_id", true)), List.of(qualified));
        assertDoesNotThrow(() -> validator.validate(config));
    }

    @Test
    @DisplayName("Should reject a schema without fields and blank relation properties")
    void testMissingProperties() {
        assertThrows(ConfigException.class, () -> validator.validate(config(List.of(), List.of())));

        RelationConfig blankConnect = relation("users", new RelationFieldConfig("user_id", "id"));
        blankConnect.setConnect(" ");
        assertThrows(ConfigException.class,
                () -> validator.validate(config(List.of(new FieldConfig("user_id", true)), List.of(blankConnect))));

        RelationConfig blankQuery = relation("users", new RelationFieldConfig("user_id", ""));
        assertThrows(ConfigException.class,
                () -> validator.validate(config(List.of(new FieldConfig("user_id", true)), List.of(blankQuery))));
    }

    @Test
    @DisplayName("Should reject a missing configuration")
    void testNullConfig() {
        assertThrows(ConfigException.class, () -> validator.validate(null));
    }
}
