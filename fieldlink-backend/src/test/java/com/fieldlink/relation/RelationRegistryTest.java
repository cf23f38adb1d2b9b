package com.fieldlink.relation;

import com.fieldlink.model.RelationConfig;
import com.fieldlink.model.RelationFieldConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RelationRegistryTest {

    private static RelationConfig relation(String name) {
        return new RelationConfig(name, "jdbc:h2:mem:" + name, name,
                new ArrayList<>(List.of(new RelationFieldConfig("user_id", "id"))));
    }

    private static RelationAdapter closeableAdapter(String name) {
        RelationAdapter adapter = mock(RelationAdapter.class, withSettings().extraInterfaces(AutoCloseable.class));
        when(adapter.getName()).thenReturn(name);
        return adapter;
    }

    @Test
    @DisplayName("Should connect every relation in declaration order")
    void testConnectAll() {
        RelationAdapter first = closeableAdapter("first");
        RelationAdapter second = closeableAdapter("second");

        RelationRegistry registry = new RelationRegistry(List.of(relation("first"), relation("second")),
                config -> config.getName().equals("first") ? first : second);

        assertEquals(List.of(first, second), registry.getAdapters());
    }

    @Test
    @DisplayName("Should close already connected relations when one fails")
    void testFailureClosesConnected() throws Exception {
        RelationAdapter first = closeableAdapter("first");

        RelationConnectionException failure = new RelationConnectionException("unreachable", null);
        RelationConnectionException thrown = assertThrows(RelationConnectionException.class,
                () -> new RelationRegistry(List.of(relation("first"), relation("second")), config -> {
                    if (config.getName().equals("second")) {
                        throw failure;
                    }
                    return first;
                }));

        assertSame(failure, thrown);
        verify((AutoCloseable) first).close();
    }

    @Test
    @DisplayName("Should close every adapter on shutdown")
    void testClose() throws Exception {
        RelationAdapter first = closeableAdapter("first");
        RelationAdapter plain = mock(RelationAdapter.class);

        RelationRegistry registry = new RelationRegistry(List.of(relation("first"), relation("plain")),
                config -> config.getName().equals("first") ? first : plain);
        registry.close();

        verify((AutoCloseable) first).close();
    }
}
