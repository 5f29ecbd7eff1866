package com.forum.infrastructure.config;

import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.parameters.Parameter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenApiConfigTest {

    private final OpenApiConfig config = new OpenApiConfig();

    @Test
    void shouldDocumentOptionalUserIdHeaderOnEveryOperation() {
        Operation operation = config.userIdHeaderCustomizer().customize(new Operation(), null);

        assertEquals(1, operation.getParameters().size());
        Parameter header = operation.getParameters().get(0);
        assertEquals("X-User-Id", header.getName());
        assertEquals("header", header.getIn());
        assertFalse(header.getRequired());
        assertEquals("1", header.getExample());
    }
}
