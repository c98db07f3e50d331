package com.tollgate.gateway;

import com.tollgate.database.SessionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ToolDescriptor")
class ToolDescriptorTest {

    @Test
    @DisplayName("advertises only visible parameters in the input schema")
    @SuppressWarnings("unchecked")
    void inputSchemaHidesInternalParameters() {
        ToolDescriptor descriptor = ToolDescriptor.builder("dba_tableSqlList")
                .description("  SQL against a table  ")
                .required("table_name", ParameterType.STRING, "table name")
                .optional("days", ParameterType.INTEGER, "", 7)
                .parameter(ToolParameter.toolName("tool_name"))
                .parameter(ToolParameter.injected("gateway_settings"))
                .build();

        Map<String, Object> schema = descriptor.inputSchema();

        assertThat(descriptor.description()).isEqualTo("SQL against a table");
        assertThat(schema).containsEntry("type", "object");
        Map<String, Object> properties = (Map<String, Object>) schema.get("properties");
        assertThat(properties).containsOnlyKeys("table_name", "days");
        assertThat((Map<String, Object>) properties.get("table_name"))
                .containsEntry("type", "string")
                .containsEntry("description", "table name");
        assertThat((Map<String, Object>) properties.get("days"))
                .containsEntry("type", "integer")
                .containsEntry("default", 7L)
                .doesNotContainKey("description");
        assertThat(schema.get("required")).isEqualTo(List.of("table_name"));
    }

    @Test
    @DisplayName("produces an empty schema for a tool without arguments")
    void emptySchema() {
        ToolDescriptor descriptor = ToolDescriptor.builder("base_sessionInfo").sessionKind(SessionKind.RAW).build();

        assertThat(descriptor.inputSchema())
                .containsEntry("properties", Map.of())
                .containsEntry("required", List.of());
    }

    @Test
    @DisplayName("a default value makes a parameter optional")
    void defaultImpliesOptional() {
        ToolParameter parameter = new ToolParameter("limit", ParameterType.INTEGER, null, true, "50",
                ParameterRole.VISIBLE);

        assertThat(parameter.required()).isFalse();
        assertThat(parameter.defaultValue()).isEqualTo(50L);
    }

    @Test
    @DisplayName("rejects duplicate visible names")
    void rejectsDuplicates() {
        assertThatThrownBy(() -> ToolDescriptor.builder("t")
                .required("a", ParameterType.STRING, "")
                .optional("a", ParameterType.STRING, "", "x")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate parameter a");
    }

    @Test
    @DisplayName("rejects an explicit session parameter")
    void rejectsSessionParameter() {
        assertThatThrownBy(() -> ToolDescriptor.builder("t")
                .parameter(new ToolParameter("conn", null, "", false, null, ParameterRole.SESSION))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
