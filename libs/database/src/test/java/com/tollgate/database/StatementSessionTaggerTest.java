package com.tollgate.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatementSessionTagger")
class StatementSessionTaggerTest {

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Test
    @DisplayName("executes the templated statement and closes it")
    void executesTemplate() throws Exception {
        when(connection.createStatement()).thenReturn(statement);

        new StatementSessionTagger("SET QUERY_BAND = '%s' FOR SESSION")
                .apply(connection, "APPLICATION=tollgate;TOOL_NAME=t;");

        verify(statement).execute("SET QUERY_BAND = 'APPLICATION=tollgate;TOOL_NAME=t;' FOR SESSION");
        verify(statement).close();
    }

    @Test
    @DisplayName("wraps SQL failures in SessionTagException")
    void wrapsFailure() throws Exception {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(anyString())).thenThrow(new SQLException("syntax error"));

        assertThatThrownBy(() -> new StatementSessionTagger("SET X = '%s'").apply(connection, "a"))
                .isInstanceOf(SessionTagException.class)
                .hasMessageContaining("syntax error")
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("rejects a template without a placeholder")
    void rejectsTemplate() {
        assertThatThrownBy(() -> new StatementSessionTagger("SET QUERY_BAND = NONE"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
