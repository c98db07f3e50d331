package com.tollgate.server.tools;

import com.tollgate.database.DataSession;
import com.tollgate.gateway.ResponseEnvelope;
import com.tollgate.gateway.annotation.Injected;
import com.tollgate.gateway.annotation.Tool;
import com.tollgate.gateway.annotation.ToolName;
import com.tollgate.gateway.annotation.ToolParam;
import com.tollgate.security.GatewaySettings;
import com.tollgate.server.config.GatewayConfiguration;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in tools available in every profile.
 */
@ToolProvider
public class BaseTools {

    @Tool(name = "base_readQuery", description = "Execute a SQL query and return the result rows.")
    public ResponseEnvelope readQuery(DataSession session,
                                      @ToolParam(value = "sql", description = "SQL text to execute") String sql,
                                      @ToolName String toolName) {
        List<Map<String, Object>> rows = session.queryForList(sql);
        List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool_name", toolName);
        metadata.put("sql", sql);
        metadata.put("columns", columns);
        metadata.put("row_count", rows.size());
        return ResponseEnvelope.success(rows, metadata);
    }

    @Tool(name = "base_sessionInfo", description = "Describe the backend session: current user, database and driver.")
    public Map<String, Object> sessionInfo(Connection connection,
                                           @Injected(GatewayConfiguration.SETTINGS_INJECTABLE) GatewaySettings settings)
            throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("user", metaData.getUserName());
        info.put("database_product", metaData.getDatabaseProductName());
        info.put("database_version", metaData.getDatabaseProductVersion());
        info.put("driver", metaData.getDriverName());
        info.put("driver_version", metaData.getDriverVersion());
        info.put("application", settings.applicationName());
        info.put("profile", settings.profile());
        info.put("auth_mode", settings.authMode().value());
        return info;
    }
}
