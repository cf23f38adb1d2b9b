package com.fieldlink.util;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.Map;

@Data
@Builder
public class JdbcConnectionInfo {
    private String url;
    private String username;
    private String password;
    private String dbType;
    private String driverClassName;
    /** Driver-specific connection properties. */
    @Singular
    private Map<String, String> dataSourceProperties;
}
