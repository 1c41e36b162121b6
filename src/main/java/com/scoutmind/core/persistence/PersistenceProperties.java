package com.scoutmind.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Database connection for report storage. Leaving {@code url} unset keeps
 * reports in memory.
 */
@Component
@ConfigurationProperties(prefix = "scoutmind.persistence")
public class PersistenceProperties {

    private String url;
    private String username;
    private String password;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isConfigured() {
        return url != null && !url.isBlank();
    }
}
