package com.forgemind.core.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Selects and configures the behavior store.
 * <p>
 * {@code forgemind.store.type=memory} (default) keeps everything in process;
 * {@code jdbc} persists to the database named by {@code forgemind.store.jdbc.url}.
 */
@Component
@ConfigurationProperties(prefix = "forgemind.store")
public class StoreProperties {

    private String type = "memory";
    private Jdbc jdbc = new Jdbc();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public void setJdbc(Jdbc jdbc) {
        this.jdbc = jdbc;
    }

    public static class Jdbc {

        private String url = "";
        private String username = "";
        private String password = "";
        private boolean initializeSchema = true;

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

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }
}
