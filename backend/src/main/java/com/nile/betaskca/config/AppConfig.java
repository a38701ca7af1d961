package com.nile.betaskca.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app-config")
public class AppConfig {

    /** Greeting returned by the root endpoint. */
    private String welcomeMessage = "Thanks for shopping at Nile!";

    /** Repository backend: "jooq" (PostgreSQL) or "memory". */
    private String storage = "jooq";
}
