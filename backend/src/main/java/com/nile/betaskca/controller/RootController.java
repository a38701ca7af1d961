package com.nile.betaskca.controller;

import com.nile.betaskca.config.AppConfig;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class RootController {

    private final AppConfig appConfig;

    public RootController(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", appConfig.getWelcomeMessage());
    }
}
