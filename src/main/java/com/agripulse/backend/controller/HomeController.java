package com.agripulse.backend.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class HomeController {

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("message", "Welcome to AgriPulse API 🚜");
        m.put("routes", List.of("/chat", "/detect", "/dashboard", "/terminal", "/ops/cache-status"));
        return m;
    }
}
