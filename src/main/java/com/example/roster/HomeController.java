package com.example.roster;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HomeController {

    @GetMapping("/")
    public Map<String, Object> home() {
        Map<String, Object> response = new HashMap<>();
        response.put("application", "Roster Engine");
        response.put("version", "1.0.0");
        response.put("description", "Presence roster generation (base / home / unavailable)");

        Map<String, Object> endpoints = new HashMap<>();

        Map<String, String> rosterEndpoints = new HashMap<>();
        rosterEndpoints.put("generate", "POST /api/roster/generate");
        rosterEndpoints.put("modes", "GET /api/roster/modes");

        endpoints.put("roster", rosterEndpoints);
        response.put("availableEndpoints", endpoints);

        response.put("note", "mode may be ratio, min_staff, tasks or annealing; defaults to roster.optimization.default-mode");

        return response;
    }
}
