package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.StoreHealthDTO;
import com.designgrowth.backend.service.StoreHealthService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    @Autowired
    private StoreHealthService storeHealthService;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "Designer Growth Platform API running"));
    }

    /**
     * Store diagnostics. Always 200; connectivity problems are reported in the body.
     */
    @GetMapping("/test")
    public ResponseEntity<StoreHealthDTO> testDatabase() {
        return ResponseEntity.ok(storeHealthService.check());
    }
}
