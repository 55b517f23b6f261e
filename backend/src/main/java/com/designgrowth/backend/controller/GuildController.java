package com.designgrowth.backend.controller;

import com.designgrowth.backend.dto.CreatedResponse;
import com.designgrowth.backend.dto.request.CreateGuildRequest;
import com.designgrowth.backend.model.Guild;
import com.designgrowth.backend.service.GuildService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/guilds")
public class GuildController {

    @Autowired
    private GuildService guildService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@Valid @RequestBody CreateGuildRequest request) {
        return ResponseEntity.ok(new CreatedResponse(guildService.createGuild(request)));
    }

    @GetMapping
    public ResponseEntity<List<Guild>> list() {
        return ResponseEntity.ok(guildService.listGuilds());
    }
}
