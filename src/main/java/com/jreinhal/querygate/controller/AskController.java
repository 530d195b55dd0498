package com.jreinhal.querygate.controller;

import com.jreinhal.querygate.filter.SecurityContext;
import com.jreinhal.querygate.model.User;
import com.jreinhal.querygate.policy.ResourceMenuEntry;
import com.jreinhal.querygate.response.RenderedResponse;
import com.jreinhal.querygate.service.QueryGatewayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ask")
@Tag(name = "Query", description = "Questions over permitted business data")
public class AskController {
    private final QueryGatewayService gatewayService;

    public AskController(QueryGatewayService gatewayService) {
        this.gatewayService = gatewayService;
    }

    @PostMapping
    @Operation(summary = "Answer a question from the caller's permitted data")
    public ResponseEntity<?> ask(@RequestBody(required = false) Map<String, Object> body) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Authentication required"));
        }
        Object message = body == null ? null : body.get("message");
        if (!(message instanceof String text) || text.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing or invalid 'message' in request body."));
        }
        RenderedResponse response = this.gatewayService.ask(text, user);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/resources")
    @Operation(summary = "List the resources and fields the caller may ask about")
    public ResponseEntity<?> resources() {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Authentication required"));
        }
        List<ResourceMenuEntry> menu = this.gatewayService.menuFor(user);
        return ResponseEntity.ok(menu);
    }
}
