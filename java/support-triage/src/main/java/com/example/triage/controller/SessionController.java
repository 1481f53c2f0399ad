package com.example.triage.controller;

import java.util.Locale;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.triage.model.Session;
import com.example.triage.model.SessionState;
import com.example.triage.service.SessionQueryService;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionQueryService queries;

    public SessionController(SessionQueryService queries) {
        this.queries = queries;
    }

    @GetMapping
    public Flux<Session> list(@RequestParam(defaultValue = "TOOL_PENDING") String state) {
        return Mono.fromCallable(() -> SessionState.valueOf(state.strip().toUpperCase(Locale.ROOT)))
            .flatMapMany(queries::byState);
    }

    @GetMapping("/{id}")
    public Mono<SessionQueryService.SessionView> get(@PathVariable String id) {
        return queries.view(id);
    }
}
