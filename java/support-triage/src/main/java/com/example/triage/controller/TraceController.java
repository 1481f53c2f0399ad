package com.example.triage.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.triage.model.TraceRecord;
import com.example.triage.trace.TraceRecorder;

import reactor.core.publisher.Flux;

@RestController
public class TraceController {

    private final TraceRecorder traceRecorder;

    public TraceController(TraceRecorder traceRecorder) {
        this.traceRecorder = traceRecorder;
    }

    @GetMapping("/api/traces")
    public Flux<TraceRecord> traces(@RequestParam(defaultValue = "0") long after,
                                    @RequestParam(defaultValue = "100") int limit) {
        return traceRecorder.feed(after, limit);
    }
}
