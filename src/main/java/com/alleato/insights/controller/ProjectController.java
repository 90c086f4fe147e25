package com.alleato.insights.controller;

import com.alleato.insights.service.ProjectResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectResolver projectResolver;

    @GetMapping("/resolve")
    public ResponseEntity<ProjectResolveResponse> resolve(@RequestParam(name = "mention") String mention) {
        return ResponseEntity.ok(new ProjectResolveResponse(mention, projectResolver.resolve(mention).orElse(null)));
    }
}
