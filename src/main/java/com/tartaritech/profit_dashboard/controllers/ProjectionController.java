package com.tartaritech.profit_dashboard.controllers;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tartaritech.profit_dashboard.dtos.BaseMonthRequestDTO;
import com.tartaritech.profit_dashboard.dtos.MultiplierRequestDTO;
import com.tartaritech.profit_dashboard.services.ProjectionEngine;
import com.tartaritech.profit_dashboard.services.ProjectionService;

import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;

/**
 * Projection state lives in the caller's HTTP session and is rebuilt by {@code init}.
 */
@RestController
@RequestMapping("/api/projection")
@CrossOrigin(origins = "*")
public class ProjectionController {

    static final String SESSION_ATTRIBUTE = "projectionEngine";

    private final ProjectionService projectionService;
    private final Logger logger = LoggerFactory.getLogger(ProjectionController.class);

    public ProjectionController(ProjectionService projectionService) {
        this.projectionService = projectionService;
    }

    @PostMapping("/init")
    public ResponseEntity<Object> init(@RequestParam(defaultValue = "180") int days, HttpSession session) {
        try {
            ProjectionEngine engine = projectionService.createProjection(days);
            session.setAttribute(SESSION_ATTRIBUTE, engine);
            return ResponseEntity.ok(engine.getState());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error initializing projection", e);
            return ResponseEntity.internalServerError().body(errorResponse("Error initializing projection: " + e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<Object> getProjection(HttpSession session) {
        ProjectionEngine engine = currentEngine(session);
        if (engine == null) {
            return notInitialized();
        }
        return ResponseEntity.ok(engine.getState());
    }

    @PutMapping("/base-month")
    public ResponseEntity<Object> setBaseMonth(@Valid @RequestBody BaseMonthRequestDTO request, HttpSession session) {
        ProjectionEngine engine = currentEngine(session);
        if (engine == null) {
            return notInitialized();
        }
        try {
            engine.setBaseMonth(request.getIndex());
            session.setAttribute(SESSION_ATTRIBUTE, engine);
            return ResponseEntity.ok(engine.getState());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        }
    }

    @PutMapping("/multipliers/{index}")
    public ResponseEntity<Object> setMultiplier(@PathVariable int index,
                                                @Valid @RequestBody MultiplierRequestDTO request,
                                                HttpSession session) {
        ProjectionEngine engine = currentEngine(session);
        if (engine == null) {
            return notInitialized();
        }
        try {
            engine.setMultiplier(index, request.getValue());
            session.setAttribute(SESSION_ATTRIBUTE, engine);
            return ResponseEntity.ok(engine.getState());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse(e.getMessage()));
        }
    }

    private ProjectionEngine currentEngine(HttpSession session) {
        Object engine = session.getAttribute(SESSION_ATTRIBUTE);
        return engine instanceof ProjectionEngine projectionEngine ? projectionEngine : null;
    }

    private ResponseEntity<Object> notInitialized() {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(errorResponse("Projection not initialized, call POST /api/projection/init first"));
    }

    private Map<String, Object> errorResponse(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("message", message);
        return error;
    }
}
