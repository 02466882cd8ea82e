package com.tartaritech.profit_dashboard.controllers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tartaritech.profit_dashboard.dtos.ProfileTestRequestDTO;
import com.tartaritech.profit_dashboard.dtos.ProfileTestResponseDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingProfileDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingProfileUpdateDTO;
import com.tartaritech.profit_dashboard.exceptions.ResourceNotFoundException;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;
import com.tartaritech.profit_dashboard.services.ShippingProfileService;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/shipping/profiles")
@CrossOrigin(origins = "*")
@Validated
public class ShippingProfileController {

    private final ShippingProfileService shippingProfileService;
    private final Logger logger = LoggerFactory.getLogger(ShippingProfileController.class);

    public ShippingProfileController(ShippingProfileService shippingProfileService) {
        this.shippingProfileService = shippingProfileService;
    }

    @GetMapping
    public ResponseEntity<List<ShippingProfileDTO>> getAllProfiles(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        try {
            logger.info("Request to get shipping profiles");
            return ResponseEntity.ok(shippingProfileService.getAllProfiles(activeOnly));
        } catch (Exception e) {
            logger.error("Error fetching shipping profiles", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getProfile(@PathVariable Long id) {
        try {
            logger.info("Request to get shipping profile: {}", id);
            return ResponseEntity.ok(shippingProfileService.getProfile(id));
        } catch (ResourceNotFoundException e) {
            Map<String, String> error = new HashMap<>();
            error.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        } catch (Exception e) {
            logger.error("Error fetching shipping profile: {}", id, e);
            Map<String, String> error = new HashMap<>();
            error.put("message", "Error fetching shipping profile: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }

    @PostMapping
    public ResponseEntity<?> createProfile(@Valid @RequestBody ShippingProfileDTO dto) {
        try {
            logger.info("Request to create shipping profile: {}", dto.getName());
            ShippingProfileDTO created = shippingProfileService.createProfile(dto);
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (IllegalArgumentException e) {
            logger.warn("Validation error creating shipping profile: {}", e.getMessage());
            Map<String, String> error = new HashMap<>();
            error.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
        } catch (Exception e) {
            logger.error("Error creating shipping profile", e);
            Map<String, String> error = new HashMap<>();
            error.put("message", "Error creating shipping profile: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateProfile(@PathVariable Long id, @Valid @RequestBody ShippingProfileUpdateDTO dto) {
        try {
            logger.info("Request to update shipping profile: {}", id);
            return ResponseEntity.ok(shippingProfileService.updateProfile(id, dto));
        } catch (ResourceNotFoundException e) {
            Map<String, String> error = new HashMap<>();
            error.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        } catch (IllegalArgumentException e) {
            logger.warn("Validation error updating shipping profile: {}", e.getMessage());
            Map<String, String> error = new HashMap<>();
            error.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
        } catch (Exception e) {
            logger.error("Error updating shipping profile: {}", id, e);
            Map<String, String> error = new HashMap<>();
            error.put("message", "Error updating shipping profile: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteProfile(@PathVariable Long id) {
        try {
            logger.info("Request to delete shipping profile: {}", id);
            shippingProfileService.deleteProfile(id);
            Map<String, String> response = new HashMap<>();
            response.put("message", "Shipping profile deleted successfully");
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            Map<String, String> error = new HashMap<>();
            error.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        } catch (Exception e) {
            logger.error("Error deleting shipping profile: {}", id, e);
            Map<String, String> error = new HashMap<>();
            error.put("message", "Error deleting shipping profile: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }

    @PostMapping("/test")
    public ResponseEntity<?> testProfile(@Valid @RequestBody ProfileTestRequestDTO request) {
        try {
            ProfileTestResponseDTO result = shippingProfileService.testProfile(request);
            return ResponseEntity.ok(result);
        } catch (ShippingRuleConfigurationException e) {
            Map<String, Object> error = new HashMap<>();
            error.put("message", e.getMessage());
            error.put("status", "MISCONFIGURED_RULE");
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
        } catch (Exception e) {
            logger.error("Error testing shipping profile", e);
            Map<String, String> error = new HashMap<>();
            error.put("message", "Error testing shipping profile: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }
}
