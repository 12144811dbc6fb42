package com.bbthechange.tutoring.controller;

import com.bbthechange.tutoring.dto.TrialEligibilityDTO;
import com.bbthechange.tutoring.service.TrialEligibilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/trials")
@Tag(name = "Trials", description = "Trial lesson eligibility")
public class TrialController extends BaseController {

    private final TrialEligibilityService trialEligibilityService;

    @Autowired
    public TrialController(TrialEligibilityService trialEligibilityService) {
        this.trialEligibilityService = trialEligibilityService;
    }

    @GetMapping("/eligibility")
    @Operation(summary = "Check trial eligibility", description = "How many trial lessons the caller has left.")
    public ResponseEntity<TrialEligibilityDTO> getEligibility(
            @Parameter(description = "Optional course ID") @RequestParam(required = false) String courseId,
            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(trialEligibilityService.checkEligibility(userId, courseId));
    }
}
