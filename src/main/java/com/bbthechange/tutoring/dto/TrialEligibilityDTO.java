package com.bbthechange.tutoring.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrialEligibilityDTO {

    private boolean eligible;
    private int trialsRemaining;
    private int trialsUsed;
    private int trialsCap;
}
