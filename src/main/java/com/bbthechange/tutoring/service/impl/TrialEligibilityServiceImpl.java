package com.bbthechange.tutoring.service.impl;

import com.bbthechange.tutoring.config.SchedulingProperties;
import com.bbthechange.tutoring.dto.TrialEligibilityDTO;
import com.bbthechange.tutoring.model.TrialUsage;
import com.bbthechange.tutoring.repository.TrialConsumption;
import com.bbthechange.tutoring.repository.TrialUsageRepository;
import com.bbthechange.tutoring.service.TrialEligibilityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class TrialEligibilityServiceImpl implements TrialEligibilityService {

    private static final Logger logger = LoggerFactory.getLogger(TrialEligibilityServiceImpl.class);

    private final TrialUsageRepository trialUsageRepository;
    private final SchedulingProperties schedulingProperties;

    @Autowired
    public TrialEligibilityServiceImpl(TrialUsageRepository trialUsageRepository,
                                       SchedulingProperties schedulingProperties) {
        this.trialUsageRepository = trialUsageRepository;
        this.schedulingProperties = schedulingProperties;
    }

    @Override
    public TrialEligibilityDTO checkEligibility(String parentId, String courseId) {
        TrialUsage usage = trialUsageRepository.getTrialUsage(parentId);
        int cap = schedulingProperties.getTrialCap();
        int used = usage.getTrialsUsed() == null ? 0 : usage.getTrialsUsed();
        int remaining = Math.max(0, cap - used);

        logger.debug("Parent {} has used {}/{} trials (course {})", parentId, used, cap, courseId);
        return new TrialEligibilityDTO(used < cap, remaining, used, cap);
    }

    @Override
    public TrialConsumption consumeTrial(String parentId, String sessionId) {
        int cap = schedulingProperties.getTrialCap();
        TrialConsumption consumption = trialUsageRepository.consumeTrial(parentId, sessionId, cap);
        if (consumption == TrialConsumption.ALREADY_COUNTED) {
            logger.info("Trial session {} was already counted for parent {}", sessionId, parentId);
        } else if (consumption == TrialConsumption.LIMIT_REACHED) {
            logger.warn("Parent {} reached the trial cap of {} before session {} was counted",
                parentId, cap, sessionId);
        }
        return consumption;
    }
}
