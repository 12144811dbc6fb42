package com.bbthechange.tutoring.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Booking policy constants. Every value can be overridden under the
 * {@code tutoring.scheduling} prefix.
 */
@Component
@ConfigurationProperties(prefix = "tutoring.scheduling")
public class SchedulingProperties {

    private int minNoticeHours = 12;

    private int slotStepMinutes = 30;

    private int trialCap = 2;

    private int trialDurationMinutes = 60;

    private int maxHorizonDays = 90;

    // Reference zone used to turn "HH:mm" windows into instants
    private ZoneId zone = ZoneId.of("UTC");

    public int getMinNoticeHours() {
        return minNoticeHours;
    }

    public void setMinNoticeHours(int minNoticeHours) {
        this.minNoticeHours = minNoticeHours;
    }

    public int getSlotStepMinutes() {
        return slotStepMinutes;
    }

    public void setSlotStepMinutes(int slotStepMinutes) {
        this.slotStepMinutes = slotStepMinutes;
    }

    public int getTrialCap() {
        return trialCap;
    }

    public void setTrialCap(int trialCap) {
        this.trialCap = trialCap;
    }

    public int getTrialDurationMinutes() {
        return trialDurationMinutes;
    }

    public void setTrialDurationMinutes(int trialDurationMinutes) {
        this.trialDurationMinutes = trialDurationMinutes;
    }

    public int getMaxHorizonDays() {
        return maxHorizonDays;
    }

    public void setMaxHorizonDays(int maxHorizonDays) {
        this.maxHorizonDays = maxHorizonDays;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }
}
