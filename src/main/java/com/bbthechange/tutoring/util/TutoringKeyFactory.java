package com.bbthechange.tutoring.util;

import com.bbthechange.tutoring.exception.InvalidKeyException;

import java.util.regex.Pattern;

/**
 * Key factory for the TutoringTable single-table layout.
 *
 * <pre>
 * SESSION#{sessionId}           METADATA          session (GSI TutorTimeIndex: TUTOR#{tutorId} / scheduledAt,
 *                                                  GSI SubscriptionIndex: SUBSCRIPTION#{subscriptionId} / scheduledAt)
 * TUTOR#{tutorId}               WINDOW#{windowId} recurring availability window
 * TUTOR#{tutorId}               BLOCK#{blockId}   one-off unavailable period
 * TUTOR#{tutorId}               SCHEDULE          per-tutor write version
 * SUBSCRIPTION#{subscriptionId} METADATA          subscription (series anchor)
 * PARENT#{parentId}             TRIAL_USAGE       trial counter
 * PARENT#{parentId}             TRIAL#{sessionId} consumed-trial marker
 * </pre>
 */
public final class TutoringKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String TUTOR_PREFIX = "TUTOR";
    public static final String SESSION_PREFIX = "SESSION";
    public static final String SUBSCRIPTION_PREFIX = "SUBSCRIPTION";
    public static final String PARENT_PREFIX = "PARENT";
    public static final String WINDOW_PREFIX = "WINDOW";
    public static final String BLOCK_PREFIX = "BLOCK";
    public static final String TRIAL_PREFIX = "TRIAL";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String SCHEDULE_SUFFIX = "SCHEDULE";
    public static final String TRIAL_USAGE_SUFFIX = "TRIAL_USAGE";

    public static final String TABLE_NAME = "TutoringTable";
    public static final String TUTOR_TIME_INDEX = "TutorTimeIndex";
    public static final String SUBSCRIPTION_INDEX = "SubscriptionIndex";

    private TutoringKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static String getTutorPk(String tutorId) {
        validateId(tutorId, "Tutor");
        return TUTOR_PREFIX + DELIMITER + tutorId;
    }

    public static String getSessionPk(String sessionId) {
        validateId(sessionId, "Session");
        return SESSION_PREFIX + DELIMITER + sessionId;
    }

    public static String getSubscriptionPk(String subscriptionId) {
        validateId(subscriptionId, "Subscription");
        return SUBSCRIPTION_PREFIX + DELIMITER + subscriptionId;
    }

    public static String getParentPk(String parentId) {
        validateId(parentId, "Parent");
        return PARENT_PREFIX + DELIMITER + parentId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    public static String getScheduleSk() {
        return SCHEDULE_SUFFIX;
    }

    public static String getTrialUsageSk() {
        return TRIAL_USAGE_SUFFIX;
    }

    public static String getWindowSk(String windowId) {
        validateId(windowId, "Window");
        return WINDOW_PREFIX + DELIMITER + windowId;
    }

    public static String getBlockSk(String blockId) {
        validateId(blockId, "Block");
        return BLOCK_PREFIX + DELIMITER + blockId;
    }

    public static String getTrialConsumptionSk(String sessionId) {
        validateId(sessionId, "Session");
        return TRIAL_PREFIX + DELIMITER + sessionId;
    }
}
