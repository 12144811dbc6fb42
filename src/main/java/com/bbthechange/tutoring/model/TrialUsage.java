package com.bbthechange.tutoring.model;

import com.bbthechange.tutoring.util.TutoringKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * How many trial lessons a parent has used, across all courses.
 *
 * Key Pattern: PK = PARENT#{parentId}, SK = TRIAL_USAGE
 */
@DynamoDbBean
public class TrialUsage extends BaseItem {

    public static final String ITEM_TYPE = "TRIAL_USAGE";

    private String parentId;
    private Integer trialsUsed;

    public TrialUsage() {
        super();
        setItemType(ITEM_TYPE);
        this.trialsUsed = 0;
    }

    public TrialUsage(String parentId, int trialsUsed) {
        this();
        this.parentId = parentId;
        this.trialsUsed = trialsUsed;

        setPk(TutoringKeyFactory.getParentPk(parentId));
        setSk(TutoringKeyFactory.getTrialUsageSk());
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public Integer getTrialsUsed() {
        return trialsUsed;
    }

    public void setTrialsUsed(Integer trialsUsed) {
        this.trialsUsed = trialsUsed;
    }
}
