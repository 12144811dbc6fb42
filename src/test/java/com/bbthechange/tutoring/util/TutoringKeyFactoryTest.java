package com.bbthechange.tutoring.util;

import com.bbthechange.tutoring.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TutoringKeyFactoryTest {

    private static final String ID = "0c6e9a52-3f1b-4d6a-9c1e-2b7f8d4a5e61";

    @Test
    void getTutorPk_WithValidId_ShouldReturnCorrectKey() {
        assertThat(TutoringKeyFactory.getTutorPk(ID)).isEqualTo("TUTOR#" + ID);
    }

    @Test
    void getSessionPk_WithValidId_ShouldReturnCorrectKey() {
        assertThat(TutoringKeyFactory.getSessionPk(ID)).isEqualTo("SESSION#" + ID);
    }

    @Test
    void trialConsumptionSk_IsScopedPerSession() {
        assertThat(TutoringKeyFactory.getTrialConsumptionSk(ID)).isEqualTo("TRIAL#" + ID);
    }

    @Test
    void getWindowSk_WithUpperCaseUuid_IsAccepted() {
        assertThat(TutoringKeyFactory.getWindowSk(ID.toUpperCase())).isEqualTo("WINDOW#" + ID.toUpperCase());
    }

    @Test
    void getTutorPk_WithNullId_ShouldThrowException() {
        assertThatThrownBy(() -> TutoringKeyFactory.getTutorPk(null))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Tutor ID cannot be null or empty");
    }

    @Test
    void getParentPk_WithMalformedId_ShouldThrowException() {
        assertThatThrownBy(() -> TutoringKeyFactory.getParentPk("parent-1"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Parent ID format");
    }

    @Test
    void fixedSortKeys_ShouldMatchTableLayout() {
        assertThat(TutoringKeyFactory.getMetadataSk()).isEqualTo("METADATA");
        assertThat(TutoringKeyFactory.getScheduleSk()).isEqualTo("SCHEDULE");
        assertThat(TutoringKeyFactory.getTrialUsageSk()).isEqualTo("TRIAL_USAGE");
    }
}
