package com.resumeai.infrastructure.ai;

import com.resumeai.domain.rewrite.model.RewriteType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TemperatureScheduleTest {

    private final TemperatureSchedule schedule = new TemperatureSchedule();

    @Test
    @DisplayName("Bullets start low and cool by 0.1 per attempt down to the floor")
    void bullet_schedule() {
        assertThat(schedule.getTemperatureForAttempt(RewriteType.BULLET, 0)).isEqualTo(0.3);
        assertThat(schedule.getTemperatureForAttempt(RewriteType.BULLET, 1)).isEqualTo(0.2);
        assertThat(schedule.getTemperatureForAttempt(RewriteType.BULLET, 2)).isEqualTo(0.1);
        assertThat(schedule.getTemperatureForAttempt(RewriteType.BULLET, 5)).isEqualTo(0.1);
    }

    @Test
    void summary_and_section_schedules() {
        assertThat(schedule.getTemperatureForType(RewriteType.SUMMARY)).isEqualTo(0.5);
        assertThat(schedule.getTemperatureForAttempt(RewriteType.SUMMARY, 4)).isEqualTo(0.2);
        assertThat(schedule.getTemperatureForAttempt(RewriteType.SECTION, 1)).isEqualTo(0.3);
        assertThat(schedule.getTemperatureForAttempt(RewriteType.SECTION, 3)).isEqualTo(0.15);
    }

    @Test
    void clamp() {
        assertThat(schedule.clampTemperature(RewriteType.BULLET, 0.9)).isEqualTo(0.5);
        assertThat(schedule.clampTemperature(RewriteType.SECTION, 0.0)).isEqualTo(0.15);
        assertThat(schedule.clampTemperature(RewriteType.SUMMARY, 0.6)).isEqualTo(0.6);
    }
}
