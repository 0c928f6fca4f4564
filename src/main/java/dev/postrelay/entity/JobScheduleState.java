package dev.postrelay.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable scheduling state of one automated job. Written only by the scheduler.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_schedule_state")
public class JobScheduleState {

    @Id
    @Column(length = 64)
    private String jobName;

    @Version
    private Long version;

    private Instant lastRunAt;

    private Integer chosenIntervalMinutes;

    // In-flight marker, cleared when the run reports completion
    private Instant runningSince;

    @Column(length = 128)
    private String runningInstance;

    private Instant lastFinishedAt;

    private Integer lastExitStatus;
}
