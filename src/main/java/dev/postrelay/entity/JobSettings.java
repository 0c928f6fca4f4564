package dev.postrelay.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator-editable settings of an automated job: on/off switch and interval bounds in minutes.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_settings")
public class JobSettings {

    @Id
    @Column(length = 64)
    private String jobName;

    @Version
    private Long version;

    @Column(nullable = false)
    private boolean enabled;

    @Column(nullable = false)
    private int minMinutes;

    @Column(nullable = false)
    private int maxMinutes;
}
