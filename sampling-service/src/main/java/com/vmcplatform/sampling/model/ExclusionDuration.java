package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("exclusion_duration")
public class ExclusionDuration {

    @Id
    private Long id;

    private Long recordingId;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    /** {@link ExclusionCategory} name. */
    private String category;
}
