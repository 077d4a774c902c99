package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Assigns one recording to a sampling round. Rounds are numbered 100, 200, 300, ...
 */
@Data
@NoArgsConstructor
@Table("coding_batch")
public class CodingBatch {

    @Id
    private Long id;

    private Long recordingId;

    private Integer batchGroup;
}
