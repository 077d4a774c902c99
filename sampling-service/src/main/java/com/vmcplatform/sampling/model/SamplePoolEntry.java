package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One rater slot for one utterance.
 *
 * <pre>
 *   unassigned   isProcessing=false  coderId=null  claimedBy=null
 *   claimed      isProcessing=true   coderId=null  claimedBy=rater, claimedAt=t
 *   assigned     isProcessing=false  coderId=rater
 * </pre>
 * A stale claim is returned to unassigned by the lease sweeper. Entries are never deleted.
 */
@Data
@NoArgsConstructor
@Table("sample_pool_entry")
public class SamplePoolEntry {

    @Id
    private Long id;

    private Long utteranceId;

    private Integer batchGroup;

    private Long coderId;

    private Boolean isProcessing;

    private Long claimedBy;

    private LocalDateTime claimedAt;

    private LocalDateTime addedOn;

    private LocalDateTime modifiedOn;
}
