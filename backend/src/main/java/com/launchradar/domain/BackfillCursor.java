package com.launchradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Backfill progress per chain. {@code id} is the {@link ChainId} name; {@code nextBlock} only moves forward.
 */
@Document(collection = "backfill_cursors")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BackfillCursor {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private long nextBlock;
    private Long lastHeadSeen;
    private boolean caughtUp;
    private Instant updatedAt;
}
