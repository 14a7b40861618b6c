package com.platform.datakeeper.action;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of a successful action.
 *
 * @param appliedOps operations actually performed, empty when the unit was left alone
 * @param detail short human-readable note, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Outcome(
    List<String> appliedOps,
    long bytesBefore,
    long bytesAfter,
    Disposition disposition,
    String detail
) {
    
    public Outcome {
        appliedOps = appliedOps == null ? List.of() : List.copyOf(appliedOps);
    }
    
    public enum Disposition {
        /** Unit removed. */
        DELETED,
        /** Deletion candidate under the dry-run strategy. */
        WOULD_DELETE,
        /** Inside the warning period; nothing changed. */
        WARNED,
        RETAINED,
        TRANSFORMED,
        EXTRACTED
    }
    
    public static Outcome retained(long bytes, String detail) {
        return new Outcome(List.of(), bytes, bytes, Disposition.RETAINED, detail);
    }
    
    @JsonIgnore
    public boolean isWarning() {
        return disposition == Disposition.WARNED;
    }
}
