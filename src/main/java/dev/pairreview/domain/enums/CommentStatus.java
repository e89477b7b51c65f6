package dev.pairreview.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * ACTIVE, DISMISSED and ADOPTED apply to AI suggestions; DRAFT, SUBMITTED and INACTIVE
 * (soft-deleted) to user comments.
 */
public enum CommentStatus {
    ACTIVE, DISMISSED, ADOPTED, DRAFT, SUBMITTED, INACTIVE;

    /** Statuses returned by suggestion listings. */
    public static final Set<CommentStatus> VISIBLE =
            EnumSet.of(ACTIVE, DISMISSED, ADOPTED, DRAFT, SUBMITTED);
}
