package dev.pairreview.domain.enums;

public enum ReviewStatus {
    DRAFT, PENDING, SUBMITTED
}
