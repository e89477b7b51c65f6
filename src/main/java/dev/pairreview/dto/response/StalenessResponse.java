package dev.pairreview.dto.response;

/**
 * {@code error} explains why the check could not compare digests; such a review is reported stale.
 */
public record StalenessResponse(long reviewId, boolean stale, String storedDigest, String error) {}
