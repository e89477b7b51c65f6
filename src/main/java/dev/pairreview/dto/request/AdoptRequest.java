package dev.pairreview.dto.request;

/**
 * @param body edited comment text; blank keeps the suggestion's own text
 */
public record AdoptRequest(String body, String author) {}
