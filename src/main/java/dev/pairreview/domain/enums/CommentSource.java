package dev.pairreview.domain.enums;

public enum CommentSource {
    AI, USER
}
