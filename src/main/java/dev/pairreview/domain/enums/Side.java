package dev.pairreview.domain.enums;

/** Diff side a comment anchors to: LEFT = old lines, RIGHT = new lines. */
public enum Side {
    LEFT, RIGHT
}
