package dev.pairreview.analysis.prompt;

public enum PromptType {
    LEVEL1, LEVEL2, LEVEL3, CONSOLIDATION;

    public static PromptType forLevel(int level) {
        return switch (level) {
            case 1 -> LEVEL1;
            case 2 -> LEVEL2;
            case 3 -> LEVEL3;
            default -> throw new IllegalArgumentException("Level must be 1-3 but was " + level);
        };
    }
}
