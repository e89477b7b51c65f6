package dev.pairreview.domain.valueobject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which of the three analysis levels a pipeline runs. Persisted as {@code {"1":true,"2":true,"3":false}}.
 */
public record EnabledLevels(boolean level1, boolean level2, boolean level3) {

    public static final int MAX_LEVEL = 3;

    public static EnabledLevels all() {
        return new EnabledLevels(true, true, true);
    }

    public static EnabledLevels fromMap(Map<String, Boolean> levels) {
        if (levels == null || levels.isEmpty()) return all();
        return new EnabledLevels(
                Boolean.TRUE.equals(levels.get("1")),
                Boolean.TRUE.equals(levels.get("2")),
                Boolean.TRUE.equals(levels.get("3")));
    }

    public boolean isEnabled(int level) {
        return switch (level) {
            case 1 -> level1;
            case 2 -> level2;
            case 3 -> level3;
            default -> throw new IllegalArgumentException("Level must be 1-3 but was " + level);
        };
    }

    public boolean anyEnabled() {
        return level1 || level2 || level3;
    }

    public List<Integer> enabled() {
        List<Integer> result = new ArrayList<>(MAX_LEVEL);
        for (int level = 1; level <= MAX_LEVEL; level++) {
            if (isEnabled(level)) result.add(level);
        }
        return result;
    }

    public Map<String, Boolean> toMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        map.put("1", level1);
        map.put("2", level2);
        map.put("3", level3);
        return map;
    }
}
