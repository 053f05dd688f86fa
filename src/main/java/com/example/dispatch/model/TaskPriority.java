package com.example.dispatch.model;

public enum TaskPriority {
    HIGH(1, "High"),
    MEDIUM(2, "Medium"),
    LOW(3, "Low");

    public static final String UNKNOWN_LABEL = "Unknown";

    private final int level;
    private final String description;

    TaskPriority(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 按优先级数值取显示名称，未知数值返回 "Unknown"
     */
    public static String labelOf(int level) {
        for (TaskPriority priority : values()) {
            if (priority.level == level) {
                return priority.getDescription();
            }
        }
        return UNKNOWN_LABEL;
    }
}
