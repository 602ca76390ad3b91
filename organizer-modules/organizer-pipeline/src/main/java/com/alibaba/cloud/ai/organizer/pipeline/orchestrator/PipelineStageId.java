package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

/**
 * 五个阶段, 按执行顺序排列
 *
 * @author RobustH
 */
public enum PipelineStageId {

    STAGE1("stage1", "scan"),
    STAGE2("stage2", "discover"),
    STAGE3("stage3", "analyze"),
    STAGE4("stage4", "taxonomy"),
    STAGE5("stage5", "move");

    private final String id;
    private final String label;

    PipelineStageId(String id, String label) {
        this.id = id;
        this.label = label;
    }

    /**
     * 缓存键中使用的阶段ID
     */
    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public int number() {
        return ordinal() + 1;
    }

    /**
     * @return 对应的阶段; 未知ID返回 null
     */
    public static PipelineStageId fromId(String id) {
        for (PipelineStageId stage : values()) {
            if (stage.id.equalsIgnoreCase(id)) {
                return stage;
            }
        }
        return null;
    }

    public static PipelineStageId fromNumber(int number) {
        if (number < 1 || number > values().length) {
            return null;
        }
        return values()[number - 1];
    }

    @Override
    public String toString() {
        return id + " (" + label + ")";
    }
}
