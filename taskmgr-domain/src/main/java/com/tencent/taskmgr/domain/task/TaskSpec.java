package com.tencent.taskmgr.domain.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * TaskSpec - 嵌套任务规格
 * <p>
 * 批量创建任务树时的输入，每个节点对应一个任务。
 * </p>
 *
 * @author taskmgr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSpec {

    private String name;

    @Builder.Default
    private String description = "";

    private LocalDateTime plannedStartTime;

    private LocalDateTime plannedFinishTime;

    @Builder.Default
    private List<TaskSpec> children = new ArrayList<>();

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }
}
