package com.tencent.taskmgr.app.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tencent.taskmgr.app.dto.TaskNodeYamlDto;
import com.tencent.taskmgr.domain.task.TaskSpec;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 将 YAML 描述的任务树解析为 {@link TaskSpec}
 * <pre>
 * name: Release
 * children:
 *   - name: Build
 *     plannedStartTime: 2024-03-01T09:00:00
 *     children:
 *       - name: Compile
 * </pre>
 */
@Component
public class TaskTreeYamlParser {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public TaskSpec parse(String yamlContent) {
        TaskNodeYamlDto dto;
        try {
            dto = mapper.readValue(yamlContent, TaskNodeYamlDto.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse task tree YAML", e);
        }
        if (dto == null) {
            throw new IllegalArgumentException("Task tree YAML is empty");
        }
        return convert(dto);
    }

    private TaskSpec convert(TaskNodeYamlDto dto) {
        List<TaskSpec> children = new ArrayList<>();
        if (dto.getChildren() != null) {
            children = dto.getChildren().stream().map(this::convert).collect(Collectors.toList());
        }

        return TaskSpec.builder()
                .name(dto.getName())
                .description(dto.getDescription() == null ? "" : dto.getDescription())
                .plannedStartTime(parseTime(dto.getPlannedStartTime()))
                .plannedFinishTime(parseTime(dto.getPlannedFinishTime()))
                .children(children)
                .build();
    }

    private static LocalDateTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim().replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 datetime in task tree YAML: " + value, e);
        }
    }
}
