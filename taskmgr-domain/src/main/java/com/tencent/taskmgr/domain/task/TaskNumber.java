package com.tencent.taskmgr.domain.task;

import com.tencent.taskmgr.domain.exception.InvalidTaskNumberException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * TaskNumber - 层级编号工具
 * <p>
 * 编号形如 "1.2.3"，每段为整数。根任务的子任务编号为 "i"，其余子任务为 "父编号.i"。
 * </p>
 *
 * @author taskmgr
 */
public final class TaskNumber {

    public static final String SEPARATOR = ".";

    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    private TaskNumber() {
    }

    /**
     * 解析编号为各层级整数
     *
     * @throws InvalidTaskNumberException 任一段不是整数时
     */
    public static List<Integer> parse(String number) {
        if (number == null || number.isBlank()) {
            throw new InvalidTaskNumberException(number);
        }
        String[] segments = number.trim().split("\\.", -1);
        List<Integer> levels = new ArrayList<>(segments.length);
        for (String segment : segments) {
            try {
                levels.add(Integer.parseInt(segment.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidTaskNumberException(number, e);
            }
        }
        return Collections.unmodifiableList(levels);
    }

    public static String format(List<Integer> levels) {
        return levels.stream().map(String::valueOf).collect(Collectors.joining(SEPARATOR));
    }

    /**
     * 父任务下第 index 个子任务的编号
     */
    public static String childOf(Task parent, int index) {
        if (parent.isRoot() || parent.getNumber() == null || parent.getNumber().isEmpty()) {
            return String.valueOf(index);
        }
        return parent.getNumber() + SEPARATOR + index;
    }

    /**
     * 父任务下一个可用的子任务编号：已有子任务末段的最大值加一
     */
    public static String nextChildOf(Task parent, Collection<Task> children) {
        int max = 0;
        for (Task child : children) {
            String number = child.getNumber();
            if (number == null || number.isEmpty()) {
                continue;
            }
            String last = number.substring(number.lastIndexOf(SEPARATOR) + 1);
            // 非数字编号不参与排号
            if (DIGITS.matcher(last).matches()) {
                max = Math.max(max, Integer.parseInt(last));
            }
        }
        return childOf(parent, max + 1);
    }
}
