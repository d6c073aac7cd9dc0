package com.tencent.taskmgr.domain.task;

import com.tencent.taskmgr.domain.exception.InvalidTaskNumberException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskNumberTest {

    @Test
    void parseAndFormat() {
        assertThat(TaskNumber.parse("1.2.3")).containsExactly(1, 2, 3);
        assertThat(TaskNumber.format(TaskNumber.parse(" 01.2 "))).isEqualTo("1.2");
    }

    @Test
    void parseRejectsNonIntegerSegments() {
        assertThatThrownBy(() -> TaskNumber.parse("1..2")).isInstanceOf(InvalidTaskNumberException.class);
        assertThatThrownBy(() -> TaskNumber.parse("a")).isInstanceOf(InvalidTaskNumberException.class);
        assertThatThrownBy(() -> TaskNumber.parse("")).isInstanceOf(InvalidTaskNumberException.class);
    }

    @Test
    void childNumbers() {
        Task root = Task.builder().id(1L).rootId(1).number("").build();
        Task group = Task.builder().id(2L).rootId(1).parentId(1).number("3").build();

        assertThat(TaskNumber.childOf(root, 1)).isEqualTo("1");
        assertThat(TaskNumber.childOf(group, 2)).isEqualTo("3.2");

        List<Task> children = List.of(
            Task.builder().number("3.1").build(),
            Task.builder().number("3.10").build(),
            Task.builder().number("3.2").build());
        assertThat(TaskNumber.nextChildOf(group, children)).isEqualTo("3.11");
        assertThat(TaskNumber.nextChildOf(root, List.of())).isEqualTo("1");
    }
}
