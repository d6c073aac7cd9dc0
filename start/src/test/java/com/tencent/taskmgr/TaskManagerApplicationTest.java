package com.tencent.taskmgr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 全链路冒烟测试：HTTP -> 应用服务 -> H2 内存库
 */
@SpringBootTest(properties = "taskmgr.store.mode=MEMORY")
@AutoConfigureMockMvc
class TaskManagerApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createStartAndFinishThroughHttp() throws Exception {
        String project = "/work/e2e-" + UUID.randomUUID();

        String created = mockMvc.perform(post("/api/projects/tasks")
                .param("projectDir", project)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Release\"}"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        long rootId = objectMapper.readTree(created).path("data").path("id").asLong();

        String child = mockMvc.perform(post("/api/projects/tasks/" + rootId + "/subtasks")
                .param("projectDir", project)
                .param("number", "1.1")
                .param("name", "Compile"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.number").value("1.1"))
            .andReturn().getResponse().getContentAsString();
        JsonNode leaf = objectMapper.readTree(child).path("data");

        mockMvc.perform(post("/api/projects/tasks/" + rootId + "/dequeue").param("projectDir", project))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value(leaf.path("id").asLong()))
            .andExpect(jsonPath("$.data.status").value("started"));

        mockMvc.perform(post("/api/projects/tasks/" + leaf.path("id").asLong() + "/finish").param("projectDir", project))
            .andExpect(status().isOk());

        String tree = mockMvc.perform(get("/api/projects/tasks/" + rootId + "/tree").param("projectDir", project))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(3))
            .andReturn().getResponse().getContentAsString();
        for (JsonNode node : objectMapper.readTree(tree).path("data")) {
            assertThat(node.path("status").asText()).isEqualTo("finished");
        }

        mockMvc.perform(get("/api/projects/tasks/9999").param("projectDir", project))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errCode").value("TASK_NOT_FOUND"));

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
    }
}
