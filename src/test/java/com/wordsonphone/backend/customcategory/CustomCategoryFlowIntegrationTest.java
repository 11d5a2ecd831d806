package com.wordsonphone.backend.customcategory;

import com.wordsonphone.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * STUB provider + H2：preview -> generate -> 查詢 -> 刪除 走一遍。
 */
@SpringBootTest
@AutoConfigureMockMvc
class CustomCategoryFlowIntegrationTest extends BaseSpringTest {

    private static final String BASE = "/api/v1/custom-categories";

    @Autowired MockMvc mvc;

    @Test
    void preview_generate_list_and_delete() throws Exception {
        mvc.perform(get(BASE + "/quota"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remaining").value(20))
                .andExpect(jsonPath("$.dailyLimit").value(20));

        mvc.perform(post(BASE + "/samples")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"categoryName\":\"Board Games\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestId").value("req_board_games"))
                .andExpect(jsonPath("$.sampleWords.length()").value(3))
                .andExpect(jsonPath("$.remainingToday").value(19));

        mvc.perform(get(BASE + "/requests/Board Games"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"));

        mvc.perform(post(BASE + "/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"categoryName\":\"Board Games\",\"description\":\"classic tabletop\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.generatedCount").value(45))
                .andExpect(jsonPath("$.partial").value(false))
                .andExpect(jsonPath("$.attempts").value(3))
                .andExpect(jsonPath("$.phrases[0].provider").value("STUB"));

        mvc.perform(get(BASE + "/requests/Board Games"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("GENERATED"))
                .andExpect(jsonPath("$.generatedCount").value(45))
                .andExpect(jsonPath("$.sampleWords.length()").value(3))
                .andExpect(jsonPath("$.description").value("classic tabletop"));

        mvc.perform(get(BASE + "/Board Games/phrases"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(45));

        mvc.perform(get(BASE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasItem("Board Games")));

        mvc.perform(get(BASE + "/quota"))
                .andExpect(jsonPath("$.remaining").value(16));

        mvc.perform(delete(BASE + "/Board Games"))
                .andExpect(status().isNoContent());

        mvc.perform(get(BASE + "/Board Games/phrases"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        mvc.perform(get(BASE + "/requests/Board Games"))
                .andExpect(status().isNotFound());
    }

    @Test
    void score_endpoint_uses_local_scoring() throws Exception {
        mvc.perform(post(BASE + "/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Pizza Delivery\",\"category\":\"Food & Drink\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(45.75))
                .andExpect(jsonPath("$.maxScore").value(55.0))
                .andExpect(jsonPath("$.verdict").value("EXCELLENT"))
                .andExpect(jsonPath("$.breakdown.encyclopedia").doesNotExist());
    }
}
