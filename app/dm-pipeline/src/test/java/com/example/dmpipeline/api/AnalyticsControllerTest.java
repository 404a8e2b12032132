package com.example.dmpipeline.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.dmpipeline.config.RequestMdcInterceptor;
import com.example.dmpipeline.model.PostDeliveryCount;
import com.example.dmpipeline.service.DeliveryAnalyticsService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AnalyticsController.class)
@Import({ApiExceptionHandler.class, RequestMdcInterceptor.class})
@ActiveProfiles("test")
class AnalyticsControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DeliveryAnalyticsService analyticsService;

  @Test
  void rendersSummaryInSnakeCase() throws Exception {
    when(analyticsService.summarize())
        .thenReturn(
            new DeliveryAnalyticsService.Summary(
                3, 1, 75.0d, 2, List.of(new PostDeliveryCount("p1", 3))));

    mockMvc
        .perform(get("/analytics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_sent").value(3))
        .andExpect(jsonPath("$.total_failed").value(1))
        .andExpect(jsonPath("$.success_rate").value(75.0d))
        .andExpect(jsonPath("$.last_24_hours").value(2))
        .andExpect(jsonPath("$.top_posts[0].post_id").value("p1"))
        .andExpect(jsonPath("$.top_posts[0].dm_count").value(3));
  }

  @Test
  void unexpectedFailureUsesErrorShape() throws Exception {
    when(analyticsService.summarize()).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(get("/analytics"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
  }
}
