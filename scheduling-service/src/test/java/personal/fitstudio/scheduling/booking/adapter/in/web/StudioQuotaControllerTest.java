package personal.fitstudio.scheduling.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.fitstudio.scheduling.booking.application.port.in.StudioQuotaUseCase;
import personal.fitstudio.scheduling.booking.domain.model.StudioQuota;

import java.time.LocalDate;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StudioQuotaController.class)
@DisplayName("Studio Quota API 단위 테스트")
class StudioQuotaControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StudioQuotaUseCase studioQuotaUseCase;

    @Test
    @DisplayName("주간 사용량과 경고 단계를 반환한다")
    void getQuota() throws Exception {
        given(studioQuotaUseCase.checkStudioQuota(LocalDate.of(2025, 1, 15)))
                .willReturn(StudioQuota.of(85, 100));

        mockMvc.perform(get("/api/v1/studio/quota").param("date", "2025-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentCount").value(85))
                .andExpect(jsonPath("$.maxAllowed").value(100))
                .andExpect(jsonPath("$.canBook").value(true))
                .andExpect(jsonPath("$.percentage").value(85))
                .andExpect(jsonPath("$.tier").value("WARNING"));
    }

    @Test
    @DisplayName("날짜 파라미터가 없으면 400을 반환한다")
    void getQuota_MissingDate() throws Exception {
        mockMvc.perform(get("/api/v1/studio/quota"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        verifyNoInteractions(studioQuotaUseCase);
    }

    @Test
    @DisplayName("주간 한도를 변경한다")
    void updateWeeklySessionLimit() throws Exception {
        mockMvc.perform(put("/api/v1/studio/settings/weekly-session-limit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(50));

        verify(studioQuotaUseCase).updateWeeklySessionLimit(50);
    }

    @Test
    @DisplayName("음수 한도는 입력 검증에서 거부된다")
    void updateWeeklySessionLimit_Negative() throws Exception {
        mockMvc.perform(put("/api/v1/studio/settings/weekly-session-limit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"limit\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").exists());

        verifyNoInteractions(studioQuotaUseCase);
    }
}
