package com.example.mltranslation.controller;

import com.example.mltranslation.config.SecurityConfig;
import com.example.mltranslation.entity.TransactionType;
import com.example.mltranslation.facade.HistoryFacade;
import com.example.mltranslation.facade.dto.HistoryResponse;
import com.example.mltranslation.facade.dto.PaginationMeta;
import com.example.mltranslation.facade.dto.TransactionItemDto;
import com.example.mltranslation.facade.dto.TranslationItemDto;
import com.example.mltranslation.security.AuthenticatedUser;
import com.example.mltranslation.security.JwtTokenService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = {HistoryController.class})
@AutoConfigureMockMvc
@Import(SecurityConfig.class)
@DisplayName("HistoryController Tests")
class HistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HistoryFacade historyFacade;

    @MockitoBean
    private JwtTokenService jwtTokenService;

    @Test
    @DisplayName("getTranslations - With defaults - Uses offset 0 and limit 100")
    void getTranslations_WithDefaults_UsesDefaultPaging() throws Exception {
        TranslationItemDto item = TranslationItemDto.builder()
            .id(1L).externalId("ext").inputText("hello").outputText("bonjour")
            .sourceLang("en").targetLang("fr").cost(1).createdAt(LocalDateTime.now()).build();
        when(historyFacade.getTranslations(4L, 0, 100))
            .thenReturn(HistoryResponse.<TranslationItemDto>builder()
                .items(List.of(item))
                .pagination(PaginationMeta.builder().offset(0).limit(100).totalElements(1).build())
                .build());

        mockMvc.perform(get("/history/translations").with(user(4L)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[0].outputText").value("bonjour"))
            .andExpect(jsonPath("$.pagination.totalElements").value(1))
            .andExpect(jsonPath("$.pagination.hasNext").value(false));
    }

    @Test
    @DisplayName("getTransactions - With offset and limit - Passes them through")
    void getTransactions_WithOffsetAndLimit_PassesThrough() throws Exception {
        TransactionItemDto item = TransactionItemDto.builder()
            .id(9L).userId(4L).amount(1L).type(TransactionType.DEBIT).createdAt(LocalDateTime.now()).build();
        when(historyFacade.getTransactions(4L, 10, 5))
            .thenReturn(HistoryResponse.<TransactionItemDto>builder()
                .items(List.of(item))
                .pagination(PaginationMeta.builder().offset(10).limit(5).totalElements(11)
                    .hasNext(false).hasPrevious(true).build())
                .build());

        mockMvc.perform(get("/history/transactions").param("offset", "10").param("limit", "5").with(user(4L)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[0].type").value("DEBIT"))
            .andExpect(jsonPath("$.pagination.hasPrevious").value(true));
    }

    @Test
    @DisplayName("getTransactions - With limit above maximum - Returns 400 Validation Failed")
    void getTransactions_WithLimitAboveMaximum_Returns400() throws Exception {
        mockMvc.perform(get("/history/transactions").param("limit", "501").with(user(4L)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("Limit must be <= 500")));

        verifyNoInteractions(historyFacade);
    }

    @Test
    @DisplayName("getTranslations - With negative offset - Returns 400 Validation Failed")
    void getTranslations_WithNegativeOffset_Returns400() throws Exception {
        mockMvc.perform(get("/history/translations").param("offset", "-1").with(user(4L)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("Offset must be >= 0")));
    }

    @Test
    @DisplayName("getTranslations - With non-numeric limit - Returns 400 Malformed Request")
    void getTranslations_WithNonNumericLimit_Returns400() throws Exception {
        mockMvc.perform(get("/history/translations").param("limit", "many").with(user(4L)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed Request"));

        verify(historyFacade, never()).getTranslations(anyLong(), anyInt(), anyInt());
    }

    private static RequestPostProcessor user(Long id) {
        AuthenticatedUser principal = new AuthenticatedUser(id, "user" + id + "@example.com", false);
        return authentication(new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }
}
