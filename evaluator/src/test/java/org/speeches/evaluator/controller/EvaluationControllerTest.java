package org.speeches.evaluator.controller;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.speeches.evaluator.model.EvaluationResult;
import org.speeches.evaluator.service.EvaluationService;
import org.speeches.evaluator.service.NoSourcesException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(EvaluationController.class)
class EvaluationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EvaluationService evaluationService;

    @Test
    void shouldReturnEvaluationAsJson() throws Exception {
        given(evaluationService.evaluate(eq(List.of("http://a", "http://b"))))
                .willReturn(CompletableFuture.completedFuture(new EvaluationResult(
                        "Alexander Abel", null, "Caesare Collins",
                        List.of("Not enough elements. URL: 'http://b' Line: 'x'"))));

        MvcResult pending = mockMvc.perform(get("/evaluation")
                        .param("url", "http://a")
                        .param("url", "http://b"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mostSpeeches").value("Alexander Abel"))
                .andExpect(jsonPath("$.mostSecurity").value(nullValue()))
                .andExpect(jsonPath("$.leastWordy").value("Caesare Collins"))
                .andExpect(jsonPath("$.errors[0]").value("Not enough elements. URL: 'http://b' Line: 'x'"));
    }

    @Test
    void shouldRejectRequestWithoutUrl() throws Exception {
        mockMvc.perform(get("/evaluation"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Url Param 'url' is missing"));
    }

    @Test
    void shouldRejectBlankUrls() throws Exception {
        given(evaluationService.evaluate(anyList())).willThrow(new NoSourcesException("Url Param 'url' is missing"));

        mockMvc.perform(get("/evaluation").param("url", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Url Param 'url' is missing"));
    }

    @Test
    void shouldAnswerServerErrorWhenEvaluationFails() throws Exception {
        given(evaluationService.evaluate(anyList()))
                .willReturn(CompletableFuture.failedFuture(new IllegalStateException("Interrupted while aggregating speeches")));

        MvcResult pending = mockMvc.perform(get("/evaluation").param("url", "http://a"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Evaluation failed: Interrupted while aggregating speeches"));
    }
}
