package com.project.recall.backend.controller;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.config.SecurityConfiguration;
import com.project.recall.backend.exception.CardAlreadyGradedException;
import com.project.recall.backend.exception.CardNotFoundException;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.InvalidCardStateException;
import com.project.recall.backend.service.AppUserService;
import com.project.recall.backend.service.DeliveryResult;
import com.project.recall.backend.service.ReviewOutcome;
import com.project.recall.backend.service.ReviewScheduler;
import com.project.recall.backend.service.ReviewService;
import com.project.recall.backend.service.security.AppUserDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CardController.class)
@Import(SecurityConfiguration.class)
@DisplayName("CardController")
class CardControllerTest {

    private static final UUID CARD_ID = UUID.fromString("0b7e7a52-3c1f-4f0e-9d7c-2f4a5b6c7d8e");
    private static final AppUserDetails ALICE = new AppUserDetails(7, "alice", "{noop}secret", true);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReviewService reviewService;

    @MockBean
    private ReviewScheduler reviewScheduler;

    @MockBean
    private AppUserService appUserService;

    @Test
    @DisplayName("POST /grade applies the grade and returns the new schedule")
    void grade() throws Exception {
        Instant next = Instant.parse("2026-03-16T09:00:00Z");
        when(reviewService.applyGrade(CARD_ID, Grade.GOOD))
                .thenReturn(new ReviewOutcome(CARD_ID, Grade.GOOD, 3, 15, 2.5, next));

        mockMvc.perform(post("/api/cards/{id}/grade", CARD_ID).with(user(ALICE))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"grade\":\"good\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Card graded"))
                .andExpect(jsonPath("$.mainBody.intervalDays").value(15));

        verify(reviewService).getOwnedCard(CARD_ID, 7);
    }

    @Test
    @DisplayName("POST /grade without a grade is a bad request")
    void gradeMissing() throws Exception {
        mockMvc.perform(post("/api/cards/{id}/grade", CARD_ID).with(user(ALICE))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.mainBody.grade").value("grade is required"));

        verify(reviewService, never()).applyGrade(any(), any());
    }

    @Test
    @DisplayName("a second grade for the same delivery is a conflict")
    void gradeTwice() throws Exception {
        when(reviewService.applyGrade(CARD_ID, Grade.AGAIN)).thenThrow(new CardAlreadyGradedException(CARD_ID));

        mockMvc.perform(post("/api/cards/{id}/grade", CARD_ID).with(user(ALICE))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"grade\":\"again\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /review-now on a pending card is a conflict")
    void reviewNowPending() throws Exception {
        when(reviewScheduler.triggerImmediate(CARD_ID))
                .thenThrow(new InvalidCardStateException(CARD_ID, ExceptionMessage.CARD_NOT_ACTIVATED));

        mockMvc.perform(post("/api/cards/{id}/review-now", CARD_ID).with(user(ALICE)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(ExceptionMessage.CARD_NOT_ACTIVATED + ": " + CARD_ID));
    }

    @Test
    @DisplayName("POST /review-now reports a delivery that has to be retried later")
    void reviewNowFailed() throws Exception {
        when(reviewScheduler.triggerImmediate(CARD_ID))
                .thenReturn(new DeliveryResult(CARD_ID, DeliveryResult.Outcome.FAILED, null, false,
                        Instant.parse("2026-03-01T10:00:00Z")));

        mockMvc.perform(post("/api/cards/{id}/review-now", CARD_ID).with(user(ALICE)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.mainBody.outcome").value("FAILED"));
    }

    @Test
    @DisplayName("a card of another user is not found")
    void otherUsersCard() throws Exception {
        when(reviewService.getOwnedCard(CARD_ID, 7)).thenThrow(new CardNotFoundException(CARD_ID));

        mockMvc.perform(post("/api/cards/{id}/archive", CARD_ID).with(user(ALICE)))
                .andExpect(status().isNotFound());

        verify(reviewService, never()).archive(any());
    }

    @Test
    @DisplayName("requests without credentials are rejected")
    void unauthenticated() throws Exception {
        mockMvc.perform(post("/api/cards/{id}/review-now", CARD_ID))
                .andExpect(status().isUnauthorized());
    }
}
