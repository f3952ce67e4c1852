package com.project.recall.backend.controller;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.dto.CardDto;
import com.project.recall.backend.dto.GradeRequestDto;
import com.project.recall.backend.dto.NewCardDto;
import com.project.recall.backend.dto.NextReviewRequestDto;
import com.project.recall.backend.dto.PostponeRequestDto;
import com.project.recall.backend.dto.PresetRequestDto;
import com.project.recall.backend.entity.CardNotification;
import com.project.recall.backend.response.ApiResponse;
import com.project.recall.backend.response.ResponseMessage;
import com.project.recall.backend.service.DeliveryResult;
import com.project.recall.backend.service.ReviewOutcome;
import com.project.recall.backend.service.ReviewScheduler;
import com.project.recall.backend.service.ReviewService;
import com.project.recall.backend.service.security.AppUserDetails;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/cards")
public class CardController {

    private final ReviewService reviewService;
    private final ReviewScheduler reviewScheduler;

    public CardController(ReviewService reviewService, ReviewScheduler reviewScheduler) {
        this.reviewService = reviewService;
        this.reviewScheduler = reviewScheduler;
    }

    @PostMapping
    public ResponseEntity<ApiResponse> createCard(@RequestBody NewCardDto newCard,
                                                  @AuthenticationPrincipal AppUserDetails appUser) {
        // validated by the service so the bot intake gets the same checks
        CardDto card = CardDto.from(reviewService.createPendingCard(appUser.getUserId(), newCard));
        return new ResponseEntity<>(new ApiResponse(ResponseMessage.CARD_CREATED, card), HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> getCard(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS,
                CardDto.from(reviewService.getOwnedCard(id, appUser.getUserId()))));
    }

    @GetMapping("/{id}/notifications")
    public ResponseEntity<ApiResponse> getNotifications(@PathVariable UUID id,
                                                        @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        List<CardNotification> notifications = reviewService.listNotifications(id);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, notifications));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<ApiResponse> activate(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, CardDto.from(reviewService.activate(id))));
    }

    @PostMapping("/{id}/review-now")
    public ResponseEntity<ApiResponse> reviewNow(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        DeliveryResult result = reviewScheduler.triggerImmediate(id);
        if (!result.isDelivered()) {
            return new ResponseEntity<>(new ApiResponse(ResponseMessage.DELIVERY_NOT_COMPLETED, result), HttpStatus.ACCEPTED);
        }
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.CARD_DELIVERED, result));
    }

    @PostMapping("/{id}/grade")
    public ResponseEntity<ApiResponse> grade(@PathVariable UUID id,
                                             @Valid @RequestBody GradeRequestDto request,
                                             @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        ReviewOutcome outcome = reviewService.applyGrade(id, Grade.fromKey(request.getGrade()));
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.CARD_GRADED, outcome));
    }

    @PostMapping("/{id}/interval")
    public ResponseEntity<ApiResponse> applyPreset(@PathVariable UUID id,
                                                   @Valid @RequestBody PresetRequestDto request,
                                                   @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS,
                CardDto.from(reviewService.applyPreset(id, request.getDays()))));
    }

    @PostMapping("/{id}/archive")
    public ResponseEntity<ApiResponse> archive(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, CardDto.from(reviewService.archive(id))));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<ApiResponse> restore(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS, CardDto.from(reviewService.restore(id))));
    }

    @PostMapping("/{id}/postpone")
    public ResponseEntity<ApiResponse> postpone(@PathVariable UUID id,
                                                @Valid @RequestBody PostponeRequestDto request,
                                                @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS,
                CardDto.from(reviewService.postpone(id, request.getMinutes()))));
    }

    @PostMapping("/{id}/next-review")
    public ResponseEntity<ApiResponse> overrideNextReview(@PathVariable UUID id,
                                                          @Valid @RequestBody NextReviewRequestDto request,
                                                          @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.SUCCESS,
                CardDto.from(reviewService.overrideNextReview(id, request.getNextReviewAt()))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> delete(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        reviewService.delete(id);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.CARD_DELETED));
    }

    @DeleteMapping("/{id}/pending")
    public ResponseEntity<ApiResponse> cancel(@PathVariable UUID id, @AuthenticationPrincipal AppUserDetails appUser) {
        reviewService.getOwnedCard(id, appUser.getUserId());
        reviewService.cancel(id);
        return ResponseEntity.ok(new ApiResponse(ResponseMessage.CARD_DELETED));
    }
}
