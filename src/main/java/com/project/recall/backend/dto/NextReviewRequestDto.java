package com.project.recall.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import java.time.Instant;


@Getter
@Setter
@NoArgsConstructor
public class NextReviewRequestDto {
    @NotNull(message="nextReviewAt is required")
    Instant nextReviewAt;
}
