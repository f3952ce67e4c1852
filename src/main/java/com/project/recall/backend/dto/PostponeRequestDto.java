package com.project.recall.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class PostponeRequestDto {
    @NotNull(message="minutes is required")
    @Min(value = 1, message="postpone by at least 1 minute")
    @Max(value = 525600, message="postpone by at most a year")
    Integer minutes;
}
