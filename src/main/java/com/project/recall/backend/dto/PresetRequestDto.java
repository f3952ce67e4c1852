package com.project.recall.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class PresetRequestDto {
    @NotNull(message="days is required")
    @Min(value = 1, message="interval should be at least 1 day")
    Integer days;
}
