package com.project.recall.backend.dto;

import com.project.recall.backend.entity.ContentKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class NewCardDto {
    @NotBlank(message="source chat is required")
    String sourceChatId;

    @NotEmpty(message="at least one source message is required")
    @Size(max = 10, message="a media group has at most 10 messages")
    List<@NotNull Integer> sourceMessageIds;

    @NotNull(message="content kind is required")
    ContentKind contentKind;

    @Size(max = 200, message="preview should be at most 200 characters")
    String contentPreview;

    String contentFileId;

    String contentFileUniqueId;

    // sm2, daily or weekly; adaptive when missing
    String reminderMode;
}
