package com.flamingo.ai.contentpipeline.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a file or directory into the corpus. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

  @NotBlank(message = "Path is required")
  private String path;
}
