package com.flamingo.ai.contentpipeline.api.dto.request;

import com.flamingo.ai.contentpipeline.domain.model.TopicSpec;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting a pipeline run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartRunRequest {

  @NotBlank(message = "Title is required")
  @Size(max = 255, message = "Title must be at most 255 characters")
  private String title;

  @Size(max = 2000, message = "Description must be at most 2000 characters")
  private String description;

  @Size(max = 20, message = "At most 20 keywords are allowed")
  private List<@NotBlank(message = "Keywords must not be blank") String> keywords;
  private String targetAudience;
  private String tone;

  public TopicSpec toTopic() {
    return new TopicSpec(title.strip(), description, keywords, targetAudience, tone);
  }
}
