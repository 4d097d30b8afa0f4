package com.flamingo.ai.contentpipeline.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.domain.model.PublishResult;
import com.flamingo.ai.contentpipeline.exception.PublishException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * {@link Publisher} for the Tistory Open API ({@code POST /post/write} and {@code /post/modify}).
 * The markdown body is rendered to HTML before posting. Visibility maps to Tistory's codes: 0 for
 * drafts, 3 for public posts; scheduled posts are public posts with a future {@code published}
 * timestamp.
 */
@Component
@ConditionalOnProperty(name = "pipeline.publish.mode", havingValue = "tistory")
@Slf4j
public class TistoryPublisher implements Publisher {

  private static final Parser MARKDOWN_PARSER = Parser.builder().build();
  private static final HtmlRenderer HTML_RENDERER = HtmlRenderer.builder().build();

  private final WebClient webClient;
  private final PipelineConfig.Publish.Tistory tistory;
  private final Duration scheduleDelay;

  @Autowired
  public TistoryPublisher(PipelineConfig pipelineConfig) {
    this(
        pipelineConfig,
        WebClient.builder().baseUrl(pipelineConfig.getPublish().getTistory().getBaseUrl()).build());
  }

  TistoryPublisher(PipelineConfig pipelineConfig, WebClient webClient) {
    this.tistory = pipelineConfig.getPublish().getTistory();
    this.scheduleDelay = pipelineConfig.getPublish().getScheduleDelay();
    this.webClient = webClient;
    if (tistory.getAccessToken().isBlank() || tistory.getBlogName().isBlank()) {
      throw new IllegalStateException(
          "Tistory publishing requires pipeline.publish.tistory.access-token and blog-name");
    }
    log.info("Tistory publisher initialized: blog={}", tistory.getBlogName());
  }

  @Override
  public PublishResult publish(FinalContent content, Visibility visibility) {
    log.info("Publishing to Tistory: {} ({})", content.title(), visibility);
    PublishResult result = send("/post/write", form(content, visibility), visibility);
    log.info("Published to Tistory: {}", result.url());
    return result;
  }

  @Override
  public PublishResult update(String postId, FinalContent content, Visibility visibility) {
    log.info("Updating Tistory post {}: {} ({})", postId, content.title(), visibility);
    MultiValueMap<String, String> form = form(content, visibility);
    form.add("postId", postId);
    PublishResult result = send("/post/modify", form, visibility);
    if (result.postId().isEmpty()) {
      result = new PublishResult(postId, result.url(), visibility, result.publishedAt());
    }
    log.info("Updated Tistory post: {}", result.url());
    return result;
  }

  private MultiValueMap<String, String> form(FinalContent content, Visibility visibility) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("access_token", tistory.getAccessToken());
    form.add("output", "json");
    form.add("blogName", tistory.getBlogName());
    form.add("title", content.title());
    form.add("content", HTML_RENDERER.render(MARKDOWN_PARSER.parse(content.body())));
    form.add("visibility", visibility == Visibility.DRAFT ? "0" : "3");
    if (!tistory.getCategoryId().isBlank()) {
      form.add("category", tistory.getCategoryId());
    }
    form.add("tag", String.join(",", content.tags()));
    if (visibility == Visibility.SCHEDULED) {
      form.add(
          "published", String.valueOf(Instant.now().plus(scheduleDelay).getEpochSecond()));
    }
    return form;
  }

  private PublishResult send(
      String path, MultiValueMap<String, String> form, Visibility visibility) {
    JsonNode response;
    try {
      response =
          webClient
              .post()
              .uri(path)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(BodyInserters.fromFormData(form))
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(tistory.getTimeout())
              .block();
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      throw new PublishException(
          "Tistory returned HTTP " + status, status == 429 || status >= 500, e);
    } catch (WebClientRequestException e) {
      throw new PublishException("Network error calling Tistory", true, e);
    } catch (RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof TimeoutException) {
        throw new PublishException("Timed out calling Tistory", true, e);
      }
      throw new PublishException("Tistory call failed: " + e.getMessage(), false, e);
    }

    JsonNode result = response == null ? null : response.path("tistory");
    if (result == null || !"200".equals(result.path("status").asText())) {
      String error =
          result == null ? "empty response" : result.path("error_message").asText("unknown error");
      throw new PublishException("Tistory API error: " + error, false);
    }
    return new PublishResult(
        result.path("postId").asText(), result.path("url").asText(), visibility, Instant.now());
  }
}
