package com.scholary.lecture.corrector.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Amazon Bedrock client for the Nova text models.
 *
 * <p>Uses the messages-v1 request schema:
 *
 * <pre>
 * {
 *   "messages": [{"role": "user", "content": [{"text": "..."}]}],
 *   "inferenceConfig": {"maxTokens": 1000, "temperature": 0.1, "topP": 0.9}
 * }
 * </pre>
 *
 * <p>and reads {@code output.message.content[0].text} and {@code usage.inputTokens/outputTokens}
 * from the reply. A reply without text comes back with empty text and its token usage.
 *
 * <p>Transient failures are retried by the AWS SDK's default retry policy; anything that still
 * fails surfaces as {@link LlmException}.
 */
public class BedrockNovaClient implements LlmClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(BedrockNovaClient.class);

  private static final String JSON = "application/json";

  private final BedrockRuntimeClient bedrockClient;
  private final String modelId;
  private final ObjectMapper objectMapper;

  public BedrockNovaClient(LlmProperties properties, ObjectMapper objectMapper) {
    this(
        BedrockRuntimeClient.builder()
            .region(Region.of(properties.region()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(Duration.ofSeconds(properties.apiCallTimeoutSeconds()))
                    .build())
            .build(),
        properties.modelId(),
        objectMapper);
  }

  BedrockNovaClient(
      BedrockRuntimeClient bedrockClient, String modelId, ObjectMapper objectMapper) {
    this.bedrockClient = bedrockClient;
    this.modelId = modelId;
    this.objectMapper = objectMapper;

    LOGGER.info("Initialized Bedrock client: modelId={}", modelId);
  }

  @Override
  public LlmReply generate(LlmRequest request) {
    String body = buildRequestBody(request);

    InvokeModelResponse response;
    try {
      response =
          bedrockClient.invokeModel(
              InvokeModelRequest.builder()
                  .modelId(modelId)
                  .contentType(JSON)
                  .accept(JSON)
                  .body(SdkBytes.fromUtf8String(body))
                  .build());
    } catch (SdkException e) {
      throw new LlmException("Bedrock invocation failed: " + e.getMessage(), e);
    }

    return parseReply(response.body().asUtf8String());
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  String buildRequestBody(LlmRequest request) {
    ObjectNode root = objectMapper.createObjectNode();

    ObjectNode message = root.putArray("messages").addObject();
    message.put("role", "user");
    message.putArray("content").addObject().put("text", request.instruction());

    ObjectNode inference = root.putObject("inferenceConfig");
    inference.put("maxTokens", request.maxTokens());
    inference.put("temperature", request.temperature());
    inference.put("topP", request.topP());

    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new LlmException("Failed to serialize Bedrock request", e);
    }
  }

  LlmReply parseReply(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (JsonProcessingException e) {
      throw new LlmException("Unparseable Bedrock response", e);
    }

    JsonNode usage = root.path("usage");
    int inputTokens = Math.max(0, usage.path("inputTokens").asInt(0));
    int outputTokens = Math.max(0, usage.path("outputTokens").asInt(0));

    // Tokens are billed even when the reply carries no text, so usage is returned either way
    JsonNode text = root.path("output").path("message").path("content").path(0).path("text");
    String replyText = text.isTextual() ? text.asText().strip() : "";

    LOGGER.debug(
        "Bedrock reply: inputTokens={}, outputTokens={}, chars={}",
        inputTokens,
        outputTokens,
        replyText.length());

    return new LlmReply(replyText, inputTokens, outputTokens);
  }

  @Override
  public void close() {
    bedrockClient.close();
  }
}
