package com.scholary.lecture.corrector.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.lecture.corrector.api.AuditRequest;
import com.scholary.lecture.corrector.api.BatchRequest;
import com.scholary.lecture.corrector.api.CorrectionRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end test of the REST surface in rule-only mode.
 *
 * <p>The LLM client is disabled, so no AWS credentials or network access are needed.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
      "llm.enabled=false",
      "corrector.batch.root=${java.io.tmpdir}/lecture-corrector-it"
    })
class CorrectionApiIntegrationTest {

  private static final Path BATCH_ROOT =
      Path.of(System.getProperty("java.io.tmpdir"), "lecture-corrector-it");

  @Autowired private TestRestTemplate restTemplate;
  @Autowired private ObjectMapper objectMapper;

  @Test
  void correct_shouldReturnCorrectedTranscriptAndStatistics() throws Exception {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/v1/corrections",
            new CorrectionRequest("[0:00:01 - 0:00:05] 申しすございす", true),
            String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode body = objectMapper.readTree(response.getBody());
    assertThat(body.get("transcript").asText())
        .isEqualTo("[0:00:01 - 0:00:05]\n申します。ございます。\n\n");

    JsonNode segment = body.get("segments").get(0);
    assertThat(segment.get("id").asInt()).isEqualTo(1);
    assertThat(segment.get("llmUsed").asBoolean()).isFalse();
    assertThat(segment.get("appliedCorrections").get(0).asText()).isEqualTo("ending fix");
    assertThat(segment.get("appliedCorrections").get(2).asText()).isEqualTo("punctuation");

    JsonNode statistics = body.get("statistics");
    assertThat(statistics.get("total_segments").asInt()).isEqualTo(1);
    assertThat(statistics.get("total_cost").asDouble()).isEqualTo(0.0);
  }

  @Test
  void correct_shouldApplyConfiguredCustomTerms() throws Exception {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/v1/corrections",
            new CorrectionRequest("[0:00:01 - 0:00:05] Googleコラボで実行", false),
            String.class);

    JsonNode body = objectMapper.readTree(response.getBody());
    assertThat(body.get("segments").get(0).get("correctedText").asText())
        .isEqualTo("Google Colabで実行");
  }

  @Test
  void correct_shouldRejectMissingText() {
    ResponseEntity<String> response =
        restTemplate.postForEntity("/api/v1/corrections", Map.of(), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void audit_shouldReturnAnalysisAndReport() throws Exception {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/v1/audits",
            new AuditRequest(
                "[0:00:01 - 0:00:05] 今日はDay2になるDay2の講座です",
                "[0:00:01 - 0:00:05] 今日はDay2の講座です"),
            String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode body = objectMapper.readTree(response.getBody());
    assertThat(body.at("/analysis/segments/0/significantChanges/0").asText())
        .contains("duplicate phrase");
    assertThat(body.get("report").asText()).contains("Segments analyzed: 1");
  }

  @Test
  void batch_shouldRunAsynchronouslyAndReportCompletion() throws Exception {
    Path run = Files.createDirectories(BATCH_ROOT.resolve(UUID.randomUUID().toString()));
    Path input = Files.createDirectory(run.resolve("lectures"));
    Files.writeString(input.resolve("day1.txt"), "[0:00:01 - 0:00:05] 申しす");
    Path output = run.resolve("corrected");

    ResponseEntity<String> started =
        restTemplate.postForEntity(
            "/api/v1/batches",
            new BatchRequest(input.toString(), output.toString(), false),
            String.class);

    assertThat(started.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    String jobId = objectMapper.readTree(started.getBody()).get("jobId").asText();

    JsonNode status = null;
    for (int attempt = 0; attempt < 50; attempt++) {
      status =
          objectMapper.readTree(
              restTemplate.getForEntity("/api/v1/jobs/" + jobId, String.class).getBody());
      if ("COMPLETED".equals(status.get("status").asText())) {
        break;
      }
      Thread.sleep(100);
    }

    assertThat(status.get("status").asText()).isEqualTo("COMPLETED");
    assertThat(status.at("/result/processedFiles/0").asText()).isEqualTo("day1.txt");
    assertThat(Files.readString(output.resolve("day1_corrected.txt")))
        .isEqualTo("[0:00:01 - 0:00:05]\n申します。\n\n");
    assertThat(output.resolve("batch_statistics.json")).exists();
  }

  @Test
  void batch_shouldRejectDirectoryOutsideBatchRoot() {
    ResponseEntity<String> response =
        restTemplate.postForEntity(
            "/api/v1/batches", new BatchRequest("../outside", null, false), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void jobStatus_shouldReturnNotFoundForUnknownJob() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/api/v1/jobs/does-not-exist", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }
}
