package dev.scriptorium.indexing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import dev.scriptorium.auth.IamTokenProvider;
import dev.scriptorium.auth.IndexingCredentials;
import dev.scriptorium.auth.TokenExchangeException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class IndexingJobSubmitterTest {

  private static final String RUNS_URL = "http://rag.test/api/v1/rags/runs";

  @Mock IamTokenProvider<IndexingCredentials> tokenProvider;

  MockRestServiceServer server;
  IndexingJobSubmitter submitter;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl("http://rag.test");
    server = MockRestServiceServer.bindTo(builder).build();
    IndexingProperties properties =
        new IndexingProperties(
            "http://rag.test",
            "/api/v1/rags/runs",
            "proj-1",
            "rag-1",
            "pi-1",
            "bucket-id-1",
            "docs-bucket",
            "Qwen/Qwen3-Embedding-0.6B",
            "registry.test/extractor:1.0",
            1500,
            300,
            null,
            1000,
            1000);
    submitter = new IndexingJobSubmitter(builder.build(), tokenProvider, properties);
  }

  @Test
  void submitsRunAndReturnsJobId() {
    given(tokenProvider.token()).willReturn("tok-I");
    server
        .expect(once(), requestTo(RUNS_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer tok-I"))
        .andExpect(jsonPath("$.project_id").value("proj-1"))
        .andExpect(jsonPath("$.rag_id").value("rag-1"))
        .andExpect(jsonPath("$.product_instance_id").value("pi-1"))
        .andExpect(jsonPath("$.deploy_params.s3_storage.s3_bucket").value("docs-bucket"))
        .andExpect(jsonPath("$.deploy_params.s3_storage.s3_prefix").value("docs/"))
        .andExpect(jsonPath("$.deploy_params.extractors.length()").value(3))
        .andExpect(jsonPath("$.deploy_params.extractors[0].extensions_supported[0]").value("txt"))
        .andExpect(jsonPath("$.deploy_params.extractors[1].extra_envs.SPLITTER")
            .value("RagSplitter_MarkdownSplitter"))
        .andExpect(jsonPath("$.deploy_params.extractors[2].extra_envs.CHUNK_SIZE").value("1500"))
        .andExpect(jsonPath("$.embedder.model_id").value("Qwen/Qwen3-Embedding-0.6B"))
        .andRespond(withSuccess("{\"id\":\"run-7\",\"status\":\"PENDING\"}", MediaType.APPLICATION_JSON));

    IndexingRun run = submitter.startIndexing("s3://docs-bucket/docs/");

    assertThat(run.jobId()).isEqualTo("run-7");
    assertThat(run.sourcePrefix()).isEqualTo("docs/");
    assertThat(run.formats())
        .containsExactly(DocumentFormat.TXT, DocumentFormat.MD, DocumentFormat.PDF);
    server.verify();
  }

  @Test
  void acceptsCreatedWithRunIdField() {
    given(tokenProvider.token()).willReturn("tok-I");
    server
        .expect(once(), requestTo(RUNS_URL))
        .andExpect(jsonPath("$.description").value("nightly"))
        .andExpect(jsonPath("$.deploy_params.extractors.length()").value(1))
        .andExpect(jsonPath("$.deploy_params.extractors[0].extensions_supported[0]").value("md"))
        .andRespond(
            withStatus(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"run_id\":\"run-8\"}"));

    IndexingRun run = submitter.startIndexing("handbook/", " nightly ", List.of(".MD"));

    assertThat(run.jobId()).isEqualTo("run-8");
    assertThat(run.description()).isEqualTo("nightly");
    assertThat(run.formats()).containsExactly(DocumentFormat.MD);
  }

  @Test
  void rejectsUnsupportedExtensionsBeforeCallingBackend() {
    assertThatThrownBy(() -> submitter.startIndexing("docs/", "", List.of("md", "docx")))
        .isInstanceOf(SubmissionException.class)
        .hasMessageContaining("Unsupported extensions: [docx]");

    verifyNoInteractions(tokenProvider);
    server.verify();
  }

  @Test
  void rejectsForeignBucket() {
    assertThatThrownBy(() -> submitter.startIndexing("s3://other-bucket/docs/"))
        .isInstanceOf(SubmissionException.class)
        .hasMessageContaining("does not match");
  }

  @Test
  void backendRejectionBecomesSubmissionException() {
    given(tokenProvider.token()).willReturn("tok-I");
    server
        .expect(once(), requestTo(RUNS_URL))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"detail\":\"rag is busy\"}"));

    assertThatThrownBy(() -> submitter.startIndexing("docs/"))
        .isInstanceOf(SubmissionException.class)
        .hasMessageContaining("HTTP 400");
    verify(tokenProvider, never()).invalidate();
  }

  @Test
  void unauthorizedInvalidatesCachedToken() {
    given(tokenProvider.token()).willReturn("stale");
    server.expect(once(), requestTo(RUNS_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> submitter.startIndexing("docs/"))
        .isInstanceOf(SubmissionException.class)
        .hasMessageContaining("HTTP 401");
    verify(tokenProvider).invalidate();
  }

  @Test
  void tokenFailureIsReportedAsAuthenticationError() {
    given(tokenProvider.token())
        .willThrow(new TokenExchangeException("No credentials configured for the indexing scope"));

    assertThatThrownBy(() -> submitter.startIndexing("docs/"))
        .isInstanceOf(SubmissionException.class)
        .hasMessageStartingWith("Indexing authentication failed")
        .hasMessageContaining("indexing scope");
    server.verify();
  }

  @Test
  void responseWithoutIdentifierIsRejected() {
    given(tokenProvider.token()).willReturn("tok-I");
    server
        .expect(once(), requestTo(RUNS_URL))
        .andRespond(withSuccess("{\"status\":\"PENDING\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> submitter.startIndexing("docs/"))
        .isInstanceOf(SubmissionException.class)
        .hasMessageContaining("returned no identifier");
  }

  @Test
  void emptyPrefixIndexesWholeBucket() {
    assertThat(submitter.normalizePrefix(null)).isEmpty();
    assertThat(submitter.normalizePrefix("s3://docs-bucket")).isEmpty();
    assertThat(submitter.normalizePrefix("  reports/2026/ ")).isEqualTo("reports/2026/");
  }

  @Test
  void blankExtensionListFallsBackToDefaults() {
    assertThat(submitter.resolveFormats(List.of(" ", "")))
        .containsExactly(DocumentFormat.TXT, DocumentFormat.MD, DocumentFormat.PDF);
    assertThat(submitter.resolveFormats(List.of("pdf", "PDF", ".pdf")))
        .containsExactly(DocumentFormat.PDF);
  }
}
