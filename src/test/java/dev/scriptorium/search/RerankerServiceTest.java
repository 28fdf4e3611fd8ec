package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import dev.scriptorium.auth.IamTokenProvider;
import dev.scriptorium.auth.QueryCredentials;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class RerankerServiceTest {

  private static final String RERANK_URL = "http://rerank.test/v1/rerank";

  @Mock IamTokenProvider<QueryCredentials> tokenProvider;

  MockRestServiceServer server;
  RerankerService rerankerService;

  private final List<SearchResult> candidates =
      List.of(
          new SearchResult("text A", 0.7, "a.md"),
          new SearchResult("text B", 0.8, "b.md"),
          new SearchResult("text C", 0.6, "c.md"));

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl("http://rerank.test");
    server = MockRestServiceServer.bindTo(builder).build();
    SearchBackendProperties properties =
        new SearchBackendProperties(
            "http://kb.test",
            "/api/v2/retrieve",
            1000,
            1000,
            new SearchBackendProperties.Rerank(
                "http://rerank.test", "/v1/rerank", "BAAI/bge-reranker-v2-m3", 1000, 1000));
    rerankerService = new RerankerService(builder.build(), tokenProvider, properties);
  }

  @Test
  void reranksResultsByScore() {
    given(tokenProvider.token()).willReturn("tok-Q");
    server
        .expect(once(), requestTo(RERANK_URL))
        .andExpect(header("Authorization", "Bearer tok-Q"))
        .andExpect(
            content()
                .json(
                    """
                    {"model":"BAAI/bge-reranker-v2-m3","query":"test query",
                     "documents":["text A","text B","text C"],"top_n":3}
                    """))
        .andRespond(
            withSuccess(
                """
                {"results":[{"index":0,"relevance_score":0.8},
                            {"index":1,"relevance_score":0.2},
                            {"index":2,"relevance_score":0.5}]}
                """,
                MediaType.APPLICATION_JSON));

    List<SearchResult> results = rerankerService.rerank("test query", candidates, 10);

    assertThat(results).extracting(SearchResult::content)
        .containsExactly("text A", "text C", "text B");
    assertThat(results).extracting(SearchResult::rerankScore).containsExactly(0.8, 0.5, 0.2);
    assertThat(results.get(1).score()).isEqualTo(0.6);
    server.verify();
  }

  @Test
  void respectsMaxResultsLimit() {
    given(tokenProvider.token()).willReturn("tok-Q");
    server
        .expect(once(), requestTo(RERANK_URL))
        .andRespond(
            withSuccess(
                """
                {"results":[{"index":2,"relevance_score":0.9},
                            {"index":0,"relevance_score":0.4},
                            {"index":1,"relevance_score":0.1}]}
                """,
                MediaType.APPLICATION_JSON));

    List<SearchResult> results = rerankerService.rerank("q", candidates, 2);

    assertThat(results).extracting(SearchResult::sourceReference).containsExactly("c.md", "a.md");
  }

  @Test
  void emptyCandidatesReturnEmptyWithoutCall() {
    assertThat(rerankerService.rerank("q", List.of(), 5)).isEmpty();
    verifyNoInteractions(tokenProvider);
    server.verify();
  }

  @Test
  void serverErrorBecomesRerankStageFailure() {
    given(tokenProvider.token()).willReturn("tok-Q");
    server.expect(once(), requestTo(RERANK_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> rerankerService.rerank("q", candidates, 2))
        .isInstanceOf(UpstreamException.class)
        .extracting(e -> ((UpstreamException) e).getStage())
        .isEqualTo("rerank");
    verify(tokenProvider, never()).invalidate();
  }

  @Test
  void unauthorizedInvalidatesQueryToken() {
    given(tokenProvider.token()).willReturn("stale");
    server.expect(once(), requestTo(RERANK_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> rerankerService.rerank("q", candidates, 2))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("rerank failed: HTTP 401");
    verify(tokenProvider).invalidate();
  }

  @Test
  void zeroRelevanceIsStillAReranking() {
    given(tokenProvider.token()).willReturn("tok-Q");
    server
        .expect(once(), requestTo(RERANK_URL))
        .andRespond(
            withSuccess(
                "{\"results\":[{\"index\":1,\"relevance_score\":0.0}]}",
                MediaType.APPLICATION_JSON));

    List<SearchResult> results = rerankerService.rerank("q", candidates, 1);

    assertThat(results).singleElement().satisfies(r -> {
      assertThat(r.isReranked()).isTrue();
      assertThat(r.rerankScore()).isZero();
    });
  }

  @Test
  void outOfRangeIndexIsRejected() {
    given(tokenProvider.token()).willReturn("tok-Q");
    server
        .expect(once(), requestTo(RERANK_URL))
        .andRespond(
            withSuccess(
                "{\"results\":[{\"index\":7,\"relevance_score\":0.9}]}",
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> rerankerService.rerank("q", candidates, 2))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("out-of-range index 7");
  }

  @Test
  void replyWithoutScoresIsRejected() {
    given(tokenProvider.token()).willReturn("tok-Q");
    server
        .expect(once(), requestTo(RERANK_URL))
        .andRespond(withSuccess("{\"results\":[]}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> rerankerService.rerank("q", candidates, 2))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("no scores");
  }
}
