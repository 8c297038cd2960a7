package dev.athenaeum.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.athenaeum.config.GlobalExceptionHandler;
import dev.athenaeum.fixture.RawResultBuilder;
import dev.athenaeum.paper.CanonicalPaper;
import dev.athenaeum.search.PaperSearchService;
import dev.athenaeum.search.SearchMetadata;
import dev.athenaeum.search.SearchRequest;
import dev.athenaeum.search.SearchResponse;
import dev.athenaeum.search.SearchStatus;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class PaperSearchControllerTest {

  @Mock PaperSearchService searchService;

  @Captor ArgumentCaptor<SearchRequest> requestCaptor;

  MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PaperSearchController(searchService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static SearchResponse oneResult() {
    CanonicalPaper paper =
        CanonicalPaper.from(
            new RawResultBuilder().title("Attention Is All You Need").doi("10.5555/1").build(),
            Set.of(),
            null,
            0.87);
    SearchMetadata metadata =
        new SearchMetadata(
            List.of("openalex"), Map.of("openalex", 1), List.of(), 42, 0, false, 0, 1, List.of());
    return new SearchResponse(List.of(paper), SearchStatus.FOUND, metadata);
  }

  @Test
  void searchReturnsPapersAndMetadata() throws Exception {
    given(searchService.search(requestCaptor.capture())).willReturn(oneResult());

    mockMvc
        .perform(
            post("/api/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"query": "transformers", "maxResults": 5, "sources": ["openalex"],
                     "localRegion": "Brazil", "linkPreprints": false,
                     "excludeIds": ["cited-1", "cited-2"]}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FOUND"))
        .andExpect(jsonPath("$.papers[0].title").value("Attention Is All You Need"))
        .andExpect(jsonPath("$.papers[0].doi").value("10.5555/1"))
        .andExpect(jsonPath("$.metadata.strategiesUsed[0]").value("openalex"))
        .andExpect(jsonPath("$.metadata.totalFound").value(1));

    SearchRequest request = requestCaptor.getValue();
    assertThat(request.query()).isEqualTo("transformers");
    assertThat(request.maxResults()).isEqualTo(5);
    assertThat(request.sources()).containsExactly("openalex");
    assertThat(request.localRegion()).isEqualTo("Brazil");
    assertThat(request.linkPreprints()).isFalse();
    assertThat(request.excludeIds()).containsExactly("cited-1", "cited-2");
    assertThat(request.minResults()).isEqualTo(SearchRequest.DEFAULT_MIN_RESULTS);
  }

  @Test
  void partialWeightsFillInDefaults() throws Exception {
    given(searchService.search(requestCaptor.capture())).willReturn(oneResult());

    mockMvc
        .perform(
            post("/api/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"q\", \"semanticWeight\": 0.7}"))
        .andExpect(status().isOk());

    assertThat(requestCaptor.getValue().semanticWeight()).isEqualTo(0.7);
    assertThat(requestCaptor.getValue().authorityWeight()).isEqualTo(0.2);
    assertThat(requestCaptor.getValue().recencyWeight()).isEqualTo(0.1);
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid search request"))
        .andExpect(jsonPath("$.detail").value(containsString("Query")));

    verifyNoInteractions(searchService);
  }

  @Test
  void missingQueryIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content("{\"maxResults\": 3}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void weightsAboveOneAreBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content(
                    "{\"query\": \"q\", \"semanticWeight\": 0.8, \"authorityWeight\": 0.5}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("must not exceed 1.0")));
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/papers/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .content("{\"query\": "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value(containsString("Malformed request body")));

    verifyNoInteractions(searchService);
  }
}
