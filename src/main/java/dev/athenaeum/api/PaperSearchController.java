package dev.athenaeum.api;

import dev.athenaeum.search.PaperSearchService;
import dev.athenaeum.search.SearchResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** HTTP entry point for paper discovery. Invalid options are answered with 400 Problem Detail. */
@RestController
@RequestMapping("/api/papers")
public class PaperSearchController {

  private final PaperSearchService searchService;

  public PaperSearchController(PaperSearchService searchService) {
    this.searchService = searchService;
  }

  @PostMapping("/search")
  public SearchResponse search(@RequestBody PaperSearchBody body) {
    return searchService.search(body.toSearchRequest());
  }
}
