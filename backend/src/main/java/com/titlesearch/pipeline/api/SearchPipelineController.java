package com.titlesearch.pipeline.api;

import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.browser.PoolStats;
import com.titlesearch.pipeline.model.RetryResult;
import com.titlesearch.pipeline.model.SearchPriority;
import com.titlesearch.pipeline.model.SearchStatusView;
import com.titlesearch.pipeline.recovery.RecoveryOptions;
import com.titlesearch.pipeline.service.PipelineOrchestrator;
import com.titlesearch.pipeline.service.SearchJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class SearchPipelineController {
    private final SearchJobService searchJobService;
    private final PipelineOrchestrator orchestrator;
    private final BrowserPool browserPool;

    public SearchPipelineController(
        SearchJobService searchJobService,
        PipelineOrchestrator orchestrator,
        BrowserPool browserPool
    ) {
        this.searchJobService = searchJobService;
        this.orchestrator = orchestrator;
        this.browserPool = browserPool;
    }

    @PostMapping("/searches")
    @ResponseStatus(HttpStatus.CREATED)
    public SearchStatusView createSearch(@RequestBody(required = false) CreateSearchRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        try {
            return searchJobService.create(
                request.streetAddress(),
                request.city(),
                request.county(),
                request.state(),
                request.zipCode(),
                request.parcelNumber(),
                SearchPriority.parse(request.priority()),
                request.searchYears()
            );
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage());
        }
    }

    @GetMapping("/searches/{id}")
    public SearchStatusView status(@PathVariable("id") long id) {
        return searchJobService.status(id);
    }

    @PostMapping("/searches/{id}/cancel")
    public SearchStatusView cancel(@PathVariable("id") long id) {
        return orchestrator.cancel(id);
    }

    @PostMapping("/searches/{id}/retry")
    public RetryResult retry(@PathVariable("id") long id) {
        return orchestrator.retry(id);
    }

    @PostMapping("/searches/{id}/accept-partial")
    public SearchStatusView acceptPartial(@PathVariable("id") long id) {
        return orchestrator.acceptPartialResults(id);
    }

    @GetMapping("/searches/{id}/recovery-options")
    public RecoveryOptions recoveryOptions(@PathVariable("id") long id) {
        return orchestrator.recoveryOptions(id);
    }

    @GetMapping("/browser-pool")
    public PoolStats browserPool() {
        return browserPool.stats();
    }
}
