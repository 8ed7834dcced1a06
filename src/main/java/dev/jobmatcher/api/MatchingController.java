package dev.jobmatcher.api;

import dev.jobmatcher.model.MatchView;
import dev.jobmatcher.scheduler.MatchScheduler;
import dev.jobmatcher.service.MatchLedger;
import dev.jobmatcher.service.MatchingEngine;
import dev.jobmatcher.service.RecommendationService;
import dev.jobmatcher.service.RecommendationService.Recommendation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MatchingController {

    private static final int MAX_PAGE_SIZE = 100;

    private final MatchingEngine matchingEngine;
    private final MatchLedger matchLedger;
    private final RecommendationService recommendationService;
    private final ObjectProvider<MatchScheduler> matchScheduler;

    /**
     * Run a matching pass. With background=true the scheduler loop is woken instead
     * and the call returns at once.
     */
    @PostMapping("/matching/run")
    public Mono<ResponseEntity<Object>> run(@RequestParam(defaultValue = "false") boolean background) {
        if (background) {
            MatchScheduler scheduler = matchScheduler.getIfAvailable();
            if (scheduler == null || !scheduler.isRunning()) {
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT)
                        .<Object>body(Map.of("error", "scheduler_not_running")));
            }
            scheduler.triggerNow();
            return Mono.just(ResponseEntity.accepted().<Object>body(Map.of("status", "triggered")));
        }
        log.info("Matching pass requested via API");
        return matchingEngine.process()
                .map(summary -> ResponseEntity.ok().<Object>body(summary));
    }

    @GetMapping("/matching/status")
    public Mono<Map<String, Object>> status() {
        MatchScheduler scheduler = matchScheduler.getIfAvailable();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("schedulerRunning", scheduler != null && scheduler.isRunning());
        status.put("passRunning", matchingEngine.isPassRunning());
        status.put("lastPass", matchingEngine.getLastSummary().orElse(null));
        return Mono.just(status);
    }

    @PostMapping("/recommendations")
    public Mono<List<Recommendation>> recommend(@Valid @RequestBody RecommendationRequest request) {
        return recommendationService.recommend(request.getKeywords(), request.getLimit(), request.getMinScore());
    }

    @GetMapping("/matches/{subscriberId}")
    public Mono<Map<String, Object>> matches(@PathVariable String subscriberId,
                                             @RequestParam(defaultValue = "20") int limit,
                                             @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE || offset < 0) {
            return Mono.error(new IllegalArgumentException(
                    "limit must be between 1 and " + MAX_PAGE_SIZE + " and offset must not be negative"));
        }
        return Mono.fromCallable(() -> {
                    Page<MatchView> page = matchLedger.findForSubscriber(subscriberId,
                            PageRequest.of(offset / limit, limit));
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("matches", page.getContent());
                    body.put("total", page.getTotalElements());
                    body.put("limit", limit);
                    body.put("offset", offset);
                    return body;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/matches/{subscriberId}/unread-count")
    public Mono<Map<String, Long>> unreadCount(@PathVariable String subscriberId) {
        return Mono.fromCallable(() -> Map.of("unread", matchLedger.countUnread(subscriberId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/matches/{matchId}/read")
    public Mono<ResponseEntity<Map<String, String>>> markRead(@PathVariable String matchId,
                                                              @RequestParam String subscriberId) {
        return Mono.fromCallable(() -> matchLedger.markRead(matchId, subscriberId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(found -> found
                        ? ResponseEntity.ok(Map.of("status", "read"))
                        : ResponseEntity.status(HttpStatus.NOT_FOUND)
                                .body(Map.of("error", "match_not_found", "matchId", matchId)));
    }
}
