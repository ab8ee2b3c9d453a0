package me.internalizable.cricketscore.controller;

import me.internalizable.cricketscore.cache.ScoreboardCache;
import me.internalizable.cricketscore.dto.ApiMessage;
import me.internalizable.cricketscore.dto.HitRequest;
import me.internalizable.cricketscore.model.Participant;
import me.internalizable.cricketscore.service.ScoreIngestService;
import me.internalizable.cricketscore.service.ScoreboardQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class ScoreController {

    private final ScoreIngestService scoreIngestService;
    private final ScoreboardQueryService scoreboardQueryService;
    private final ScoreboardCache scoreboardCache;

    public ScoreController(ScoreIngestService scoreIngestService,
                           ScoreboardQueryService scoreboardQueryService,
                           ScoreboardCache scoreboardCache) {
        this.scoreIngestService = scoreIngestService;
        this.scoreboardQueryService = scoreboardQueryService;
        this.scoreboardCache = scoreboardCache;
    }

    @PostMapping("/hit")
    public ApiMessage hit(@RequestBody(required = false) HitRequest request) {
        scoreIngestService.hit(request != null ? request : HitRequest.EMPTY);
        return ApiMessage.success("Shot recorded successfully");
    }

    /**
     * Ranked by score, highest first. Order among equal scores is not stable between reloads.
     */
    @GetMapping("/scoreboard")
    public List<Participant> scoreboard() {
        return scoreboardQueryService.getScoreboard();
    }

    @GetMapping("/cache/stats")
    public Map<String, Object> cacheStats() {
        return scoreboardCache.getStats();
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }
}
