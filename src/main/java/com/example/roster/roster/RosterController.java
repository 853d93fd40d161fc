package com.example.roster.roster;

import com.example.roster.common.ApiResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/roster")
public class RosterController {

    private static final Logger logger = LoggerFactory.getLogger(RosterController.class);

    private final RosterService rosterService;
    private final StrategySelector strategySelector;

    public RosterController(RosterService rosterService, StrategySelector strategySelector) {
        this.rosterService = rosterService;
        this.strategySelector = strategySelector;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<RosterResult>> generate(@Valid @RequestBody RosterGenerationRequest request) {
        RosterResult result = rosterService.generateRoster(request);
        Map<String, Object> meta = new HashMap<>();
        meta.put("mode", rosterService.resolveMode(request.mode()).getCode());
        meta.put("totalDays", result.stats().totalDays());
        meta.put("warningCount", result.warnings().size());
        meta.put("unfulfilledCount", result.unfulfilledConstraints().size());
        if (!result.warnings().isEmpty()) {
            logger.info("Roster {} - {} generated with {} warning(s)",
                    request.startDate(), request.endDate(), result.warnings().size());
        }
        return ResponseEntity.ok(ApiResponse.success("Roster generated", result, meta));
    }

    @GetMapping("/modes")
    public ResponseEntity<ApiResponse<List<String>>> modes() {
        List<String> modes = strategySelector.availableModes().stream()
                .map(OptimizationMode::getCode)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(modes));
    }
}
