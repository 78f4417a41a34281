package com.example.seasonroster.schedule;

import com.example.seasonroster.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/roster")
public class RosterController {

    private final RosterGenerationService generationService;

    public RosterController(RosterGenerationService generationService) {
        this.generationService = generationService;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<RosterResult>> generate(@Valid @RequestBody GenerateRosterRequest request) {
        RosterResult result = generationService.generate(request);
        Map<String, Object> meta = Map.of(
                "assignments", result.assignments().size(),
                "violations", result.violations().size());
        return ResponseEntity.ok(ApiResponse.success("Roster generated", result, meta));
    }
}
