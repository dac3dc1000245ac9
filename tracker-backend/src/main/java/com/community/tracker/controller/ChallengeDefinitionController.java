package com.community.tracker.controller;

import com.community.tracker.dto.ChallengeDefinitionDTO;
import com.community.tracker.dto.CommonResponse;
import com.community.tracker.service.ChallengeCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 全局挑战模板，由机器人运营者维护
 */
@RestController
@RequestMapping("/api/definitions")
public class ChallengeDefinitionController {

    private final ChallengeCatalogService catalogService;

    public ChallengeDefinitionController(ChallengeCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<ChallengeDefinitionDTO>> createDefinition(@Valid @RequestBody ChallengeDefinitionDTO request) {
        return ResponseEntity.ok(CommonResponse.success(catalogService.createDefinition(request)));
    }

    // 只更新请求中非空的字段
    @PatchMapping("/{key}")
    public ResponseEntity<CommonResponse<ChallengeDefinitionDTO>> correctDefinition(@PathVariable("key") String key,
                                                                                    @RequestBody ChallengeDefinitionDTO changes) {
        return ResponseEntity.ok(CommonResponse.success(catalogService.correctDefinition(key, changes)));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<List<ChallengeDefinitionDTO>>> listDefinitions() {
        return ResponseEntity.ok(CommonResponse.success(catalogService.listDefinitions()));
    }

    @GetMapping("/{key}")
    public ResponseEntity<CommonResponse<ChallengeDefinitionDTO>> getDefinition(@PathVariable("key") String key) {
        return ResponseEntity.ok(CommonResponse.success(catalogService.getDefinition(key)));
    }
}
