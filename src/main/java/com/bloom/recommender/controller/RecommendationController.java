package com.bloom.recommender.controller;

import com.bloom.recommender.dto.ProfileDtos;
import com.bloom.recommender.dto.RecommendationDtos;
import com.bloom.recommender.service.profile.ProfileService;
import com.bloom.recommender.service.recommend.RecommendationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class RecommendationController {
    private static final Logger log = LoggerFactory.getLogger(RecommendationController.class);
    private final ProfileService profileService;
    private final RecommendationService recommendationService;

    public RecommendationController(ProfileService profileService, RecommendationService recommendationService) {
        this.profileService = profileService;
        this.recommendationService = recommendationService;
    }

    /**
     * Builds the profile from the submitted evidence and returns recommendations grouped by the
     * profile's categories. Sources that fail or time out are left out of the result.
     */
    @PostMapping("/recommendations")
    public Mono<RecommendationDtos.RecommendationResponse> recommend(@Valid @RequestBody ProfileDtos.EvidenceRequest body) {
        log.info("/recommendations sources={}", recommendationService.getAdapters().size());
        return Mono.fromCallable(() -> profileService.buildProfile(body.toEvidence()))
                .flatMap(profile -> recommendationService.recommend(profile)
                        .map(items -> new RecommendationDtos.RecommendationResponse(profile, items)));
    }
}
