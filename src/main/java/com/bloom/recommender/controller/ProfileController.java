package com.bloom.recommender.controller;

import com.bloom.recommender.dto.ProfileDtos;
import com.bloom.recommender.model.Profile;
import com.bloom.recommender.service.profile.ProfileService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class ProfileController {
    private static final Logger log = LoggerFactory.getLogger(ProfileController.class);
    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @PostMapping("/profile")
    public Mono<Profile> profile(@Valid @RequestBody ProfileDtos.EvidenceRequest body) {
        log.info("/profile social_present={} structured_present={}",
                body.getSocialProfile() != null, body.getStructured() != null);
        return Mono.fromCallable(() -> profileService.buildProfile(body.toEvidence()));
    }
}
