package com.bloom.recommender.dto;

import com.bloom.recommender.model.Profile;
import com.bloom.recommender.model.RankedRecommendation;

import java.util.List;

public class RecommendationDtos {
    public static class RecommendationResponse {
        private Profile profile;
        private List<RankedRecommendation> items;

        public RecommendationResponse() {}

        public RecommendationResponse(Profile profile, List<RankedRecommendation> items) {
            this.profile = profile;
            this.items = items;
        }

        public Profile getProfile() { return profile; }
        public void setProfile(Profile profile) { this.profile = profile; }
        public List<RankedRecommendation> getItems() { return items; }
        public void setItems(List<RankedRecommendation> items) { this.items = items; }
    }
}
