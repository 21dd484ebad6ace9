package com.bloom.recommender.dto;

import com.bloom.recommender.model.Evidence;
import com.bloom.recommender.model.SocialEvidence;
import com.bloom.recommender.model.StructuredSignals;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;

import java.util.List;

public class ProfileDtos {
    /** Evidence for one person; only the conversation counts towards the message minimum. */
    public static class EvidenceRequest {
        private String conversation;
        @Valid
        private SocialProfileBody socialProfile;
        @Valid
        private StructuredBody structured;

        public String getConversation() { return conversation; }
        public void setConversation(String conversation) { this.conversation = conversation; }
        public SocialProfileBody getSocialProfile() { return socialProfile; }
        public void setSocialProfile(SocialProfileBody socialProfile) { this.socialProfile = socialProfile; }
        public StructuredBody getStructured() { return structured; }
        public void setStructured(StructuredBody structured) { this.structured = structured; }

        public Evidence toEvidence() {
            SocialEvidence social = socialProfile == null ? null
                    : new SocialEvidence(socialProfile.getBio(), socialProfile.getPosts(), socialProfile.getFollowing());
            StructuredSignals signals = structured == null ? null
                    : new StructuredSignals(structured.getEntityInteractions(), structured.getAssets(),
                    structured.getCounterparties(), structured.getGovernanceActions(),
                    structured.getTotalInteractions() == null ? 0 : structured.getTotalInteractions());
            return new Evidence(conversation, social, signals);
        }
    }

    public static class SocialProfileBody {
        private String bio;
        private List<String> posts;
        private List<String> following;

        public String getBio() { return bio; }
        public void setBio(String bio) { this.bio = bio; }
        public List<String> getPosts() { return posts; }
        public void setPosts(List<String> posts) { this.posts = posts; }
        public List<String> getFollowing() { return following; }
        public void setFollowing(List<String> following) { this.following = following; }
    }

    public static class StructuredBody {
        private List<String> entityInteractions;
        private List<String> assets;
        private List<String> counterparties;
        private List<String> governanceActions;
        @Min(0)
        private Integer totalInteractions;

        public List<String> getEntityInteractions() { return entityInteractions; }
        public void setEntityInteractions(List<String> entityInteractions) { this.entityInteractions = entityInteractions; }
        public List<String> getAssets() { return assets; }
        public void setAssets(List<String> assets) { this.assets = assets; }
        public List<String> getCounterparties() { return counterparties; }
        public void setCounterparties(List<String> counterparties) { this.counterparties = counterparties; }
        public List<String> getGovernanceActions() { return governanceActions; }
        public void setGovernanceActions(List<String> governanceActions) { this.governanceActions = governanceActions; }
        public Integer getTotalInteractions() { return totalInteractions; }
        public void setTotalInteractions(Integer totalInteractions) { this.totalInteractions = totalInteractions; }
    }
}
