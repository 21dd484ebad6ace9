package com.bloom.recommender.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Content source configuration.
 *
 * Properties are prefixed with "sources" in application.yml.
 */
@ConfigurationProperties(prefix = "sources")
public class SourceProperties {
    private final Github github = new Github();
    private final Curated curated = new Curated();
    private final Clawhub clawhub = new Clawhub();

    public Github getGithub() { return github; }
    public Curated getCurated() { return curated; }
    public Clawhub getClawhub() { return clawhub; }

    public static class Github {
        private boolean enabled = true;
        /** REST API base URL */
        private String baseUrl = "https://api.github.com";
        /** Optional personal access token; unauthenticated search is heavily rate limited */
        private String token;
        /** Number of topics queried per request (search API has query length limits) */
        private int maxTopics = 3;
        /** Total repositories requested across all topics */
        private int limit = 40;
        private int minStars = 50;
        /** Only repositories pushed within this many days */
        private int pushedWithinDays = 180;
        /** Retries on 5xx / connection failures before the source gives up */
        private int maxRetries = 1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public int getMaxTopics() { return maxTopics; }
        public void setMaxTopics(int maxTopics) { this.maxTopics = maxTopics; }

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }

        public int getMinStars() { return minStars; }
        public void setMinStars(int minStars) { this.minStars = minStars; }

        public int getPushedWithinDays() { return pushedWithinDays; }
        public void setPushedWithinDays(int pushedWithinDays) { this.pushedWithinDays = pushedWithinDays; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Curated {
        private boolean enabled = true;
        /** Upper bound of items kept from all curated lists per request */
        private int limit = 20;
        /** Raw list score that maps to a preliminary score of 100 */
        private int scoreCeiling = 30;
        private List<CuratedList> lists = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }

        public int getScoreCeiling() { return scoreCeiling; }
        public void setScoreCeiling(int scoreCeiling) { this.scoreCeiling = scoreCeiling; }

        public List<CuratedList> getLists() { return lists; }
        public void setLists(List<CuratedList> lists) { this.lists = lists; }
    }

    public static class Clawhub {
        private boolean enabled = true;
        /** Registry base URL; skill pages live under {baseUrl}/skills/{slug} */
        private String baseUrl = "https://clawhub.ai";
        /** Skills kept across all category searches */
        private int limit = 15;
        /** Results requested per category search */
        private int perCategory = 4;
        private int maxRetries = 1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }

        public int getPerCategory() { return perCategory; }
        public void setPerCategory(int perCategory) { this.perCategory = perCategory; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /** A curated awesome-list repository whose README is parsed for items. */
    public static class CuratedList {
        private String owner;
        private String repo;
        private boolean official;

        public CuratedList() {}

        public CuratedList(String owner, String repo, boolean official) {
            this.owner = owner;
            this.repo = repo;
            this.official = official;
        }

        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }

        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }

        public boolean isOfficial() { return official; }
        public void setOfficial(boolean official) { this.official = official; }

        public String slug() {
            return owner + "/" + repo;
        }
    }
}
