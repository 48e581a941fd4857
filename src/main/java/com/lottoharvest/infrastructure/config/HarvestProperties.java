package com.lottoharvest.infrastructure.config;

import com.lottoharvest.infrastructure.normalize.OnlineChannelPredicate;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code harvest.*}.
 */
@Component
@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {

    private int window = 10;
    private int workers = 4;
    private Duration pacingDelay = Duration.ofMillis(250);
    private int maxPages = 50;
    private int recordCeiling = 2000;
    private Duration runBudget = Duration.ofMinutes(10);

    private Round round = new Round();
    private Http http = new Http();
    private Source source = new Source();
    private Normalize normalize = new Normalize();
    private Aggregate aggregate = new Aggregate();
    private Features features = new Features();

    public int getWindow() {
        return window;
    }

    public void setWindow(int window) {
        this.window = window;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public Duration getPacingDelay() {
        return pacingDelay;
    }

    public void setPacingDelay(Duration pacingDelay) {
        this.pacingDelay = pacingDelay;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public int getRecordCeiling() {
        return recordCeiling;
    }

    public void setRecordCeiling(int recordCeiling) {
        this.recordCeiling = recordCeiling;
    }

    public Duration getRunBudget() {
        return runBudget;
    }

    public void setRunBudget(Duration runBudget) {
        this.runBudget = runBudget;
    }

    public Round getRound() {
        return round;
    }

    public void setRound(Round round) {
        this.round = round;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Normalize getNormalize() {
        return normalize;
    }

    public void setNormalize(Normalize normalize) {
        this.normalize = normalize;
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    public void setAggregate(Aggregate aggregate) {
        this.aggregate = aggregate;
    }

    public Features getFeatures() {
        return features;
    }

    public void setFeatures(Features features) {
        this.features = features;
    }

    public enum RoundStrategy {
        PROBE, PAGE, DATE
    }

    public static class Round {
        private RoundStrategy strategy = RoundStrategy.PROBE;
        private Integer hint;
        private int probeCeiling = 10000;
        private int anchorRound = 1152;
        /** ISO offset date-time of the anchor round's draw day, at midnight. */
        private String anchorDate = "2024-12-28T00:00+09:00";
        private DayOfWeek drawDay = DayOfWeek.SATURDAY;
        private int publishHour = 21;
        private String zone = "Asia/Seoul";
        private int maxDeviation = 1;
        private boolean fallbackToDate = false;

        public RoundStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(RoundStrategy strategy) {
            this.strategy = strategy;
        }

        public Integer getHint() {
            return hint;
        }

        public void setHint(Integer hint) {
            this.hint = hint;
        }

        public int getProbeCeiling() {
            return probeCeiling;
        }

        public void setProbeCeiling(int probeCeiling) {
            this.probeCeiling = probeCeiling;
        }

        public int getAnchorRound() {
            return anchorRound;
        }

        public void setAnchorRound(int anchorRound) {
            this.anchorRound = anchorRound;
        }

        public String getAnchorDate() {
            return anchorDate;
        }

        public void setAnchorDate(String anchorDate) {
            this.anchorDate = anchorDate;
        }

        public DayOfWeek getDrawDay() {
            return drawDay;
        }

        public void setDrawDay(DayOfWeek drawDay) {
            this.drawDay = drawDay;
        }

        public int getPublishHour() {
            return publishHour;
        }

        public void setPublishHour(int publishHour) {
            this.publishHour = publishHour;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public int getMaxDeviation() {
            return maxDeviation;
        }

        public void setMaxDeviation(int maxDeviation) {
            this.maxDeviation = maxDeviation;
        }

        public boolean isFallbackToDate() {
            return fallbackToDate;
        }

        public void setFallbackToDate(boolean fallbackToDate) {
            this.fallbackToDate = fallbackToDate;
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(25);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(8);
        private List<Integer> retryableStatuses = new ArrayList<>(List.of(429, 500, 502, 503, 504));
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
        private String acceptLanguage = "ko-KR,ko;q=0.9,en-US;q=0.8,en;q=0.7";
        private String fallbackHost;

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public void setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public List<Integer> getRetryableStatuses() {
            return retryableStatuses;
        }

        public void setRetryableStatuses(List<Integer> retryableStatuses) {
            this.retryableStatuses = retryableStatuses;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public String getAcceptLanguage() {
            return acceptLanguage;
        }

        public void setAcceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
        }

        public String getFallbackHost() {
            return fallbackHost;
        }

        public void setFallbackHost(String fallbackHost) {
            this.fallbackHost = fallbackHost;
        }
    }

    public static class Source {
        private String storeUrl = "https://dhlottery.co.kr/store.do?method=topStore&pageGubun=L645";
        private String byWinUrl = "https://dhlottery.co.kr/gameResult.do?method=byWin&drwNo={round}";
        private String latestUrl = "https://dhlottery.co.kr/gameResult.do?method=byWin";
        private String apiUrl = "https://www.dhlottery.co.kr/common.do?method=getLottoNumber&drwNo={round}";

        public String getStoreUrl() {
            return storeUrl;
        }

        public void setStoreUrl(String storeUrl) {
            this.storeUrl = storeUrl;
        }

        public String getByWinUrl() {
            return byWinUrl;
        }

        public void setByWinUrl(String byWinUrl) {
            this.byWinUrl = byWinUrl;
        }

        public String getLatestUrl() {
            return latestUrl;
        }

        public void setLatestUrl(String latestUrl) {
            this.latestUrl = latestUrl;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }
    }

    public static class Normalize {
        private List<Region> regions = new ArrayList<>();
        private List<String> onlineMarkers = new ArrayList<>(List.of("동행복권", "dhlottery", "인터넷"));
        private OnlineChannelPredicate.Scope onlineScope = OnlineChannelPredicate.Scope.EITHER;
        private List<String> noResultPhrases = new ArrayList<>(List.of("조회 결과가 없습니다", "당첨 판매점이 없습니다"));

        public List<Region> getRegions() {
            return regions;
        }

        public void setRegions(List<Region> regions) {
            this.regions = regions;
        }

        public List<String> getOnlineMarkers() {
            return onlineMarkers;
        }

        public void setOnlineMarkers(List<String> onlineMarkers) {
            this.onlineMarkers = onlineMarkers;
        }

        public OnlineChannelPredicate.Scope getOnlineScope() {
            return onlineScope;
        }

        public void setOnlineScope(OnlineChannelPredicate.Scope onlineScope) {
            this.onlineScope = onlineScope;
        }

        public List<String> getNoResultPhrases() {
            return noResultPhrases;
        }

        public void setNoResultPhrases(List<String> noResultPhrases) {
            this.noResultPhrases = noResultPhrases;
        }
    }

    public static class Region {
        private String code;
        private List<String> aliases = new ArrayList<>();

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases;
        }
    }

    public static class Aggregate {
        private int maxSamples = 3;

        public int getMaxSamples() {
            return maxSamples;
        }

        public void setMaxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
        }
    }

    public static class Features {
        private boolean prizeBreakdown = true;
        private boolean numberFrequency = true;

        public boolean isPrizeBreakdown() {
            return prizeBreakdown;
        }

        public void setPrizeBreakdown(boolean prizeBreakdown) {
            this.prizeBreakdown = prizeBreakdown;
        }

        public boolean isNumberFrequency() {
            return numberFrequency;
        }

        public void setNumberFrequency(boolean numberFrequency) {
            this.numberFrequency = numberFrequency;
        }
    }
}
