package com.creatorradar.discovery.keyword;

import com.creatorradar.discovery.adapter.KeywordSuggestionClient;
import com.creatorradar.discovery.adapter.ProviderException;
import com.creatorradar.discovery.config.KeywordExpansionProperties;
import com.creatorradar.discovery.config.SearchProperties;
import com.creatorradar.domain.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Grows the seed keywords so the job has roughly enough keywords to reach its target.
 * <p>
 * Wanted count = ceil(targetResults / creatorsPerKeyword), never below the seed count, capped at maxKeywords.
 * Seeds always come first. Any expansion failure degrades to the seeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeywordExpander {

    static final int MIN_KEYWORD_LENGTH = 2;
    static final int MAX_KEYWORD_LENGTH = 100;

    private final KeywordSuggestionClient suggestionClient;
    private final KeywordExpansionProperties expansionProperties;
    private final SearchProperties searchProperties;

    public List<String> expand(Platform platform, List<String> seeds, int targetResults, boolean requested) {
        Map<String, String> keywords = new LinkedHashMap<>();
        seeds.forEach(s -> add(keywords, s));
        List<String> seedList = new ArrayList<>(keywords.values());
        int wanted = wantedCount(seedList.size(), targetResults);
        if (!requested || !expansionProperties.isEnabled() || wanted <= seedList.size()) {
            return cap(seedList);
        }
        if (expansionProperties.getApiKey() == null || expansionProperties.getApiKey().isBlank()) {
            log.warn("Keyword expansion requested but no API key configured; using {} seed keywords",
                    seedList.size());
            return cap(seedList);
        }
        try {
            List<String> suggestions = suggestionClient.suggest(platform, seedList, wanted - seedList.size())
                    .block(Duration.ofMillis(expansionProperties.getRequestTimeoutMs() + 1_000));
            if (suggestions != null) {
                for (String s : suggestions) {
                    if (keywords.size() >= wanted) {
                        break;
                    }
                    add(keywords, s);
                }
            }
        } catch (ProviderException | IllegalStateException e) {
            log.warn("Keyword expansion failed for {} on {}; using seeds: {}", seedList, platform, e.getMessage());
            return cap(seedList);
        }
        List<String> expanded = cap(new ArrayList<>(keywords.values()));
        log.info("Expanded {} seed keywords to {} for target {} on {}", seedList.size(), expanded.size(),
                targetResults, platform);
        return expanded;
    }

    int wantedCount(int seedCount, int targetResults) {
        int perKeyword = Math.max(1, searchProperties.getCreatorsPerKeyword());
        int byTarget = (targetResults + perKeyword - 1) / perKeyword;
        return Math.min(searchProperties.getMaxKeywords(), Math.max(seedCount, byTarget));
    }

    private List<String> cap(List<String> keywords) {
        int max = searchProperties.getMaxKeywords();
        return keywords.size() > max ? new ArrayList<>(keywords.subList(0, max)) : keywords;
    }

    /** Case-insensitive dedupe; first spelling wins. */
    private static void add(Map<String, String> keywords, String candidate) {
        if (candidate == null) {
            return;
        }
        String trimmed = candidate.trim();
        if (trimmed.length() < MIN_KEYWORD_LENGTH || trimmed.length() > MAX_KEYWORD_LENGTH) {
            return;
        }
        keywords.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
}
