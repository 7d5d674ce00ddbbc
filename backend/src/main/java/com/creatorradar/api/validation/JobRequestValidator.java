package com.creatorradar.api.validation;

import com.creatorradar.domain.Platform;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates platform and keyword input for POST /jobs. Worker message validation reuses the keyword bounds.
 */
@Component
public class JobRequestValidator {

    public static final int MAX_KEYWORDS = 50;
    public static final int MIN_KEYWORD_LENGTH = 2;
    public static final int MAX_KEYWORD_LENGTH = 100;

    public boolean isSupportedPlatform(String platform) {
        return Platform.fromWire(platform).isPresent();
    }

    /**
     * 1..50 keywords, each 2..100 characters once trimmed.
     */
    public boolean areValidKeywords(List<String> keywords) {
        if (keywords == null || keywords.isEmpty() || keywords.size() > MAX_KEYWORDS) return false;
        return keywords.stream().allMatch(JobRequestValidator::isValidKeyword);
    }

    public static boolean isValidKeyword(String keyword) {
        if (keyword == null) return false;
        int length = keyword.trim().length();
        return length >= MIN_KEYWORD_LENGTH && length <= MAX_KEYWORD_LENGTH;
    }

    public List<String> sanitizeKeywords(List<String> keywords) {
        return keywords.stream().map(String::trim).toList();
    }
}
