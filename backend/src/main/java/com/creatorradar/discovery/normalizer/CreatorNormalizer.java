package com.creatorradar.discovery.normalizer;

import com.creatorradar.domain.NormalizedCreator;
import com.creatorradar.domain.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw provider records to {@link NormalizedCreator}. Records without any usable creator identifier are
 * dropped (empty). The raw record is kept on the creator unchanged.
 */
@Component
@Slf4j
public class CreatorNormalizer {

    public List<NormalizedCreator> normalizeAll(Platform platform, List<Map<String, Object>> items) {
        List<NormalizedCreator> out = new ArrayList<>(items.size());
        int dropped = 0;
        for (Map<String, Object> item : items) {
            Optional<NormalizedCreator> c = normalize(platform, item);
            if (c.isPresent()) {
                out.add(c.get());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} {} records without creator identifiers", dropped, platform);
        }
        return out;
    }

    public Optional<NormalizedCreator> normalize(Platform platform, Map<String, Object> item) {
        if (item == null) {
            return Optional.empty();
        }
        return switch (platform) {
            case TIKTOK -> tiktok(item);
            case INSTAGRAM -> instagram(item);
            case YOUTUBE -> youtube(item);
        };
    }

    /** {@code aweme_info.author} carries the creator; a bare author object is accepted too. */
    private Optional<NormalizedCreator> tiktok(Map<String, Object> item) {
        Map<String, Object> aweme = map(item.get("aweme_info"));
        Map<String, Object> author = map(aweme.isEmpty() ? item.get("author") : aweme.get("author"));
        String handle = string(author.get("unique_id"));
        String uid = string(author.get("uid"));
        if (handle == null && uid == null) {
            return Optional.empty();
        }
        NormalizedCreator c = base(Platform.TIKTOK, item);
        c.setHandle(handle);
        c.setExternalId(uid);
        c.setSecondaryId(string(author.get("sec_uid")));
        c.setDisplayName(firstNonNull(string(author.get("nickname")), handle));
        c.setFollowerCount(count(author.get("follower_count")));
        c.setBio(string(author.get("signature")));
        c.setAvatarUrl(firstUrl(author.get("avatar_medium")));
        c.setProfileUrl(handle != null ? "https://www.tiktok.com/@" + handle : null);
        c.setEmails(new ArrayList<>(EmailExtractor.fromText(c.getBio())));
        return Optional.of(c);
    }

    /** Reels carry the creator under {@code owner}. */
    private Optional<NormalizedCreator> instagram(Map<String, Object> item) {
        Map<String, Object> owner = map(item.get("owner"));
        String username = string(owner.get("username"));
        if (username == null) {
            return Optional.empty();
        }
        NormalizedCreator c = base(Platform.INSTAGRAM, item);
        c.setHandle(username);
        c.setExternalId(string(owner.get("id")));
        c.setDisplayName(firstNonNull(string(owner.get("full_name")), username));
        c.setFollowerCount(count(owner.get("follower_count")));
        c.setBio(string(owner.get("biography")));
        c.setAvatarUrl(string(owner.get("profile_pic_url")));
        c.setProfileUrl("https://www.instagram.com/" + username + "/");
        c.setEmails(new ArrayList<>(EmailExtractor.extract(c.getBio(), bioLinks(owner))));
        return Optional.of(c);
    }

    /** Videos carry the channel; followers and bio only arrive with enrichment. */
    private Optional<NormalizedCreator> youtube(Map<String, Object> item) {
        Map<String, Object> channel = map(item.get("channel"));
        String id = string(channel.get("id"));
        String handle = string(channel.get("handle"));
        if (id == null && handle == null) {
            return Optional.empty();
        }
        NormalizedCreator c = base(Platform.YOUTUBE, item);
        c.setHandle(handle);
        c.setExternalId(id);
        c.setDisplayName(firstNonNull(string(channel.get("title")), handle, id));
        c.setAvatarUrl(string(channel.get("thumbnail")));
        c.setProfileUrl(handle != null
                ? "https://www.youtube.com/" + (handle.startsWith("@") ? handle : "@" + handle)
                : "https://www.youtube.com/channel/" + id);
        return Optional.of(c);
    }

    private static NormalizedCreator base(Platform platform, Map<String, Object> item) {
        NormalizedCreator c = new NormalizedCreator();
        c.setPlatform(platform);
        c.setRaw(new LinkedHashMap<>(item));
        return c;
    }

    private static List<String> bioLinks(Map<String, Object> owner) {
        List<String> links = new ArrayList<>();
        if (owner.get("bio_links") instanceof List<?> list) {
            for (Object o : list) {
                if (o instanceof Map<?, ?> link && link.get("url") instanceof String url) {
                    links.add(url);
                }
            }
        }
        return links;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    private static String string(Object value) {
        if (value instanceof String s && !s.isBlank()) {
            return s.trim();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        return null;
    }

    private static Long count(Object value) {
        if (value instanceof Number n) {
            long v = n.longValue();
            return v >= 0 ? v : null;
        }
        if (value instanceof String s) {
            String digits = s.replaceAll("[^0-9]", "");
            return digits.isEmpty() || digits.length() > 18 ? null : Long.parseLong(digits);
        }
        return null;
    }

    private static String firstUrl(Object imageObject) {
        if (map(imageObject).get("url_list") instanceof List<?> urls && !urls.isEmpty()
                && urls.get(0) instanceof String s) {
            return s;
        }
        return null;
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
