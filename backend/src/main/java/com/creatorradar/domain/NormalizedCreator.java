package com.creatorradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Platform-agnostic creator as discovered by a search worker. The identity key is derived from the
 * identifier fields on write and is not part of this shape.
 */
@NoArgsConstructor
@Getter
@Setter
public class NormalizedCreator {

    private Platform platform;
    private String handle;
    private String externalId;
    private String secondaryId;
    private String profileUrl;
    private String displayName;
    private Long followerCount;
    private String bio;
    private String avatarUrl;
    private List<String> emails = new ArrayList<>();
    /** Provider payload carried through unchanged (known or opaque shape). */
    private Map<String, Object> raw = new LinkedHashMap<>();

    /**
     * Identifier view consumed by the identity engine: top-level candidate fields plus the raw payload nested
     * under {@code raw}.
     */
    public Map<String, Object> identityView() {
        Map<String, Object> view = new LinkedHashMap<>();
        if (platform != null) {
            view.put("platform", platform.wireName());
        }
        view.put("handle", handle);
        view.put("id", externalId);
        view.put("secUid", secondaryId);
        view.put("url", profileUrl);
        view.put("profile", raw);
        return view;
    }
}
