package com.creatorradar.discovery.adapter;

import java.util.List;

/**
 * Profile fields the contact provider returned for one creator. Any field may be null.
 */
public record ContactProfile(String bio, String email, List<String> links, Long followerCount) {
}
