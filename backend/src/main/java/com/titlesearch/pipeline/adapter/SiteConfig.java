package com.titlesearch.pipeline.adapter;

public record SiteConfig(String siteKey, String siteName, String baseUrl, int delayBetweenRequestsMs) {
}
