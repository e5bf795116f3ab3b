package com.auditlead.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of the agents an audit knows about, with their wire names and display names.
 * <p>
 * Implementations are contributed separately as {@code Agent} beans; a name listed
 * here without an implementation is simply not registered for the run.
 */
public enum AgentName {
    WEB_SCRAPER("web_scraper", "Web Scraper"),
    SCREENSHOT("screenshot", "Visual Screenshot Capture"),
    COMPANY_RESEARCH("company_research", "Company Research"),
    COMPETITOR("competitor", "Competitor Intelligence"),
    REVIEW_SENTIMENT("review_sentiment", "Reviews & Sentiment"),
    SEO("seo", "SEO & Visibility"),
    MESSAGING("messaging", "Messaging & Positioning"),
    VISUAL_DESIGN("visual_design", "Visual & Design"),
    CONVERSION("conversion", "Conversion Optimization"),
    SOCIAL("social", "Social & Engagement"),
    ICP("icp", "ICP & Segmentation"),
    REPORT("report", "Report Generation");

    private final String wireName;
    private final String displayName;

    AgentName(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public static List<String> allWireNames() {
        return Arrays.stream(values()).map(AgentName::wireName).toList();
    }

    public static Optional<AgentName> fromWireName(String name) {
        return Arrays.stream(values()).filter(a -> a.wireName.equals(name)).findFirst();
    }

    /** Display name for a catalog entry, or the raw name for agents outside the catalog. */
    public static String displayNameOf(String name) {
        return fromWireName(name).map(AgentName::displayName).orElse(name);
    }
}
