package com.leadharvest.scrape.model;

import java.util.List;
import java.util.Locale;

/**
 * Detail-page extraction rules per listing platform. Each profile is an ordinary target
 * config whose single item is the whole document.
 */
public enum EnrichmentProfile {
    GENERIC(
        """
            {
              "item_selector": "html",
              "fields": {
                "email": "a[href^='mailto:']@href",
                "phone": "a[href^='tel:']@href",
                "event_description": "meta[name=description]@content",
                "event_datetime": "time[datetime]@datetime"
              }
            }
            """,
        List.of()
    ),
    EVENTBRITE(
        """
            {
              "item_selector": "html",
              "fields": {
                "company": ".organizer-name, [class*=organizer] h2, [class*=organizer] h3, .event-details__organizer-name",
                "event_description": ".event-description, [class*=description] [class*=text], .structured-content-rich-text",
                "website": "a[rel=nofollow][target=_blank][href^=http]@href",
                "event_datetime": "time[datetime]@datetime, [datetime]@datetime",
                "email": "a[href^='mailto:']@href"
              }
            }
            """,
        List.of("eventbrite.")
    ),
    MEETUP(
        """
            {
              "item_selector": "html",
              "fields": {
                "company": "[class*=groupName], [id*=group-name]",
                "event_description": "[class*=eventDescription], .event-description, [class*=description]",
                "website": "a[href*=http][rel=noopener]@href",
                "event_datetime": "time[datetime]@datetime",
                "email": "a[href^='mailto:']@href"
              }
            }
            """,
        List.of("meetup.com", "facebook.com")
    ),
    LINKEDIN(
        """
            {
              "item_selector": "html",
              "fields": {
                "full_name": ".top-card-layout__title, h1[class*=name], .pv-text-details__title",
                "company": ".top-card-layout__headline, [class*=headline], .pv-text-details__subtitle",
                "event_description": ".about-section, [class*=summary], .pv-about-section",
                "email": "a[href^='mailto:']@href",
                "website": "a[data-field=website_url]@href"
              }
            }
            """,
        List.of("linkedin.com")
    );

    private final String configJson;
    private final List<String> excludedWebsiteHosts;

    EnrichmentProfile(String configJson, List<String> excludedWebsiteHosts) {
        this.configJson = configJson;
        this.excludedWebsiteHosts = excludedWebsiteHosts;
    }

    public String configJson() {
        return configJson;
    }

    public List<String> excludedWebsiteHosts() {
        return excludedWebsiteHosts;
    }

    public static EnrichmentProfile parse(String value) {
        if (value == null || value.isBlank()) {
            return GENERIC;
        }
        try {
            return EnrichmentProfile.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown enrichment profile: " + value);
        }
    }
}
