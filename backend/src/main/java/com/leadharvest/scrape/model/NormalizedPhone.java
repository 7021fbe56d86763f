package com.leadharvest.scrape.model;

/**
 * @param region ISO 3166 region code of the number, empty when it is non-geographic
 */
public record NormalizedPhone(String raw, String e164, String region) {
}
