package com.leadharvest.scrape.normalize;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import com.leadharvest.scrape.model.NormalizedPhone;

import java.util.Locale;
import java.util.Optional;

public final class PhoneNormalizer {
    private static final PhoneNumberUtil PHONE_UTIL = PhoneNumberUtil.getInstance();
    private static final String UNKNOWN_REGION = "ZZ";

    private PhoneNormalizer() {}

    /**
     * Parses a free-form phone number. The region hint is only consulted when the
     * number carries no country code. Unparseable or invalid numbers yield empty.
     */
    public static Optional<NormalizedPhone> normalize(String raw, String defaultRegion) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String region = defaultRegion == null || defaultRegion.isBlank()
            ? UNKNOWN_REGION
            : defaultRegion.trim().toUpperCase(Locale.ROOT);
        Phonenumber.PhoneNumber parsed;
        try {
            parsed = PHONE_UTIL.parse(value, region);
        } catch (NumberParseException e) {
            return Optional.empty();
        }
        if (!PHONE_UTIL.isValidNumber(parsed)) {
            return Optional.empty();
        }
        String e164 = PHONE_UTIL.format(parsed, PhoneNumberUtil.PhoneNumberFormat.E164);
        String numberRegion = PHONE_UTIL.getRegionCodeForNumber(parsed);
        if (numberRegion == null || UNKNOWN_REGION.equals(numberRegion)) {
            numberRegion = "";
        }
        return Optional.of(new NormalizedPhone(value, e164, numberRegion));
    }
}
