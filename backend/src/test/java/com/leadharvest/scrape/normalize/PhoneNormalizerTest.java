package com.leadharvest.scrape.normalize;

import com.leadharvest.scrape.model.NormalizedPhone;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneNormalizerTest {

    @Test
    void normalizesInternationalNumbersWithoutRegionHint() {
        Optional<NormalizedPhone> phone = PhoneNormalizer.normalize(" +1 650-253-0000 ", null);

        assertThat(phone).contains(new NormalizedPhone("+1 650-253-0000", "+16502530000", "US"));
    }

    @Test
    void usesRegionHintForNationalNumbers() {
        assertThat(PhoneNormalizer.normalize("(650) 253-0000", "us"))
            .map(NormalizedPhone::e164)
            .contains("+16502530000");
        assertThat(PhoneNormalizer.normalize("020 7031 3000", "GB"))
            .map(NormalizedPhone::region)
            .contains("GB");
    }

    @Test
    void rejectsNationalNumbersWithoutRegion() {
        assertThat(PhoneNormalizer.normalize("(650) 253-0000", "")).isEmpty();
    }

    @Test
    void rejectsInvalidOrBlankInput() {
        assertThat(PhoneNormalizer.normalize("12345", "US")).isEmpty();
        assertThat(PhoneNormalizer.normalize("call me", "US")).isEmpty();
        assertThat(PhoneNormalizer.normalize("  ", "US")).isEmpty();
        assertThat(PhoneNormalizer.normalize(null, "US")).isEmpty();
    }
}
