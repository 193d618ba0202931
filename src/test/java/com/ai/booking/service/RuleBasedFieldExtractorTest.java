package com.ai.booking.service;

import com.ai.booking.conversation.ExtractedFields;
import org.junit.jupiter.api.Test;

import static com.ai.booking.BookingTestSupport.clockAt;
import static com.ai.booking.BookingTestSupport.properties;
import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedFieldExtractorTest {

    private final RuleBasedFieldExtractor extractor =
            new RuleBasedFieldExtractor(new TimePreferenceResolver(clockAt(8, 0), properties()));

    @Test
    void allFieldsInOneMessage() {
        ExtractedFields fields = extractor.extract("Hi, my name is Olena, olena@example.com, tomorrow morning please");

        assertThat(fields.name()).isEqualTo("Olena");
        assertThat(fields.email()).isEqualTo("olena@example.com");
        assertThat(fields.timePreference()).contains("tomorrow morning");
    }

    @Test
    void nameStopsBeforeConnectingWords() {
        assertThat(RuleBasedFieldExtractor.findName("my name is olena and my email is o@example.com")).isEqualTo("Olena");
        assertThat(RuleBasedFieldExtractor.findName("This is Taras Shevchenko")).isEqualTo("Taras Shevchenko");
    }

    @Test
    void phrasesThatAreNotNames() {
        assertThat(RuleBasedFieldExtractor.findName("I'm looking for a meeting")).isNull();
        assertThat(RuleBasedFieldExtractor.findName("I am free on Friday")).isNull();
    }

    @Test
    void noTimePreferenceWithoutDayOrTime() {
        ExtractedFields fields = extractor.extract("olena@example.com");

        assertThat(fields.email()).isEqualTo("olena@example.com");
        assertThat(fields.timePreference()).isNull();
        assertThat(fields.name()).isNull();
    }

    @Test
    void blankIsNone() {
        assertThat(extractor.extract("  ").isEmpty()).isTrue();
    }
}
