package com.ai.booking.service;

import com.ai.booking.conversation.ExtractedFields;
import com.ai.booking.conversation.QualificationField;
import com.ai.booking.conversation.UserInfo;
import com.ai.booking.conversation.UserTurn;
import com.ai.booking.conversation.ValidationError;
import org.junit.jupiter.api.Test;

import static com.ai.booking.BookingTestSupport.clockAt;
import static com.ai.booking.BookingTestSupport.properties;
import static org.assertj.core.api.Assertions.assertThat;

class QualificationServiceTest {

    private final QualificationService service =
            new QualificationService(new TimePreferenceResolver(clockAt(8, 0), properties()));

    @Test
    void collectsAllFieldsFromOneTurn() {
        UserTurn turn = new UserTurn("I'm Olena, olena@example.com, tomorrow afternoon",
                new ExtractedFields("Olena", "olena@example.com", "tomorrow afternoon"));

        QualificationService.QualificationOutcome outcome = service.merge(UserInfo.empty(), turn);

        assertThat(outcome.hasErrors()).isFalse();
        assertThat(outcome.userInfo()).isEqualTo(new UserInfo("Olena", "olena@example.com", "tomorrow afternoon"));
        assertThat(outcome.userInfo().isComplete()).isTrue();
    }

    @Test
    void missingFieldsAreListedInOrder() {
        UserInfo info = service.merge(UserInfo.empty(), new UserTurn("friday", new ExtractedFields(null, null, "friday")))
                .userInfo();

        assertThat(info.missingFields()).containsExactly(QualificationField.NAME, QualificationField.EMAIL);
    }

    @Test
    void invalidEmailIsReportedAndNotStored() {
        QualificationService.QualificationOutcome outcome = service.merge(new UserInfo("Olena", null, null),
                new UserTurn("olena@", new ExtractedFields(null, "olena@", null)));

        assertThat(outcome.errors()).containsExactly(new ValidationError(QualificationField.EMAIL, "olena@"));
        assertThat(outcome.userInfo().email()).isNull();
    }

    @Test
    void emailIsFoundInRawTextWhenExtractorMissedIt() {
        QualificationService.QualificationOutcome outcome = service.merge(new UserInfo("Olena", null, null),
                UserTurn.of("sure, it's olena.k@example.com."));

        assertThat(outcome.userInfo().email()).isEqualTo("olena.k@example.com");
    }

    @Test
    void unresolvableTimePreferenceIsRejected() {
        QualificationService.QualificationOutcome outcome = service.merge(new UserInfo("Olena", "olena@example.com", null),
                new UserTurn("whenever", new ExtractedFields(null, null, "whenever")));

        assertThat(outcome.errors()).extracting(ValidationError::field).containsExactly(QualificationField.TIME_PREFERENCE);
        assertThat(outcome.userInfo().timePreference()).isNull();
    }

    @Test
    void blankNameIsNotTaken() {
        QualificationService.QualificationOutcome outcome = service.merge(UserInfo.empty(),
                new UserTurn("", new ExtractedFields("   ", null, null)));

        assertThat(outcome.userInfo().name()).isNull();
        assertThat(service.isValidName("12345")).isFalse();
        assertThat(service.isValidName("a@b")).isFalse();
        assertThat(service.isValidName("Jean-Luc")).isTrue();
    }

    @Test
    void bareReplyIsTakenAsNameWhenOnlyNameIsMissing() {
        QualificationService.QualificationOutcome outcome = service.merge(
                new UserInfo(null, "olena@example.com", "tomorrow"), UserTurn.of("Olena Kovalenko"));

        assertThat(outcome.userInfo().name()).isEqualTo("Olena Kovalenko");
        assertThat(outcome.userInfo().isComplete()).isTrue();
    }

    @Test
    void bareReplyWithDateWordsIsNotAName() {
        QualificationService.QualificationOutcome outcome = service.merge(
                new UserInfo(null, "olena@example.com", "tomorrow"), UserTurn.of("next monday"));

        assertThat(outcome.userInfo().name()).isNull();
    }

    @Test
    void newTimePreferenceOnCompleteInfoIsAChange() {
        UserInfo complete = new UserInfo("Olena", "olena@example.com", "tomorrow");

        QualificationService.QualificationOutcome changed = service.merge(complete,
                new UserTurn("friday instead", new ExtractedFields(null, null, "friday")));
        QualificationService.QualificationOutcome same = service.merge(complete,
                new UserTurn("tomorrow works", new ExtractedFields(null, null, "tomorrow works")));

        assertThat(changed.timePreferenceChanged()).isTrue();
        assertThat(changed.userInfo().timePreference()).isEqualTo("friday");
        assertThat(same.timePreferenceChanged()).isFalse();
    }

    @Test
    void nameAndEmailAreKeptOnceComplete() {
        UserInfo complete = new UserInfo("Olena", "olena@example.com", "tomorrow");

        QualificationService.QualificationOutcome outcome = service.merge(complete,
                new UserTurn("actually", new ExtractedFields("Taras", "taras@example.com", null)));

        assertThat(outcome.userInfo()).isEqualTo(complete);
    }
}
