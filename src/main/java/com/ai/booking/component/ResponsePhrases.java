package com.ai.booking.component;

import org.springframework.stereotype.Component;

@Component
public class ResponsePhrases {

    public String askName() {
        return "Sure, let's get you booked. What's your name?";
    }

    public String askEmail(String name) {
        return name != null
                ? "Thanks, " + name + ". What email should I send the invite to?"
                : "What email should I send the invite to?";
    }

    public String askTimePreference(String name) {
        return name != null
                ? "Got it, " + name + ". When would you like to meet? For example, tomorrow afternoon or Friday morning."
                : "When would you like to meet? For example, tomorrow afternoon or Friday morning.";
    }

    public String askNameAndEmail() {
        return "Happy to set that up. Could I have your name and email address?";
    }

    public String invalidName() {
        return "Sorry, I didn't get your name. Could you tell me again?";
    }

    public String invalidEmail(String value) {
        return "Hmm, \"" + value + "\" doesn't look like a valid email address. Could you check it?";
    }

    public String invalidTimePreference(String value) {
        return "I couldn't work out a time from \"" + value + "\". Could you say a day, like tomorrow or Monday, and maybe morning or afternoon?";
    }

    public String slotsIntro(boolean widened) {
        return widened
                ? "Nothing was free exactly then, so I looked a bit further. Here's what's available:"
                : "Here's what's available:";
    }

    public String pickSlot() {
        return "Which one works for you? Just say the number or the time.";
    }

    public String noAvailability(String preference) {
        return "Sorry, there's nothing free around " + preference + " or the next few working days. Is there another time that suits you?";
    }

    public String availabilityError() {
        return "I couldn't check the calendar just now. Please try again in a moment.";
    }

    public String staleSelection() {
        return "That one isn't in the list I gave you. The options are:";
    }

    public String confirmBookingPrompt(String name, String email, String slot) {
        return "Okay, booking a meeting for " + name + " (" + email + ") on " + slot + ". Shall I confirm it?";
    }

    public String confirmUnclear(String slot) {
        return "Should I book " + slot + "? Please say yes or no.";
    }

    public String bookingConfirmed(String slot, String email) {
        return "You're all set! The meeting is booked for " + slot + ". An invite is on its way to " + email + ".";
    }

    public String calendarLink(String link) {
        return "Calendar link: " + link;
    }

    public String slotTaken() {
        return "Sorry, that slot was just taken. Here are the times still free:";
    }

    public String retryOffer(String slot) {
        return "I couldn't reach the calendar to book " + slot + ". Want me to try again?";
    }

    public String bookingFailed() {
        return "Sorry, I couldn't complete the booking. Please try again later.";
    }

    public String bookingBlocked() {
        return "Sorry, booking isn't available right now. Please contact our team directly.";
    }

    public String goodbye() {
        return "No problem, I've stopped the booking. Have a good day!";
    }

    public String cannotAnswer() {
        return "I'm not sure about that one. I can book a meeting with our team if you'd like to ask them directly.";
    }
}
