package com.votesync.client.submission;

import com.votesync.common.exception.VoteFailureReason;
import com.votesync.common.exception.VoteSubmissionException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw vote submission failures into actionable, user-facing errors
 */
public final class VoteErrorClassifier {

    private static final Pattern REVERT_REASON = Pattern.compile("reverted with reason string [\"'](.+?)[\"']");
    private static final Pattern CUSTOM_ERROR = Pattern.compile("reverted with custom error [\"'](.+?)[\"']");

    private VoteErrorClassifier() {
    }

    public static VoteFailureReason classify(Throwable error) {
        if (error instanceof VoteSubmissionException) {
            return ((VoteSubmissionException) error).getReason();
        }
        String message = messageOf(error).toLowerCase(Locale.ROOT);

        if (message.contains("user rejected") || message.contains("user denied") || message.contains("action_rejected")) {
            return VoteFailureReason.USER_REJECTED;
        }
        if (message.contains("insufficient funds")) {
            return VoteFailureReason.INSUFFICIENT_FUNDS;
        }
        if (message.contains("already voted")) {
            return VoteFailureReason.ALREADY_VOTED;
        }
        if (message.contains("not active") || message.contains("voting closed") || message.contains("inactive")) {
            return VoteFailureReason.INACTIVE_PROPOSAL;
        }
        return VoteFailureReason.GENERIC_FAILURE;
    }

    /**
     * Normalized exception for a failed submission. Generic failures keep the ledger's revert
     * reason when one can be extracted.
     */
    public static VoteSubmissionException toException(Throwable error) {
        if (error instanceof VoteSubmissionException) {
            return (VoteSubmissionException) error;
        }
        VoteFailureReason reason = classify(error);
        if (reason != VoteFailureReason.GENERIC_FAILURE) {
            return new VoteSubmissionException(reason, reason.getUserMessage(), error);
        }
        return new VoteSubmissionException(reason, genericMessage(messageOf(error)), error);
    }

    static String genericMessage(String raw) {
        Matcher revert = REVERT_REASON.matcher(raw);
        if (revert.find()) {
            return "Smart contract reverted: " + revert.group(1);
        }
        Matcher custom = CUSTOM_ERROR.matcher(raw);
        if (custom.find()) {
            return "Smart contract error: " + custom.group(1);
        }
        if (raw.isBlank()) {
            return VoteFailureReason.GENERIC_FAILURE.getUserMessage();
        }
        return VoteFailureReason.GENERIC_FAILURE.getUserMessage() + ": " + raw;
    }

    private static String messageOf(Throwable error) {
        StringBuilder message = new StringBuilder();
        Throwable current = error;
        for (int depth = 0; current != null && depth < 5; depth++) {
            if (current.getMessage() != null) {
                if (message.length() > 0) {
                    message.append(" | ");
                }
                message.append(current.getMessage());
            }
            current = current.getCause();
        }
        return message.toString();
    }
}
