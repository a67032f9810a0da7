package com.complexity.inferrer.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of analyzing one snippet: either a {@link Success} with time and
 * space labels and their justification notes, or a {@link ParseFailure}
 * carrying the front end's diagnostic.
 */
public abstract class ClassificationResult {

    private ClassificationResult() {
    }

    public abstract boolean isSuccess();

    public static Success success(ComplexityLabel timeLabel, ComplexityLabel spaceLabel,
                                  List<String> timeNotes, List<String> spaceNotes,
                                  SignalSummary signals) {
        return new Success(timeLabel, spaceLabel, timeNotes, spaceNotes, signals);
    }

    public static ParseFailure parseFailure(String message) {
        return new ParseFailure(message);
    }

    /**
     * A completed classification.
     */
    public static final class Success extends ClassificationResult {
        private final ComplexityLabel timeLabel;
        private final ComplexityLabel spaceLabel;
        private final List<String> timeNotes;
        private final List<String> spaceNotes;
        private final SignalSummary signals;

        private Success(ComplexityLabel timeLabel, ComplexityLabel spaceLabel,
                        List<String> timeNotes, List<String> spaceNotes, SignalSummary signals) {
            this.timeLabel = Objects.requireNonNull(timeLabel, "timeLabel");
            this.spaceLabel = Objects.requireNonNull(spaceLabel, "spaceLabel");
            this.timeNotes = List.copyOf(timeNotes);
            this.spaceNotes = List.copyOf(spaceNotes);
            this.signals = Objects.requireNonNull(signals, "signals");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        public ComplexityLabel getTimeLabel() {
            return timeLabel;
        }

        public ComplexityLabel getSpaceLabel() {
            return spaceLabel;
        }

        public List<String> getTimeNotes() {
            return timeNotes;
        }

        public List<String> getSpaceNotes() {
            return spaceNotes;
        }

        public SignalSummary getSignals() {
            return signals;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Success)) return false;
            Success that = (Success) o;
            return timeLabel.equals(that.timeLabel) && spaceLabel.equals(that.spaceLabel)
                    && timeNotes.equals(that.timeNotes) && spaceNotes.equals(that.spaceNotes)
                    && signals.equals(that.signals);
        }

        @Override
        public int hashCode() {
            return Objects.hash(timeLabel, spaceLabel, timeNotes, spaceNotes, signals);
        }

        @Override
        public String toString() {
            return "time=" + timeLabel + ", space=" + spaceLabel;
        }
    }

    /**
     * The snippet could not be parsed; the engine never ran.
     */
    public static final class ParseFailure extends ClassificationResult {
        private final String message;

        private ParseFailure(String message) {
            this.message = Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ParseFailure)) return false;
            return message.equals(((ParseFailure) o).message);
        }

        @Override
        public int hashCode() {
            return message.hashCode();
        }

        @Override
        public String toString() {
            return "parse error: " + message;
        }
    }
}
