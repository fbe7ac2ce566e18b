package com.genderai.server.service;

import java.time.Instant;

/**
 * Result of evaluating one image. Exactly one of {@link Success},
 * {@link Rejected} or {@link Failure}; check {@link #getKind()} before casting.
 */
public abstract class PredictionOutcome {

    public enum Kind {
        SUCCESS,
        REJECTED,
        FAILURE
    }

    public enum RejectReason {
        NO_PERSON,
        MULTIPLE_PEOPLE
    }

    public enum FailureKind {
        INVALID_IMAGE,
        MODEL_UNAVAILABLE,
        INFERENCE_ERROR,
        BUSY,
        TIMEOUT,
        CANCELLED
    }

    private PredictionOutcome() {
    }

    public abstract Kind getKind();

    /**
     * Persons counted by the gate; 0 when the gate never ran.
     */
    public abstract int getPersonCount();

    public static Success success(String label, double confidence, double male, double female,
            boolean lowConfidence) {
        return new Success(label, confidence, 1, male, female, lowConfidence);
    }

    public static Rejected noPerson() {
        return new Rejected(RejectReason.NO_PERSON, 0);
    }

    public static Rejected multiplePeople(int personCount) {
        return new Rejected(RejectReason.MULTIPLE_PEOPLE, personCount);
    }

    public static Failure failure(FailureKind kind, String message) {
        return new Failure(kind, message, null);
    }

    public static Failure failure(FailureKind kind, String message, Instant retryAfter) {
        return new Failure(kind, message, retryAfter);
    }

    public static final class Success extends PredictionOutcome {
        private final String label;
        private final double confidence;
        private final int personCount;
        private final double male;
        private final double female;
        private final boolean lowConfidence;

        private Success(String label, double confidence, int personCount, double male, double female,
                boolean lowConfidence) {
            this.label = label;
            this.confidence = confidence;
            this.personCount = personCount;
            this.male = male;
            this.female = female;
            this.lowConfidence = lowConfidence;
        }

        @Override
        public Kind getKind() {
            return Kind.SUCCESS;
        }

        @Override
        public int getPersonCount() {
            return personCount;
        }

        public String getLabel() {
            return label;
        }

        public double getConfidence() {
            return confidence;
        }

        public double getMale() {
            return male;
        }

        public double getFemale() {
            return female;
        }

        /**
         * Presentation hint: the top probability is below the advisory threshold.
         */
        public boolean isLowConfidence() {
            return lowConfidence;
        }

        @Override
        public String toString() {
            return "Success{" + label + ", confidence=" + String.format("%.4f", confidence) + '}';
        }
    }

    public static final class Rejected extends PredictionOutcome {
        private final RejectReason reason;
        private final int personCount;

        private Rejected(RejectReason reason, int personCount) {
            this.reason = reason;
            this.personCount = personCount;
        }

        @Override
        public Kind getKind() {
            return Kind.REJECTED;
        }

        @Override
        public int getPersonCount() {
            return personCount;
        }

        public RejectReason getReason() {
            return reason;
        }

        public String getMessage() {
            if (reason == RejectReason.NO_PERSON) {
                return "No person detected";
            }
            return "Multiple people detected (" + personCount + " people). Please use single-person images.";
        }

        @Override
        public String toString() {
            return "Rejected{" + reason + ", personCount=" + personCount + '}';
        }
    }

    public static final class Failure extends PredictionOutcome {
        private final FailureKind failureKind;
        private final String message;
        private final Instant retryAfter;

        private Failure(FailureKind failureKind, String message, Instant retryAfter) {
            this.failureKind = failureKind;
            this.message = message;
            this.retryAfter = retryAfter;
        }

        @Override
        public Kind getKind() {
            return Kind.FAILURE;
        }

        @Override
        public int getPersonCount() {
            return 0;
        }

        public FailureKind getFailureKind() {
            return failureKind;
        }

        public String getMessage() {
            return message;
        }

        /**
         * When a retry is worth attempting; null if no hint applies.
         */
        public Instant getRetryAfter() {
            return retryAfter;
        }

        @Override
        public String toString() {
            return "Failure{" + failureKind + ", " + message + '}';
        }
    }
}
