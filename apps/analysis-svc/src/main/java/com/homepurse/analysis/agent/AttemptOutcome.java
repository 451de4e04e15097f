package com.homepurse.analysis.agent;

/**
 * Result of one attempt. Only {@link Accepted} ends the loop successfully; every rejection carries
 * the text that the repair prompt receives.
 */
public interface AttemptOutcome {

    boolean succeeded();

    /** Text passed to the repair prompt, null for {@link Accepted}. */
    String failureText();

    record Accepted(QueryResult result) implements AttemptOutcome {
        @Override
        public boolean succeeded() {
            return true;
        }

        @Override
        public String failureText() {
            return null;
        }
    }

    record RejectedGeneration(String reason) implements AttemptOutcome {
        @Override
        public boolean succeeded() {
            return false;
        }

        @Override
        public String failureText() {
            return "The model did not produce usable SQL: " + reason;
        }
    }

    record RejectedValidation(String reason) implements AttemptOutcome {
        @Override
        public boolean succeeded() {
            return false;
        }

        @Override
        public String failureText() {
            return reason;
        }
    }

    record RejectedExecution(String error) implements AttemptOutcome {
        @Override
        public boolean succeeded() {
            return false;
        }

        @Override
        public String failureText() {
            return error;
        }
    }
}
