package io.trigger4j.core;

public enum JobState {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    FIRING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
