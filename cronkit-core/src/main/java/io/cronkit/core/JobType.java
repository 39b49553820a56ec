package io.cronkit.core;

public enum JobType {
    SHELL {
        @Override
        public boolean requiresAgentExecutor() {
            return false;
        }
    },
    AGENT {
        @Override
        public boolean requiresAgentExecutor() {
            return true;
        }
    };

    public abstract boolean requiresAgentExecutor();
}
