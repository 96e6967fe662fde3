package se.kth.patchmerge.merge;

import java.util.Objects;

/**
 * Immutable configuration of a merge.
 */
public class MergeConfig {
    private static final MergeConfig DEFAULT = builder().build();

    private final UnanchoredPolicy unanchoredPolicy;
    private final String matcherId;
    private final boolean includeComments;

    private MergeConfig(Builder builder) {
        this.unanchoredPolicy = builder.unanchoredPolicy;
        this.matcherId = builder.matcherId;
        this.includeComments = builder.includeComments;
    }

    public static MergeConfig defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public UnanchoredPolicy getUnanchoredPolicy() {
        return unanchoredPolicy;
    }

    /**
     * @return Id of the GumTree matcher to use, or null for the classic GumTree matcher.
     */
    public String getMatcherId() {
        return matcherId;
    }

    /**
     * @return Whether the parser should keep comments as tree nodes.
     */
    public boolean isIncludeComments() {
        return includeComments;
    }

    @Override
    public String toString() {
        return "MergeConfig{" +
                "unanchoredPolicy=" + unanchoredPolicy +
                ", matcherId=" + matcherId +
                ", includeComments=" + includeComments +
                '}';
    }

    public static class Builder {
        private UnanchoredPolicy unanchoredPolicy = UnanchoredPolicy.REPORT;
        private String matcherId = null;
        private boolean includeComments = false;

        private Builder() {
        }

        public Builder unanchoredPolicy(UnanchoredPolicy unanchoredPolicy) {
            this.unanchoredPolicy = Objects.requireNonNull(unanchoredPolicy);
            return this;
        }

        public Builder matcherId(String matcherId) {
            this.matcherId = matcherId;
            return this;
        }

        public Builder includeComments(boolean includeComments) {
            this.includeComments = includeComments;
            return this;
        }

        public MergeConfig build() {
            return new MergeConfig(this);
        }
    }
}
