package org.apache.nifi.controllers.vfs.attribute;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-kind instructions for which metadata a copy carries over.
 * <p>
 * A kind's policy is resolved in this order: the entry registered for the kind, then the fallback entry
 * for all unlisted kinds, then the kind's own {@link AttributeSet#isCopiedByDefault()}.
 * This class is immutable, and instances are created using the Builder pattern.
 */
public final class CopyAttributesSpec {

    /**
     * No entries and no fallback: every kind follows its own default.
     */
    public static final CopyAttributesSpec DEFAULT = builder().build();

    /**
     * Skips every kind.
     */
    public static final CopyAttributesSpec NONE = builder().otherwise(false).build();

    private final Map<AttributeKind<?>, AttributePolicy> policies;
    private final AttributePolicy fallback;

    private CopyAttributesSpec(Builder builder) {
        this.policies = Collections.unmodifiableMap(new HashMap<>(builder.policies));
        this.fallback = builder.fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the policy for one attribute set of the source file.
     *
     * @param source the source set
     * @return the policy to apply
     */
    public AttributePolicy resolve(AttributeSet source) {
        AttributePolicy policy = policies.get(source.getKind());
        if (policy != null) {
            return policy;
        }
        if (fallback != null) {
            return fallback;
        }
        return AttributePolicy.of(source.isCopiedByDefault());
    }

    public Map<AttributeKind<?>, AttributePolicy> getPolicies() {
        return policies;
    }

    /**
     * Gets the entry for unlisted kinds.
     *
     * @return the fallback, or null when unlisted kinds use their own default
     */
    public AttributePolicy getFallback() {
        return fallback;
    }

    /**
     * Builder class for CopyAttributesSpec.
     */
    public static class Builder {
        private final Map<AttributeKind<?>, AttributePolicy> policies = new HashMap<>();
        private AttributePolicy fallback;

        public Builder copy(AttributeKind<?> kind) {
            return policy(kind, AttributePolicy.ALWAYS);
        }

        public Builder skip(AttributeKind<?> kind) {
            return policy(kind, AttributePolicy.NEVER);
        }

        public Builder custom(AttributeKind<?> kind, AttributeTransfer transfer) {
            return policy(kind, AttributePolicy.custom(transfer));
        }

        public Builder policy(AttributeKind<?> kind, AttributePolicy policy) {
            policies.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(policy, "policy"));
            return this;
        }

        /**
         * Sets the entry applied to every kind without an entry of its own.
         */
        public Builder otherwise(boolean copy) {
            return otherwise(AttributePolicy.of(copy));
        }

        public Builder otherwise(AttributePolicy policy) {
            this.fallback = policy;
            return this;
        }

        public CopyAttributesSpec build() {
            return new CopyAttributesSpec(this);
        }
    }
}
