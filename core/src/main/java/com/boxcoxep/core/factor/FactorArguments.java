package com.boxcoxep.core.factor;

import com.boxcoxep.core.belief.Beliefs;
import com.boxcoxep.core.belief.Gaussian;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Current beliefs of the variables around one factor instance, keyed by role.
 * Exact values are held as point masses; a belief read as a scalar collapses to its mean.
 */
public final class FactorArguments {

    private final Map<Role, Gaussian> beliefs;

    private FactorArguments(Map<Role, Gaussian> beliefs) {
        this.beliefs = Collections.unmodifiableMap(new EnumMap<>(beliefs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean has(Role role) {
        return beliefs.containsKey(role);
    }

    public Gaussian getBelief(Role role) {
        Gaussian belief = beliefs.get(role);
        if (belief == null) {
            throw new IllegalArgumentException("No argument bound to role " + role + " (have " + beliefs.keySet() + ")");
        }
        return belief;
    }

    /**
     * Belief for {@code role}, or uniform when the host did not supply one.
     */
    public Gaussian getBeliefOrUniform(Role role) {
        return beliefs.getOrDefault(role, Gaussian.uniform());
    }

    public double getScalar(Role role) {
        return Beliefs.meanOf(getBelief(role));
    }

    @Override
    public String toString() {
        return "FactorArguments" + beliefs;
    }

    public static final class Builder {
        private final Map<Role, Gaussian> beliefs = new EnumMap<>(Role.class);

        private Builder() {
        }

        public Builder belief(Role role, Gaussian belief) {
            if (belief == null) {
                throw new IllegalArgumentException("Belief for role " + role + " cannot be null");
            }
            beliefs.put(role, belief);
            return this;
        }

        public Builder scalar(Role role, double value) {
            beliefs.put(role, Gaussian.pointMass(value));
            return this;
        }

        public FactorArguments build() {
            return new FactorArguments(beliefs);
        }
    }
}
