package com.boxcoxep.core.inference;

import com.boxcoxep.core.belief.Gaussian;
import com.boxcoxep.core.factor.FactorArguments;
import com.boxcoxep.core.factor.FactorKind;
import com.boxcoxep.core.factor.JacobianFactor;
import com.boxcoxep.core.factor.Role;
import com.boxcoxep.core.factor.TransformFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch table from (factor kind, target role) to the operator computing that message,
 * plus one evidence operator per factor kind. Built once and read-only afterwards.
 */
public class FactorOperatorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FactorOperatorRegistry.class);

    private final Map<FactorKind, Map<Role, MessageOperator>> messageOperators;
    private final Map<FactorKind, EvidenceOperator> evidenceOperators;

    private FactorOperatorRegistry(Map<FactorKind, Map<Role, MessageOperator>> messageOperators,
            Map<FactorKind, EvidenceOperator> evidenceOperators) {
        Map<FactorKind, Map<Role, MessageOperator>> copy = new EnumMap<>(FactorKind.class);
        for (Map.Entry<FactorKind, Map<Role, MessageOperator>> e : messageOperators.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableMap(new EnumMap<>(e.getValue())));
        }
        this.messageOperators = Collections.unmodifiableMap(copy);
        this.evidenceOperators = Collections.unmodifiableMap(new EnumMap<>(evidenceOperators));
    }

    /**
     * Registry wiring the two Box-Cox factors to the given operator implementations.
     */
    public static FactorOperatorRegistry of(TransformFactor transform, JacobianFactor jacobian) {
        Builder builder = new Builder();

        builder.message(FactorKind.TRANSFORM, Role.OUTPUT,
                args -> transform.messageToOutput(args.getScalar(Role.OBSERVATION), args.getBelief(Role.LAMBDA)));
        builder.message(FactorKind.TRANSFORM, Role.LAMBDA,
                args -> transform.messageToLambda(args.getBeliefOrUniform(Role.OUTPUT),
                        args.getScalar(Role.OBSERVATION), args.getBelief(Role.LAMBDA)));
        builder.evidence(FactorKind.TRANSFORM,
                args -> transform.logEvidenceRatio(args.getBeliefOrUniform(Role.OUTPUT),
                        args.getScalar(Role.OBSERVATION), args.getBelief(Role.LAMBDA)));

        builder.message(FactorKind.JACOBIAN, Role.LAMBDA,
                args -> jacobian.messageToLambda(args.getScalar(Role.OBSERVATION), args.getBelief(Role.LAMBDA)));
        builder.message(FactorKind.JACOBIAN, Role.OUTPUT,
                args -> jacobian.messageToWeight(args.getBelief(Role.LAMBDA), args.getScalar(Role.OBSERVATION)));
        builder.evidence(FactorKind.JACOBIAN,
                args -> jacobian.logEvidenceRatio(args.getScalar(Role.OBSERVATION), args.getBelief(Role.LAMBDA)));

        FactorOperatorRegistry registry = builder.build();
        logger.info("Operator registry built: {}", registry.describe());
        return registry;
    }

    public Gaussian computeMessage(FactorKind kind, Role target, FactorArguments args) {
        return lookup(kind, target).compute(args);
    }

    public double computeLogEvidence(FactorKind kind, FactorArguments args) {
        EvidenceOperator op = evidenceOperators.get(kind);
        if (op == null) {
            throw new IllegalArgumentException("No evidence operator registered for " + kind);
        }
        return op.logEvidence(args);
    }

    public boolean supports(FactorKind kind, Role target) {
        Map<Role, MessageOperator> byRole = messageOperators.get(kind);
        return byRole != null && byRole.containsKey(target);
    }

    public Set<Role> targets(FactorKind kind) {
        Map<Role, MessageOperator> byRole = messageOperators.get(kind);
        return byRole == null ? Collections.emptySet() : byRole.keySet();
    }

    private MessageOperator lookup(FactorKind kind, Role target) {
        Map<Role, MessageOperator> byRole = messageOperators.get(kind);
        MessageOperator op = byRole != null ? byRole.get(target) : null;
        if (op == null) {
            throw new IllegalArgumentException("No message operator registered for " + kind + " -> " + target);
        }
        return op;
    }

    private String describe() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<FactorKind, Map<Role, MessageOperator>> e : messageOperators.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append("->").append(e.getValue().keySet());
        }
        return sb.toString();
    }

    public static class Builder {
        private final Map<FactorKind, Map<Role, MessageOperator>> messageOperators = new EnumMap<>(FactorKind.class);
        private final Map<FactorKind, EvidenceOperator> evidenceOperators = new EnumMap<>(FactorKind.class);

        public Builder message(FactorKind kind, Role target, MessageOperator op) {
            MessageOperator previous = messageOperators
                    .computeIfAbsent(kind, k -> new EnumMap<>(Role.class))
                    .put(target, op);
            if (previous != null) {
                logger.warn("Replacing message operator for {} -> {}", kind, target);
            }
            return this;
        }

        public Builder evidence(FactorKind kind, EvidenceOperator op) {
            if (evidenceOperators.put(kind, op) != null) {
                logger.warn("Replacing evidence operator for {}", kind);
            }
            return this;
        }

        public FactorOperatorRegistry build() {
            return new FactorOperatorRegistry(messageOperators, evidenceOperators);
        }
    }
}
