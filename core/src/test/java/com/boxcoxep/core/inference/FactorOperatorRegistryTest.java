package com.boxcoxep.core.inference;

import com.boxcoxep.core.belief.Gaussian;
import com.boxcoxep.core.factor.BoxCoxJacobianOperator;
import com.boxcoxep.core.factor.BoxCoxTransformOperator;
import com.boxcoxep.core.factor.FactorArguments;
import com.boxcoxep.core.factor.FactorKind;
import com.boxcoxep.core.factor.Role;
import com.boxcoxep.core.math.BoxCoxMath;
import com.boxcoxep.core.math.InvalidObservationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class FactorOperatorRegistryTest {

    private final BoxCoxTransformOperator transform = new BoxCoxTransformOperator();
    private final BoxCoxJacobianOperator jacobian = new BoxCoxJacobianOperator();
    private final FactorOperatorRegistry registry = FactorOperatorRegistry.of(transform, jacobian);

    @Test
    public void testTransformDispatch() {
        Gaussian lambda = Gaussian.fromMeanAndVariance(0.0, 4.0);
        Gaussian output = Gaussian.fromMeanAndVariance(0.2, 0.5);
        FactorArguments args = FactorArguments.builder()
                .scalar(Role.OBSERVATION, 1.2)
                .belief(Role.LAMBDA, lambda)
                .belief(Role.OUTPUT, output)
                .build();

        assertEquals(transform.messageToOutput(1.2, lambda),
                registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, args));
        assertEquals(transform.messageToLambda(output, 1.2, lambda),
                registry.computeMessage(FactorKind.TRANSFORM, Role.LAMBDA, args));
        assertEquals(transform.logAverageFactor(output, 1.2, lambda),
                registry.computeLogEvidence(FactorKind.TRANSFORM, args));
    }

    @Test
    public void testPointMassLambdaThroughRegistry() {
        FactorArguments args = FactorArguments.builder()
                .scalar(Role.OBSERVATION, 2.0)
                .scalar(Role.LAMBDA, 0.5)
                .build();
        Gaussian message = registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, args);
        assertEquals(Gaussian.pointMass(BoxCoxMath.transform(2.0, 0.5)), message);
        // no output belief supplied: treated as uninformative
        assertEquals(0.0, registry.computeLogEvidence(FactorKind.TRANSFORM, args));
    }

    @Test
    public void testJacobianDispatch() {
        Gaussian lambda = Gaussian.fromMeanAndVariance(0.0, 1.0);
        FactorArguments args = FactorArguments.builder()
                .scalar(Role.OBSERVATION, 2.0)
                .belief(Role.LAMBDA, lambda)
                .build();

        Gaussian toLambda = registry.computeMessage(FactorKind.JACOBIAN, Role.LAMBDA, args);
        assertEquals(0.0, toLambda.getPrecision());
        assertEquals(2.0, toLambda.getMeanTimesPrecision());

        Gaussian toWeight = registry.computeMessage(FactorKind.JACOBIAN, Role.OUTPUT, args);
        assertEquals(1.0, toWeight.getMean(), 1e-12);
        assertEquals(0.0, registry.computeLogEvidence(FactorKind.JACOBIAN, args), 1e-15);
    }

    @Test
    public void testBeliefObservationCollapsesToMean() {
        Gaussian lambda = Gaussian.fromMeanAndVariance(0.1, 1.0);
        FactorArguments exact = FactorArguments.builder()
                .scalar(Role.OBSERVATION, 2.0)
                .belief(Role.LAMBDA, lambda)
                .build();
        FactorArguments soft = FactorArguments.builder()
                .belief(Role.OBSERVATION, Gaussian.fromMeanAndVariance(2.0, 0.25))
                .belief(Role.LAMBDA, lambda)
                .build();
        assertEquals(registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, exact),
                registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, soft));
    }

    @Test
    public void testUnsupportedRequestsRejected() {
        FactorArguments args = FactorArguments.builder()
                .scalar(Role.OBSERVATION, 2.0)
                .belief(Role.LAMBDA, Gaussian.fromMeanAndVariance(0.0, 1.0))
                .build();
        assertThrows(IllegalArgumentException.class,
                () -> registry.computeMessage(FactorKind.TRANSFORM, Role.OBSERVATION, args));
        assertThrows(IllegalArgumentException.class,
                () -> registry.computeMessage(FactorKind.JACOBIAN, Role.OBSERVATION, args));

        FactorArguments missingLambda = FactorArguments.builder().scalar(Role.OBSERVATION, 2.0).build();
        assertThrows(IllegalArgumentException.class,
                () -> registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, missingLambda));

        FactorArguments badObservation = FactorArguments.builder()
                .scalar(Role.OBSERVATION, -1.0)
                .belief(Role.LAMBDA, Gaussian.fromMeanAndVariance(0.0, 1.0))
                .build();
        assertThrows(InvalidObservationException.class,
                () -> registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, badObservation));
    }

    @Test
    public void testSupportedTargets() {
        assertEquals(EnumSet.of(Role.OUTPUT, Role.LAMBDA), EnumSet.copyOf(registry.targets(FactorKind.TRANSFORM)));
        assertEquals(EnumSet.of(Role.OUTPUT, Role.LAMBDA), EnumSet.copyOf(registry.targets(FactorKind.JACOBIAN)));
        assertTrue(registry.supports(FactorKind.JACOBIAN, Role.LAMBDA));
        assertFalse(registry.supports(FactorKind.TRANSFORM, Role.OBSERVATION));
    }

    @Test
    public void testCustomRegistration() {
        FactorOperatorRegistry custom = new FactorOperatorRegistry.Builder()
                .message(FactorKind.TRANSFORM, Role.OUTPUT, args -> Gaussian.pointMass(7.0))
                .build();
        FactorArguments args = FactorArguments.builder().scalar(Role.LAMBDA, 1.0).build();
        assertEquals(Gaussian.pointMass(7.0), custom.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, args));
        assertThrows(IllegalArgumentException.class, () -> custom.computeLogEvidence(FactorKind.TRANSFORM, args));
    }

    @Test
    public void testConcurrentCallsMatchSequentialResult() throws Exception {
        FactorArguments args = FactorArguments.builder()
                .scalar(Role.OBSERVATION, 3.5)
                .belief(Role.LAMBDA, Gaussian.fromMeanAndVariance(0.4, 1.5))
                .belief(Role.OUTPUT, Gaussian.fromMeanAndVariance(1.0, 0.25))
                .build();
        Gaussian expectedLambda = registry.computeMessage(FactorKind.TRANSFORM, Role.LAMBDA, args);
        Gaussian expectedOutput = registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, args);
        double expectedEvidence = registry.computeLogEvidence(FactorKind.TRANSFORM, args);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                futures.add(pool.submit(() -> expectedLambda
                        .equals(registry.computeMessage(FactorKind.TRANSFORM, Role.LAMBDA, args))
                        && expectedOutput.equals(registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, args))
                        && expectedEvidence == registry.computeLogEvidence(FactorKind.TRANSFORM, args)));
            }
            for (Future<Boolean> f : futures) {
                assertTrue(f.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testParallelSweepMatchesSequentialSweep() {
        List<FactorArguments> inputs = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            inputs.add(FactorArguments.builder()
                    .scalar(Role.OBSERVATION, 0.5 + 0.25 * i)
                    .belief(Role.LAMBDA, Gaussian.fromMeanAndVariance(-1.0 + 0.1 * i, 0.5))
                    .belief(Role.OUTPUT, Gaussian.fromMeanAndVariance(0.2, 1.0))
                    .build());
        }
        List<List<Object>> sequential = inputs.stream().map(this::evaluateAll).collect(Collectors.toList());
        List<List<Object>> parallel = inputs.parallelStream().map(this::evaluateAll).collect(Collectors.toList());
        assertEquals(sequential, parallel);
    }

    private List<Object> evaluateAll(FactorArguments args) {
        return Arrays.asList(
                registry.computeMessage(FactorKind.TRANSFORM, Role.OUTPUT, args),
                registry.computeMessage(FactorKind.TRANSFORM, Role.LAMBDA, args),
                registry.computeLogEvidence(FactorKind.TRANSFORM, args),
                registry.computeMessage(FactorKind.JACOBIAN, Role.LAMBDA, args),
                registry.computeMessage(FactorKind.JACOBIAN, Role.OUTPUT, args),
                registry.computeLogEvidence(FactorKind.JACOBIAN, args));
    }
}
