package com.boxcoxep.core.inference;

import com.boxcoxep.core.config.BoxCoxConfig;
import com.boxcoxep.core.config.BoxCoxConfigLoader;
import com.boxcoxep.core.factor.BoxCoxJacobianOperator;
import com.boxcoxep.core.factor.BoxCoxTransformOperator;
import com.boxcoxep.core.math.QuadratureSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OperatorRegistryFactory {

    private static final Logger logger = LoggerFactory.getLogger(OperatorRegistryFactory.class);

    public static FactorOperatorRegistry create() {
        return create(BoxCoxConfigLoader.load());
    }

    public static FactorOperatorRegistry create(BoxCoxConfig.ConfigRoot config) {
        QuadratureSettings quadrature = quadratureSettings(config);
        double jacobianMinVariance = jacobianMinVariance(config);
        logger.info("Creating Box-Cox operators with {} and jacobian minVariance={}", quadrature, jacobianMinVariance);
        return FactorOperatorRegistry.of(
                new BoxCoxTransformOperator(quadrature),
                new BoxCoxJacobianOperator(jacobianMinVariance));
    }

    public static QuadratureSettings quadratureSettings(BoxCoxConfig.ConfigRoot config) {
        BoxCoxConfig.QuadratureConfig q = (config != null) ? config.quadrature : null;
        if (q == null) {
            return QuadratureSettings.defaults();
        }
        try {
            return new QuadratureSettings(
                    q.truncationStdDevs != null ? q.truncationStdDevs : QuadratureSettings.DEFAULT_TRUNCATION_STD_DEVS,
                    q.steps != null ? q.steps : QuadratureSettings.DEFAULT_STEPS,
                    q.minVariance != null ? q.minVariance : QuadratureSettings.DEFAULT_MIN_VARIANCE,
                    q.pointMassVariance != null ? q.pointMassVariance
                            : QuadratureSettings.DEFAULT_POINT_MASS_VARIANCE,
                    q.fallbackMean != null ? q.fallbackMean : QuadratureSettings.DEFAULT_FALLBACK_MEAN,
                    q.fallbackVariance != null ? q.fallbackVariance : QuadratureSettings.DEFAULT_FALLBACK_VARIANCE,
                    q.precisionFloor != null ? q.precisionFloor : QuadratureSettings.DEFAULT_PRECISION_FLOOR);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid quadrature configuration ({}), defaulting to {}", e.getMessage(),
                    QuadratureSettings.defaults());
            return QuadratureSettings.defaults();
        }
    }

    public static double jacobianMinVariance(BoxCoxConfig.ConfigRoot config) {
        Double v = (config != null && config.jacobian != null) ? config.jacobian.minVariance : null;
        if (v == null) {
            return BoxCoxJacobianOperator.DEFAULT_MIN_VARIANCE;
        }
        if (!(v > 0.0) || v.isInfinite()) {
            logger.warn("Invalid jacobian minVariance {}, defaulting to {}", v,
                    BoxCoxJacobianOperator.DEFAULT_MIN_VARIANCE);
            return BoxCoxJacobianOperator.DEFAULT_MIN_VARIANCE;
        }
        return v;
    }
}
