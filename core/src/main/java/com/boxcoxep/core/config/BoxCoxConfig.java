package com.boxcoxep.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON shape of {@code boxcox_config.json}. Every field is optional; defaults are applied
 * where the values are consumed.
 */
public class BoxCoxConfig {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QuadratureConfig {
        public Double truncationStdDevs;
        public Integer steps; // rounded up to even
        public Double minVariance;
        public Double pointMassVariance;
        public Double fallbackMean;
        public Double fallbackVariance;
        public Double precisionFloor;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JacobianConfig {
        public Double minVariance;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfigRoot {
        public QuadratureConfig quadrature;
        public JacobianConfig jacobian;
    }
}
