package io.facsforge.transforms;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Logicle (biexponential) display transform for fluorescence channels.
 *
 * <h2>Definition</h2>
 *
 * <p>On display scale {@code x}, with {@code x1} the display position of data zero,
 * the inverse transform is
 *
 * <pre>{@code
 * S(x) = a·e^(b·x) − c·e^(−d·x) − f     for x >= x1
 * S(x) = −S(2·x1 − x)                    for x <  x1
 * }</pre>
 *
 * <p>which behaves like a logarithm for large values, is close to linear around zero
 * and extends smoothly into negative data. {@code toDisplay} inverts {@code S}.
 *
 * <h2>Solving</h2>
 *
 * <p>Given {@code (T, W, M, A)}, {@code b = (M + A)·ln 10} and {@code d} is the root of
 *
 * <pre>{@code
 * 2·(ln d − ln b) + w·(b + d) = 0,    w = W / (M + A)
 * }</pre>
 *
 * <p>on {@code (0, b]}. The equation has no closed form; the root is found with a
 * Newton step safeguarded by bisection, bounded to {@value #MAX_SOLVE_ITERATIONS}
 * iterations. {@code a, c, f} follow from {@code S(x1) = 0},
 * {@code S''(x1) = 0} and {@code S(1) = T}.
 *
 * <h2>Numerics</h2>
 *
 * <p>Near data zero the formal definition cancels badly, so {@code S} is evaluated
 * from a {@value #TAYLOR_LENGTH}-term Taylor series around {@code x1} within a quarter
 * of the linearization width. {@code toDisplay} uses Halley's method on {@code S},
 * which converges cubically from the linear or logarithmic initial guess.
 *
 * <p>Instances are immutable. Two transforms built from equal parameters hold
 * identical coefficients.
 */
public final class LogicleTransform implements ChannelTransform {
    private static final Logger logger = LogManager.getLogger(LogicleTransform.class);

    public static final String KIND = "logicle";

    static final int MAX_SOLVE_ITERATIONS = 100;
    static final int MAX_SCALE_ITERATIONS = 50;
    static final int TAYLOR_LENGTH = 16;
    private static final double LN_10 = Math.log(10.0);
    private static final double EPSILON = Math.ulp(1.0);

    private final LogicleParameters parameters;

    private final double w;
    private final double x0;
    private final double x1;
    private final double x2;

    private final double a;
    private final double b;
    private final double c;
    private final double d;
    private final double f;

    private final double xTaylor;
    private final double[] taylor;

    private LogicleTransform(LogicleParameters parameters) {
        this.parameters = parameters;
        double T = parameters.T();
        double W = parameters.W();
        double M = parameters.M();
        double A = parameters.A();

        w = W / (M + A);
        x2 = A / (M + A);
        x1 = x2 + w;
        x0 = x2 + 2 * w;
        b = (M + A) * LN_10;
        d = solve(b, w);

        double cA = Math.exp(x0 * (b + d));
        double mfA = Math.exp(b * x1) - cA / Math.exp(d * x1);
        a = T / ((Math.exp(b) - mfA) - cA / Math.exp(d));
        c = cA * a;
        f = -mfA * a;

        if (!(a > 0) || !Double.isFinite(a) || !Double.isFinite(c) || !Double.isFinite(f)) {
            throw new TransformParameterException(
                "Logicle parameters " + parameters + " do not produce a monotone scale "
                    + "(a=" + a + ", c=" + c + ", f=" + f + "); reduce W relative to M");
        }

        xTaylor = x1 + w / 4;
        taylor = new double[TAYLOR_LENGTH];
        double posCoef = a * Math.exp(b * x1);
        double negCoef = -c / Math.exp(d * x1);
        for (int i = 0; i < TAYLOR_LENGTH; i++) {
            posCoef *= b / (i + 1);
            negCoef *= -d / (i + 1);
            taylor[i] = posCoef + negCoef;
        }
        // the second-order term vanishes by construction
        taylor[1] = 0;

        logger.debug("Solved logicle {}: a={} b={} c={} d={} f={} x1={}", parameters, a, b, c, d, f, x1);
    }

    /**
     * Solves the coefficients for a parameter set.
     *
     * @param parameters validated logicle parameters
     * @return a ready-to-use transform
     * @throws TransformParameterException if the parameters cannot be solved into a monotone scale
     */
    public static LogicleTransform create(LogicleParameters parameters) {
        Objects.requireNonNull(parameters, "parameters");
        return new LogicleTransform(parameters);
    }

    /**
     * Convenience overload of {@link #create(LogicleParameters)}.
     */
    public static LogicleTransform create(double T, double W, double M, double A) {
        return create(new LogicleParameters(T, W, M, A));
    }

    /**
     * Finds d in (0, b] with 2·(ln d − ln b) + w·(b + d) = 0.
     */
    static double solve(double b, double w) {
        // w == 0 is the pure arcsinh case
        if (w == 0) {
            return b;
        }
        double tolerance = 2 * b * EPSILON;

        double dLo = 0;
        double dHi = b;
        double d = (dLo + dHi) / 2;
        double fB = -2 * Math.log(b) + w * b;
        double fd = 2 * Math.log(d) + w * d + fB;
        double lastF = Double.NaN;

        for (int i = 0; i < MAX_SOLVE_ITERATIONS; i++) {
            double df = 2 / d + w;
            double delta;
            boolean newtonLeavesBracket = ((d - dHi) * df - fd) * ((d - dLo) * df - fd) >= 0;
            boolean newtonTooSlow = Math.abs(1.9 * fd) > Math.abs(lastF * df);
            if (newtonLeavesBracket || newtonTooSlow) {
                delta = (dHi - dLo) / 2;
                d = dLo + delta;
                if (d == dLo) {
                    return d;
                }
            } else {
                delta = fd / df;
                double previous = d;
                d -= delta;
                if (d == previous) {
                    return d;
                }
            }
            if (Math.abs(delta) < tolerance) {
                return d;
            }
            fd = 2 * Math.log(d) + w * d + fB;
            if (fd == 0 || fd == lastF) {
                return d;
            }
            lastF = fd;
            if (fd < 0) {
                dLo = d;
            } else {
                dHi = d;
            }
        }
        throw new TransformParameterException("Logicle solver did not converge within "
            + MAX_SOLVE_ITERATIONS + " iterations for b=" + b + ", w=" + w);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public double toDisplay(double raw) {
        if (Double.isNaN(raw)) {
            return Double.NaN;
        }
        if (Double.isInfinite(raw)) {
            return raw;
        }
        if (raw == 0) {
            return x1;
        }
        boolean negative = raw < 0;
        double value = negative ? -raw : raw;

        double x;
        if (value < f) {
            x = x1 + value / taylor[0];
        } else {
            x = Math.log(value / a) / b;
        }

        double tolerance = 3 * EPSILON;
        if (x > 1) {
            tolerance = 3 * x * EPSILON;
        }

        for (int i = 0; i < MAX_SCALE_ITERATIONS; i++) {
            double ae2bx = a * Math.exp(b * x);
            double ce2mdx = c / Math.exp(d * x);
            double y;
            if (x < xTaylor) {
                y = seriesBiexponential(x) - value;
            } else {
                y = (ae2bx + f) - (ce2mdx + value);
            }
            double abe2bx = b * ae2bx;
            double cde2mdx = d * ce2mdx;
            double dy = abe2bx + cde2mdx;
            double ddy = b * abe2bx - d * cde2mdx;

            // Halley's method
            double delta = y / (dy * (1 - y * ddy / (2 * dy * dy)));
            x -= delta;
            if (Math.abs(delta) < tolerance) {
                return negative ? 2 * x1 - x : x;
            }
        }
        throw new ArithmeticException("Logicle toDisplay did not converge for raw value " + raw
            + " with " + parameters);
    }

    @Override
    public double toRaw(double display) {
        if (Double.isNaN(display) || Double.isInfinite(display)) {
            return display;
        }
        boolean negative = display < x1;
        double scale = negative ? 2 * x1 - display : display;

        double inverse;
        if (scale < xTaylor) {
            inverse = seriesBiexponential(scale);
        } else {
            inverse = (a * Math.exp(b * scale) + f) - c / Math.exp(d * scale);
        }
        return negative ? -inverse : inverse;
    }

    private double seriesBiexponential(double scale) {
        double x = scale - x1;
        // taylor[1] is zero, so the loop stops at index 2
        double sum = taylor[TAYLOR_LENGTH - 1] * x;
        for (int i = TAYLOR_LENGTH - 2; i >= 2; --i) {
            sum = (sum + taylor[i]) * x;
        }
        return (sum * x + taylor[0]) * x;
    }

    /**
     * @return the parameters this transform was solved from
     */
    public LogicleParameters getParameters() {
        return parameters;
    }

    /**
     * @return the display position of raw zero
     */
    public double getZeroDisplay() {
        return x1;
    }

    /**
     * @return the solved coefficients {@code [a, b, c, d, f]}
     */
    public double[] getCoefficients() {
        return new double[]{a, b, c, d, f};
    }

    /**
     * @return the raw value at display 0, the bottom of the plotted scale
     */
    public double getBottomOfScale() {
        return toRaw(0.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicleTransform)) return false;
        return parameters.equals(((LogicleTransform) o).parameters);
    }

    @Override
    public int hashCode() {
        return parameters.hashCode();
    }

    @Override
    public String toString() {
        return "logicle[T=" + parameters.T() + ", W=" + parameters.W() + ", M=" + parameters.M()
            + ", A=" + parameters.A() + "]";
    }
}
