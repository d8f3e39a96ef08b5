package com.optionsanalytics.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.optionsanalytics.core.processor.StandardNormal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StandardNormal against tabulated values of the standard normal distribution.
 */
class StandardNormalTest {

    private final StandardNormal normal = new StandardNormal();

    @Nested
    @DisplayName("CDF")
    class Cdf {

        @Test
        @DisplayName("Reference values to 1e-7")
        void referenceValues() {
            assertThat(normal.cdf(0.0)).isCloseTo(0.5, within(1e-12));
            assertThat(normal.cdf(1.96)).isCloseTo(0.9750021048517795, within(1e-7));
            assertThat(normal.cdf(-1.0)).isCloseTo(0.15865525393145707, within(1e-7));
            assertThat(normal.cdf(2.5)).isCloseTo(0.9937903346742238, within(1e-7));
        }

        @Test
        @DisplayName("Symmetric: N(x) + N(-x) = 1")
        void symmetric() {
            for (double x = -8.0; x <= 8.0; x += 0.25) {
                assertThat(normal.cdf(x) + normal.cdf(-x)).isCloseTo(1.0, within(1e-12));
            }
        }

        @Test
        @DisplayName("Monotonic non-decreasing over [-8, 8]")
        void monotonic() {
            double previous = normal.cdf(-8.0);
            for (double x = -7.9; x <= 8.0; x += 0.1) {
                double current = normal.cdf(x);
                assertThat(current).isGreaterThanOrEqualTo(previous);
                previous = current;
            }
        }

        @Test
        @DisplayName("Saturates beyond |x| = 8")
        void saturates() {
            assertThat(normal.cdf(8.5)).isEqualTo(1.0);
            assertThat(normal.cdf(-8.5)).isEqualTo(0.0);
            assertThat(normal.cdf(Double.POSITIVE_INFINITY)).isEqualTo(1.0);
            assertThat(normal.cdf(Double.NEGATIVE_INFINITY)).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("PDF")
    class Pdf {

        @Test
        @DisplayName("Peak at zero is 1/sqrt(2*pi)")
        void peak() {
            assertThat(normal.pdf(0.0)).isCloseTo(1.0 / Math.sqrt(2 * Math.PI), within(1e-12));
        }

        @Test
        @DisplayName("Non-negative and symmetric")
        void nonNegativeSymmetric() {
            for (double x = -10.0; x <= 10.0; x += 0.5) {
                assertThat(normal.pdf(x)).isGreaterThanOrEqualTo(0.0);
                assertThat(normal.pdf(x)).isCloseTo(normal.pdf(-x), within(1e-15));
            }
        }
    }
}
