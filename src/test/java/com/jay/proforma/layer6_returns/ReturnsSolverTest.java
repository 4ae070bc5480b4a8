package com.jay.proforma.layer6_returns;

import com.jay.proforma.config.ModelConfig;
import com.jay.proforma.exception.ConvergenceException;
import com.jay.proforma.exception.DegenerateCashFlowException;
import com.jay.proforma.exception.ScenarioValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ReturnsSolverTest {

    private final ReturnsSolver solver = new ReturnsSolver(new ModelConfig());

    @Nested
    @DisplayName("IRR")
    class Irr {

        @Test
        @DisplayName("XIRR of a one-year doubling is 100%")
        void xirrDoubling() {
            List<LocalDate> dates = List.of(LocalDate.of(2025, 1, 1), LocalDate.of(2026, 1, 1));

            assertThat(solver.xirr(new double[]{-1_000, 2_000}, dates)).isCloseTo(1.0, within(1e-6));
        }

        @Test
        @DisplayName("XIRR discounts by actual days over 365")
        void xirrKnownRate() {
            List<LocalDate> dates = List.of(
                LocalDate.of(2025, 1, 1), LocalDate.of(2025, 7, 1), LocalDate.of(2026, 1, 1));
            double rate = 0.08;
            double second = 50 * Math.pow(1 + rate, 181 / 365.0);
            double third = 1_000 * Math.pow(1 + rate, 365 / 365.0);
            double[] mixed = {-1_050, second, third};

            double irr = solver.xirr(mixed, dates);

            assertThat(irr).isCloseTo(rate, within(1e-6));
            assertThat(solver.xnpv(irr, mixed, dates)).isCloseTo(0.0, within(1e-4));
        }

        @Test
        @DisplayName("Periodic IRR is annualized as (1 + r)^12 − 1")
        void periodicAnnualized() {
            double monthly = 0.01;
            double[] cf = new double[13];
            cf[0] = -1_000;
            cf[12] = 1_000 * Math.pow(1 + monthly, 12);

            assertThat(solver.periodicIrr(cf)).isCloseTo(monthly, within(1e-8));
            assertThat(solver.annualizedIrr(cf)).isCloseTo(Math.pow(1.01, 12) - 1, within(1e-7));
        }

        @Test
        @DisplayName("A far-off guess whose Newton step overshoots the bracket still converges by bisection")
        void farGuessConverges() {
            List<LocalDate> dates = List.of(LocalDate.of(2025, 1, 1), LocalDate.of(2026, 1, 1));

            assertThat(solver.xirr(new double[]{-1_000, 1_100}, dates, 5.0)).isCloseTo(0.10, within(1e-6));
        }

        @Test
        @DisplayName("Single-sign series fail as degenerate instead of returning a rate")
        void singleSignIsDegenerate() {
            assertThatThrownBy(() -> solver.periodicIrr(new double[]{100, 100, 100}))
                .isInstanceOf(DegenerateCashFlowException.class);
            assertThatThrownBy(() -> solver.periodicIrr(new double[]{-100, -100}))
                .isInstanceOf(DegenerateCashFlowException.class);
            assertThatThrownBy(() -> solver.periodicIrr(new double[]{0, 0, 0}))
                .isInstanceOf(DegenerateCashFlowException.class);
        }

        @Test
        @DisplayName("Fewer than two flows are degenerate")
        void tooShort() {
            assertThatThrownBy(() -> solver.periodicIrr(new double[]{-100}))
                .isInstanceOf(DegenerateCashFlowException.class);
            assertThatThrownBy(() -> solver.periodicIrr(new double[0]))
                .isInstanceOf(DegenerateCashFlowException.class);
        }

        @Test
        @DisplayName("A root outside the bisection bracket is a convergence failure")
        void noRootInBracket() {
            ModelConfig config = new ModelConfig();
            config.solver().setMaxIterations(1);
            config.solver().setBisectionHigh(0.5);
            ReturnsSolver narrow = new ReturnsSolver(config);

            assertThatThrownBy(() -> narrow.periodicIrr(new double[]{-1, 10}))
                .isInstanceOf(ConvergenceException.class);
        }

        @Test
        @DisplayName("A root below the bracket fails instead of returning the lower bound")
        void rootBelowBracket() {
            // true root is -0.995; NPV at -0.99 is -50
            assertThatThrownBy(() -> solver.periodicIrr(new double[]{-100, 0.5}))
                .isInstanceOf(ConvergenceException.class);
        }

        @Test
        @DisplayName("XIRR needs one date per cash flow")
        void xirrDateMismatch() {
            List<LocalDate> dates = List.of(LocalDate.of(2025, 1, 1));

            assertThatThrownBy(() -> solver.xirr(new double[]{-1_000, 1_100}, dates))
                .isInstanceOf(ScenarioValidationException.class)
                .hasMessageContaining("one date per cash flow");
        }
    }

    @Nested
    @DisplayName("Closed-form measures")
    class ClosedForm {

        private final double[] cf = {-1_000, 100, 100, 1_100};

        @Test
        @DisplayName("Multiple is inflows over outflows and profit is the sum")
        void multipleAndProfit() {
            assertThat(solver.multiple(cf)).isCloseTo(1.3, within(1e-12));
            assertThat(solver.profit(cf)).isCloseTo(300, within(1e-12));
            assertThat(solver.invested(cf)).isCloseTo(1_000, within(1e-12));
        }

        @Test
        @DisplayName("NPV at the IRR is zero and period 0 is undiscounted")
        void npv() {
            assertThat(solver.npv(0.10, cf)).isCloseTo(0.0, within(1e-9));
            assertThat(solver.npv(0.0, cf)).isCloseTo(300, within(1e-9));
        }

        @Test
        @DisplayName("Cash-on-cash needs equity")
        void cashOnCash() {
            assertThat(solver.cashOnCash(80, 1_000)).isCloseTo(0.08, within(1e-12));
            assertThatThrownBy(() -> solver.cashOnCash(80, 0))
                .isInstanceOf(DegenerateCashFlowException.class);
        }

        @Test
        @DisplayName("Multiple without an outflow is degenerate")
        void multipleWithoutOutflow() {
            assertThatThrownBy(() -> solver.multiple(new double[]{100, 200}))
                .isInstanceOf(DegenerateCashFlowException.class);
        }
    }
}
