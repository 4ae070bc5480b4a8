package com.jay.proforma.layer1_escalation;

import com.jay.proforma.BenchmarkScenario;
import com.jay.proforma.exception.ScheduleLookupException;
import com.jay.proforma.layer1_escalation.EscalationEngine.EscalationSeries;
import com.jay.proforma.model.PeriodSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EscalationEngineTest {

    private final EscalationEngine engine = new EscalationEngine();

    @Nested
    @DisplayName("Rent and expense conventions")
    class Conventions {

        @Test
        @DisplayName("Rent compounds monthly at rate / 12")
        void rentCompoundsMonthly() {
            PeriodSeries rent = engine.rentSeries(0.025, 25);

            assertThat(rent.get(0)).isEqualTo(1.0);
            assertThat(rent.get(1)).isCloseTo(1 + 0.025 / 12, within(1e-12));
            assertThat(rent.get(12)).isCloseTo(Math.pow(1 + 0.025 / 12, 12), within(1e-12));
        }

        @Test
        @DisplayName("Expense grows at the monthly root of the annual rate")
        void expenseGrowsAtMonthlyRoot() {
            PeriodSeries expense = engine.expenseSeries(0.025, 25);

            assertThat(expense.get(12)).isCloseTo(1.025, within(1e-12));
            assertThat(expense.get(24)).isCloseTo(1.025 * 1.025, within(1e-12));
        }

        @Test
        @DisplayName("Rent and expense factors diverge after 12 periods for a nonzero rate")
        void rentAndExpenseDiverge() {
            PeriodSeries rent = engine.rentSeries(0.025, 13);
            PeriodSeries expense = engine.expenseSeries(0.025, 13);

            assertThat(rent.get(12)).isGreaterThan(expense.get(12));
            assertThat(rent.get(12) - expense.get(12)).isGreaterThan(1e-4);
        }

        @Test
        @DisplayName("Zero growth leaves every factor at 1")
        void zeroGrowthIsFlat() {
            PeriodSeries rent = engine.rentSeries(0.0, 30);
            PeriodSeries expense = engine.expenseSeries(0.0, 30);

            for (int t = 0; t < 30; t++) {
                assertThat(rent.get(t)).isEqualTo(1.0);
                assertThat(expense.get(t)).isEqualTo(1.0);
            }
        }

        @Test
        @DisplayName("Post-stabilization rate applies only after the stabilization month")
        void postStabilizationRate() {
            PeriodSeries rent = engine.rentSeries(0.03, 0.01, 6, 13);

            assertThat(rent.get(6)).isCloseTo(Math.pow(1 + 0.03 / 12, 6), within(1e-12));
            assertThat(rent.get(7)).isCloseTo(rent.get(6) * (1 + 0.01 / 12), within(1e-12));
        }
    }

    @Nested
    @DisplayName("Property tax")
    class PropertyTax {

        @Test
        @DisplayName("Tax steps once every 12 periods after tax start")
        void taxSteps() {
            PeriodSeries tax = engine.propertyTaxSeries(0.025, 1, 40);

            for (int t = 0; t <= 12; t++) {
                assertThat(tax.get(t)).as("period %d", t).isEqualTo(1.0);
            }
            assertThat(tax.get(13)).isCloseTo(1.025, within(1e-12));
            assertThat(tax.get(24)).isCloseTo(1.025, within(1e-12));
            assertThat(tax.get(25)).isCloseTo(1.025 * 1.025, within(1e-12));
        }

        @Test
        @DisplayName("A later tax start delays the first step")
        void laterTaxStart() {
            PeriodSeries tax = engine.propertyTaxSeries(0.05, 6, 30);

            assertThat(tax.get(17)).isEqualTo(1.0);
            assertThat(tax.get(18)).isCloseTo(1.05, within(1e-12));
        }
    }

    @Test
    @DisplayName("Scenario projection covers the hold plus the forward year")
    void projectCoversForwardYear() {
        EscalationSeries series = engine.project(BenchmarkScenario.parameters());

        assertThat(series.rent().size()).isEqualTo(133);
        assertThat(series.expense().size()).isEqualTo(133);
        assertThat(series.propertyTax().size()).isEqualTo(133);
        assertThatThrownBy(() -> series.rent().get(133))
            .isInstanceOf(ScheduleLookupException.class);
    }
}
