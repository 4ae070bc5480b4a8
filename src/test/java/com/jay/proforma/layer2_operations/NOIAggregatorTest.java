package com.jay.proforma.layer2_operations;

import com.jay.proforma.BenchmarkScenario;
import com.jay.proforma.layer1_escalation.EscalationEngine;
import com.jay.proforma.layer1_escalation.EscalationEngine.EscalationSeries;
import com.jay.proforma.model.RunOptions;
import com.jay.proforma.model.ScenarioParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NOIAggregatorTest {

    private EscalationEngine escalation;
    private RentRollProjector rentRoll;
    private NOIAggregator aggregator;

    @BeforeEach
    void setUp() {
        escalation = new EscalationEngine();
        rentRoll = new RentRollProjector(escalation);
        aggregator = new NOIAggregator(rentRoll, new OperatingExpenseProjector());
    }

    private List<OperatingPeriod> run(ScenarioParameters p, RunOptions options) {
        EscalationSeries esc = escalation.project(p);
        return aggregator.aggregate(p, rentRoll.project(p, BenchmarkScenario.tenants(), esc), esc, options);
    }

    @Test
    @DisplayName("Benchmark NOI at months 1 and 120")
    void benchmarkNoi() {
        List<OperatingPeriod> ops = run(BenchmarkScenario.parameters(), RunOptions.defaults());

        assertThat(ops.get(0).getNoi()).isZero();
        assertThat(ops.get(1).getNoi()).isCloseTo(158_975.65, within(160.0));
        assertThat(ops.get(120).getNoi()).isCloseTo(247_802.71, within(250.0));
    }

    @Test
    @DisplayName("NOI is effective revenue less total expenses in every period")
    void noiIdentity() {
        List<OperatingPeriod> ops = run(BenchmarkScenario.parameters(), RunOptions.defaults());

        for (OperatingPeriod op : ops) {
            assertThat(op.getNoi()).isCloseTo(op.getEffectiveRevenue() - op.getTotalExpenses(), within(1e-6));
        }
    }

    @Test
    @DisplayName("Vacancy applies to potential revenue, collection loss to rental revenue only")
    void vacancyAndCollectionLoss() {
        ScenarioParameters p = BenchmarkScenario.parameters();
        p.setVacancyRate(0.05);
        p.setCollectionLossRate(0.01);
        p.setParkingStalls(10);
        p.setParkingRatePerStall(100);

        OperatingPeriod op = run(p, RunOptions.defaults()).get(1);

        assertThat(op.getVacancyLoss()).isCloseTo(-0.05 * op.getPotentialRevenue(), within(1e-6));
        double rental = op.getGrossRent() + op.getFreeRent() + op.getConcession();
        assertThat(op.getCollectionLoss()).isCloseTo(-0.01 * rental, within(1e-6));
    }

    @Test
    @DisplayName("Circular fee is charged on effective revenue including its own recovery")
    void circularToggleChangesNoi() {
        ScenarioParameters p = BenchmarkScenario.parameters();
        OperatingPeriod circular = run(p, new RunOptions(true, true, false, 0.10)).get(1);
        OperatingPeriod simple = run(p, new RunOptions(false, true, false, 0.10)).get(1);

        assertThat(circular.getManagementFee()).isGreaterThan(simple.getManagementFee());
        assertThat(circular.getVariableReimbursement()).isCloseTo(circular.getManagementFee(), within(1e-6));
        assertThat(circular.getManagementFee())
            .isCloseTo(0.04 * circular.getEffectiveRevenue(), within(1e-6));
    }
}
