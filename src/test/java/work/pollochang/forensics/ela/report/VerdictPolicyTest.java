package work.pollochang.forensics.ela.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerdictPolicyTest {

    private final VerdictPolicy policy = new VerdictPolicy(15.0);

    @Test
    void testBrightHeatmap_ShouldBeManipulated() {
        Assessment assessment = policy.assess(new ElaStatistics(20.0, 10.0, 5.0, 3.0));

        assertEquals(Verdict.MANIPULATED, assessment.verdict());
        // 50 + 7.84 + 4 + 10
        assertEquals(71, assessment.certainty());
        assertFalse(assessment.description().isBlank());
    }

    @Test
    void testDarkHeatmap_ShouldBeAuthentic() {
        Assessment assessment = policy.assess(new ElaStatistics(5.0, 5.0, 2.0, 1.0));

        assertEquals(Verdict.AUTHENTIC, assessment.verdict());
        // 100 - 1.96 - 1 - 2
        assertEquals(95, assessment.certainty());
    }

    @Test
    void testMeanAtThreshold_ShouldStillBeAuthentic() {
        assertEquals(Verdict.AUTHENTIC, policy.assess(new ElaStatistics(15.0, 0.0, 0.0, 0.0)).verdict());
    }

    @Test
    void testManipulatedCertainty_ShouldBeCappedAt100() {
        Assessment extreme = policy.assess(new ElaStatistics(200.0, 100.0, 50.0, 40.0));

        assertEquals(Verdict.MANIPULATED, extreme.verdict());
        assertEquals(100, extreme.certainty());
    }

    @Test
    void testAuthenticCertainty_ShouldBottomOutAt40() {
        // 各因子都到上限時為 100 - 40 - 10 - 10，下限 30 實際上不會用到
        Assessment lenient = new VerdictPolicy(250.0).assess(new ElaStatistics(200.0, 100.0, 50.0, 40.0));

        assertEquals(Verdict.AUTHENTIC, lenient.verdict());
        assertEquals(40, lenient.certainty());
    }
}
