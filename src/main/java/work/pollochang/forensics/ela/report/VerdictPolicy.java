package work.pollochang.forensics.ela.report;

/**
 * 依 ELA 統計判定圖片是否可能被竄改。
 *
 * <p>平均亮度超過門檻即判定為 {@link Verdict#MANIPULATED}，信心程度由平均值、
 * 標準差與高亮像素比例加權而成。</p>
 */
public class VerdictPolicy {

    private static final int BASE_CONFIDENCE = 50;

    private final double manipulationThreshold;

    public VerdictPolicy(double manipulationThreshold) {
        this.manipulationThreshold = manipulationThreshold;
    }

    public Assessment assess(ElaStatistics stats) {
        double meanFactor = Math.min(40.0, stats.mean() / 255.0 * 100.0);
        double stdFactor = Math.min(20.0, stats.standardDeviation() / 50.0 * 20.0);
        double varianceFactor = Math.min(20.0, stats.highVariancePercent() * 2.0);

        if (stats.mean() > manipulationThreshold) {
            int certainty = (int) Math.min(100.0, BASE_CONFIDENCE + meanFactor + stdFactor + varianceFactor);
            String description = String.format(
                    "ELA 出現明顯亮區 (平均: %.1f)，壓縮程度不一致；高變異區域佔 %.1f%%，可能經過竄改。",
                    stats.mean(), stats.highVariancePercent());
            return new Assessment(Verdict.MANIPULATED, certainty, description);
        }

        int certainty = (int) Math.max(30.0, 100.0 - meanFactor - stdFactor / 2 - varianceFactor / 2);
        String description = String.format(
                "ELA 整體壓縮程度一致 (平均: %.1f)，高變異區域佔 %.1f%%，可能未經編輯。",
                stats.mean(), stats.highVariancePercent());
        return new Assessment(Verdict.AUTHENTIC, certainty, description);
    }
}
