package work.pollochang.forensics.ela.report;

/**
 * @param verdict     判定結果
 * @param certainty   信心程度 (0-100)
 * @param description 判定說明
 */
public record Assessment(Verdict verdict, int certainty, String description) {
}
