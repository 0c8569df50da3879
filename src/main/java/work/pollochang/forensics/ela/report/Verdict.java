package work.pollochang.forensics.ela.report;

public enum Verdict {
    AUTHENTIC("可能未經編輯"),
    MANIPULATED("可能經過竄改");

    private final String description;
    Verdict(String description) { this.description = description; }
    public String getDescription() { return description; }
}
