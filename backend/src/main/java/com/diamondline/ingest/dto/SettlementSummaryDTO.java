package com.diamondline.ingest.dto;

public class SettlementSummaryDTO {
    private int checked;
    private int won;
    private int lost;
    private int push;
    private int voided;
    private int stillOpen;
    private int errors;
    private long durationMs;

    public SettlementSummaryDTO() {}

    public int settled() { return won + lost + push + voided; }

    public int getChecked() { return checked; }
    public void setChecked(int checked) { this.checked = checked; }
    public int getWon() { return won; }
    public void setWon(int won) { this.won = won; }
    public int getLost() { return lost; }
    public void setLost(int lost) { this.lost = lost; }
    public int getPush() { return push; }
    public void setPush(int push) { this.push = push; }
    public int getVoided() { return voided; }
    public void setVoided(int voided) { this.voided = voided; }
    public int getStillOpen() { return stillOpen; }
    public void setStillOpen(int stillOpen) { this.stillOpen = stillOpen; }
    public int getErrors() { return errors; }
    public void setErrors(int errors) { this.errors = errors; }
    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
}
