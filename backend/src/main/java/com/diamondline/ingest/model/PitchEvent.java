package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "pitch_events", uniqueConstraints = {
        @UniqueConstraint(name = "uk_pitch_event", columnNames = {"game_id", "pitch_sequence_id"})
})
public class PitchEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "pitch_sequence_id", nullable = false, length = 64)
    private String pitchSequenceId;

    @Column(name = "pitcher_id", nullable = false)
    private Long pitcherId;

    @Column(name = "batter_id")
    private Long batterId;

    private Integer inning;

    @Column(name = "pitch_type", length = 8)
    private String pitchType;

    @Column(name = "release_speed", precision = 6, scale = 2)
    private BigDecimal releaseSpeed;

    @Column(name = "spin_rate")
    private Integer spinRate;

    @Column(name = "pitch_result", length = 64)
    private String pitchResult;

    @Column(name = "hit_probability", precision = 6, scale = 4)
    private BigDecimal hitProbability;

    @Column(length = 64)
    private String source;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    public PitchEvent() {}

    public PitchEvent(Long gameId, String pitchSequenceId) {
        this.gameId = gameId;
        this.pitchSequenceId = pitchSequenceId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public String getPitchSequenceId() { return pitchSequenceId; }
    public void setPitchSequenceId(String pitchSequenceId) { this.pitchSequenceId = pitchSequenceId; }
    public Long getPitcherId() { return pitcherId; }
    public void setPitcherId(Long pitcherId) { this.pitcherId = pitcherId; }
    public Long getBatterId() { return batterId; }
    public void setBatterId(Long batterId) { this.batterId = batterId; }
    public Integer getInning() { return inning; }
    public void setInning(Integer inning) { this.inning = inning; }
    public String getPitchType() { return pitchType; }
    public void setPitchType(String pitchType) { this.pitchType = pitchType; }
    public BigDecimal getReleaseSpeed() { return releaseSpeed; }
    public void setReleaseSpeed(BigDecimal releaseSpeed) { this.releaseSpeed = releaseSpeed; }
    public Integer getSpinRate() { return spinRate; }
    public void setSpinRate(Integer spinRate) { this.spinRate = spinRate; }
    public String getPitchResult() { return pitchResult; }
    public void setPitchResult(String pitchResult) { this.pitchResult = pitchResult; }
    public BigDecimal getHitProbability() { return hitProbability; }
    public void setHitProbability(BigDecimal hitProbability) { this.hitProbability = hitProbability; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Instant getObservedAt() { return observedAt; }
    public void setObservedAt(Instant observedAt) { this.observedAt = observedAt; }
}
