package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;

@Component
public class PitchNormalizer extends AbstractRecordNormalizer {

    static final double MIN_SPEED_MPH = 30.0;
    static final double MAX_SPEED_MPH = 110.0;
    static final int MAX_SPIN_RPM = 4000;

    public PitchNormalizer(IdentityResolver identityResolver, Clock clock) {
        super(identityResolver, clock);
    }

    @Override
    public RecordType supports() {
        return RecordType.PITCH;
    }

    @Override
    public List<NormalizedRecord> normalize(SourceRecord record) {
        PayloadReader r = PayloadReader.of(record.payload());
        String sequenceId = r.string("pitchSequenceId", "pitch_sequence_id", "playId", "play_id");
        if (sequenceId == null) {
            // feeds without play ids number pitches within the game
            sequenceId = r.requireString(GAME_KEYS) + "_" + r.requireInteger("pitchNumber", "pitch_number");
        }
        requireLength("pitchSequenceId", sequenceId, 64);
        String pitchType = requireLength("pitchType", r.string("pitchType", "pitch_type"), 8);
        String pitchResult = requireLength("pitchResult", r.string("pitchResult", "pitch_result", "callName", "call_name"), 64);
        String pitcherToken = r.requireString("pitcher", "pitcherId", "pitcher_id");
        String batterToken = r.string("batter", "batterId", "batter_id");
        Integer inning = requireRange("inning", r.integer("inning"), 1, 30);
        BigDecimal speed = requireRange("releaseSpeed", r.decimal("releaseSpeed", "release_speed", "startSpeed", "start_speed"), MIN_SPEED_MPH, MAX_SPEED_MPH);
        Integer spin = requireRange("spinRate", r.integer("spinRate", "spin_rate", "releaseSpinRate"), 0, MAX_SPIN_RPM);
        BigDecimal hitProbability = requireRange("hitProbability", r.decimal("hitProbability", "hit_probability", "xba"), 0.0, 1.0);

        String source = record.source();
        Long gameId = resolveGame(source, r);
        Long pitcherId = identityResolver.resolveOrRegisterPlayer(source, pitcherToken, r.string("pitcherName", "pitcher_name"), null);
        Long batterId = batterToken == null ? null
                : identityResolver.resolveOrRegisterPlayer(source, batterToken, r.string("batterName", "batter_name"), null);

        // scaled to the stored precision so a replay compares equal
        return List.of(new NormalizedPitch(gameId, sequenceId, pitcherId, batterId, inning,
                pitchType, scale(speed, 2), spin, pitchResult, scale(hitProbability, 4),
                source, observedAt(r)));
    }

    private static BigDecimal scale(BigDecimal v, int digits) {
        return v == null ? null : v.setScale(digits, RoundingMode.HALF_UP);
    }
}
