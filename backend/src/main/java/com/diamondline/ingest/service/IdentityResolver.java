package com.diamondline.ingest.service;

import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.exception.UnresolvedAliasException;
import com.diamondline.ingest.model.AliasResolutionAudit;
import com.diamondline.ingest.model.EntityAlias;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.model.GameRecord;
import com.diamondline.ingest.model.Player;
import com.diamondline.ingest.model.ResolutionMethod;
import com.diamondline.ingest.model.Team;
import com.diamondline.ingest.repository.AliasResolutionAuditRepository;
import com.diamondline.ingest.repository.EntityAliasRepository;
import com.diamondline.ingest.repository.GameRecordRepository;
import com.diamondline.ingest.repository.PlayerRepository;
import com.diamondline.ingest.repository.TeamRepository;
import com.diamondline.ingest.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Maps source-scoped tokens to canonical team, player and game ids.
 *
 * <p>Resolution order is fixed: exact alias, then deterministic normalization (case and
 * punctuation folding, the abbreviation table, canonical names), then for players only a
 * bounded edit-distance match. Every non-exact success is stored as a new alias for the
 * source, so the next lookup of the same token is exact, and is written to the audit table.
 *
 * <p>Reads go through a concurrent cache and never block. Learning a new alias is
 * serialized per (source, kind, token) on a fixed set of lock stripes and committed in its
 * own transaction, so a unit that later rolls back never takes a learned alias with it.
 */
@Service
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final int MAX_SOURCE_LENGTH = 64;
    static final int MAX_ALIAS_LENGTH = 191;
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_ABBREVIATION_LENGTH = 32;
    private static final int LOCK_STRIPES = 64;

    private final EntityAliasRepository aliasRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final GameRecordRepository gameRepository;
    private final AliasResolutionAuditRepository auditRepository;
    private final AbbreviationTable abbreviations;
    private final TransactionTemplate requiresNew;
    private final int fuzzyThreshold;
    private final Set<String> authoritativeSources;

    private final ConcurrentHashMap<AliasKey, Long> aliasCache = new ConcurrentHashMap<>();
    private final Object[] learningLocks = new Object[LOCK_STRIPES];

    public IdentityResolver(EntityAliasRepository aliasRepository,
                            TeamRepository teamRepository,
                            PlayerRepository playerRepository,
                            GameRecordRepository gameRepository,
                            AliasResolutionAuditRepository auditRepository,
                            AbbreviationTable abbreviations,
                            PlatformTransactionManager transactionManager,
                            @Value("${diamondline.identity.fuzzy-threshold:2}") int fuzzyThreshold,
                            @Value("${diamondline.identity.authoritative-sources:mlb}") String[] authoritativeSources) {
        this.aliasRepository = aliasRepository;
        this.teamRepository = teamRepository;
        this.playerRepository = playerRepository;
        this.gameRepository = gameRepository;
        this.auditRepository = auditRepository;
        this.abbreviations = abbreviations;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.fuzzyThreshold = fuzzyThreshold;
        this.authoritativeSources = Arrays.stream(authoritativeSources)
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        for (int i = 0; i < learningLocks.length; i++) {
            learningLocks[i] = new Object();
        }
    }

    public Long resolve(String source, EntityKind kind, String rawToken) {
        return resolve(source, kind, rawToken, null);
    }

    /**
     * @param teamContext canonical team the token was seen with, used to break ties between
     *                    equally good player matches; may be null
     * @throws UnresolvedAliasException when no alias exists and no heuristic is confident
     */
    public Long resolve(String source, EntityKind kind, String rawToken, Long teamContext) {
        AliasKey key = keyOf(source, kind, rawToken);
        Long exact = exactMatch(key);
        if (exact != null) return exact;

        Optional<Match> heuristic = heuristicMatch(key, teamContext);
        if (heuristic.isPresent()) {
            Match m = heuristic.get();
            return learn(key, () -> m);
        }
        log.warn("[Identity][Unresolved] source={}, kind={}, token='{}'", source, kind, key.alias());
        throw new UnresolvedAliasException(source, kind, key.alias());
    }

    /** Exact alias lookup only: no heuristics, no learning, no audit. */
    public Optional<Long> lookup(String source, EntityKind kind, String rawToken) {
        if (source == null || source.isBlank() || rawToken == null || rawToken.isBlank()) return Optional.empty();
        return Optional.ofNullable(exactMatch(keyOf(source, kind, rawToken)));
    }

    public boolean isAuthoritative(String source) {
        return source != null && authoritativeSources.contains(source.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Authoritative sources introduce teams: an unseen token is linked to the team with the
     * same canonical abbreviation or creates it. Other sources can only resolve.
     */
    public Long resolveOrRegisterTeam(String source, String rawToken, String displayName) {
        if (!isAuthoritative(source)) return resolve(source, EntityKind.TEAM, rawToken);
        AliasKey key = keyOf(source, EntityKind.TEAM, rawToken);
        Long exact = exactMatch(key);
        if (exact != null) return exact;

        String abbreviation = abbreviations.canonical(key.alias()).orElse(NameNormalizer.normalizeToken(key.alias()));
        requireLength("team", abbreviation, MAX_ABBREVIATION_LENGTH);
        String name = requireLength("teamName", (displayName == null || displayName.isBlank()) ? key.alias() : displayName.trim(), MAX_NAME_LENGTH);
        return learn(key, () -> teamRepository.findByAbbreviation(abbreviation)
                .map(t -> new Match(t.getId(), ResolutionMethod.ABBREVIATION, "linked to team " + abbreviation))
                .orElseGet(() -> new Match(teamRepository.save(new Team(abbreviation, name)).getId(),
                        ResolutionMethod.REGISTERED, "new team " + abbreviation)));
    }

    /** Authoritative player tokens are source ids; an unseen one creates a player. */
    public Long resolveOrRegisterPlayer(String source, String rawToken, String fullName, Long teamId) {
        if (!isAuthoritative(source)) {
            String token = (fullName == null || fullName.isBlank()) ? rawToken : fullName;
            return resolve(source, EntityKind.PLAYER, token, teamId);
        }
        AliasKey key = keyOf(source, EntityKind.PLAYER, rawToken);
        Long exact = exactMatch(key);
        if (exact != null) return exact;

        String name = requireLength("playerName", (fullName == null || fullName.isBlank()) ? key.alias() : fullName.trim(), MAX_NAME_LENGTH);
        return learn(key, () -> {
            Player p = new Player(name, teamId);
            p.setLastSeenAt(Instant.now());
            return new Match(playerRepository.save(p).getId(), ResolutionMethod.REGISTERED, "new player " + name);
        });
    }

    /**
     * Resolves a game token. A non-authoritative source falls back to the single game on the
     * (date, home, away) key, narrowed by game number when it has one. An authoritative source
     * claims the first game on that key it has no token for yet, or creates the game as an
     * unloaded shell row, so a second token on the same matchup and date is a second game.
     */
    public Long resolveOrRegisterGame(String source, String rawToken, LocalDate officialDate,
                                      Long homeTeamId, Long awayTeamId, Integer gameNumber) {
        AliasKey key = keyOf(source, EntityKind.GAME, rawToken);
        Long exact = exactMatch(key);
        if (exact != null) return exact;

        if (!isAuthoritative(source)) {
            List<GameRecord> candidates = gamesOnMatchup(officialDate, homeTeamId, awayTeamId).stream()
                    .filter(g -> gameNumber == null || gameNumber.equals(g.getGameNumber()))
                    .collect(Collectors.toList());
            if (candidates.size() == 1) {
                Long id = candidates.get(0).getId();
                return learn(key, () -> new Match(id, ResolutionMethod.NORMALIZED, "matched on date and teams " + officialDate));
            }
            log.warn("[Identity][Unresolved] source={}, kind=GAME, token='{}', date={}, candidates={}", source, key.alias(), officialDate, candidates.size());
            throw new UnresolvedAliasException(source, EntityKind.GAME, key.alias());
        }
        return learn(key, () -> claimOrCreateGame(key, officialDate, homeTeamId, awayTeamId, gameNumber));
    }

    private Match claimOrCreateGame(AliasKey key, LocalDate officialDate, Long homeTeamId, Long awayTeamId, Integer gameNumber) {
        List<GameRecord> sameMatchup = gamesOnMatchup(officialDate, homeTeamId, awayTeamId);
        for (GameRecord g : sameMatchup) {
            if (gameNumber != null && !gameNumber.equals(g.getGameNumber())) continue;
            if (!aliasRepository.existsBySourceAndKindAndCanonicalId(key.source(), EntityKind.GAME, g.getId())) {
                return new Match(g.getId(), ResolutionMethod.NORMALIZED, "matched on date and teams " + officialDate + " #" + g.getGameNumber());
            }
            if (gameNumber != null) {
                throw new RecordValidationException("gameNumber", "game " + gameNumber + " on " + officialDate + " already has another id from " + key.source());
            }
        }
        int number = gameNumber != null ? gameNumber
                : sameMatchup.stream().mapToInt(GameRecord::getGameNumber).max().orElse(0) + 1;
        Long id = gameRepository.save(new GameRecord(officialDate, homeTeamId, awayTeamId, number)).getId();
        return new Match(id, ResolutionMethod.REGISTERED, "new game " + officialDate + " #" + number);
    }

    private List<GameRecord> gamesOnMatchup(LocalDate officialDate, Long homeTeamId, Long awayTeamId) {
        return gameRepository.findAllByOfficialDateAndHomeTeamIdAndAwayTeamIdOrderByGameNumberAsc(officialDate, homeTeamId, awayTeamId);
    }

    /** The single game a team plays on a date; doubleheaders need the game number. */
    public Long resolveGameByTeam(String source, LocalDate officialDate, Long teamId, Integer gameNumber) {
        List<GameRecord> games = gameRepository.findAllByOfficialDateAndHomeTeamIdOrOfficialDateAndAwayTeamId(officialDate, teamId, officialDate, teamId)
                .stream()
                .filter(g -> gameNumber == null || gameNumber.equals(g.getGameNumber()))
                .collect(Collectors.toList());
        if (games.size() == 1) return games.get(0).getId();
        String token = officialDate + "/" + teamId + (gameNumber == null ? "" : "/" + gameNumber);
        log.warn("[Identity][Unresolved] source={}, kind=GAME, token='{}', candidates={}", source, token, games.size());
        throw new UnresolvedAliasException(source, EntityKind.GAME, token);
    }

    /** Drops the in-memory alias snapshot; the next lookups read through to the store. */
    public void reload() {
        aliasCache.clear();
        log.info("[Identity][Cache] alias cache cleared");
    }

    private Long exactMatch(AliasKey key) {
        Long cached = aliasCache.get(key);
        if (cached != null) return cached;
        Optional<EntityAlias> stored = aliasRepository.findBySourceAndKindAndAlias(key.source(), key.kind(), key.alias());
        if (stored.isEmpty()) return null;
        Long id = stored.get().getCanonicalId();
        aliasCache.put(key, id);
        return id;
    }

    private Optional<Match> heuristicMatch(AliasKey key, Long teamContext) {
        if (key.kind() == EntityKind.GAME) return Optional.empty();
        String normalized = normalizedKey(key.kind(), key.alias());
        if (normalized.isEmpty()) return Optional.empty();

        Optional<Long> sameSource = uniqueCanonical(aliasRepository.findAllBySourceAndKindAndNormalizedAlias(key.source(), key.kind(), normalized));
        if (sameSource.isPresent()) {
            return Optional.of(new Match(sameSource.get(), ResolutionMethod.NORMALIZED, "normalized=" + normalized));
        }
        if (key.kind() == EntityKind.TEAM) {
            Optional<Long> anySource = uniqueCanonical(aliasRepository.findAllByKindAndNormalizedAlias(EntityKind.TEAM, normalized));
            if (anySource.isPresent()) {
                return Optional.of(new Match(anySource.get(), ResolutionMethod.NORMALIZED, "normalized=" + normalized));
            }
            return matchTeam(key.alias(), normalized);
        }
        return matchPlayer(key.alias(), teamContext);
    }

    private Optional<Match> matchTeam(String token, String normalized) {
        Optional<String> canonical = abbreviations.canonical(token);
        if (canonical.isPresent()) {
            Optional<Team> team = teamRepository.findByAbbreviation(canonical.get());
            if (team.isPresent()) {
                ResolutionMethod method = canonical.get().equals(normalized) ? ResolutionMethod.NORMALIZED : ResolutionMethod.ABBREVIATION;
                return Optional.of(new Match(team.get().getId(), method, normalized + "->" + canonical.get()));
            }
        }
        Optional<Team> byAbbreviation = teamRepository.findByAbbreviation(normalized);
        if (byAbbreviation.isPresent()) {
            return Optional.of(new Match(byAbbreviation.get().getId(), ResolutionMethod.NORMALIZED, "abbreviation=" + normalized));
        }
        List<Team> byName = teamRepository.findAllByNormalizedName(NameNormalizer.normalizeName(token));
        if (byName.size() == 1) {
            return Optional.of(new Match(byName.get(0).getId(), ResolutionMethod.NORMALIZED, "name=" + byName.get(0).getNormalizedName()));
        }
        return Optional.empty();
    }

    private Optional<Match> matchPlayer(String token, Long teamContext) {
        String name = NameNormalizer.normalizePlayerName(token);
        if (name == null || name.isEmpty()) return Optional.empty();

        List<Player> sameName = playerRepository.findAllByNormalizedName(name);
        if (!sameName.isEmpty()) {
            Candidate best = sameName.stream()
                    .map(p -> new Candidate(p, 0))
                    .min(candidateOrder(teamContext))
                    .orElseThrow();
            return Optional.of(new Match(best.player().getId(), ResolutionMethod.NORMALIZED,
                    "name=" + name + (sameName.size() > 1 ? ", candidates=" + sameName.size() : "")));
        }

        List<Candidate> close = playerRepository.findAll().stream()
                .filter(p -> p.getNormalizedName() != null)
                .map(p -> new Candidate(p, NameNormalizer.levenshtein(name, p.getNormalizedName())))
                .filter(c -> c.distance() <= fuzzyThreshold)
                .collect(Collectors.toList());
        if (close.isEmpty()) return Optional.empty();
        Candidate best = close.stream().min(candidateOrder(teamContext)).orElseThrow();
        log.info("[Identity][Fuzzy] '{}'->'{}' (dist={}, candidates={})", token, best.player().getFullName(), best.distance(), close.size());
        return Optional.of(new Match(best.player().getId(), ResolutionMethod.FUZZY,
                "'" + name + "'->'" + best.player().getNormalizedName() + "' dist=" + best.distance()));
    }

    // closest first, then same team, then most recently seen, then lowest id
    private static Comparator<Candidate> candidateOrder(Long teamContext) {
        return Comparator.comparingInt(Candidate::distance)
                .thenComparing(c -> !(teamContext != null && teamContext.equals(c.player().getTeamId())))
                .thenComparing(c -> c.player().getLastSeenAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                .thenComparing(c -> c.player().getId());
    }

    private static Optional<Long> uniqueCanonical(Collection<EntityAlias> aliases) {
        Set<Long> ids = aliases.stream().map(EntityAlias::getCanonicalId).filter(Objects::nonNull).collect(Collectors.toSet());
        if (ids.size() == 1) return Optional.of(ids.iterator().next());
        if (ids.size() > 1) log.info("[Identity][Ambiguous] normalized alias maps to {} canonical ids, ignoring", ids.size());
        return Optional.empty();
    }

    private Long learn(AliasKey key, Supplier<Match> canonical) {
        Object lock = learningLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
        synchronized (lock) {
            Long known = aliasCache.get(key);
            if (known != null) return known;
            Long stored;
            try {
                stored = requiresNew.execute(status -> writeAlias(key, canonical));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // a concurrent writer stored the alias or a row with the same natural key first
                log.info("[Identity][Learn] retrying after constraint violation for source={}, kind={}, token='{}'", key.source(), key.kind(), key.alias());
                stored = requiresNew.execute(status -> writeAlias(key, canonical));
            }
            aliasCache.put(key, stored);
            return stored;
        }
    }

    private Long writeAlias(AliasKey key, Supplier<Match> canonical) {
        Optional<EntityAlias> existing = aliasRepository.findBySourceAndKindAndAlias(key.source(), key.kind(), key.alias());
        if (existing.isPresent()) return existing.get().getCanonicalId();
        Match m = canonical.get();
        aliasRepository.save(new EntityAlias(key.source(), key.kind(), key.alias(), normalizedKey(key.kind(), key.alias()), m.canonicalId(), m.method()));
        auditRepository.save(new AliasResolutionAudit(key.source(), key.kind(), key.alias(), m.method(), m.canonicalId(), truncate(m.detail())));
        log.info("[Identity][Audit] source={}, kind={}, token='{}', method={}, canonicalId={}, detail={}",
                key.source(), key.kind(), key.alias(), m.method(), m.canonicalId(), m.detail());
        return m.canonicalId();
    }

    private static AliasKey keyOf(String source, EntityKind kind, String rawToken) {
        if (source == null || source.isBlank()) throw new IllegalArgumentException("source is required");
        if (rawToken == null || rawToken.isBlank()) throw new UnresolvedAliasException(source, kind, rawToken);
        String normalizedSource = requireLength("source", source.trim().toLowerCase(Locale.ROOT), MAX_SOURCE_LENGTH);
        String alias = requireLength(kind.name().toLowerCase(Locale.ROOT), rawToken.trim(), MAX_ALIAS_LENGTH);
        return new AliasKey(normalizedSource, kind, alias);
    }

    private static String requireLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new RecordValidationException(field, "longer than " + max + " characters");
        }
        return value;
    }

    static String normalizedKey(EntityKind kind, String alias) {
        String base = kind == EntityKind.PLAYER ? NameNormalizer.normalizePlayerName(alias) : alias;
        String token = NameNormalizer.normalizeToken(base);
        return token == null ? "" : token;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= 255) return s;
        return s.substring(0, 255);
    }

    private record AliasKey(String source, EntityKind kind, String alias) {}

    private record Match(Long canonicalId, ResolutionMethod method, String detail) {}

    private record Candidate(Player player, int distance) {}
}
