package com.diamondline.ingest.service;

import com.diamondline.ingest.StoreReset;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.exception.UnresolvedAliasException;
import com.diamondline.ingest.model.AliasResolutionAudit;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.model.Player;
import com.diamondline.ingest.model.ResolutionMethod;
import com.diamondline.ingest.repository.AliasResolutionAuditRepository;
import com.diamondline.ingest.repository.EntityAliasRepository;
import com.diamondline.ingest.repository.GameRecordRepository;
import com.diamondline.ingest.repository.PlayerRepository;
import com.diamondline.ingest.repository.TeamRepository;
import com.diamondline.ingest.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(StoreReset.class)
class IdentityResolverTest {

    @Autowired private IdentityResolver resolver;
    @Autowired private StoreReset storeReset;
    @Autowired private TeamRepository teamRepository;
    @Autowired private PlayerRepository playerRepository;
    @Autowired private EntityAliasRepository aliasRepository;
    @Autowired private AliasResolutionAuditRepository auditRepository;
    @Autowired private GameRecordRepository gameRepository;

    @BeforeEach
    void setUp() {
        storeReset.clear();
    }

    @Test
    void abbreviationVariantsFromTwoSourcesResolveToOneTeam() {
        Long fromMlb = resolver.resolveOrRegisterTeam("mlb", "CWS", "Chicago White Sox");
        Long fromBook = resolver.resolve("fanduel", EntityKind.TEAM, "CHW");

        assertThat(fromBook).isEqualTo(fromMlb);
        assertThat(teamRepository.count()).isEqualTo(1);
        List<AliasResolutionAudit> audits = auditRepository.findAllBySourceAndRawToken("fanduel", "CHW");
        assertThat(audits).hasSize(1);
        assertThat(audits.get(0).getMethod()).isEqualTo(ResolutionMethod.ABBREVIATION);
    }

    @Test
    void unseededTokenIsUnresolved() {
        resolver.resolveOrRegisterTeam("mlb", "CWS", "Chicago White Sox");

        assertThatThrownBy(() -> resolver.resolve("fanduel", EntityKind.TEAM, "ChiSox"))
                .isInstanceOf(UnresolvedAliasException.class)
                .satisfies(e -> assertThat(((UnresolvedAliasException) e).getRawToken()).isEqualTo("ChiSox"));
        assertThat(aliasRepository.countBySourceAndKindAndAlias("fanduel", EntityKind.TEAM, "ChiSox")).isZero();
    }

    @Test
    void secondResolutionIsExactAndLearnsNothingNew() {
        resolver.resolveOrRegisterTeam("mlb", "NYY", "New York Yankees");
        Long first = resolver.resolve("draftkings", EntityKind.TEAM, "New York Yankees");
        long aliases = aliasRepository.count();
        long audits = auditRepository.count();

        resolver.reload();
        Long second = resolver.resolve("draftkings", EntityKind.TEAM, "New York Yankees");

        assertThat(second).isEqualTo(first);
        assertThat(aliasRepository.count()).isEqualTo(aliases);
        assertThat(auditRepository.count()).isEqualTo(audits);
    }

    @Test
    void misspelledPlayerMatchesWithinEditDistance() {
        Long teamId = resolver.resolveOrRegisterTeam("mlb", "TOR", "Toronto Blue Jays");
        Long vlad = resolver.resolveOrRegisterPlayer("mlb", "665489", "Vladimir Guerrero Jr.", teamId);

        Long resolved = resolver.resolve("prizepicks", EntityKind.PLAYER, "Vladimir Guerero");

        assertThat(resolved).isEqualTo(vlad);
        List<AliasResolutionAudit> audits = auditRepository.findAllBySourceAndRawToken("prizepicks", "Vladimir Guerero");
        assertThat(audits).extracting(AliasResolutionAudit::getMethod).containsExactly(ResolutionMethod.FUZZY);
        assertThatThrownBy(() -> resolver.resolve("prizepicks", EntityKind.PLAYER, "Vernon Wells"))
                .isInstanceOf(UnresolvedAliasException.class);
    }

    @Test
    void sameNamedPlayersArePickedByTeamThenRecency() {
        Team dodgers = teamRepository.save(new Team("LAD", "Los Angeles Dodgers"));
        Team braves = teamRepository.save(new Team("ATL", "Atlanta Braves"));
        Player older = new Player("Will Smith", braves.getId());
        older.setLastSeenAt(Instant.parse("2024-04-01T00:00:00Z"));
        older = playerRepository.save(older);
        Player recent = new Player("Will Smith", dodgers.getId());
        recent.setLastSeenAt(Instant.parse("2024-04-20T00:00:00Z"));
        recent = playerRepository.save(recent);

        assertThat(resolver.resolve("bookA", EntityKind.PLAYER, "Will Smith", braves.getId())).isEqualTo(older.getId());
        assertThat(resolver.resolve("bookB", EntityKind.PLAYER, "Will Smith")).isEqualTo(recent.getId());
    }

    @Test
    void concurrentResolutionsLearnOneAlias() throws Exception {
        Long team = resolver.resolveOrRegisterTeam("mlb", "CWS", "Chicago White Sox");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Long>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> resolver.resolve("betfair", EntityKind.TEAM, "CHW"));
            }
            Set<Long> ids = new HashSet<>();
            for (Future<Long> f : pool.invokeAll(calls)) {
                ids.add(f.get());
            }
            assertThat(ids).containsExactly(team);
        } finally {
            pool.shutdownNow();
        }
        assertThat(aliasRepository.countBySourceAndKindAndAlias("betfair", EntityKind.TEAM, "CHW")).isEqualTo(1);
        assertThat(auditRepository.findAllBySourceAndRawToken("betfair", "CHW")).hasSize(1);
    }

    @Test
    void nonAuthoritativeSourceCannotRegisterTeams() {
        assertThatThrownBy(() -> resolver.resolveOrRegisterTeam("fanduel", "SEA", "Seattle Mariners"))
                .isInstanceOf(UnresolvedAliasException.class);
        assertThat(teamRepository.count()).isZero();
    }

    @Test
    void doubleheaderGamesWithoutGameNumbersStayApart() {
        LocalDate date = LocalDate.of(2024, 4, 11);
        Long bos = resolver.resolveOrRegisterTeam("mlb", "BOS", "Boston Red Sox");
        Long nyy = resolver.resolveOrRegisterTeam("mlb", "NYY", "New York Yankees");

        Long first = resolver.resolveOrRegisterGame("mlb", "745001", date, bos, nyy, null);
        Long second = resolver.resolveOrRegisterGame("mlb", "745002", date, bos, nyy, null);

        assertThat(second).isNotEqualTo(first);
        assertThat(gameRepository.findById(first).orElseThrow().getGameNumber()).isEqualTo(1);
        assertThat(gameRepository.findById(second).orElseThrow().getGameNumber()).isEqualTo(2);
        assertThat(resolver.resolveOrRegisterGame("mlb", "745002", date, bos, nyy, null)).isEqualTo(second);
    }

    @Test
    void otherSourcesNeedTheGameNumberOnADoubleheader() {
        LocalDate date = LocalDate.of(2024, 4, 11);
        Long bos = resolver.resolveOrRegisterTeam("mlb", "BOS", "Boston Red Sox");
        Long nyy = resolver.resolveOrRegisterTeam("mlb", "NYY", "New York Yankees");
        resolver.resolveOrRegisterGame("mlb", "745001", date, bos, nyy, 1);
        Long nightcap = resolver.resolveOrRegisterGame("mlb", "745002", date, bos, nyy, 2);

        assertThatThrownBy(() -> resolver.resolveOrRegisterGame("betfair", "evt-1", date, bos, nyy, null))
                .isInstanceOf(UnresolvedAliasException.class);
        assertThat(resolver.resolveOrRegisterGame("betfair", "evt-2", date, bos, nyy, 2)).isEqualTo(nightcap);
    }

    @Test
    void gameNumberAlreadyClaimedByAnotherIdIsRejected() {
        LocalDate date = LocalDate.of(2024, 4, 11);
        Long bos = resolver.resolveOrRegisterTeam("mlb", "BOS", "Boston Red Sox");
        Long nyy = resolver.resolveOrRegisterTeam("mlb", "NYY", "New York Yankees");
        resolver.resolveOrRegisterGame("mlb", "745001", date, bos, nyy, 1);

        assertThatThrownBy(() -> resolver.resolveOrRegisterGame("mlb", "745009", date, bos, nyy, 1))
                .isInstanceOf(RecordValidationException.class);
        assertThat(gameRepository.count()).isEqualTo(1);
        assertThat(resolver.lookup("mlb", EntityKind.GAME, "745009")).isEmpty();
    }

    @Test
    void oversizedTokensAreValidationErrorsAndStoreNothing() {
        String longToken = "9".repeat(300);

        assertThatThrownBy(() -> resolver.resolveOrRegisterPlayer("mlb", longToken, "Aaron Judge", null))
                .isInstanceOf(RecordValidationException.class);
        assertThatThrownBy(() -> resolver.resolveOrRegisterPlayer("mlb", "592450", "J".repeat(300), null))
                .isInstanceOf(RecordValidationException.class);
        assertThatThrownBy(() -> resolver.resolveOrRegisterTeam("mlb", "B".repeat(100), null))
                .isInstanceOf(RecordValidationException.class);
        assertThat(playerRepository.count()).isZero();
        assertThat(teamRepository.count()).isZero();
        assertThat(aliasRepository.count()).isZero();
    }
}
