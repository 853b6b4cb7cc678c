package com.hockey.prediction.stats;

import com.hockey.prediction.exception.StatisticsUnavailableException;
import com.hockey.prediction.model.readonly.GameDocument;
import com.hockey.prediction.model.readonly.GameLogDocument;
import com.hockey.prediction.model.readonly.GoalieStatsDocument;
import com.hockey.prediction.model.readonly.PlayerSeasonStatsDocument;
import com.hockey.prediction.model.readonly.ProbableGoalieDocument;
import com.hockey.prediction.model.readonly.TeamSeasonStatsDocument;
import com.hockey.prediction.repository.readonly.GameLogReadRepository;
import com.hockey.prediction.repository.readonly.GameReadRepository;
import com.hockey.prediction.repository.readonly.GoalieStatsReadRepository;
import com.hockey.prediction.repository.readonly.PlayerSeasonStatsReadRepository;
import com.hockey.prediction.repository.readonly.ProbableGoalieReadRepository;
import com.hockey.prediction.repository.readonly.TeamSeasonStatsReadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link StatisticsRepository} backed by the collections the ingestion pipeline maintains.
 *
 * <p>Documents are validated while they are mapped to records. A document that cannot be
 * trusted (missing keys, negative counts, impossible percentages) is reported as
 * {@link StatisticsUnavailableException} rather than silently skipped, so a run never
 * ranks on partially read data.
 */
@Component
public class MongoStatisticsRepository implements StatisticsRepository {

    private static final Logger log = LoggerFactory.getLogger(MongoStatisticsRepository.class);

    private final PlayerSeasonStatsReadRepository seasonStatsRepository;
    private final GameLogReadRepository gameLogRepository;
    private final TeamSeasonStatsReadRepository teamStatsRepository;
    private final GoalieStatsReadRepository goalieStatsRepository;
    private final ProbableGoalieReadRepository probableGoalieRepository;
    private final GameReadRepository gameRepository;

    public MongoStatisticsRepository(
            PlayerSeasonStatsReadRepository seasonStatsRepository,
            GameLogReadRepository gameLogRepository,
            TeamSeasonStatsReadRepository teamStatsRepository,
            GoalieStatsReadRepository goalieStatsRepository,
            ProbableGoalieReadRepository probableGoalieRepository,
            GameReadRepository gameRepository
    ) {
        this.seasonStatsRepository = seasonStatsRepository;
        this.gameLogRepository = gameLogRepository;
        this.teamStatsRepository = teamStatsRepository;
        this.goalieStatsRepository = goalieStatsRepository;
        this.probableGoalieRepository = probableGoalieRepository;
        this.gameRepository = gameRepository;
    }

    @Override
    public Optional<PlayerSeasonRecord> getSeasonRecord(long playerId, String season) {
        return read("season record for player " + playerId,
                () -> seasonStatsRepository.findFirstByPlayerIdAndSeason(playerId, season))
                .map(this::toSeasonRecord);
    }

    @Override
    public List<GameLogEntry> getRecentGames(long playerId, int limit, LocalDate asOf) {
        if (limit <= 0) {
            return List.of();
        }
        List<GameLogDocument> docs = read("recent games for player " + playerId,
                () -> gameLogRepository.findByPlayerIdAndGameDateBeforeOrderByGameDateDescGameIdDesc(
                        playerId, asOf, PageRequest.of(0, limit)));
        return toEntries(docs);
    }

    @Override
    public List<GameLogEntry> getSeasonGames(long playerId, String season, LocalDate asOf) {
        List<GameLogDocument> docs = read("season games for player " + playerId,
                () -> gameLogRepository.findSeasonGames(playerId, season, asOf));
        return toEntries(docs);
    }

    @Override
    public HeadToHeadRecord getHeadToHead(long playerId, String opponent, LocalDate asOf) {
        List<GameLogDocument> docs = read("games vs " + opponent + " for player " + playerId,
                () -> gameLogRepository.findHeadToHead(playerId, opponent, asOf));
        return new HeadToHeadRecord(playerId, opponent, toEntries(docs));
    }

    @Override
    public Optional<TeamContext> getTeamContext(String team, String season) {
        return read("team stats for " + team,
                () -> teamStatsRepository.findFirstByTeamAbbrevAndSeason(team, season))
                .flatMap(this::toTeamContext);
    }

    @Override
    public GoalieContext getGoalieContext(String team, LocalDate asOf) {
        String season = Seasons.forDate(asOf);
        Double leagueAverage = leagueAverageSavePct(season);

        List<ProbableGoalieDocument> probables = read("probable goalie for " + team,
                () -> probableGoalieRepository.findByTeamAbbrevAndGameDate(team, asOf));
        // Confirmed starters win over projections; game id keeps the pick stable
        Optional<ProbableGoalieDocument> starter = probables.stream()
                .filter(p -> p.getGoalieId() != null)
                .min(Comparator.comparing((ProbableGoalieDocument p) -> !p.isConfirmed())
                        .thenComparing(p -> p.getGameId() == null ? Long.MAX_VALUE : p.getGameId()));
        if (starter.isEmpty()) {
            log.debug("No probable starter recorded for {} on {}", team, asOf);
            return GoalieContext.unannounced(team, leagueAverage);
        }

        Long goalieId = starter.get().getGoalieId();
        Optional<GoalieStatsDocument> stats = read("goalie stats for " + goalieId,
                () -> goalieStatsRepository.findFirstByPlayerIdAndSeason(goalieId, season));
        if (stats.isEmpty() || stats.get().getSavePct() == null) {
            log.debug("Starter {} for {} has no save percentage for {}", goalieId, team, season);
            return new GoalieContext(team, goalieId, stats.map(GoalieStatsDocument::getPlayerName).orElse(null),
                    null, leagueAverage);
        }
        GoalieStatsDocument g = stats.get();
        requirePercentage(g.getSavePct(), "goalie " + goalieId + " save percentage");
        return new GoalieContext(team, goalieId, g.getPlayerName(), g.getSavePct(), leagueAverage);
    }

    @Override
    public List<ScheduledGame> getScheduledGames(LocalDate date) {
        List<GameDocument> docs = read("schedule for " + date,
                () -> gameRepository.findByGameDateOrderByGameIdAsc(date));
        return docs.stream()
                .map(this::toScheduledGame)
                .sorted(Comparator.comparingLong(ScheduledGame::gameId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<String> getCurrentTeam(long playerId, String season) {
        Optional<PlayerSeasonStatsDocument> record = read("season record for player " + playerId,
                () -> seasonStatsRepository.findFirstByPlayerIdAndSeason(playerId, season));
        if (record.isPresent() && record.get().getTeamAbbrev() != null) {
            return Optional.of(record.get().getTeamAbbrev());
        }
        return read("latest game for player " + playerId,
                () -> gameLogRepository.findFirstByPlayerIdAndSeasonOrderByGameDateDescGameIdDesc(playerId, season))
                .map(GameLogDocument::getTeamAbbrev);
    }

    @Override
    public List<RosterEntry> getRoster(String team, String season) {
        Map<Long, RosterEntry> roster = new TreeMap<>();
        read("season roster for " + team, () -> seasonStatsRepository.findBySeasonAndTeamAbbrev(season, team))
                .forEach(doc -> {
                    long playerId = require(doc.getPlayerId(), "player season record without player id");
                    roster.putIfAbsent(playerId, new RosterEntry(playerId, doc.getPlayerName(), team));
                });

        Map<Long, String> logOnly = new TreeMap<>();
        read("game log roster for " + team, () -> gameLogRepository.findPlayersBySeasonAndTeam(season, team))
                .forEach(doc -> {
                    long playerId = require(doc.getPlayerId(), "game log row without player id");
                    if (!roster.containsKey(playerId)) {
                        logOnly.putIfAbsent(playerId, doc.getPlayerName());
                    }
                });
        // Players who left the team keep their old game rows
        logOnly.forEach((playerId, name) -> {
            if (getCurrentTeam(playerId, season).filter(team::equals).isPresent()) {
                roster.put(playerId, new RosterEntry(playerId, name, team));
            } else {
                log.debug("Player {} has games for {} but now plays elsewhere", playerId, team);
            }
        });
        return List.copyOf(roster.values());
    }

    // ============ MAPPING ============

    private PlayerSeasonRecord toSeasonRecord(PlayerSeasonStatsDocument doc) {
        long playerId = require(doc.getPlayerId(), "player season record without player id");
        String what = "season record for player " + playerId;
        return new PlayerSeasonRecord(
                playerId,
                doc.getPlayerName(),
                doc.getSeason(),
                doc.getTeamAbbrev(),
                count(doc.getGamesPlayed(), what),
                count(doc.getGoals(), what),
                count(doc.getAssists(), what),
                count(doc.getPoints(), what),
                count(doc.getShots(), what),
                doc.getExpectedGoals(),
                doc.getCorsiForPct()
        );
    }

    private List<GameLogEntry> toEntries(List<GameLogDocument> docs) {
        return docs.stream()
                .map(this::toEntry)
                .sorted(GameLogEntry.MOST_RECENT_FIRST)
                .collect(Collectors.toList());
    }

    private GameLogEntry toEntry(GameLogDocument doc) {
        long playerId = require(doc.getPlayerId(), "game log row without player id");
        long gameId = require(doc.getGameId(), "game log row without game id for player " + playerId);
        String what = "game log row " + gameId + " for player " + playerId;
        LocalDate date = require(doc.getGameDate(), what + " has no date");
        String opponent = require(doc.getOpponent(), what + " has no opponent");
        boolean home;
        if ("home".equalsIgnoreCase(doc.getHomeAway())) {
            home = true;
        } else if ("away".equalsIgnoreCase(doc.getHomeAway())) {
            home = false;
        } else {
            throw malformed(what + " has venue flag '" + doc.getHomeAway() + "'");
        }
        double toi = doc.getToi() == null ? 0.0 : doc.getToi();
        if (toi < 0.0) {
            throw malformed(what + " has negative ice time");
        }
        return new GameLogEntry(playerId, gameId, date, doc.getTeamAbbrev(), opponent, home,
                count(doc.getGoals(), what), count(doc.getAssists(), what),
                count(doc.getPoints(), what), count(doc.getShots(), what), toi);
    }

    private Optional<TeamContext> toTeamContext(TeamSeasonStatsDocument doc) {
        if (doc.getGoalsForPerGame() == null || doc.getGoalsAgainstPerGame() == null) {
            log.debug("Team stats for {} {} have no per-game rates", doc.getTeamAbbrev(), doc.getSeason());
            return Optional.empty();
        }
        if (doc.getGoalsForPerGame() < 0.0 || doc.getGoalsAgainstPerGame() < 0.0) {
            throw malformed("team stats for " + doc.getTeamAbbrev() + " have negative rates");
        }
        return Optional.of(new TeamContext(doc.getTeamAbbrev(), doc.getSeason(),
                doc.getGoalsForPerGame(), doc.getGoalsAgainstPerGame()));
    }

    private ScheduledGame toScheduledGame(GameDocument doc) {
        long gameId = require(doc.getGameId(), "schedule entry without game id");
        String what = "game " + gameId;
        return new ScheduledGame(
                gameId,
                require(doc.getGameDate(), what + " has no date"),
                doc.getSeason() != null ? doc.getSeason() : Seasons.forDate(doc.getGameDate()),
                require(doc.getHomeTeamAbbrev(), what + " has no home team"),
                require(doc.getAwayTeamAbbrev(), what + " has no away team"),
                doc.getVenue()
        );
    }

    private Double leagueAverageSavePct(String season) {
        List<GoalieStatsDocument> goalies = read("league goalie stats for " + season,
                () -> goalieStatsRepository.findBySeasonAndGamesStartedGreaterThan(season, 0));
        // Sorted so the floating-point sum is identical run to run
        List<Double> savePcts = goalies.stream()
                .filter(g -> g.getSavePct() != null && g.getPlayerId() != null)
                .sorted(Comparator.comparing(GoalieStatsDocument::getPlayerId))
                .map(GoalieStatsDocument::getSavePct)
                .collect(Collectors.toList());
        if (savePcts.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        for (Double pct : savePcts) {
            requirePercentage(pct, "league save percentage sample");
            sum += pct;
        }
        return sum / savePcts.size();
    }

    // ============ HELPERS ============

    private <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.warn("Statistics store failed reading {}: {}", what, e.getMessage());
            throw new StatisticsUnavailableException("Could not read " + what, e);
        }
    }

    private static int count(Integer value, String what) {
        if (value == null) {
            return 0;
        }
        if (value < 0) {
            throw malformed(what + " has a negative count");
        }
        return value;
    }

    private static <T> T require(T value, String problem) {
        if (value == null) {
            throw malformed(problem);
        }
        return value;
    }

    private static void requirePercentage(double value, String what) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw malformed(what + " outside [0,1]: " + value);
        }
    }

    private static StatisticsUnavailableException malformed(String problem) {
        log.warn("Malformed statistics record: {}", problem);
        return new StatisticsUnavailableException("Malformed statistics record: " + problem);
    }
}
