package org.tilecascade.runtime;

import org.tilecascade.runtime.model.BonusReward;
import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.Grid;
import org.tilecascade.runtime.model.IGridReader;
import org.tilecascade.runtime.model.Swap;
import org.tilecascade.runtime.spi.IRandomProvider;
import org.tilecascade.runtime.worldgen.GridGenerator;
import org.tilecascade.runtime.worldgen.IBlockTypeSource;
import org.tilecascade.runtime.worldgen.TileFactory;
import org.tilecascade.runtime.worldgen.WeightedBlockPicker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One round of play. It consumes {@link #select(int, int)} events from the input layer, drives
 * swaps through the cascade resolver, the bonus engine and the objective tracker, and reports
 * every state change to an {@link IRoundListener}.
 * <p>
 * A round is single-threaded and non-reentrant: while a swap is resolving, and after the round
 * has ended, selections are ignored.
 */
public class Round {
    private static final Logger LOG = LoggerFactory.getLogger(Round.class);

    private final RoundSettings settings;
    private final Grid grid;
    private final RoundSession session;
    private final CascadeResolver resolver;
    private final BonusRuleEngine bonusEngine;
    private final ObjectiveTracker objective = new ObjectiveTracker();
    private final MoveFinder moveFinder;
    private final IRoundListener listener;

    private SelectionState state = SelectionState.IDLE;
    private CellCoordinate selected;
    private long reportedScore;

    /**
     * Creates a round on a prepared grid.
     *
     * @param settings The round parameters.
     * @param grid A filled grid of {@code settings.gridSize()}.
     * @param refillSource Chooses the types of refilled tiles.
     * @param tileFactory Creates tiles for refill and spawns.
     * @param bonusRandom Chooses spawn cells of bonus rewards.
     * @param listener Receives the round's events.
     */
    public Round(RoundSettings settings, Grid grid, IBlockTypeSource refillSource, TileFactory tileFactory,
                 IRandomProvider bonusRandom, IRoundListener listener) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.grid = Objects.requireNonNull(grid, "grid");
        if (grid.getSize() != settings.gridSize()) {
            throw new IllegalArgumentException("Grid size " + grid.getSize() + " does not match settings " + settings.gridSize());
        }
        MatchScanner scanner = new MatchScanner();
        this.session = new RoundSession(settings.targetMatches(), settings.moveBudget());
        this.resolver = new CascadeResolver(scanner, new SpecialEffectExpander(), refillSource, tileFactory);
        this.bonusEngine = new BonusRuleEngine(settings.bonusRules(), settings.catalog(), tileFactory, bonusRandom);
        this.moveFinder = new MoveFinder(scanner);
        this.listener = listener != null ? listener : new IRoundListener() {};
    }

    /**
     * Starts a round: builds the grid with its blocked cells, fills it without starting runs and
     * wires weighted refill. Generation, refill and bonus spawns use independent random streams
     * derived from {@code random}.
     *
     * @param settings The round parameters.
     * @param random The round's random source.
     * @param listener Receives the round's events, may be null.
     * @return The started round.
     */
    public static Round start(RoundSettings settings, IRandomProvider random, IRoundListener listener) {
        TileFactory tileFactory = new TileFactory();
        Grid grid = new Grid(settings.gridSize(), settings.boardModifier().blockedCells());
        WeightedBlockPicker generationPicker = new WeightedBlockPicker(settings.catalog(), random.deriveFor("generation", 0));
        int attempts = new GridGenerator(generationPicker, tileFactory).generate(grid);
        WeightedBlockPicker refillPicker = new WeightedBlockPicker(settings.catalog(), random.deriveFor("refill", 0));
        Round round = new Round(settings, grid, refillPicker, tileFactory, random.deriveFor("bonus", 0), listener);
        LOG.info("Round started: {}x{} grid, {} blocked cells, target {} matches in {} moves, {} block types, {} bonus rules (generated in {} attempts)",
                settings.gridSize(), settings.gridSize(), grid.blockedCells().size(), settings.targetMatches(),
                settings.moveBudget(), settings.catalog().size(), settings.bonusRules().size(), attempts);
        return round;
    }

    /**
     * Handles a tap on a cell.
     * <ul>
     *   <li>Idle: the cell becomes selected.</li>
     *   <li>Same cell again: deselect.</li>
     *   <li>A cell not adjacent to the selection: it becomes the selection.</li>
     *   <li>An adjacent cell: the two tiles are swapped and resolved; a swap that matches nothing
     *       is reverted. Either way one move is used.</li>
     * </ul>
     * Blocked and out-of-bounds cells are ignored, as is every selection while resolving or after
     * the round has ended.
     *
     * @param row The row.
     * @param col The column.
     * @return The report of the swap, if this selection completed one.
     */
    public Optional<MoveReport> select(int row, int col) {
        if (session.isEnded() || state == SelectionState.RESOLVING || grid.isBlocked(row, col)) {
            return Optional.empty();
        }
        CellCoordinate cell = new CellCoordinate(row, col);
        if (state == SelectionState.IDLE) {
            changeSelection(cell);
            return Optional.empty();
        }
        if (cell.equals(selected)) {
            changeSelection(null);
            return Optional.empty();
        }
        if (!selected.isAdjacentTo(cell)) {
            changeSelection(cell);
            return Optional.empty();
        }
        Swap swap = new Swap(selected, cell);
        changeSelection(null);
        return Optional.of(performSwap(swap));
    }

    private void changeSelection(CellCoordinate cell) {
        selected = cell;
        state = cell == null ? SelectionState.IDLE : SelectionState.FIRST_SELECTED;
        listener.selectionChanged(cell);
    }

    private MoveReport performSwap(Swap swap) {
        state = SelectionState.RESOLVING;
        try {
            grid.swap(swap.first(), swap.second());
            CascadeResult cascade = resolver.resolve(grid, session);
            List<BonusActivation> bonuses = List.of();
            RoundOutcome outcome = null;

            if (cascade.hadMatches()) {
                flushScore();
                listener.matchProgress(session.getMatches(), session.getTargetMatches());
                bonuses = bonusEngine.evaluate(BonusContext.of(cascade, session), grid, session);
                for (BonusActivation activation : bonuses) {
                    BonusReward reward = activation.rule().reward();
                    listener.bonusTriggered(activation.rule().id(), reward.summary());
                    if (reward.extraMoves() != 0) {
                        listener.movesLeftChanged(session.getMovesLeft());
                    }
                }
                flushScore();
                outcome = objective.checkVictory(session).orElse(null);
            } else {
                grid.swap(swap.first(), swap.second());
                session.setComboMultiplier(1.0);
                listener.swapReverted(swap);
            }

            Optional<RoundOutcome> afterMove = objective.consumeMove(session, cascade.hadMatches());
            listener.movesLeftChanged(session.getMovesLeft());
            if (afterMove.isPresent()) {
                outcome = afterMove.get();
            }
            flushScore();
            if (outcome != null) {
                listener.roundEnded(outcome);
            }
            LOG.debug("Swap {}: cascades={} groups={} points={} movesLeft={}", swap, cascade.cascades(),
                    cascade.groups(), cascade.points(), session.getMovesLeft());
            return new MoveReport(swap, cascade, bonuses, !cascade.hadMatches(), session.getMovesLeft(),
                    session.getScore(), outcome);
        } finally {
            state = SelectionState.IDLE;
        }
    }

    private void flushScore() {
        long delta = session.getScore() - reportedScore;
        if (delta != 0) {
            reportedScore = session.getScore();
            listener.scoreDelta(delta);
        }
    }

    /**
     * Suggests a swap that produces a match.
     * @return The first matching swap in row-major order, or empty if the board has none.
     */
    public Optional<Swap> hint() {
        return moveFinder.findMatchingSwap(grid);
    }

    /**
     * Suggests a matching swap, or any legal swap if the board has no matching one.
     * @return A swap, or empty if the board has no two adjacent tiles.
     */
    public Optional<Swap> suggestSwap() {
        Optional<Swap> matching = moveFinder.findMatchingSwap(grid);
        return matching.isPresent() ? matching : moveFinder.findAnySwap(grid);
    }

    public IGridReader getGrid() {
        return grid;
    }

    /**
     * Renders the grid as text.
     * @return One line per row.
     */
    public String renderGrid() {
        return grid.render();
    }

    public RoundSettings getSettings() {
        return settings;
    }

    public RoundSession getSession() {
        return session;
    }

    public SelectionState getState() {
        return state;
    }

    public CellCoordinate getSelected() {
        return selected;
    }

    public boolean isEnded() {
        return session.isEnded();
    }
}
