package org.tilecascade.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.tilecascade.cli.CommandLineInterface;
import org.tilecascade.runtime.BonusActivation;
import org.tilecascade.runtime.CascadeResult;
import org.tilecascade.runtime.MoveReport;
import org.tilecascade.runtime.Round;
import org.tilecascade.runtime.RoundOutcome;
import org.tilecascade.runtime.RoundSettings;
import org.tilecascade.runtime.internal.services.SeededRandomProvider;
import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.Swap;
import org.tilecascade.variant.ConfigNormalizer;
import org.tilecascade.variant.NormalizedVariant;
import org.tilecascade.variant.RoundParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "play",
    description = "Play a headless round of a variant, either with scripted selections or automatically"
)
public class PlayCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(PlayCommand.class);
    private static final String ROUND_CONFIG_PATH = "tilecascade.round";

    @Parameters(index = "0", paramLabel = "<variant.json>", description = "Variant file to play")
    private Path variantFile;

    @Option(names = {"-s", "--seed"}, description = "Random seed (default: tilecascade.round.seed)")
    private Long seed;

    @Option(names = {"-g", "--grid-size"}, description = "Grid size, overrides the variant")
    private Integer gridSize;

    @Option(names = {"-t", "--target"}, description = "Runs required to win")
    private Integer targetMatches;

    @Option(names = {"-m", "--moves"}, description = "Move budget")
    private Integer moves;

    @Option(
        names = "--select",
        paramLabel = "ROW,COL",
        converter = CellConverter.class,
        description = "Cell to select, repeatable. Without selections the round plays itself"
    )
    private List<CellCoordinate> selections = new ArrayList<>();

    @Option(names = "--show-grid", description = "Print the grid after every move")
    private boolean showGrid;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Config config = parent.getConfig();
            Config roundConfig = config.hasPath(ROUND_CONFIG_PATH) ? config.getConfig(ROUND_CONFIG_PATH) : null;

            String json = Files.readString(variantFile, StandardCharsets.UTF_8);
            NormalizedVariant variant = new ConfigNormalizer().normalize(json);
            RoundParameters parameters = (roundConfig != null ? RoundParameters.fromConfig(roundConfig) : RoundParameters.derived())
                    .withOverrides(gridSize, targetMatches, moves);
            RoundSettings settings = parameters.toSettings(variant);
            long effectiveSeed = seed != null ? seed
                    : roundConfig != null && roundConfig.hasPath("seed") ? roundConfig.getLong("seed") : 0L;

            out.printf("%s: %s%n", variant.meta().codename(), variant.meta().flavorText());
            out.printf("Seed %d, %dx%d grid, target %d matches in %d moves%n", effectiveSeed,
                    settings.gridSize(), settings.gridSize(), settings.targetMatches(), settings.moveBudget());

            Round round = Round.start(settings, new SeededRandomProvider(effectiveSeed), null);
            out.println(round.renderGrid());

            int moveNumber = 0;
            if (selections.isEmpty()) {
                while (!round.isEnded()) {
                    Optional<Swap> swap = round.suggestSwap();
                    if (swap.isEmpty()) {
                        out.println("No legal swap left");
                        break;
                    }
                    round.select(swap.get().first().row(), swap.get().first().col());
                    Optional<MoveReport> report = round.select(swap.get().second().row(), swap.get().second().col());
                    if (report.isPresent()) {
                        printMove(out, ++moveNumber, report.get(), round);
                    }
                }
            } else {
                for (CellCoordinate cell : selections) {
                    Optional<MoveReport> report = round.select(cell.row(), cell.col());
                    if (report.isPresent()) {
                        printMove(out, ++moveNumber, report.get(), round);
                    }
                }
            }

            RoundOutcome outcome = round.getSession().getOutcome();
            if (outcome == null) {
                out.printf("Round still running: score %d, matches %d/%d, %d moves left%n",
                        round.getSession().getScore(), round.getSession().getMatches(),
                        settings.targetMatches(), round.getSession().getMovesLeft());
            } else {
                out.printf("%s Final score %d, matches %d/%d, %d moves left%n",
                        outcome.success() ? "Victory!" : "Defeat.", outcome.finalScore(),
                        outcome.matches(), outcome.targetMatches(), outcome.movesLeft());
            }
            return 0;
        } catch (IOException e) {
            LOG.error("Failed to read variant file {}: {}", variantFile, e.getMessage());
            spec.commandLine().getErr().println("Error reading variant file: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printMove(PrintWriter out, int moveNumber, MoveReport report, Round round) {
        CascadeResult cascade = report.cascade();
        if (report.reverted()) {
            out.printf("Move %d: %s no match, reverted; moves %d, score %d%n",
                    moveNumber, report.swap(), report.movesLeft(), report.score());
        } else {
            out.printf("Move %d: %s cascades %d, groups %d, destroyed %d, +%d points (x%.1f); moves %d, score %d%n",
                    moveNumber, report.swap(), cascade.cascades(), cascade.groups(), cascade.destroyed(),
                    cascade.points(), cascade.comboMultiplier(), report.movesLeft(), report.score());
        }
        for (BonusActivation bonus : report.bonuses()) {
            out.printf("  Bonus %s: %s%n", bonus.rule().name(), bonus.summary());
        }
        if (showGrid) {
            out.println(round.renderGrid());
        }
    }

    /**
     * Parses {@code ROW,COL} into a cell.
     */
    static class CellConverter implements CommandLine.ITypeConverter<CellCoordinate> {
        @Override
        public CellCoordinate convert(String value) {
            String[] parts = value.split(",");
            if (parts.length != 2) {
                throw new CommandLine.TypeConversionException("Expected ROW,COL but was '" + value + "'");
            }
            try {
                return new CellCoordinate(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException("Expected ROW,COL but was '" + value + "'");
            }
        }
    }
}
