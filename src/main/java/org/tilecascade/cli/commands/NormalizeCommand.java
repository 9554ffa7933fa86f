package org.tilecascade.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigException;
import org.tilecascade.cli.CommandLineInterface;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.BonusRule;
import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.variant.ConfigNormalizer;
import org.tilecascade.variant.NormalizedVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "normalize",
    description = "Sanitize a variant file and print the normalized variant as JSON"
)
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizeCommand.class);

    @Parameters(index = "0", paramLabel = "<variant.json>", description = "Variant file to normalize")
    private Path variantFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Integer call() {
        try {
            parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            spec.commandLine().getErr().println("Error loading configuration: " + e.getMessage());
            return 1;
        }
        final String json;
        try {
            json = Files.readString(variantFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Failed to read variant file {}: {}", variantFile, e.getMessage());
            spec.commandLine().getErr().println("Error reading variant file: " + e.getMessage());
            return 1;
        }
        NormalizedVariant variant = new ConfigNormalizer(objectMapper).normalize(json);
        try {
            spec.commandLine().getOut().println(objectMapper.writeValueAsString(toJson(variant)));
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error writing normalized variant: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    /**
     * Builds the JSON form of a normalized variant, using the same field names as variant input.
     *
     * @param variant The variant.
     * @return The JSON object.
     */
    ObjectNode toJson(NormalizedVariant variant) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("codename", variant.meta().codename());
        root.put("flavorText", variant.meta().flavorText());
        if (variant.meta().baseGridSize() != null) {
            root.put("baseGridSize", variant.meta().baseGridSize());
        }
        if (variant.meta().targetMatchesModifier() != null) {
            root.put("targetMatchesModifier", variant.meta().targetMatchesModifier());
        }
        if (variant.meta().moveBudgetModifier() != null) {
            root.put("moveBudgetModifier", variant.meta().moveBudgetModifier());
        }
        root.put("comboDecaySeconds", variant.comboDecaySeconds());
        root.put("fallbackCatalog", variant.fallbackCatalog());

        ArrayNode blocks = root.putArray("blockTypes");
        for (BlockType type : variant.catalog().types()) {
            ObjectNode block = blocks.addObject();
            block.put("id", type.id());
            block.put("name", type.name());
            block.put("color", type.colorHex());
            block.put("spawnWeight", type.spawnWeight());
            block.put("power", type.power().wireName());
            block.put("bonusScore", type.bonusScore());
        }

        ArrayNode rules = root.putArray("bonusRules");
        for (BonusRule rule : variant.bonusRules()) {
            ObjectNode node = rules.addObject();
            node.put("id", rule.id());
            node.put("name", rule.name());
            node.put("description", rule.description());
            node.put("triggerType", rule.triggerType().wireName());
            node.put("threshold", rule.threshold());
            ObjectNode reward = node.putObject("reward");
            reward.put("extraMoves", rule.reward().extraMoves());
            reward.put("score", rule.reward().score());
            if (rule.reward().spawnSpecialBlockId() != null) {
                reward.put("spawnSpecialBlockId", rule.reward().spawnSpecialBlockId());
            }
        }

        ObjectNode modifier = root.putObject("boardModifiers");
        modifier.put("presetName", variant.boardModifier().presetName());
        if (variant.boardModifier().description() != null) {
            modifier.put("description", variant.boardModifier().description());
        }
        ArrayNode cells = modifier.putArray("blockedCells");
        for (CellCoordinate cell : variant.boardModifier().blockedCells()) {
            cells.addObject().put("row", cell.row()).put("col", cell.col());
        }
        return root;
    }
}
