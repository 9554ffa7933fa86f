package org.tilecascade.variant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tilecascade.runtime.Config;
import org.tilecascade.runtime.model.BlockCatalog;
import org.tilecascade.runtime.model.BlockType;
import org.tilecascade.runtime.model.BoardModifier;
import org.tilecascade.runtime.model.BonusReward;
import org.tilecascade.runtime.model.BonusRule;
import org.tilecascade.runtime.model.BonusTriggerType;
import org.tilecascade.runtime.model.CellCoordinate;
import org.tilecascade.runtime.model.TilePower;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Turns untrusted variant data into bounded engine parameters.
 * <p>
 * The normalizer never throws on bad input. Entries that cannot be repaired are dropped and
 * logged; numbers are clamped; missing values take defaults. Without any usable block type the
 * built-in catalog is used; a catalog with fewer than {@link #MIN_DISTINCT_COLORS} distinct colors
 * keeps its types and is topped up with built-in types in new colors.
 *
 * <h3>Input shape:</h3>
 * <pre>
 * {
 *   "codename": "...", "flavorText": "...",
 *   "baseGridSize": 7, "targetMatchesModifier": 1.2, "moveBudgetModifier": 0.8,
 *   "comboDecaySeconds": 2,
 *   "blockTypes": [ { "id", "name", "color": "#ff0", "spawnWeight", "power", "bonusScore" } ],
 *   "bonusRules": [ { "id", "name", "description", "triggerType", "threshold",
 *                     "reward": { "extraMoves", "score", "spawnSpecialBlockId" } } ],
 *   "boardModifiers": { "presetName", "description", "blockedCells": [ { "row", "col" } ] }
 * }
 * </pre>
 */
public class ConfigNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigNormalizer.class);

    /** Fewer colors cannot fill a grid without runs. */
    public static final int MIN_DISTINCT_COLORS = 3;

    static final int[] FALLBACK_COLORS = {0xff5f6d, 0xffc371, 0x1dd1a1, 0x54a0ff, 0x9b59b6};
    static final int FALLBACK_BONUS_SCORE = 6;

    static final double MIN_SPAWN_WEIGHT = 0.2;
    static final double MAX_SPAWN_WEIGHT = 12;
    static final int MAX_BONUS_SCORE = 120;
    static final double MIN_MODIFIER = 0.5;
    static final double MAX_MODIFIER = 2;
    static final double MIN_COMBO_DECAY_SECONDS = 0.8;
    static final double MAX_COMBO_DECAY_SECONDS = 6;
    static final double DEFAULT_COMBO_DECAY_SECONDS = 2;
    static final int MAX_THRESHOLD = 999;
    static final int MAX_EXTRA_MOVES = 50;
    static final int MAX_REWARD_SCORE = 10_000;

    private final ObjectMapper objectMapper;

    public ConfigNormalizer() {
        this(new ObjectMapper());
    }

    public ConfigNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and normalizes variant JSON text. Text that is not JSON is treated as absent.
     *
     * @param json The raw text, may be null.
     * @return The normalized variant.
     */
    public NormalizedVariant normalize(String json) {
        if (json == null || json.isBlank()) {
            return normalize((JsonNode) null);
        }
        try {
            return normalize(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            LOG.warn("Variant data is not valid JSON, using defaults: {}", e.getOriginalMessage());
            return normalize((JsonNode) null);
        }
    }

    /**
     * Normalizes a parsed variant.
     *
     * @param raw The variant object, may be null, missing or of any JSON type.
     * @return The normalized variant.
     */
    public NormalizedVariant normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            if (raw != null && !raw.isMissingNode() && !raw.isNull()) {
                LOG.warn("Variant data is a {} instead of an object, using defaults", raw.getNodeType());
            }
            return new NormalizedVariant(VariantMeta.defaults(), builtinCatalog(), List.of(), BoardModifier.none(),
                    DEFAULT_COMBO_DECAY_SECONDS, true);
        }

        VariantMeta meta = normalizeMeta(raw);
        List<BlockType> blocks = normalizeBlockTypes(raw.get("blockTypes"));
        boolean fallback = false;
        BlockCatalog catalog;
        if (blocks.isEmpty()) {
            LOG.warn("Variant has no usable block types, using the built-in catalog");
            catalog = builtinCatalog();
            fallback = true;
        } else {
            catalog = new BlockCatalog(blocks);
            if (catalog.distinctColorCount() < MIN_DISTINCT_COLORS) {
                List<BlockType> added = fillMissingColors(blocks);
                LOG.warn("Variant block types have only {} distinct colors (need {}), adding built-in block types {}",
                        catalog.distinctColorCount(), MIN_DISTINCT_COLORS, added.stream().map(BlockType::id).toList());
                List<BlockType> extended = new ArrayList<>(blocks);
                extended.addAll(added);
                catalog = new BlockCatalog(extended);
            }
        }

        JsonNode modifierNode = raw.has("boardModifiers") ? raw.get("boardModifiers") : raw.get("boardModifier");
        double comboDecay = safeNumber(raw.get("comboDecaySeconds"), DEFAULT_COMBO_DECAY_SECONDS,
                MIN_COMBO_DECAY_SECONDS, MAX_COMBO_DECAY_SECONDS);

        return new NormalizedVariant(meta, catalog, normalizeBonusRules(raw.get("bonusRules")),
                normalizeBoardModifier(modifierNode), comboDecay, fallback);
    }

    /**
     * The catalog used when a variant supplies no usable block types.
     * @return Five plain block types {@code fallback-0} to {@code fallback-4}.
     */
    public static BlockCatalog builtinCatalog() {
        List<BlockType> types = new ArrayList<>();
        for (int i = 0; i < FALLBACK_COLORS.length; i++) {
            types.add(new BlockType("fallback-" + i, "Block " + (i + 1), FALLBACK_COLORS[i], 1.0, TilePower.NONE, FALLBACK_BONUS_SCORE));
        }
        return new BlockCatalog(types);
    }

    /**
     * Picks built-in block types in new colors until the catalog reaches {@link #MIN_DISTINCT_COLORS}.
     */
    private static List<BlockType> fillMissingColors(List<BlockType> blocks) {
        Set<Integer> colors = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (BlockType block : blocks) {
            colors.add(block.color());
            ids.add(block.id());
        }
        List<BlockType> added = new ArrayList<>();
        for (BlockType builtin : builtinCatalog().types()) {
            if (colors.size() >= MIN_DISTINCT_COLORS) {
                break;
            }
            if (!ids.contains(builtin.id()) && colors.add(builtin.color())) {
                added.add(builtin);
            }
        }
        return added;
    }

    private VariantMeta normalizeMeta(JsonNode raw) {
        Integer baseGridSize = null;
        if (isNumeric(raw.get("baseGridSize"))) {
            baseGridSize = (int) Math.round(safeNumber(raw.get("baseGridSize"), Config.DEFAULT_GRID_SIZE,
                    Config.MIN_GRID_SIZE, Config.MAX_GRID_SIZE));
        }
        Double targetModifier = isNumeric(raw.get("targetMatchesModifier"))
                ? safeNumber(raw.get("targetMatchesModifier"), 1, MIN_MODIFIER, MAX_MODIFIER) : null;
        Double moveModifier = isNumeric(raw.get("moveBudgetModifier"))
                ? safeNumber(raw.get("moveBudgetModifier"), 1, MIN_MODIFIER, MAX_MODIFIER) : null;
        return new VariantMeta(
                text(raw.get("codename")).orElse(VariantMeta.DEFAULT_CODENAME),
                text(raw.get("flavorText")).orElse(VariantMeta.DEFAULT_FLAVOR_TEXT),
                baseGridSize, targetModifier, moveModifier);
    }

    private List<BlockType> normalizeBlockTypes(JsonNode input) {
        List<BlockType> result = new ArrayList<>();
        if (input == null || !input.isArray()) {
            return result;
        }
        Set<String> seenIds = new HashSet<>();
        for (int index = 0; index < input.size(); index++) {
            JsonNode block = input.get(index);
            if (block == null || !block.isObject()) {
                LOG.warn("Dropping block type #{}: not an object", index);
                continue;
            }
            JsonNode colorNode = block.get("color");
            OptionalInt color = colorNode != null && colorNode.isTextual() ? ColorParser.parse(colorNode.asText()) : OptionalInt.empty();
            if (color.isEmpty()) {
                LOG.warn("Dropping block type #{}: invalid color {}", index, colorNode);
                continue;
            }
            String id = text(block.get("id")).orElse("block-" + index);
            if (!seenIds.add(id)) {
                LOG.warn("Dropping block type #{}: duplicate id '{}'", index, id);
                continue;
            }
            String name = text(block.get("name")).orElse("Block " + (index + 1));
            TilePower power = text(block.get("power")).map(TilePower::fromWireName).orElse(TilePower.NONE);
            double spawnWeight = safeNumber(block.get("spawnWeight"), 1, MIN_SPAWN_WEIGHT, MAX_SPAWN_WEIGHT);
            int bonusScore = (int) Math.round(safeNumber(block.get("bonusScore"), 0, 0, MAX_BONUS_SCORE));
            result.add(new BlockType(id, name, color.getAsInt(), spawnWeight, power, bonusScore));
        }
        return result;
    }

    private List<BonusRule> normalizeBonusRules(JsonNode input) {
        List<BonusRule> result = new ArrayList<>();
        if (input == null || !input.isArray()) {
            return result;
        }
        for (int index = 0; index < input.size(); index++) {
            JsonNode rule = input.get(index);
            if (rule == null || !rule.isObject()) {
                LOG.warn("Dropping bonus rule #{}: not an object", index);
                continue;
            }
            Optional<BonusTriggerType> trigger = text(rule.get("triggerType")).flatMap(BonusTriggerType::fromWireName);
            if (trigger.isEmpty()) {
                LOG.warn("Dropping bonus rule #{}: unknown trigger type {}", index, rule.get("triggerType"));
                continue;
            }
            JsonNode rewardNode = rule.get("reward");
            if (rewardNode == null || !rewardNode.isObject()) {
                LOG.warn("Dropping bonus rule #{}: missing reward", index);
                continue;
            }
            BonusReward reward = new BonusReward(
                    (int) Math.round(safeNumber(rewardNode.get("extraMoves"), 0, -MAX_EXTRA_MOVES, MAX_EXTRA_MOVES)),
                    (int) Math.round(safeNumber(rewardNode.get("score"), 0, -MAX_REWARD_SCORE, MAX_REWARD_SCORE)),
                    text(rewardNode.get("spawnSpecialBlockId")).orElse(null));
            if (reward.isNoOp()) {
                LOG.warn("Dropping bonus rule #{}: reward has no effect", index);
                continue;
            }
            String id = text(rule.get("id")).orElse("bonus-" + index);
            String name = text(rule.get("name")).orElse("Bonus " + (index + 1));
            String description = text(rule.get("description")).orElse(name);
            int threshold = (int) Math.max(1, Math.round(safeNumber(rule.get("threshold"), 1, 1, MAX_THRESHOLD)));
            result.add(new BonusRule(id, name, description, trigger.get(), threshold, reward));
        }
        return result;
    }

    private BoardModifier normalizeBoardModifier(JsonNode input) {
        if (input == null || !input.isObject()) {
            return BoardModifier.none();
        }
        List<CellCoordinate> cells = new ArrayList<>();
        JsonNode blocked = input.get("blockedCells");
        if (blocked != null && blocked.isArray()) {
            for (int index = 0; index < blocked.size(); index++) {
                JsonNode cell = blocked.get(index);
                if (cell == null || !cell.isObject() || !isNumeric(cell.get("row")) || !isNumeric(cell.get("col"))) {
                    LOG.warn("Dropping blocked cell #{}: row and col must be numbers", index);
                    continue;
                }
                cells.add(new CellCoordinate(
                        (int) Math.round(safeNumber(cell.get("row"), -1, -1, Integer.MAX_VALUE)),
                        (int) Math.round(safeNumber(cell.get("col"), -1, -1, Integer.MAX_VALUE))));
            }
        }
        JsonNode descriptionNode = input.get("description");
        String description = descriptionNode != null && descriptionNode.isTextual() ? descriptionNode.asText() : null;
        return new BoardModifier(text(input.get("presetName")).orElse(BoardModifier.DEFAULT_PRESET_NAME), description, cells);
    }

    /**
     * Reads a number, accepting numeric strings, and clamps it.
     *
     * @return The clamped value, or {@code fallback} if the node is absent, not a number or not finite.
     */
    static double safeNumber(JsonNode node, double fallback, double min, double max) {
        OptionalDouble value = finiteValue(node);
        if (value.isEmpty()) {
            return fallback;
        }
        return Math.min(max, Math.max(min, value.getAsDouble()));
    }

    private static boolean isNumeric(JsonNode node) {
        return finiteValue(node).isPresent();
    }

    private static OptionalDouble finiteValue(JsonNode node) {
        if (node == null) {
            return OptionalDouble.empty();
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        String trimmed = node.asText().trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
