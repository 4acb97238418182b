package ai.compile.catalog;

import ai.compile.effects.Effect;
import ai.compile.effects.EffectBox;
import ai.compile.effects.Instruction;
import ai.compile.effects.Op;
import ai.compile.effects.PassiveRule;
import ai.compile.effects.TargetFilter;
import ai.compile.effects.Trigger;
import ai.compile.game.Card;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns catalog DTOs into immutable {@link Card}s, validating the instruction tree on the way.
 * <p>
 * Every check names the card it failed on, e.g. {@code "Fire-3: unknown op DRAWW"}.
 */
final class CatalogMapper {
    static final int CARDS_PER_PROTOCOL = 6;
    static final int MAX_CARD_VALUE = 6;

    private CatalogMapper() {
    }

    static List<Card> toCards(CatalogDocument document) {
        if (document == null) {
            throw new CatalogException("Catalog is empty");
        }
        if (document.getVersion() != CatalogDocument.SUPPORTED_VERSION) {
            throw new CatalogException("Unsupported catalog version " + document.getVersion()
                    + ", expected " + CatalogDocument.SUPPORTED_VERSION);
        }
        Set<String> protocolNames = new LinkedHashSet<>();
        for (ProtocolDefinition protocol : document.getProtocols()) {
            String name = protocol.getName();
            if (name == null || name.isBlank()) {
                throw new CatalogException("Protocol without a name");
            }
            if (!protocolNames.add(name)) {
                throw new CatalogException("Duplicate protocol " + name);
            }
        }
        List<Card> cards = new ArrayList<>();
        for (ProtocolDefinition protocol : document.getProtocols()) {
            cards.addAll(toCards(protocol, protocolNames));
        }
        return cards;
    }

    private static List<Card> toCards(ProtocolDefinition protocol, Set<String> protocolNames) {
        String name = protocol.getName();
        if (protocol.getCards().size() != CARDS_PER_PROTOCOL) {
            throw new CatalogException("Protocol " + name + " has " + protocol.getCards().size()
                    + " cards, expected " + CARDS_PER_PROTOCOL);
        }
        Set<Integer> values = new HashSet<>();
        List<Card> cards = new ArrayList<>();
        for (CardDefinition def : protocol.getCards()) {
            String cardName = name + "-" + def.getValue();
            if (def.getValue() < 0 || def.getValue() > MAX_CARD_VALUE) {
                throw new CatalogException(cardName + ": value out of range 0.." + MAX_CARD_VALUE);
            }
            if (!values.add(def.getValue())) {
                throw new CatalogException(cardName + ": duplicate value in protocol " + name);
            }
            List<Effect> effects = new ArrayList<>();
            for (EffectDefinition effect : def.getEffects()) {
                effects.add(toEffect(cardName, effect, protocolNames));
            }
            cards.add(new Card(name, def.getValue(), def.getTop(), def.getMiddle(), def.getBottom(),
                    effects, def.isIgnoresProtocolMatching()));
        }
        return cards;
    }

    private static Effect toEffect(String cardName, EffectDefinition def, Set<String> protocolNames) {
        Trigger trigger = parse(cardName, Trigger.class, def.getTrigger(), null, "trigger");
        EffectBox box = parse(cardName, EffectBox.class, def.getBox(), null, "box");
        if (trigger == Trigger.PASSIVE) {
            if (def.getRule() == null || !def.getInstructions().isEmpty()) {
                throw new CatalogException(cardName + ": a passive effect needs a rule and no instructions");
            }
            RuleDefinition rule = def.getRule();
            return Effect.passive(box, new PassiveRule(
                    parse(cardName, PassiveRule.Type.class, rule.getType(), null, "rule type"),
                    parse(cardName, PassiveRule.Target.class, rule.getTarget(), null, "rule target"),
                    parse(cardName, PassiveRule.Scope.class, rule.getScope(), null, "rule scope"),
                    rule.getValue()));
        }
        if (def.getRule() != null) {
            throw new CatalogException(cardName + ": only passive effects carry a rule");
        }
        if (def.getInstructions().isEmpty()) {
            throw new CatalogException(cardName + ": " + trigger + " effect has no instructions");
        }
        if (trigger == Trigger.ON_PLAY && box != EffectBox.MIDDLE) {
            throw new CatalogException(cardName + ": on-play effects belong in the middle box");
        }
        return new Effect(trigger, box, toInstructions(cardName, def.getInstructions(), protocolNames), null);
    }

    private static List<Instruction> toInstructions(String cardName, List<InstructionDefinition> defs,
                                                    Set<String> protocolNames) {
        List<Instruction> instructions = new ArrayList<>();
        for (InstructionDefinition def : defs) {
            instructions.add(toInstruction(cardName, def, protocolNames));
        }
        return instructions;
    }

    private static Instruction toInstruction(String cardName, InstructionDefinition def, Set<String> protocolNames) {
        Op op = parse(cardName, Op.class, def.getOp(), null, "op");
        if (def.getCount() < 0) {
            throw new CatalogException(cardName + ": negative count for " + op);
        }
        Instruction.Builder b = Instruction.builder(op)
                .count(def.getCount())
                .optional(def.isOptional())
                .variable(def.isVariable())
                .actor(parse(cardName, Instruction.Actor.class, def.getActor(), Instruction.Actor.SELF, "actor"))
                .condition(parse(cardName, Instruction.Condition.class, def.getCondition(),
                        Instruction.Condition.ALWAYS, "condition"))
                .conditionProtocol(def.getConditionProtocol())
                .amount(parse(cardName, Instruction.Amount.class, def.getAmount(), Instruction.Amount.FIXED, "amount"))
                .scope(parse(cardName, Instruction.Scope.class, def.getScope(), Instruction.Scope.SINGLE, "scope"))
                .destination(parse(cardName, Instruction.Destination.class, def.getDestination(),
                        Instruction.Destination.ANY_OTHER, "destination"))
                .whose(parse(cardName, TargetFilter.Owner.class, def.getWhose(), TargetFilter.Owner.OWN, "whose"))
                .minCards(def.getMinCards())
                .forbiddenProtocol(def.getForbiddenProtocol())
                .filter(toFilter(cardName, def.getFilter()));
        if (def.getCondition() != null && "IF_IN_PROTOCOL_LINE".equals(def.getCondition())
                && (def.getConditionProtocol() == null || !protocolNames.contains(def.getConditionProtocol()))) {
            throw new CatalogException(cardName + ": IF_IN_PROTOCOL_LINE needs a known protocol");
        }
        if (def.getForbiddenProtocol() != null && !protocolNames.contains(def.getForbiddenProtocol())) {
            throw new CatalogException(cardName + ": unknown protocol " + def.getForbiddenProtocol());
        }
        if (op == Op.CHOICE) {
            if (def.getOptions().size() < 2) {
                throw new CatalogException(cardName + ": a choice needs at least two options");
            }
            for (OptionDefinition option : def.getOptions()) {
                if (option.getLabel() == null || option.getSteps().isEmpty()) {
                    throw new CatalogException(cardName + ": choice option without label or steps");
                }
                b.option(option.getLabel(), toInstructions(cardName, option.getSteps(), protocolNames));
            }
        } else if (!def.getOptions().isEmpty()) {
            throw new CatalogException(cardName + ": only CHOICE takes options, found them on " + op);
        }
        return b.build();
    }

    private static TargetFilter toFilter(String cardName, FilterDefinition def) {
        if (def == null) {
            return TargetFilter.any();
        }
        try {
            return TargetFilter.builder()
                    .owner(parse(cardName, TargetFilter.Owner.class, def.getOwner(), TargetFilter.Owner.ANY, "owner"))
                    .faceState(parse(cardName, TargetFilter.FaceState.class, def.getFace(),
                            TargetFilter.FaceState.ANY, "face"))
                    .position(parse(cardName, TargetFilter.Position.class, def.getPosition(),
                            TargetFilter.Position.UNCOVERED, "position"))
                    .excludeSelf(def.isExcludeSelf())
                    .valueRange(def.getMinValue() == null ? 0 : def.getMinValue(),
                            def.getMaxValue() == null ? Integer.MAX_VALUE : def.getMaxValue())
                    .lane(parse(cardName, TargetFilter.LaneFilter.class, def.getLane(),
                            TargetFilter.LaneFilter.ANY, "lane"))
                    .protocolMatch(parse(cardName, TargetFilter.ProtocolMatch.class, def.getProtocolMatch(),
                            TargetFilter.ProtocolMatch.ANY, "protocolMatch"))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CatalogException(cardName + ": " + e.getMessage(), e);
        }
    }

    private static <E extends Enum<E>> E parse(String cardName, Class<E> type, String name, E fallback, String field) {
        if (name == null) {
            if (fallback == null) {
                throw new CatalogException(cardName + ": missing " + field);
            }
            return fallback;
        }
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new CatalogException(cardName + ": unknown " + field + " " + name, e);
        }
    }
}
