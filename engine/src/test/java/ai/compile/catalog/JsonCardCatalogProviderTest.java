package ai.compile.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.compile.effects.Effect;
import ai.compile.effects.EffectBox;
import ai.compile.effects.Instruction;
import ai.compile.effects.Keyword;
import ai.compile.effects.Op;
import ai.compile.effects.PassiveRule;
import ai.compile.effects.Trigger;
import ai.compile.game.Card;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JsonCardCatalogProvider")
class JsonCardCatalogProviderTest {

    private static final String BLANK_CARDS = "{\"value\":0},{\"value\":1},{\"value\":2},"
            + "{\"value\":3},{\"value\":4},{\"value\":5}";

    @Nested
    @DisplayName("Bundled catalog")
    class BundledCatalogTests {

        private final CardCatalog catalog = new JsonCardCatalogProvider().load();

        @Test
        void holdsEighteenProtocolsOfSixCards() {
            assertEquals(18, catalog.protocols().size());
            assertEquals(108, catalog.size());
            for (String protocol : catalog.protocols()) {
                assertEquals(6, catalog.cardsOf(protocol).size(), protocol);
            }
        }

        @Test
        void looksCardsUpByShortName() {
            Card card = catalog.get("Speed-1");

            assertEquals("Speed", card.getProtocol());
            assertEquals(1, card.getValue());
            assertEquals(card, catalog.get("Speed", 1));
            assertThrows(IllegalArgumentException.class, () -> catalog.get("Speed1"));
            assertThrows(IllegalArgumentException.class, () -> catalog.get("Nope", 1));
        }

        @Test
        void keywordsAreDerivedFromInstructions() {
            assertTrue(catalog.get("Hate-0").hasKeyword(Keyword.DELETE));
            assertTrue(catalog.get("Speed-1").hasKeyword(Keyword.DRAW));
            assertFalse(catalog.get("Chaos-3").hasKeyword(Keyword.DELETE));
        }

        @Test
        void triggersAndFlagsSurviveMapping() {
            assertTrue(catalog.get("Chaos-3").ignoresProtocolMatching());
            assertTrue(catalog.get("Speed-2").hasTrigger(Trigger.ON_COMPILE_DELETE));
            assertTrue(catalog.get("Hate-3").hasTrigger(Trigger.AFTER_DELETE));
            assertTrue(catalog.get("Metal-0").hasTrigger(Trigger.PASSIVE));
            assertTrue(catalog.get("Metal-0").hasTopBoxEffect());
        }

        @Test
        void gravityLoveAndFrostAreBundled() {
            assertTrue(catalog.hasProtocol("Gravity"));
            assertTrue(catalog.hasProtocol("Love"));
            assertTrue(catalog.hasProtocol("Frost"));
            assertThrows(IllegalArgumentException.class, () -> catalog.get("Gravity", 3));
            assertThrows(IllegalArgumentException.class, () -> catalog.get("Love", 0));
            assertEquals(5, catalog.get("Frost-5").getValue());
        }

        @Test
        void frostRulesAreBoxedWhereTheyArePrinted() {
            Card frostOne = catalog.get("Frost-1");
            List<Effect> rules = frostOne.effectsFor(Trigger.PASSIVE);

            assertEquals(2, rules.size());
            assertEquals(PassiveRule.Type.BLOCK_FLIP_FACE_UP, rules.get(0).rule().type());
            assertEquals(EffectBox.TOP, rules.get(0).box());
            assertEquals(PassiveRule.Type.BLOCK_PROTOCOL_REARRANGE, rules.get(1).rule().type());
            assertEquals(EffectBox.BOTTOM, rules.get(1).box());
            PassiveRule frostThree = catalog.get("Frost-3").effectsFor(Trigger.PASSIVE).get(0).rule();
            assertEquals(PassiveRule.Type.BLOCK_SHIFTS, frostThree.type());
            assertEquals(PassiveRule.Scope.THIS_LANE, frostThree.scope());
        }

        @Test
        void handAndDeckOperationsMap() {
            List<Instruction> loveThree = catalog.get("Love-3").effectsFor(Trigger.ON_PLAY).get(0).instructions();
            assertEquals(Op.TAKE_RANDOM, loveThree.get(0).op());
            assertEquals(Op.GIVE, loveThree.get(1).op());

            List<Instruction> loveOneEnd = catalog.get("Love-1").effectsFor(Trigger.END).get(0).instructions();
            assertTrue(loveOneEnd.get(0).optional());
            assertEquals(Instruction.Condition.IF_PREVIOUS, loveOneEnd.get(1).condition());

            Instruction gravityZero = catalog.get("Gravity-0").effectsFor(Trigger.ON_PLAY).get(0).instructions().get(0);
            assertEquals(Op.PLAY_TOP_OF_DECK_UNDER_SELF, gravityZero.op());
            assertEquals(Instruction.Amount.HALF_CARDS_IN_LINE, gravityZero.amount());
            assertEquals(Instruction.Destination.TO_OR_FROM_THIS_LANE,
                    catalog.get("Gravity-1").effectsFor(Trigger.ON_PLAY).get(0).instructions().get(1).destination());
            assertTrue(catalog.get("Gravity-6").hasKeyword(Keyword.PLAY));
            assertTrue(catalog.get("Love-1").hasKeyword(Keyword.DRAW));
        }

        @Test
        void metalReplacesItsFourWithASix() {
            assertThrows(IllegalArgumentException.class, () -> catalog.get("Metal", 4));
            assertEquals(6, catalog.get("Metal-6").getValue());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        void parsesAMinimalProtocol() {
            CardCatalog catalog = JsonCardCatalogProvider.fromJson(
                    "{\"version\":1,\"protocols\":[{\"name\":\"Test\",\"cards\":[" + BLANK_CARDS + "]}]}");

            assertEquals(6, catalog.size());
            assertTrue(catalog.hasProtocol("Test"));
        }

        @Test
        void malformedJsonIsACatalogError() {
            assertThrows(CatalogException.class, () -> JsonCardCatalogProvider.fromJson("{not json"));
        }

        @Test
        void unsupportedVersionIsRejected() {
            CatalogException e = assertThrows(CatalogException.class, () -> JsonCardCatalogProvider.fromJson(
                    "{\"version\":2,\"protocols\":[{\"name\":\"Test\",\"cards\":[" + BLANK_CARDS + "]}]}"));
            assertTrue(e.getMessage().contains("version"), e.getMessage());
        }

        @Test
        void protocolsNeedSixCards() {
            assertThrows(CatalogException.class, () -> JsonCardCatalogProvider.fromJson(
                    "{\"version\":1,\"protocols\":[{\"name\":\"Test\",\"cards\":[{\"value\":0}]}]}"));
        }

        @Test
        void duplicateProtocolsAreRejected() {
            String protocol = "{\"name\":\"Test\",\"cards\":[" + BLANK_CARDS + "]}";
            assertThrows(CatalogException.class, () -> JsonCardCatalogProvider.fromJson(
                    "{\"version\":1,\"protocols\":[" + protocol + "," + protocol + "]}"));
        }

        @Test
        void unknownOpNamesTheCard() {
            String cards = "{\"value\":0,\"effects\":[{\"trigger\":\"ON_PLAY\",\"box\":\"MIDDLE\","
                    + "\"instructions\":[{\"op\":\"DRAWW\"}]}]},"
                    + "{\"value\":1},{\"value\":2},{\"value\":3},{\"value\":4},{\"value\":5}";

            CatalogException e = assertThrows(CatalogException.class, () -> JsonCardCatalogProvider.fromJson(
                    "{\"version\":1,\"protocols\":[{\"name\":\"Test\",\"cards\":[" + cards + "]}]}"));
            assertTrue(e.getMessage().startsWith("Test-0"), e.getMessage());
        }

        @Test
        void onPlayEffectsBelongInTheMiddleBox() {
            String cards = "{\"value\":0,\"effects\":[{\"trigger\":\"ON_PLAY\",\"box\":\"TOP\","
                    + "\"instructions\":[{\"op\":\"DRAW\"}]}]},"
                    + "{\"value\":1},{\"value\":2},{\"value\":3},{\"value\":4},{\"value\":5}";

            assertThrows(CatalogException.class, () -> JsonCardCatalogProvider.fromJson(
                    "{\"version\":1,\"protocols\":[{\"name\":\"Test\",\"cards\":[" + cards + "]}]}"));
        }

        @Test
        void missingResourceIsACatalogError() {
            assertThrows(CatalogException.class, () -> new JsonCardCatalogProvider("missing.json").load());
        }
    }
}
