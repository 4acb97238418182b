package ai.compile.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link GameState} as plain text for logs and the match runner.
 * <p>
 * The opponent's lanes are printed above the player's, each lane as a column headed by its
 * protocol and total. Face-down cards show as {@code [##]} followed by their value for whoever
 * reads the log; the engine itself never hides information.
 */
public class BoardFormatter {
    /** Minimum column width in characters. */
    private static final int CELL_WIDTH = 14;

    private final GameState state;

    public BoardFormatter(GameState state) {
        this.state = state;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        String border = "-".repeat((CELL_WIDTH + 3) * PlayerState.LANES + 1);
        sb.append(border).append('\n');
        sb.append("Turn ").append(state.getTurnNumber()).append(" | ").append(state.getTurn())
                .append(" | ").append(state.getPhase());
        if (state.getControlCardHolder() != null) {
            sb.append(" | control: ").append(state.getControlCardHolder());
        }
        sb.append('\n');
        appendSide(sb, Side.OPPONENT, true);
        sb.append(border).append('\n');
        appendSide(sb, Side.PLAYER, false);
        sb.append(border).append('\n');
        if (state.getActionRequired() != null) {
            sb.append("Pending: ").append(state.getActionRequired()).append('\n');
        }
        return sb.toString();
    }

    private void appendSide(StringBuilder sb, Side side, boolean topDown) {
        PlayerState ps = state.side(side);
        List<String> header = new ArrayList<>();
        int depth = 0;
        for (int lane = 0; lane < PlayerState.LANES; lane++) {
            String protocol = ps.getProtocol(lane) + (ps.isCompiled(lane) ? "*" : "");
            header.add(protocol + " (" + ps.getLaneValue(lane) + ")");
            depth = Math.max(depth, ps.getLane(lane).size());
        }
        if (topDown) {
            appendSummary(sb, side, ps);
            appendRow(sb, header);
        }
        for (int row = 0; row < depth; row++) {
            int index = topDown ? depth - 1 - row : row;
            List<String> cells = new ArrayList<>();
            for (int lane = 0; lane < PlayerState.LANES; lane++) {
                List<PlayedCard> stack = ps.getLane(lane);
                cells.add(index < stack.size() ? cellFor(stack.get(index)) : "");
            }
            appendRow(sb, cells);
        }
        if (!topDown) {
            appendRow(sb, header);
            appendSummary(sb, side, ps);
        }
    }

    private static void appendSummary(StringBuilder sb, Side side, PlayerState ps) {
        sb.append(side.label().toUpperCase())
                .append("  hand=").append(ps.getHand().size())
                .append("  deck=").append(ps.getDeck().size())
                .append("  discard=").append(ps.getDiscard().size())
                .append("  compiled=").append(ps.compiledCount())
                .append('\n');
    }

    private static String cellFor(PlayedCard card) {
        if (card.isFaceUp()) {
            return card.getCard().name();
        }
        return "[##] " + card.getCard().name();
    }

    private static void appendRow(StringBuilder sb, List<String> cells) {
        sb.append('|');
        for (String cell : cells) {
            sb.append(' ').append(pad(cell)).append(" |");
        }
        sb.append('\n');
    }

    private static String pad(String text) {
        if (text.length() >= CELL_WIDTH) {
            return text;
        }
        return text + " ".repeat(CELL_WIDTH - text.length());
    }
}
