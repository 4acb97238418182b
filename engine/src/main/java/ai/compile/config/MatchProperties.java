package ai.compile.config;

import ai.compile.game.Side;
import ai.compile.player.Difficulty;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for AI-versus-AI matches.
 *
 * Protocol lists may be left empty, in which case each match drafts three distinct protocols per side
 * from the catalog using the match seed. A missing seed means a fresh random seed per run.
 *
 * Usage:
 * {@code java -jar engine.jar --match.games=10 --match.player-difficulty=hard -Dlog.matches=true}
 */
@Component
@ConfigurationProperties(prefix = "match")
public class MatchProperties {
  private int games = 1;
  private Long seed;
  private int maxTurns = 200;
  private boolean useControl = true;
  private Side startingPlayer;
  private Difficulty playerDifficulty = Difficulty.NORMAL;
  private Difficulty opponentDifficulty = Difficulty.NORMAL;
  private List<String> playerProtocols = new ArrayList<>();
  private List<String> opponentProtocols = new ArrayList<>();

  /**
   * Returns how many matches the runner plays.
   * @return number of matches, 0 to only load the catalog
   */
  public int getGames() {
    return games;
  }

  public void setGames(int games) {
    this.games = games;
  }

  /**
   * Returns the seed of the first match; later matches use seed + index.
   * @return base seed, or null for a random one
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns the turn cap after which a match is recorded as a draw.
   * @return maximum turn number
   */
  public int getMaxTurns() {
    return maxTurns;
  }

  public void setMaxTurns(int maxTurns) {
    this.maxTurns = maxTurns;
  }

  public boolean isUseControl() {
    return useControl;
  }

  public void setUseControl(boolean useControl) {
    this.useControl = useControl;
  }

  /**
   * Returns the side that moves first.
   * @return starting side, or null for a seeded coin flip
   */
  public Side getStartingPlayer() {
    return startingPlayer;
  }

  public void setStartingPlayer(Side startingPlayer) {
    this.startingPlayer = startingPlayer;
  }

  public Difficulty getPlayerDifficulty() {
    return playerDifficulty;
  }

  public void setPlayerDifficulty(Difficulty playerDifficulty) {
    this.playerDifficulty = playerDifficulty;
  }

  public Difficulty getOpponentDifficulty() {
    return opponentDifficulty;
  }

  public void setOpponentDifficulty(Difficulty opponentDifficulty) {
    this.opponentDifficulty = opponentDifficulty;
  }

  public List<String> getPlayerProtocols() {
    return playerProtocols;
  }

  public void setPlayerProtocols(List<String> playerProtocols) {
    this.playerProtocols = playerProtocols;
  }

  public List<String> getOpponentProtocols() {
    return opponentProtocols;
  }

  public void setOpponentProtocols(List<String> opponentProtocols) {
    this.opponentProtocols = opponentProtocols;
  }

  /**
   * Difficulty of the AI playing {@code side}.
   * @param side the side
   * @return configured difficulty
   */
  public Difficulty difficultyFor(Side side) {
    return side == Side.PLAYER ? playerDifficulty : opponentDifficulty;
  }
}
