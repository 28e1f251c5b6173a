package max.repertoire.analysis;

import max.repertoire.common.Color;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A game as handed over by a {@link GameParser}: its tag pairs, the position it starts from and
 * its plies with normalized notation.
 */
public record ParsedGame(Map<String, String> headers, String startingPosition, List<Ply> plies) {

    public String header(String name) {
        return headers.getOrDefault(name, "?");
    }

    /** The side {@code username} played, from the White / Black tags, case-insensitively. */
    public Optional<Color> userColor(String username) {
        if(username == null || username.isBlank()) {
            return Optional.empty();
        }
        String user = username.trim().toLowerCase(Locale.ROOT);
        if(user.equals(header("White").trim().toLowerCase(Locale.ROOT))) {
            return Optional.of(Color.WHITE);
        }
        if(user.equals(header("Black").trim().toLowerCase(Locale.ROOT))) {
            return Optional.of(Color.BLACK);
        }
        return Optional.empty();
    }
}
