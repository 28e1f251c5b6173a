package max.repertoire.analysis;

import java.util.List;

/** Turns raw game text into parsed games whose moves are already normalized. */
public interface GameParser {

    /**
     * @throws IllegalArgumentException if a game cannot be read or contains an illegal move
     */
    List<ParsedGame> parse(String text);
}
