package max.repertoire.analysis;

import max.repertoire.common.Color;
import max.repertoire.rules.ChessRulesEngineImpl;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PgnGameParserTest {
    private static final String ITALIAN = """
            [Event "Club championship"]
            [White "Alice"]
            [Black "bob"]
            [Result "1-0"]

            1. e4 {best by test} e5 2. Nf3 (2. Bc4 Nf6 (2... Bc5)) Nc6 $1
            3. Bc4 ; the Italian
            Bc5 4. c3!? 1-0
            """;

    private final PgnGameParser parser = new PgnGameParser(new ChessRulesEngineImpl());

    private static List<String> sans(ParsedGame game) {
        return game.plies().stream().map(Ply::san).toList();
    }

    @Test
    public void parse_shouldKeepOnlyTheMainLine() {
        // When
        List<ParsedGame> games = parser.parse(ITALIAN);

        // Then
        assertEquals(1, games.size());
        ParsedGame game = games.get(0);
        assertEquals(List.of("e4", "e5", "Nf3", "Nc6", "Bc4", "Bc5", "c3"), sans(game));
        assertEquals(Color.WHITE, game.plies().get(0).mover());
        assertEquals(Color.BLACK, game.plies().get(5).mover());
        assertEquals("Club championship", game.header("Event"));
        assertEquals("1-0", game.header("Result"));
    }

    @Test
    public void userColor_shouldComeFromThePlayerTags() {
        // Given
        ParsedGame game = parser.parse(ITALIAN).get(0);

        // Then
        assertEquals(Optional.of(Color.WHITE), game.userColor("alice"));
        assertEquals(Optional.of(Color.BLACK), game.userColor("Bob "));
        assertEquals(Optional.empty(), game.userColor("carol"));
    }

    @Test
    public void parse_shouldSplitSeveralGamesAndFillMissingTags() {
        // Given
        String pgn = ITALIAN + "\n[White \"carol\"]\n\n1. d4 d5 2. c4 *\n";

        // When
        List<ParsedGame> games = parser.parse(pgn);

        // Then
        assertEquals(2, games.size());
        ParsedGame second = games.get(1);
        assertEquals(List.of("d4", "d5", "c4"), sans(second));
        assertEquals("Unknown", second.header("Event"));
        assertEquals("Unknown", second.header("Black"));
        assertEquals("*", second.header("Result"));
    }

    @Test
    public void parse_shouldStartFromTheFenTag() {
        // Given
        String pgn = """
                [FEN "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq - 0 1"]

                1... c5 2. Nf3 d6 *
                """;

        // When
        ParsedGame game = parser.parse(pgn).get(0);

        // Then
        assertEquals("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq -", game.startingPosition());
        assertEquals(List.of("c5", "Nf3", "d6"), sans(game));
        assertEquals(Color.BLACK, game.plies().get(0).mover());
    }

    @Test
    public void parse_shouldNormalizeNotation() {
        // When
        ParsedGame game = parser.parse("1. e2e4 e7e5 2. g1f3 b8c6 3. f1b5 a6 4. 0-0 *").get(0);

        // Then
        assertEquals(List.of("e4", "e5", "Nf3", "Nc6", "Bb5", "a6", "O-O"), sans(game));
    }

    @Test
    public void parse_shouldRejectIllegalMoves() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("1. e4 e5 2. Ke3 *"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("   "));
    }

    @Test
    public void tokenize_shouldSkipAnnotations() {
        assertEquals(List.of("e4", "e5", "Nf3"), PgnGameParser.tokenize("1.e4 $2 {a {comment} 1...e5 (1...c5 2.Nf3) 2.Nf3 1/2-1/2"));
    }
}
