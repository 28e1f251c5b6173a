package max.repertoire.analysis;

import max.repertoire.common.Color;
import max.repertoire.rules.ChessRulesEngine;
import max.repertoire.rules.MoveValidation;
import max.repertoire.utils.notations.FENUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads PGN text holding one or more games. Only the main line is kept: comments, variations,
 * numeric annotation glyphs, move numbers and results are skipped. Every move is replayed through
 * the rules engine so the plies carry normalized notation.
 */
public class PgnGameParser implements GameParser {
    private static final Logger log = LoggerFactory.getLogger(PgnGameParser.class);

    private static final Pattern TAG_PAIR = Pattern.compile("^\\[\\s*(\\w+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\s*]$");
    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");
    private static final Pattern RESULT = Pattern.compile("^(1-0|0-1|1/2-1/2|\\*)$");

    private final ChessRulesEngine rules;

    public PgnGameParser(ChessRulesEngine rules) {
        this.rules = Objects.requireNonNull(rules);
    }

    @Override
    public List<ParsedGame> parse(String text) {
        if(text == null || text.isBlank()) {
            throw new IllegalArgumentException("PGN text is empty");
        }
        List<ParsedGame> games = new ArrayList<>();
        for(String rawGame : splitGames(text)) {
            games.add(parseGame(rawGame, games.size()));
        }
        log.debug("Parsed {} games", games.size());
        return games;
    }

    // A tag line seen after move text starts the next game
    static List<String> splitGames(String text) {
        List<String> games = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean seenMoves = false;
        for(String line : text.split("\\R")) {
            String trimmed = line.trim();
            if(trimmed.startsWith("[") && seenMoves) {
                addGame(games, current);
                current.setLength(0);
                seenMoves = false;
            }
            if(!trimmed.isEmpty() && !trimmed.startsWith("[")) {
                seenMoves = true;
            }
            current.append(line).append('\n');
        }
        addGame(games, current);
        return games;
    }

    private static void addGame(List<String> games, StringBuilder current) {
        String game = current.toString().trim();
        if(!game.isEmpty()) {
            games.add(game);
        }
    }

    private ParsedGame parseGame(String rawGame, int gameIndex) {
        Map<String, String> headers = new LinkedHashMap<>();
        StringBuilder movetext = new StringBuilder();
        for(String line : rawGame.split("\\R")) {
            String trimmed = line.trim();
            if(trimmed.startsWith("[") && movetext.isEmpty()) {
                Matcher matcher = TAG_PAIR.matcher(trimmed);
                if(!matcher.matches()) {
                    throw new IllegalArgumentException("Game "+(gameIndex + 1)+": malformed tag pair "+trimmed);
                }
                headers.put(matcher.group(1), matcher.group(2).replace("\\\"", "\"").replace("\\\\", "\\"));
            } else if(!trimmed.isEmpty()) {
                movetext.append(line).append('\n');
            }
        }
        headers.putIfAbsent("Event", "Unknown");
        headers.putIfAbsent("White", "Unknown");
        headers.putIfAbsent("Black", "Unknown");
        headers.putIfAbsent("Result", "*");

        String startingPosition = headers.containsKey("FEN")
                ? FENUtils.normalize(headers.get("FEN"))
                : rules.startingPosition();
        Color mover = FENUtils.getSideToMove(startingPosition).orElse(Color.WHITE);

        List<Ply> plies = new ArrayList<>();
        String position = startingPosition;
        for(String token : tokenize(movetext.toString())) {
            MoveValidation validation;
            try {
                validation = rules.validateMove(position, token);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Game "+(gameIndex + 1)+": unreadable position "+position, e);
            }
            if(!validation.legal()) {
                throw new IllegalArgumentException("Game "+(gameIndex + 1)+": illegal move "+token+" at ply "+plies.size());
            }
            plies.add(new Ply(validation.san(), mover));
            position = validation.resultPosition();
            mover = mover.getOppositeColor();
        }
        return new ParsedGame(Map.copyOf(headers), startingPosition, List.copyOf(plies));
    }

    /** The main-line move tokens of a movetext section. */
    static List<String> tokenize(String movetext) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        int variationDepth = 0;
        int i = 0;
        while(i < movetext.length()) {
            char c = movetext.charAt(i);
            if(c == '{') {
                int end = movetext.indexOf('}', i);
                i = end == -1 ? movetext.length() : end + 1;
                flush(tokens, token, variationDepth);
                continue;
            }
            if(c == ';') {
                int end = movetext.indexOf('\n', i);
                i = end == -1 ? movetext.length() : end + 1;
                flush(tokens, token, variationDepth);
                continue;
            }
            if(c == '(' || c == ')') {
                flush(tokens, token, variationDepth);
                variationDepth = Math.max(0, variationDepth + (c == '(' ? 1 : -1));
            } else if(Character.isWhitespace(c)) {
                flush(tokens, token, variationDepth);
            } else {
                token.append(c);
            }
            i++;
        }
        flush(tokens, token, variationDepth);
        return tokens;
    }

    private static void flush(List<String> tokens, StringBuilder token, int variationDepth) {
        if(token.isEmpty()) {
            return;
        }
        String value = MOVE_NUMBER.matcher(token).replaceFirst("");
        token.setLength(0);
        if(variationDepth > 0 || value.isEmpty() || value.startsWith("$") || RESULT.matcher(value).matches()) {
            return;
        }
        tokens.add(value);
    }
}
