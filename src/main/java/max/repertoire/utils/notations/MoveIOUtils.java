package max.repertoire.utils.notations;

import max.repertoire.common.PieceType;
import max.repertoire.rules.Board;
import max.repertoire.rules.Move;
import max.repertoire.rules.MoveGenerator;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class MoveIOUtils {
    private static final Pattern LONG_ALGEBRAIC = Pattern.compile("([a-h][1-8])-?([a-h][1-8])=?([qrbnQRBN])?");
    private static final Pattern BARE_PROMOTION = Pattern.compile("(.*[18])([QRBN])");

    /** Short algebraic notation of a legal move, with the check or mate suffix. */
    public static String writeAlgebraicNotation(Board board, Move move, List<Move> legalMoves) {
        String san = writeAlgebraicNotationWithoutSuffix(board, move, legalMoves);
        Board next = board.play(move);
        if(MoveGenerator.isInCheck(next)) {
            return san + (MoveGenerator.getLegalMoves(next).isEmpty() ? "#" : "+");
        }
        return san;
    }

    public static String writeAlgebraicNotation(Board board, Move move) {
        return writeAlgebraicNotation(board, move, MoveGenerator.getLegalMoves(board));
    }

    /**
     * Resolves a move written by a person or a parser against the legal moves of the board.
     * Check and annotation suffixes, zero-castling and long algebraic input are tolerated.
     */
    public static Optional<Move> readAlgebraicNotation(Board board, String notation) {
        if(notation == null) {
            return Optional.empty();
        }
        String cleaned = cleanNotation(notation);
        if(cleaned.isEmpty()) {
            return Optional.empty();
        }
        List<Move> legalMoves = MoveGenerator.getLegalMoves(board);
        for(Move move : legalMoves) {
            if(writeAlgebraicNotationWithoutSuffix(board, move, legalMoves).equals(cleaned)) {
                return Optional.of(move);
            }
        }

        Matcher bare = BARE_PROMOTION.matcher(cleaned);
        if(bare.matches()) {
            String withEquals = bare.group(1) + "=" + bare.group(2);
            for(Move move : legalMoves) {
                if(writeAlgebraicNotationWithoutSuffix(board, move, legalMoves).equals(withEquals)) {
                    return Optional.of(move);
                }
            }
        }

        Matcher longAlgebraic = LONG_ALGEBRAIC.matcher(cleaned);
        if(longAlgebraic.matches()) {
            int from = getIndexFromSquare(longAlgebraic.group(1));
            int to = getIndexFromSquare(longAlgebraic.group(2));
            PieceType promotion = longAlgebraic.group(3) == null
                    ? PieceType.NONE
                    : PieceType.getPieceTypeFromLetter(longAlgebraic.group(3).charAt(0));
            return legalMoves.stream()
                    .filter(move -> move.startPosition() == from && move.endPosition() == to && move.promotion() == promotion)
                    .findFirst();
        }
        return Optional.empty();
    }

    private static String cleanNotation(String notation) {
        String cleaned = notation.trim().replace("e.p.", "").trim();
        int end = cleaned.length();
        while(end > 0 && "+#!?".indexOf(cleaned.charAt(end - 1)) >= 0) {
            end--;
        }
        cleaned = cleaned.substring(0, end);
        if(cleaned.equals("0-0") || cleaned.equals("O-O")) {
            return "O-O";
        }
        if(cleaned.equals("0-0-0") || cleaned.equals("O-O-O")) {
            return "O-O-O";
        }
        return cleaned;
    }

    private static String writeAlgebraicNotationWithoutSuffix(Board board, Move move, List<Move> legalMoves) {
        int from = move.startPosition();
        int to = move.endPosition();
        PieceType pieceType = board.pieceTypeAt(from);

        if(pieceType == PieceType.KING && Math.abs(Move.fileOf(to) - Move.fileOf(from)) == 2) {
            return Move.fileOf(to) > Move.fileOf(from) ? "O-O" : "O-O-O";
        }

        boolean capture = !board.isEmptySquare(to)
                || (pieceType == PieceType.PAWN && Move.fileOf(from) != Move.fileOf(to));
        StringBuilder san = new StringBuilder();
        if(pieceType == PieceType.PAWN) {
            if(capture) {
                san.append(getLetterFromFile(Move.fileOf(from))).append('x');
            }
            san.append(getSquareFromIndex(to));
            if(move.isPromotion()) {
                san.append('=').append(move.promotion().sanLetter());
            }
            return san.toString();
        }

        san.append(pieceType.sanLetter());
        san.append(getDisambiguation(board, move, pieceType, legalMoves));
        if(capture) {
            san.append('x');
        }
        san.append(getSquareFromIndex(to));
        return san.toString();
    }

    private static String getDisambiguation(Board board, Move move, PieceType pieceType, List<Move> legalMoves) {
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for(Move other : legalMoves) {
            if(other.endPosition() != move.endPosition()
                    || other.startPosition() == move.startPosition()
                    || board.pieceTypeAt(other.startPosition()) != pieceType) {
                continue;
            }
            ambiguous = true;
            sameFile |= Move.fileOf(other.startPosition()) == Move.fileOf(move.startPosition());
            sameRank |= Move.rankOf(other.startPosition()) == Move.rankOf(move.startPosition());
        }
        if(!ambiguous) {
            return "";
        }
        if(!sameFile) {
            return getLetterFromFile(Move.fileOf(move.startPosition()));
        }
        if(!sameRank) {
            return getNumberFromRank(Move.rankOf(move.startPosition()));
        }
        return getSquareFromIndex(move.startPosition());
    }

    public static String getSquareFromIndex(int index) {
        return getLetterFromFile(Move.fileOf(index)) + getNumberFromRank(Move.rankOf(index));
    }

    public static String getNumberFromRank(int rank) {
        return String.valueOf(rank + 1);
    }

    public static String getLetterFromFile(int file) {
        return switch(file) {
            case 0 -> "a";
            case 1 -> "b";
            case 2 -> "c";
            case 3 -> "d";
            case 4 -> "e";
            case 5 -> "f";
            case 6 -> "g";
            case 7 -> "h";
            default -> throw new IllegalArgumentException("file should be in [0-7]");
        };
    }

    public static int getIndexFromSquare(String square) {
        char[] squareChars = square.toCharArray();
        if(squareChars.length != 2) {
            throw new IllegalArgumentException("square should be format 'a1'");
        }

        int file = switch (squareChars[0]) {
            case 'a' -> 0;
            case 'b' -> 1;
            case 'c' -> 2;
            case 'd' -> 3;
            case 'e' -> 4;
            case 'f' -> 5;
            case 'g' -> 6;
            case 'h' -> 7;
            default -> throw new IllegalArgumentException("square letter should be in [a-h]");
        };
        int rank = squareChars[1] - '1';
        if(rank < 0 || rank > 7) {
            throw new IllegalArgumentException("square digit should be in [1-8]");
        }

        return Move.indexOf(file, rank);
    }
}
