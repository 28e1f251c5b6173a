package max.repertoire.utils.notations;

import max.repertoire.common.Color;
import max.repertoire.common.PieceType;
import max.repertoire.rules.Board;
import max.repertoire.rules.Move;

import java.util.Optional;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public class FENUtils {
    public static final String STARTING_PIECE_PLACEMENT = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR";

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    // Recognized frames only carry the piece placement, so every field after it is optional:
    // side defaults to white, castling rights are inferred from king and rook squares.
    public static Board getBoardFrom(String FEN) {
        if(FEN == null || FEN.isBlank()) {
            throw new IllegalArgumentException("Invalid FEN record: empty");
        }
        String[] fenFields = FEN.trim().split("\\s+");
        if(fenFields.length > 6) {
            throw new IllegalArgumentException("Invalid FEN record: "+FEN);
        }

        Board board = new Board();
        injectPiecePlacement(board, fenFields[0]);
        injectCurrentTurn(board, fenFields.length > 1 ? fenFields[1] : "w");
        injectCastlingRights(board, fenFields.length > 2 ? fenFields[2] : inferCastlingRights(board));
        injectEnPassantSquare(board, fenFields.length > 3 ? fenFields[3] : "-");
        board.setHalfMoveClock(fenFields.length > 4 ? parseClock(fenFields[4], FEN) : 0);
        board.setFullMoveClock(fenFields.length > 5 ? parseClock(fenFields[5], FEN) : 1);
        return board;
    }

    public static String getFENFromBoard(Board board) {
        StringBuilder fen = new StringBuilder(getNormalizedFEN(board));
        fen.append(' ').append(board.getHalfMoveClock());
        fen.append(' ').append(board.getFullMoveClock());
        return fen.toString();
    }

    /** Placement, side to move, castling and en passant: the four fields positions are compared on. */
    public static String getNormalizedFEN(Board board) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(board, fen);
        fen.append(' ').append(board.getCurrentPlayer().fenLetter());
        injectCastlingRights(board, fen);
        injectEnPassantSquare(board, fen);
        return fen.toString();
    }

    /** Strips the half-move and full-move counters without parsing the record. */
    public static String normalize(String fen) {
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length >= 4) {
            return String.join(" ", fenFields[0], fenFields[1], fenFields[2], fenFields[3]);
        }
        return fen.trim();
    }

    public static String getPiecePlacement(String fen) {
        String trimmed = fen.trim();
        int space = trimmed.indexOf(' ');
        return space == -1 ? trimmed : trimmed.substring(0, space);
    }

    public static boolean isPlacementOnly(String fen) {
        return fen.trim().indexOf(' ') == -1;
    }

    public static Optional<Color> getSideToMove(String fen) {
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length < 2) {
            return Optional.empty();
        }
        return Optional.of(Color.fromFENLetter(fenFields[1]));
    }

    /** 64 characters, rank 8 first, '.' for empty squares. Malformed placements give a different length. */
    public static String expandPiecePlacement(String placement) {
        StringBuilder expanded = new StringBuilder(64);
        for(char character : placement.toCharArray()) {
            if(character == '/') {
                continue;
            }
            if(character >= '1' && character <= '8') {
                expanded.append(".".repeat(character - '0'));
            } else {
                expanded.append(character);
            }
        }
        return expanded.toString();
    }

    public static int countBoardDiffs(String placementA, String placementB) {
        String a = expandPiecePlacement(getPiecePlacement(placementA));
        String b = expandPiecePlacement(getPiecePlacement(placementB));
        if(a.length() != 64 || b.length() != 64) {
            return 64;
        }
        int diffs = 0;
        for(int i = 0; i < 64; i++) {
            if(a.charAt(i) != b.charAt(i)) {
                diffs++;
            }
        }
        return diffs;
    }

    private static String inferCastlingRights(Board board) {
        StringBuilder castlingRights = new StringBuilder();
        boolean whiteKingHome = board.pieceAt(Move.indexOf(4, 0)) == 'K';
        boolean blackKingHome = board.pieceAt(Move.indexOf(4, 7)) == 'k';
        if(whiteKingHome && board.pieceAt(Move.indexOf(7, 0)) == 'R') {
            castlingRights.append('K');
        }
        if(whiteKingHome && board.pieceAt(Move.indexOf(0, 0)) == 'R') {
            castlingRights.append('Q');
        }
        if(blackKingHome && board.pieceAt(Move.indexOf(7, 7)) == 'r') {
            castlingRights.append('k');
        }
        if(blackKingHome && board.pieceAt(Move.indexOf(0, 7)) == 'r') {
            castlingRights.append('q');
        }
        return castlingRights.isEmpty() ? "-" : castlingRights.toString();
    }

    private static int parseClock(String clock, String fen) {
        try {
            return Integer.parseInt(clock);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FEN record: "+fen, e);
        }
    }

    private static void injectEnPassantSquare(Board board, StringBuilder fen) {
        fen.append(' ');
        int enPassantIndex = board.getEnPassantIndex();
        if(enPassantIndex != -1) {
            fen.append(MoveIOUtils.getSquareFromIndex(enPassantIndex));
        } else {
            fen.append('-');
        }
    }

    private static void injectCastlingRights(Board board, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(board.whiteCanCastleKingSide()) {
            castlingRights.append("K");
        }
        if(board.whiteCanCastleQueenSide()) {
            castlingRights.append("Q");
        }
        if(board.blackCanCastleKingSide()) {
            castlingRights.append("k");
        }
        if(board.blackCanCastleQueenSide()) {
            castlingRights.append("q");
        }
        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static void injectPiecePlacement(Board board, StringBuilder fen) {
        for(int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0; file < 8; file++) {
                char square = board.pieceAt(Move.indexOf(file, rank));
                if(square == Board.EMPTY) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(square);
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectEnPassantSquare(Board board, String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            board.setEnPassantIndex(-1);
        } else {
            board.setEnPassantIndex(MoveIOUtils.getIndexFromSquare(enPassantSquare));
        }
    }

    private static void injectCastlingRights(Board board, String castlingRights) {
        boolean whiteCanCastleKingSide = false;
        boolean whiteCanCastleQueenSide = false;
        boolean blackCanCastleKingSide = false;
        boolean blackCanCastleQueenSide = false;
        for(char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> whiteCanCastleKingSide = true;
                case 'k' -> blackCanCastleKingSide = true;
                case 'Q' -> whiteCanCastleQueenSide = true;
                case 'q' -> blackCanCastleQueenSide = true;
                case '-' -> { }
                default -> throw new IllegalArgumentException("Invalid castling rights '"+castlingRights+"'");
            }
        }
        board.setBlackCanCastleKingSide(blackCanCastleKingSide);
        board.setBlackCanCastleQueenSide(blackCanCastleQueenSide);
        board.setWhiteCanCastleKingSide(whiteCanCastleKingSide);
        board.setWhiteCanCastleQueenSide(whiteCanCastleQueenSide);
    }

    private static void injectCurrentTurn(Board board, String currentTurn) {
        board.setCurrentPlayer(Color.fromFENLetter(currentTurn));
    }

    private static void injectPiecePlacement(Board board, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/", -1);
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Invalid piece placement '"+piecePlacement+"': expected 8 ranks");
        }
        int currentRank = 7;
        for(String piecePlacementRow : piecePlacementRows) {
            int currentFile = 0;
            for(char character : piecePlacementRow.toCharArray()) {
                if(character >= '1' && character <= '8') {
                    currentFile += character - '0';
                    continue;
                }
                if(PieceType.fromFENLetter(character) == PieceType.NONE) {
                    throw new IllegalArgumentException("Unexpected fen letter "+character);
                }
                if(currentFile > 7) {
                    throw new IllegalArgumentException("Invalid piece placement '"+piecePlacement+"': rank overflow");
                }
                board.setPiece(Move.indexOf(currentFile, currentRank), character);
                currentFile++;
            }
            if(currentFile != 8) {
                throw new IllegalArgumentException("Invalid piece placement '"+piecePlacement+"': rank of "+currentFile+" squares");
            }
            currentRank--;
        }
    }
}
