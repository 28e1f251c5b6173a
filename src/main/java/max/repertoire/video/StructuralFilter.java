package max.repertoire.video;

import max.repertoire.utils.notations.FENUtils;

import java.util.Optional;

/** Rejects recognized boards no game can reach. */
final class StructuralFilter {

    private StructuralFilter() {}

    /** @return why the board is impossible, empty when it looks like a chess position */
    static Optional<String> rejectionReason(String position) {
        String expanded = FENUtils.expandPiecePlacement(FENUtils.getPiecePlacement(position));
        if(expanded.length() != 64) {
            return Optional.of("invalid board length: "+expanded.length());
        }

        int whiteKings = 0, blackKings = 0;
        int whitePieces = 0, blackPieces = 0;
        int whitePawns = 0, blackPawns = 0;
        for(int i = 0; i < 64; i++) {
            char piece = expanded.charAt(i);
            if(piece == '.') {
                continue;
            }
            // rank 8 first
            boolean backRank = i < 8 || i >= 56;
            switch (piece) {
                case 'K' -> whiteKings++;
                case 'k' -> blackKings++;
                case 'P' -> {
                    whitePawns++;
                    if(backRank) return Optional.of("white pawn on back rank");
                }
                case 'p' -> {
                    blackPawns++;
                    if(backRank) return Optional.of("black pawn on back rank");
                }
                case 'Q', 'R', 'B', 'N', 'q', 'r', 'b', 'n' -> { }
                default -> {
                    return Optional.of("unknown piece '"+piece+"'");
                }
            }
            if(Character.isUpperCase(piece)) {
                whitePieces++;
            } else {
                blackPieces++;
            }
        }

        if(whiteKings != 1 || blackKings != 1) {
            return Optional.of("invalid kings: K="+whiteKings+", k="+blackKings);
        }
        if(whitePieces > 16 || blackPieces > 16) {
            return Optional.of("too many pieces: white="+whitePieces+", black="+blackPieces);
        }
        if(whitePawns > 8 || blackPawns > 8) {
            return Optional.of("too many pawns: white="+whitePawns+", black="+blackPawns);
        }
        return Optional.empty();
    }
}
