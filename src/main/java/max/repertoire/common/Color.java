package max.repertoire.common;

public enum Color {
    BLACK('b'), WHITE('w');

    private final char fenLetter;

    Color(char fenLetter) {
        this.fenLetter = fenLetter;
    }

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public char fenLetter() {
        return fenLetter;
    }

    public static Color fromFENLetter(String letter) {
        return switch (letter) {
            case "w" -> WHITE;
            case "b" -> BLACK;
            default -> throw new IllegalArgumentException("Unknown side to move '"+letter+"'");
        };
    }
}
