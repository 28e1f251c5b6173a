package max.repertoire.video;

/**
 * A position recognized on a video frame. Recognizers usually only see the board, so
 * {@code position} may be a bare piece placement.
 */
public record VideoSample(String position, int frameIndex, double timestampSeconds) {

    public static VideoSample of(String position, int frameIndex) {
        return new VideoSample(position, frameIndex, 0.0);
    }
}
