package max.repertoire.video;

/** A sample that could not be connected to the position the fragment was at. */
public record UnlinkedGap(String fromPosition, VideoSample to) {
}
