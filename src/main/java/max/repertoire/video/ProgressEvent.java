package max.repertoire.video;

public record ProgressEvent(ProgressStatus status, int percentComplete, String message) {

    public static ProgressEvent of(ProgressStatus status, int percentComplete, String message) {
        return new ProgressEvent(status, Math.max(0, Math.min(100, percentComplete)), message);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
