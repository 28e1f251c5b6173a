package max.repertoire.video;

public final class ReconcilerConfig {

    // Connection search
    public final int maxSearchDepth;      // plies bridged between two samples (default 2)
    public final int resyncSearchDepth;   // plies bridged from an earlier node (default 1)
    public final int resyncCandidates;    // earlier nodes tried, most recently visited first (default 32)

    // Noise handling
    public final boolean structuralFilter;
    public final boolean closestMoveFallback;
    public final int closestMoveMaxDiff;

    // Progress
    public final int progressBufferCapacity;

    private ReconcilerConfig(Builder b) {
        maxSearchDepth = b.maxSearchDepth;
        resyncSearchDepth = b.resyncSearchDepth;
        resyncCandidates = b.resyncCandidates;
        structuralFilter = b.structuralFilter;
        closestMoveFallback = b.closestMoveFallback;
        closestMoveMaxDiff = b.closestMoveMaxDiff;
        progressBufferCapacity = b.progressBufferCapacity;
    }

    public static ReconcilerConfig defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private int maxSearchDepth = Integer.parseInt(System.getProperty("reconciler.maxSearchDepth", "2"));
        private int resyncSearchDepth = 1;
        private int resyncCandidates = 32;
        private boolean structuralFilter = Boolean.parseBoolean(System.getProperty("reconciler.structuralFilter", "true"));
        private boolean closestMoveFallback = Boolean.parseBoolean(System.getProperty("reconciler.closestMoveFallback", "false"));
        private int closestMoveMaxDiff = Integer.parseInt(System.getProperty("reconciler.closestMoveMaxDiff", "4"));
        private int progressBufferCapacity = Integer.parseInt(System.getProperty("reconciler.progressBuffer", "100"));

        public Builder maxSearchDepth(int v){maxSearchDepth=v;return this;}
        public Builder resyncSearchDepth(int v){resyncSearchDepth=v;return this;}
        public Builder resyncCandidates(int v){resyncCandidates=v;return this;}
        public Builder structuralFilter(boolean v){structuralFilter=v;return this;}
        public Builder closestMoveFallback(boolean v){closestMoveFallback=v;return this;}
        public Builder closestMoveMaxDiff(int v){closestMoveMaxDiff=v;return this;}
        public Builder progressBufferCapacity(int v){progressBufferCapacity=v;return this;}

        public ReconcilerConfig build() {
            if(maxSearchDepth < 1) {
                throw new IllegalArgumentException("maxSearchDepth must be at least 1, got "+maxSearchDepth);
            }
            if(progressBufferCapacity < 2) {
                // one slot is kept for the terminal event
                throw new IllegalArgumentException("progressBufferCapacity must be at least 2, got "+progressBufferCapacity);
            }
            return new ReconcilerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ReconcilerConfig{" +
                "maxSearchDepth=" + maxSearchDepth +
                ", resyncSearchDepth=" + resyncSearchDepth +
                ", resyncCandidates=" + resyncCandidates +
                ", structuralFilter=" + structuralFilter +
                ", closestMoveFallback=" + closestMoveFallback +
                ", closestMoveMaxDiff=" + closestMoveMaxDiff +
                ", progressBufferCapacity=" + progressBufferCapacity +
                '}';
    }
}
