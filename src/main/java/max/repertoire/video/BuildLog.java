package max.repertoire.video;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** What the reconciler did with the samples it did not simply connect. */
public final class BuildLog {

    public record FilteredSample(VideoSample sample, String reason) {}

    public record FallbackMove(VideoSample sample, String move, String resultPosition, int diff) {}

    /** The cursor left its line: jumped back to a known node or branched from one. */
    public record Resync(VideoSample sample, long nodeId, boolean jumped) {}

    private final List<FilteredSample> filtered = new ArrayList<>();
    private final List<FallbackMove> fallbacks = new ArrayList<>();
    private final List<Resync> resyncs = new ArrayList<>();
    private boolean unfilteredFallback;

    void filtered(VideoSample sample, String reason) {
        filtered.add(new FilteredSample(sample, reason));
    }

    void fallback(VideoSample sample, String move, String resultPosition, int diff) {
        fallbacks.add(new FallbackMove(sample, move, resultPosition, diff));
    }

    void resync(VideoSample sample, long nodeId, boolean jumped) {
        resyncs.add(new Resync(sample, nodeId, jumped));
    }

    void usedUnfilteredSamples() {
        unfilteredFallback = true;
    }

    public List<FilteredSample> filtered() {
        return Collections.unmodifiableList(filtered);
    }

    public List<FallbackMove> fallbacks() {
        return Collections.unmodifiableList(fallbacks);
    }

    public List<Resync> resyncs() {
        return Collections.unmodifiableList(resyncs);
    }

    /** True when every sample was rejected by the structural filter and the filter was ignored. */
    public boolean unfilteredFallback() {
        return unfilteredFallback;
    }
}
