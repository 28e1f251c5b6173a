package max.repertoire.video;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** Extracts positions from a video. Implementations live outside this library. */
public interface FrameRecognizer {

    /**
     * @param source where the video is found, as understood by the implementation
     * @param stopFlag raised when the caller gave up; implementations should return early
     * @return the recognized samples in frame order
     */
    List<VideoSample> recognize(String source, AtomicBoolean stopFlag) throws IOException;
}
