package io.github.yok.dedalo.input;

import io.github.yok.dedalo.core.frame.ChannelFrame;
import io.github.yok.dedalo.core.frame.FrameSource;
import java.util.Iterator;
import java.util.Optional;

/**
 * 記録ファイルのフレームを順に再生する供給元です。
 */
public final class RecordedFileFrameSource implements FrameSource {

    private final Iterator<ChannelFrame> frames;

    private boolean closed;

    public RecordedFileFrameSource(RecordedFile file) {
        this.frames = file.getFrames().iterator();
    }

    @Override
    public synchronized Optional<ChannelFrame> read() {
        if (closed || !frames.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(frames.next());
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
