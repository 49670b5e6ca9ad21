package buffers;

import types.FramePack;

// random access to decoded video frames, one stream per camera view
public interface FrameSource {

	public FramePack getFrame(int view, int videoFrame);

	public int getNumViews();

}
