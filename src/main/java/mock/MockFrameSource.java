package mock;

import java.util.Arrays;
import java.util.List;

import buffers.FrameSource;
import label3d.Camera;
import types.FramePack;
import types.Point2D;
import types.Point3D;

/**
 * Renders synthetic grey frames: black background with a white square at every marker's
 * projection. Video frame numbers index directly into the point data.
 */
public class MockFrameSource implements FrameSource {

	private static final int HALF_SIZE = 2;

	protected List<Camera> cameras;
	protected double[][] points;

	public MockFrameSource(List<Camera> cameras, double[][] points) {
		this.cameras = cameras;
		this.points = points;
	}

	@Override
	public FramePack getFrame(int view, int videoFrame) {

		if (videoFrame < 0 || videoFrame >= this.points.length) {
			throw new IndexOutOfBoundsException("Video frame " + videoFrame + " outside [0, " + this.points.length + ")");
		}
		Camera camera = this.cameras.get(view);
		int width = camera.getImageWidth();
		int height = camera.getImageHeight();

		byte bg = (byte) 0;
		byte fg = (byte) 255;

		// init buffer
		byte[] buffer = new byte[width * height];
		Arrays.fill(buffer, bg);

		double[] frame = this.points[videoFrame];
		for (int m = 0; m < frame.length / 3; m++) {
			Point2D pixel = MockRig.observe(camera, new Point3D(frame[3 * m], frame[3 * m + 1], frame[3 * m + 2]),
					camera.hasDistortion());
			if (pixel == null) {
				continue;
			}
			int u = (int) Math.round(pixel.getX());
			int v = (int) Math.round(pixel.getY());
			for (int row = Math.max(0, v - HALF_SIZE); row <= Math.min(height - 1, v + HALF_SIZE); row++) {
				for (int col = Math.max(0, u - HALF_SIZE); col <= Math.min(width - 1, u + HALF_SIZE); col++) {
					buffer[row * width + col] = fg;
				}
			}
		}

		FramePack pack = new FramePack(view, videoFrame, width, height, 1, buffer);
		pack.setFrameTitle(camera.getName() + "-" + videoFrame);
		return pack;
	}

	@Override
	public int getNumViews() {
		return this.cameras.size();
	}

}
