package types;

// a decoded video frame for one camera view: interleaved 8-bit pixels, row major
public class FramePack {

	private int view = 0;
	private int videoFrame = 0;
	private String frameTitle = "";
	private int width = 0;
	private int height = 0;
	private int channels = 3;
	private byte[] pixels = null;

	public FramePack(int view, int videoFrame, int width, int height, int channels, byte[] pixels) {
		if (pixels != null && pixels.length != width * height * channels) {
			throw new IllegalArgumentException(
					"Pixel buffer has " + pixels.length + " bytes, expected " + (width * height * channels));
		}
		this.view = view;
		this.videoFrame = videoFrame;
		this.width = width;
		this.height = height;
		this.channels = channels;
		this.pixels = pixels;
	}

	public int getPixel(int row, int col, int channel) {
		return this.pixels[(row * this.width + col) * this.channels + channel] & 0xFF;
	}

	public int getView() {
		return view;
	}

	public int getVideoFrame() {
		return videoFrame;
	}

	public String getFrameTitle() {
		return frameTitle;
	}

	public void setFrameTitle(String frameTitle) {
		this.frameTitle = frameTitle;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getChannels() {
		return channels;
	}

	public byte[] getPixels() {
		return pixels;
	}

}
