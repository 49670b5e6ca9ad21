package buffers;

import java.util.ArrayList;

public class QueuedBuffer<T> implements Buffer<T> {

	protected ArrayList<T> payload = new ArrayList<T>();

	public QueuedBuffer() {

	}

	public synchronized void push(T payload) {
		if (payload == null) {
			throw new IllegalArgumentException("Cannot queue a null payload");
		}
		this.payload.add(payload);
	}

	public synchronized T getNext() {
		return this.payload.size() > 0 ? this.payload.remove(0) : null;
	}

	public synchronized boolean isEmpty() {
		return this.payload.isEmpty();
	}

	public synchronized int size() {
		return this.payload.size();
	}

	public synchronized void clear() {
		this.payload.clear();
	}

}
