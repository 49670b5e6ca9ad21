package buffers;

// FIFO hand-off between an event producer and the code that consumes it
public interface Buffer<T> {

	public void push(T payload);

	// next payload, or null when empty
	public T getNext();

	public boolean isEmpty();

}
