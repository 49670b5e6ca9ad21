package types;

public interface Callback<T> {

	public void callback(T payload);

}
