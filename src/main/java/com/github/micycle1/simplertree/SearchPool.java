package com.github.micycle1.simplertree;

import java.util.ArrayDeque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A simple free-list of reusable objects used by nearest-neighbour queries so
 * that a warmed-up index answers queries without allocating.
 * <p>
 * {@link #take()} and {@link #giveBack(Object)} are mutually exclusive, so one
 * pool can be shared by concurrent queries against the same index.
 *
 * @param <T> the pooled type
 */
public class SearchPool<T> {

	private final ArrayDeque<T> free;
	private final Supplier<T> factory;
	private final Consumer<T> reset;
	private int outstanding;

	/**
	 * @param initialSize number of instances to pre-allocate
	 * @param factory     creates new instances when the pool runs dry
	 * @param reset       restores an instance to its default state before it is
	 *                    handed out
	 */
	public SearchPool(int initialSize, Supplier<T> factory, Consumer<T> reset) {
		this.free = new ArrayDeque<>(Math.max(initialSize, 1));
		this.factory = factory;
		this.reset = reset;
		for (int i = 0; i < initialSize; i++) {
			free.push(factory.get());
		}
	}

	/**
	 * @return an instance in its default state
	 */
	public synchronized T take() {
		T item = free.poll();
		if (item == null) {
			item = factory.get();
		}
		reset.accept(item);
		outstanding++;
		return item;
	}

	public synchronized void giveBack(T item) {
		free.push(item);
		outstanding--;
	}

	/**
	 * @return number of instances currently held by the pool
	 */
	public synchronized int available() {
		return free.size();
	}

	/**
	 * @return number of instances taken and not yet given back
	 */
	public synchronized int outstanding() {
		return outstanding;
	}
}
