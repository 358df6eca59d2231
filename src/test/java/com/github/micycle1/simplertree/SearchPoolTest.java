package com.github.micycle1.simplertree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class SearchPoolTest {

	@Test
	public void testPreallocatedAndReused() {
		SearchPool<SearchQueueItem> pool = new SearchPool<>(4, SearchQueueItem::new, SearchQueueItem::reset);
		assertEquals(4, pool.available());

		SearchQueueItem item = pool.take();
		assertEquals(3, pool.available());
		assertEquals(1, pool.outstanding());

		pool.giveBack(item);
		assertEquals(4, pool.available());
		assertEquals(0, pool.outstanding());
		assertSame(item, pool.take(), "Most recently returned instance should be handed out first");
	}

	@Test
	public void testTakeResetsState() {
		SearchPool<SearchQueueItem> pool = new SearchPool<>(1, SearchQueueItem::new, SearchQueueItem::reset);
		SearchQueueItem item = pool.take();
		item.node = SimpleRTree.Node.leaf(0, 1, 1);
		item.distance = 3;
		pool.giveBack(item);

		SearchQueueItem again = pool.take();
		assertNull(again.node);
		assertEquals(Double.POSITIVE_INFINITY, again.distance);
	}

	@Test
	public void testGrowsWhenExhausted() {
		SearchPool<SearchQueueItem> pool = new SearchPool<>(2, SearchQueueItem::new, SearchQueueItem::reset);
		List<SearchQueueItem> taken = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			taken.add(pool.take());
		}
		assertEquals(0, pool.available());
		assertEquals(10, pool.outstanding());
		taken.forEach(pool::giveBack);
		assertEquals(10, pool.available());
		assertEquals(0, pool.outstanding());
	}
}
