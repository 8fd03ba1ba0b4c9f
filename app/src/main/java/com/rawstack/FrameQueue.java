package com.rawstack;

import java.io.File;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded single-producer/single-consumer hand-off between decoding and
 * aggregation. A full queue blocks the producer, so decoding can never run
 * more than {@code capacity} frames ahead of the aggregator.
 */
public class FrameQueue
{

	public enum Kind
	{
		FRAME, SKIPPED, FAILED
	}

	public record Message(Kind kind, int index, File file, FrameRecord frame, DecodeException error)
	{
		static Message frame(FrameRecord frame)
		{
			return new Message(Kind.FRAME, frame.index(), frame.file(), frame, null);
		}

		static Message skipped(int index, File file, DecodeException error)
		{
			return new Message(Kind.SKIPPED, index, file, null, error);
		}

		static Message failed(int index, File file, DecodeException error)
		{
			return new Message(Kind.FAILED, index, file, null, error);
		}
	}

	private final BlockingQueue<Message> queue;
	private final int capacity;

	public FrameQueue(int capacity)
	{
		if (capacity < 1)
		{
			throw new IllegalArgumentException("Queue capacity must be at least 1, got " + capacity);
		}
		this.capacity = capacity;
		this.queue = new ArrayBlockingQueue<>(capacity);
	}

	public void put(Message message) throws InterruptedException
	{
		queue.put(message);
	}

	/**
	 * @return the next message, or null if none arrived within the timeout
	 */
	public Message poll(long timeout, TimeUnit unit) throws InterruptedException
	{
		return queue.poll(timeout, unit);
	}

	public int size()
	{
		return queue.size();
	}

	public int capacity()
	{
		return capacity;
	}
}
