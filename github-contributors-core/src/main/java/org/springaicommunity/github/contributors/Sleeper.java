package org.springaicommunity.github.contributors;

import java.time.Duration;

/**
 * Blocks the calling thread for a duration. Rate-limit waits and timeout backoff go
 * through this seam so tests can record the requested waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
