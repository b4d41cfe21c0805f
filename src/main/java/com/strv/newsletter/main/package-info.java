/**
 * Process wiring for the dispatch service.
 *
 * <h2>Config</h2>
 * <p>Static container for the loaded dispatch configuration.
 *
 * <h2>Dispatcher</h2>
 * <p>Builds the mail sender, metrics, worker pool and issue fan-out, and owns the root lifecycle.
 * <br>Its shutdown hook cancels the lifecycle and waits for the workers to drain.
 */
package com.strv.newsletter.main;
