/**
 * The main package for the newsletter dispatch service.
 *
 * <p>Publishing a newsletter post turns into one email per active subscriber.
 * <br>Those emails are not sent on the request thread. They are placed on a bounded in-memory queue
 * <br>and delivered by a fixed pool of worker threads through a pluggable mail transport.
 *
 * <p>On shutdown the queue is closed and every email already accepted is still attempted
 * <br>before the process exits.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar newsletter-dispatch.jar --help
 *      usage: java -jar newsletter-dispatch.jar [-c &lt;arg&gt;] [-h]
 *       Newsletter email dispatch service
 *       -c,--config &lt;arg&gt;   Path to dispatch configuration file (JSON5)
 *       -h,--help           Show usage
 * </pre>
 *
 * <h2>Configuration:</h2>
 * <pre>
 *      worker: { count: 5, queueCapacity: 100, sendTimeoutSeconds: 30, shutdownTimeoutSeconds: 0 }
 *      mail: { provider: "smtp", from: "newsletter@example.com", smtp: { password: "{$GOOGLE_APP_PASSWORD}" } }
 *      app: { baseUrl: "https://news.example.com" }
 *      metrics: { enabled: true, port: 8090 }
 * </pre>
 */
package com.strv.newsletter;
