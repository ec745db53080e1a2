/**
 * Failover-aware routing of requests across providers.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aimux.router.FailoverRouter} - Candidate loop, dispatch and outcome feedback</li>
 *   <li>{@link fr.lapetina.aimux.router.FailoverPolicy} - Attempt budget, attempt timeout and default deadline</li>
 *   <li>{@link fr.lapetina.aimux.router.exception.RoutingExhaustedException} - All attempts failed, with their causes</li>
 * </ul>
 */
package fr.lapetina.aimux.router;
