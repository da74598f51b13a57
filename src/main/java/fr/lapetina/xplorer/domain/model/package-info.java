/**
 * Transport-agnostic message model.
 *
 * <p>All types are immutable and safe to share between transport threads, the
 * affinity worker and the handler worker pool.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.xplorer.domain.model.Request} - Path, query, optional body and metadata</li>
 *   <li>{@link fr.lapetina.xplorer.domain.model.Response} - Status, content type and body, with JSON/text factories</li>
 *   <li>{@link fr.lapetina.xplorer.domain.model.ParameterInfo} - Descriptive parameter metadata for discovery</li>
 * </ul>
 */
package fr.lapetina.xplorer.domain.model;
