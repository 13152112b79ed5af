/**
 * Cooperative task tree: a {@link com.arbor.tree.Commander} root, {@link com.arbor.tree.Job} and
 * {@link com.arbor.tree.Handler} nodes, and the barrier that keeps a node unresolved until all of its
 * children resolved.
 * <ul>
 *   <li>{@link com.arbor.tree.TaskNode} – status machine (PENDING, RUNNING, COMPLETED / FAILED / TERMINATED), children, result or error</li>
 *   <li>{@link com.arbor.tree.JobContext} – what a job body uses to submit children and await results</li>
 *   <li>{@link com.arbor.tree.FaultPolicy} – RECORD keeps a fault on the node, PROPAGATE also fails the parent</li>
 *   <li>{@link com.arbor.tree.callback} – lifecycle callbacks per node</li>
 * </ul>
 * Configuration comes from {@link com.arbor.config.ArborConfig}.
 */
package com.arbor.tree;
